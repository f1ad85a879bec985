/*
 * Copyright 2016 Midokura SARL
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.midonet.ovsport.link;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.inject.Inject;

import org.midonet.ovsport.config.OvsPortConfig;
import org.midonet.util.process.ProcessHelper;
import org.midonet.util.process.ProcessHelper.ProcessResult;

/**
 * {@link LinkControl} on top of the iproute2 {@code ip} tool.
 */
public class IpLinkControl implements LinkControl {

    private final String ip;
    private final boolean sudo;

    @Inject
    public IpLinkControl(OvsPortConfig config) {
        this(config.ipCommand(), config.useSudo());
    }

    public IpLinkControl(String ip, boolean sudo) {
        this.ip = ip;
        this.sudo = sudo;
    }

    @Override
    public boolean exists(String device) throws IOException {
        List<String> command = command("link", "show", "dev", device);
        ProcessResult result = execute(command);
        if (result.returnValue == ProcessHelper.LAUNCH_FAILED) {
            throw new IOException(
                "cannot run \"" + String.join(" ", command) + "\"");
        }
        return result.succeeded();
    }

    @Override
    public void setMtu(String device, int mtu) throws IOException {
        run("link", "set", "dev", device, "mtu", Integer.toString(mtu));
    }

    @Override
    public void up(String device) throws IOException {
        run("link", "set", "dev", device, "up");
    }

    @Override
    public void down(String device) throws IOException {
        run("link", "set", "dev", device, "down");
    }

    @Override
    public void rename(String device, String newName) throws IOException {
        run("link", "set", "dev", device, "name", newName);
    }

    @Override
    public void setMac(String device, String mac) throws IOException {
        run("link", "set", "dev", device, "address", mac);
    }

    @Override
    public void addAddress(String device, String cidr) throws IOException {
        run("addr", "add", cidr, "dev", device);
    }

    @Override
    public void setDefaultGateway(String device, String gateway)
            throws IOException {
        if (gateway.indexOf(':') >= 0) {
            run("-6", "route", "add", "default", "via", gateway, "dev",
                device);
        } else {
            run("route", "add", "default", "via", gateway, "dev", device);
        }
    }

    @Override
    public void moveToNamespace(String device, int pid) throws IOException {
        run("link", "set", "dev", device, "netns", Integer.toString(pid));
    }

    private void run(String... args) throws IOException {
        List<String> command = command(args);
        ProcessResult result = execute(command);
        if (!result.succeeded()) {
            throw new IOException(String.format(
                "\"%s\" exited with %d: %s", String.join(" ", command),
                result.returnValue, result.errorText()));
        }
    }

    private List<String> command(String... args) {
        List<String> command = new ArrayList<>(args.length + 2);
        if (sudo) {
            command.add("sudo");
        }
        command.add(ip);
        command.addAll(Arrays.asList(args));
        return command;
    }

    protected ProcessResult execute(List<String> command) {
        return ProcessHelper.executeCommandLine(command);
    }
}
