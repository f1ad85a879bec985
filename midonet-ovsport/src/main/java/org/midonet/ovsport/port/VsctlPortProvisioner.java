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

package org.midonet.ovsport.port;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.inject.Inject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.ovsport.OvsPortException;
import org.midonet.ovsport.OvsPortException.TransactionFailedException;
import org.midonet.ovsport.config.OvsPortConfig;
import org.midonet.util.process.ProcessHelper;
import org.midonet.util.process.ProcessHelper.ProcessResult;

/**
 * Creates internal ports with the {@code ovs-vsctl} tool, for hosts where
 * the database socket is not reachable over TCP. ovs-vsctl runs the same
 * insert-insert-mutate transaction and fails when the bridge is missing.
 */
public class VsctlPortProvisioner implements PortProvisioner {

    private static final Logger log =
        LoggerFactory.getLogger(VsctlPortProvisioner.class);

    private final String vsctl;
    private final boolean sudo;
    private final NameGenerator names;
    private final int nameLength;

    @Inject
    public VsctlPortProvisioner(OvsPortConfig config, NameGenerator names) {
        this(config.ovsVsctlCommand(), config.useSudo(), names,
             config.nameLength());
    }

    public VsctlPortProvisioner(String vsctl, boolean sudo,
                                NameGenerator names, int nameLength) {
        this.vsctl = vsctl;
        this.sudo = sudo;
        this.names = names;
        this.nameLength = nameLength;
    }

    @Override
    public String createInternalPort(String namePrefix, String bridgeName)
            throws OvsPortException {
        String name = names.generate(namePrefix, nameLength);
        List<String> command = new ArrayList<>();
        if (sudo) {
            command.add("sudo");
        }
        command.add(vsctl);
        command.addAll(Arrays.asList(
            "add-port", bridgeName, name,
            "--", "set", "Interface", name, "type=internal"));

        ProcessResult result = execute(command);
        if (!result.succeeded()) {
            throw new TransactionFailedException(
                String.format("create ovs port %s on %s failed with exit "
                              + "code %d: %s", name, bridgeName,
                              result.returnValue, result.errorText()),
                -1, "add-port", "exit code " + result.returnValue,
                result.errorText());
        }
        log.info("Created internal port {} on bridge {} with {}", name,
                 bridgeName, vsctl);
        return name;
    }

    protected ProcessResult execute(List<String> command) {
        return ProcessHelper.executeCommandLine(command);
    }
}
