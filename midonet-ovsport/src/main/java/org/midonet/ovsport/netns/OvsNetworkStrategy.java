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

package org.midonet.ovsport.netns;

import java.io.IOException;

import com.google.inject.Inject;
import com.google.inject.name.Named;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.ovsport.OvsPortException;
import org.midonet.ovsport.OvsPortException.ConfigurationInvalidException;
import org.midonet.ovsport.OvsPortException.DeviceOperationFailedException;
import org.midonet.ovsport.link.DeviceWaiter;
import org.midonet.ovsport.link.LinkControl;
import org.midonet.ovsport.port.PortProvisioner;

/**
 * Gives a namespace an OVS internal port: the port is created on a bridge,
 * moved into the namespace, then renamed to the canonical device name and
 * configured there.
 *
 * Every step is fatal on failure and nothing is rolled back or retried.
 */
public class OvsNetworkStrategy implements NetworkStrategy {

    private static final Logger log =
        LoggerFactory.getLogger(OvsNetworkStrategy.class);

    public static final String DEVICE_NAME = "ovsport.device.name";

    /** Operation on one link, as run by {@link #step}. */
    private interface LinkStep {
        void run() throws IOException;
    }

    private final PortProvisioner provisioner;
    private final LinkControl links;
    private final DeviceWaiter waiter;
    private final String deviceName;

    @Inject
    public OvsNetworkStrategy(PortProvisioner provisioner, LinkControl links,
                              DeviceWaiter waiter,
                              @Named(DEVICE_NAME) String deviceName) {
        this.provisioner = provisioner;
        this.links = links;
        this.waiter = waiter;
        this.deviceName = deviceName;
    }

    @Override
    public void create(NetworkConfig config, int nsPid, NetworkState state)
            throws OvsPortException {
        if (isBlank(config.getBridge())) {
            throw new ConfigurationInvalidException("bridge is not specified");
        }
        if (isBlank(config.getVethPrefix())) {
            throw new ConfigurationInvalidException(
                "veth prefix is not specified");
        }

        final String name = provisioner.createInternalPort(
            config.getVethPrefix(), config.getBridge());
        final int mtu = config.getMtu();

        waiter.await(name);
        step(name, "set mtu", Integer.toString(mtu),
             () -> links.setMtu(name, mtu));
        step(name, "link up", null, () -> links.up(name));
        step(name, "move to namespace", "pid " + nsPid,
             () -> links.moveToNamespace(name, nsPid));

        state.setOvsPort(name);
        log.info("Port {} on bridge {} moved to the namespace of pid {}",
                 name, config.getBridge(), nsPid);
    }

    @Override
    public void initialize(NetworkConfig config, NetworkState state)
            throws OvsPortException {
        final String ovsPort = state.getOvsPort();
        if (isBlank(ovsPort)) {
            throw new ConfigurationInvalidException("ovsPort is not specified");
        }
        if (isBlank(config.getAddress())) {
            throw new ConfigurationInvalidException(
                "address is not specified");
        }
        final String dev = deviceName;

        step(ovsPort, "link down", null, () -> links.down(ovsPort));
        step(ovsPort, "rename", dev, () -> links.rename(ovsPort, dev));
        if (config.getMacAddress() != null) {
            step(dev, "set mac", config.getMacAddress(),
                 () -> links.setMac(dev, config.getMacAddress()));
        }
        step(dev, "set ip", config.getAddress(),
             () -> links.addAddress(dev, config.getAddress()));
        if (config.getIpv6Address() != null) {
            step(dev, "set ipv6", config.getIpv6Address(),
                 () -> links.addAddress(dev, config.getIpv6Address()));
        }
        step(dev, "set mtu", Integer.toString(config.getMtu()),
             () -> links.setMtu(dev, config.getMtu()));
        step(dev, "link up", null, () -> links.up(dev));
        if (config.getGateway() != null) {
            step(dev, "set gateway", config.getGateway(),
                 () -> links.setDefaultGateway(dev, config.getGateway()));
        }
        if (config.getIpv6Gateway() != null) {
            step(dev, "set ipv6 gateway", config.getIpv6Gateway(),
                 () -> links.setDefaultGateway(dev, config.getIpv6Gateway()));
        }
        log.info("Device {} (was {}) configured with {}", dev, ovsPort,
                 config.getAddress());
    }

    private static void step(String device, String step, String target,
                             LinkStep op)
            throws DeviceOperationFailedException {
        log.debug("{} on {}{}", step, device,
                  target == null ? "" : " (" + target + ")");
        try {
            op.run();
        } catch (IOException e) {
            throw new DeviceOperationFailedException(device, step, target, e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
