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

package org.midonet.ovsport.guice;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Names;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.ovsport.config.OvsPortConfig;
import org.midonet.ovsport.link.DeviceWaiter;
import org.midonet.ovsport.link.IpLinkControl;
import org.midonet.ovsport.link.LinkControl;
import org.midonet.ovsport.netns.NetworkStrategy;
import org.midonet.ovsport.netns.OvsNetworkStrategy;
import org.midonet.ovsport.port.NameGenerator;
import org.midonet.ovsport.port.OvsdbPortProvisioner;
import org.midonet.ovsport.port.PortProvisioner;
import org.midonet.ovsport.port.RandomNameGenerator;
import org.midonet.ovsport.port.VsctlPortProvisioner;

/**
 * Wires the port provisioner and the namespace strategy from an
 * {@link OvsPortConfig}.
 */
public class OvsPortModule extends AbstractModule {

    private static final Logger log =
        LoggerFactory.getLogger(OvsPortModule.class);

    private final OvsPortConfig config;

    public OvsPortModule(OvsPortConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(OvsPortConfig.class).toInstance(config);
        bindConstant().annotatedWith(Names.named(OvsNetworkStrategy.DEVICE_NAME))
                      .to(config.deviceName());

        bind(NameGenerator.class).to(RandomNameGenerator.class);
        bind(LinkControl.class).to(IpLinkControl.class).in(Singleton.class);
        bind(DeviceWaiter.class).in(Singleton.class);
        bind(NetworkStrategy.class).to(OvsNetworkStrategy.class)
                                   .in(Singleton.class);
    }

    @Provides
    @Singleton
    PortProvisioner providePortProvisioner(NameGenerator names) {
        switch (config.provisioner()) {
            case VSCTL:
                log.debug("Provisioning ports with {}",
                          config.ovsVsctlCommand());
                return new VsctlPortProvisioner(config, names);
            case OVSDB:
            default:
                log.debug("Provisioning ports through OVSDB at {}:{}",
                          config.ovsdbHost(), config.ovsdbPort());
                return new OvsdbPortProvisioner(config, names);
        }
    }
}
