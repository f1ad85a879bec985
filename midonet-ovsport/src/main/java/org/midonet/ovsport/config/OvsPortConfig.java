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

package org.midonet.ovsport.config;

import java.io.File;
import java.util.concurrent.TimeUnit;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import org.midonet.ovsport.OvsPortException.ConfigurationInvalidException;

/**
 * Typed view over the {@code ovsport} section of the configuration. Values
 * not set by the user come from {@code reference.conf}.
 */
public class OvsPortConfig {

    public static final String PREFIX = "ovsport";

    public enum ProvisionerType {
        OVSDB, VSCTL
    }

    private final Config conf;

    public OvsPortConfig(Config conf) {
        this.conf = conf.withFallback(ConfigFactory.defaultReference())
                        .resolve()
                        .getConfig(PREFIX);
    }

    /**
     * Loads the application config (system properties, application.conf,
     * reference.conf).
     */
    public static OvsPortConfig load() throws ConfigurationInvalidException {
        try {
            return new OvsPortConfig(ConfigFactory.load()).validate();
        } catch (ConfigException e) {
            throw new ConfigurationInvalidException(e.getMessage());
        }
    }

    /**
     * Loads the given file on top of the defaults.
     */
    public static OvsPortConfig load(File file)
            throws ConfigurationInvalidException {
        if (!file.isFile()) {
            throw new ConfigurationInvalidException(
                "configuration file not found: " + file);
        }
        try {
            return new OvsPortConfig(ConfigFactory.parseFile(file)
                .withFallback(ConfigFactory.load())).validate();
        } catch (ConfigException e) {
            throw new ConfigurationInvalidException(
                "cannot parse " + file + ": " + e.getMessage());
        }
    }

    /**
     * Reads every setting once, so a value of the wrong type or out of
     * range is reported at load time rather than by the first component
     * using it.
     *
     * @return this config
     */
    public OvsPortConfig validate() throws ConfigurationInvalidException {
        try {
            ovsdbHost();
            ovsdbDatabase();
            connectTimeoutMillis();
            requestTimeoutMillis();
            deviceName();
            deviceWaitTimeoutMillis();
            devicePollIntervalMillis();
            provisioner();
            ipCommand();
            ovsVsctlCommand();
            useSudo();
            int port = ovsdbPort();
            if (port < 1 || port > 65535) {
                throw new ConfigException.BadValue(
                    conf.origin(), PREFIX + ".ovsdb.port",
                    "not a TCP port: " + port);
            }
            if (nameLength() < 1) {
                throw new ConfigException.BadValue(
                    conf.origin(), PREFIX + ".name_length",
                    "must be positive");
            }
        } catch (ConfigException e) {
            throw new ConfigurationInvalidException(e.getMessage());
        }
        return this;
    }

    public static OvsPortConfig fromString(String hocon) {
        return new OvsPortConfig(ConfigFactory.parseString(hocon));
    }

    public String ovsdbHost() {
        return conf.getString("ovsdb.host");
    }

    public int ovsdbPort() {
        return conf.getInt("ovsdb.port");
    }

    public String ovsdbDatabase() {
        return conf.getString("ovsdb.database");
    }

    public long connectTimeoutMillis() {
        return conf.getDuration("ovsdb.connect_timeout", TimeUnit.MILLISECONDS);
    }

    public long requestTimeoutMillis() {
        return conf.getDuration("ovsdb.request_timeout", TimeUnit.MILLISECONDS);
    }

    public String deviceName() {
        return conf.getString("device.name");
    }

    public long deviceWaitTimeoutMillis() {
        return conf.getDuration("device.wait_timeout", TimeUnit.MILLISECONDS);
    }

    public long devicePollIntervalMillis() {
        return conf.getDuration("device.poll_interval", TimeUnit.MILLISECONDS);
    }

    public int nameLength() {
        return conf.getInt("name_length");
    }

    public ProvisionerType provisioner() {
        String value = conf.getString("provisioner");
        for (ProvisionerType type : ProvisionerType.values()) {
            if (type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new ConfigException.BadValue(
            conf.origin(), PREFIX + ".provisioner",
            "expected \"ovsdb\" or \"vsctl\", got \"" + value + "\"");
    }

    public String ipCommand() {
        return conf.getString("commands.ip");
    }

    public String ovsVsctlCommand() {
        return conf.getString("commands.ovs_vsctl");
    }

    public boolean useSudo() {
        return conf.getBoolean("commands.sudo");
    }
}
