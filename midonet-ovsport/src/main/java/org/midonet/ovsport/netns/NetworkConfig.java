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

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

/**
 * The caller-supplied description of the network of one namespace. Unset
 * optional values are null.
 */
public final class NetworkConfig {

    private final String bridge;
    private final String vethPrefix;
    private final int mtu;
    private final String macAddress;
    private final String address;
    private final String ipv6Address;
    private final String gateway;
    private final String ipv6Gateway;

    private NetworkConfig(Builder b) {
        this.bridge = b.bridge;
        this.vethPrefix = b.vethPrefix;
        this.mtu = b.mtu;
        this.macAddress = Strings.emptyToNull(b.macAddress);
        this.address = Strings.emptyToNull(b.address);
        this.ipv6Address = Strings.emptyToNull(b.ipv6Address);
        this.gateway = Strings.emptyToNull(b.gateway);
        this.ipv6Gateway = Strings.emptyToNull(b.ipv6Gateway);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Name of the switch bridge the port is attached to. */
    public String getBridge() {
        return bridge;
    }

    /** Prefix of the generated port name. */
    public String getVethPrefix() {
        return vethPrefix;
    }

    public int getMtu() {
        return mtu;
    }

    public String getMacAddress() {
        return macAddress;
    }

    /** Primary address in CIDR notation. */
    public String getAddress() {
        return address;
    }

    public String getIpv6Address() {
        return ipv6Address;
    }

    public String getGateway() {
        return gateway;
    }

    public String getIpv6Gateway() {
        return ipv6Gateway;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("bridge", bridge)
            .add("vethPrefix", vethPrefix)
            .add("mtu", mtu)
            .add("macAddress", macAddress)
            .add("address", address)
            .add("ipv6Address", ipv6Address)
            .add("gateway", gateway)
            .add("ipv6Gateway", ipv6Gateway)
            .toString();
    }

    public static final class Builder {
        private String bridge;
        private String vethPrefix;
        private int mtu = 1500;
        private String macAddress;
        private String address;
        private String ipv6Address;
        private String gateway;
        private String ipv6Gateway;

        private Builder() { }

        public Builder bridge(String bridge) {
            this.bridge = bridge;
            return this;
        }

        public Builder vethPrefix(String vethPrefix) {
            this.vethPrefix = vethPrefix;
            return this;
        }

        public Builder mtu(int mtu) {
            this.mtu = mtu;
            return this;
        }

        public Builder macAddress(String macAddress) {
            this.macAddress = macAddress;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder ipv6Address(String ipv6Address) {
            this.ipv6Address = ipv6Address;
            return this;
        }

        public Builder gateway(String gateway) {
            this.gateway = gateway;
            return this;
        }

        public Builder ipv6Gateway(String ipv6Gateway) {
            this.ipv6Gateway = ipv6Gateway;
            return this;
        }

        public NetworkConfig build() {
            return new NetworkConfig(this);
        }
    }
}
