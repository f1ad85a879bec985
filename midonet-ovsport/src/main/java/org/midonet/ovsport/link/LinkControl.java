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

/**
 * Single-step operations on network links. Each call either takes full
 * effect or throws; none of them is retried.
 */
public interface LinkControl {

    /** Whether a link with that name is visible in this namespace. */
    boolean exists(String device) throws IOException;

    void setMtu(String device, int mtu) throws IOException;

    void up(String device) throws IOException;

    void down(String device) throws IOException;

    void rename(String device, String newName) throws IOException;

    void setMac(String device, String mac) throws IOException;

    /**
     * Adds an address in CIDR notation, either family.
     */
    void addAddress(String device, String cidr) throws IOException;

    /**
     * Installs a default route through the gateway, in the gateway's
     * address family.
     */
    void setDefaultGateway(String device, String gateway) throws IOException;

    /**
     * Moves the link into the network namespace of the given process.
     */
    void moveToNamespace(String device, int pid) throws IOException;
}
