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

import java.io.Closeable;

import org.midonet.ovsport.OvsPortException;

/**
 * Creates OVS internal ports on existing bridges.
 */
public interface PortProvisioner extends Closeable {

    /**
     * Creates an internal port named after the prefix plus a random suffix,
     * and attaches it to the bridge.
     *
     * @return the name of the new port, which is also the name of the
     *         kernel device backing it
     * @throws OvsPortException.ConnectionFailedException if the switch
     *         cannot be reached
     * @throws OvsPortException.TransactionFailedException if the port was
     *         not created and attached; no port should be assumed to exist
     */
    String createInternalPort(String namePrefix, String bridgeName)
        throws OvsPortException;

    @Override
    default void close() { }
}
