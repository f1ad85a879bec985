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

import org.midonet.ovsport.OvsPortException;

/**
 * A way of giving a network namespace its network device. Set-up happens
 * in two stages: {@link #create} runs in the parent namespace, then
 * {@link #initialize} runs inside the target namespace.
 */
public interface NetworkStrategy {

    /**
     * Creates the device and hands it to the namespace of the process
     * {@code nsPid}, recording what the second stage needs in the state.
     */
    void create(NetworkConfig config, int nsPid, NetworkState state)
        throws OvsPortException;

    /**
     * Configures the device handed over by {@link #create}, from inside the
     * namespace.
     */
    void initialize(NetworkConfig config, NetworkState state)
        throws OvsPortException;
}
