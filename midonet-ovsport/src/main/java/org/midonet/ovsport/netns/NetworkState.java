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

import java.io.File;
import java.io.IOException;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Hand-off between the attachment stage, run outside the namespace, and
 * the finalization stage, run inside it. It can be written to a file so
 * the two stages may run in different processes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NetworkState {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @JsonProperty("ovs_port")
    private String ovsPort;

    public NetworkState() { }

    public NetworkState(String ovsPort) {
        this.ovsPort = ovsPort;
    }

    /** Name of the provisioned port, null until attachment succeeds. */
    @Nullable
    public String getOvsPort() {
        return ovsPort;
    }

    public void setOvsPort(String ovsPort) {
        this.ovsPort = ovsPort;
    }

    public void writeTo(File file) throws IOException {
        objectMapper.writeValue(file, this);
    }

    public static NetworkState readFrom(File file) throws IOException {
        return objectMapper.readValue(file, NetworkState.class);
    }

    @Override
    public String toString() {
        return "NetworkState{ovsPort=" + ovsPort + "}";
    }
}
