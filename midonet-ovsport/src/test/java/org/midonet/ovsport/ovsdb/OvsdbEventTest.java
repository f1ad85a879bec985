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

package org.midonet.ovsport.ovsdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class OvsdbEventTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return mapper.readTree(text.replace('\'', '"'));
    }

    @Test
    public void testUpdateNotification() throws Exception {
        OvsdbEvent event = OvsdbEvent.fromNotification("update", json(
            "['ovsport', {'Port': {"
            + "'p1': {'new': {'name': 'veth1'}},"
            + "'p2': {'old': {'name': 'veth2'}}}}]"));

        assertThat(event.getKind(), is(OvsdbEvent.Kind.UPDATED));
        assertThat(event.getUpdates().tables().get("Port").keySet(),
                   containsInAnyOrder("p1", "p2"));
        assertThat(event.getUpdates().tables().get("Port").get("p2")
                       .isDeletion(), is(true));
        assertThat(event.getUpdates().tables().get("Port").get("p1")
                       .isDeletion(), is(false));
    }

    @Test
    public void testOtherKinds() throws Exception {
        OvsdbEvent locked = OvsdbEvent.fromNotification("locked",
                                                        json("['l']"));
        assertThat(locked.getKind(), is(OvsdbEvent.Kind.LOCKED));
        assertThat(locked.getParams().get(0).asText(), is("l"));
        assertThat(locked.getUpdates(), nullValue());
        assertThat(OvsdbEvent.fromNotification("stolen", json("['l']"))
                       .getKind(), is(OvsdbEvent.Kind.STOLEN));
        assertThat(OvsdbEvent.fromNotification("echo", json("[]"))
                       .getKind(), is(OvsdbEvent.Kind.ECHO));
    }

    @Test
    public void testUnknownMethodGivesNull() throws Exception {
        assertThat(OvsdbEvent.fromNotification("update2", json("[]")),
                   nullValue());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUpdateWithoutTableUpdates() throws Exception {
        OvsdbEvent.fromNotification("update", json("['ovsport']"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUpdateWithMalformedTable() throws Exception {
        OvsdbEvent.fromNotification("update",
                                    json("['ovsport', {'Port': [1, 2]}]"));
    }
}
