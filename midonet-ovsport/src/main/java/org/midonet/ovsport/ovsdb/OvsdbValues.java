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

import java.util.LinkedHashSet;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Conversions between Java values and the OVSDB JSON notation of
 * RFC 7047: uuids are {@code ["uuid", "..."]}, references to rows inserted
 * in the same transaction are {@code ["named-uuid", "..."]}, and sets are
 * {@code ["set", [...]]} unless they hold exactly one atom.
 */
public final class OvsdbValues {

    public static final String UUID = "uuid";
    public static final String NAMED_UUID = "named-uuid";
    public static final String SET = "set";

    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private OvsdbValues() { }

    /**
     * Converts a row UUID into an Open vSwitch UUID reference to an
     * existing row.
     */
    public static ArrayNode uuid(String uuid) {
        return pair(UUID, uuid);
    }

    /**
     * References a row inserted in the same transaction through the
     * uuid-name it was given by its insert operation.
     */
    public static ArrayNode namedUuid(String uuidName) {
        return pair(NAMED_UUID, uuidName);
    }

    /**
     * Wraps the given atoms in an OVSDB set.
     */
    public static ArrayNode set(JsonNode... atoms) {
        ArrayNode members = nodes.arrayNode();
        for (JsonNode atom : atoms) {
            members.add(atom);
        }
        ArrayNode set = nodes.arrayNode();
        set.add(SET);
        set.add(members);
        return set;
    }

    public static ArrayNode emptySet() {
        return set();
    }

    /**
     * Returns true if the value is a {@code ["uuid", ...]} or
     * {@code ["named-uuid", ...]} pair.
     */
    public static boolean isReference(JsonNode value) {
        return value != null && value.isArray() && value.size() == 2
               && value.get(0).isTextual()
               && (UUID.equals(value.get(0).asText())
                   || NAMED_UUID.equals(value.get(0).asText()));
    }

    /**
     * Extracts the uuids of a column holding either a single uuid atom or
     * a set of them. Absent or null values give an empty set.
     */
    public static Set<String> uuids(JsonNode value) {
        Set<String> result = new LinkedHashSet<>();
        for (JsonNode atom : atoms(value)) {
            if (isReference(atom)) {
                result.add(atom.get(1).asText());
            }
        }
        return result;
    }

    /**
     * Flattens a column value into its atoms: a set yields its members, a
     * map yields nothing useful here and is returned as is, any other
     * value is a single atom.
     */
    public static Iterable<JsonNode> atoms(JsonNode value) {
        ArrayNode result = nodes.arrayNode();
        if (value == null || value.isNull() || value.isMissingNode()) {
            return result;
        }
        if (value.isArray() && value.size() == 2 && value.get(0).isTextual()
            && SET.equals(value.get(0).asText()) && value.get(1).isArray()) {
            for (JsonNode member : value.get(1)) {
                result.add(member);
            }
        } else {
            result.add(value);
        }
        return result;
    }

    /**
     * Returns the string held by a column, or null if the column is absent
     * or is an empty set (the OVSDB encoding of an unset optional string).
     */
    public static String string(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isTextual()) {
            return value.asText();
        }
        for (JsonNode atom : atoms(value)) {
            if (atom.isTextual()) {
                return atom.asText();
            }
        }
        return null;
    }

    private static ArrayNode pair(String tag, String value) {
        ArrayNode pair = nodes.arrayNode();
        pair.add(tag);
        pair.add(value);
        return pair;
    }
}
