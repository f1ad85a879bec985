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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * A {@code [column, mutator, value]} element of a mutate operation.
 */
public final class Mutation {

    public static final String INSERT = "insert";

    private final String column;
    private final String mutator;
    private final JsonNode value;

    private Mutation(String column, String mutator, JsonNode value) {
        this.column = column;
        this.mutator = mutator;
        this.value = value;
    }

    /**
     * Adds the members of the given set (or the single atom) to a set
     * column.
     */
    public static Mutation insert(String column, JsonNode value) {
        return new Mutation(column, INSERT, value);
    }

    public String getColumn() {
        return column;
    }

    public String getMutator() {
        return mutator;
    }

    public JsonNode getValue() {
        return value;
    }

    public ArrayNode toJson() {
        ArrayNode json = JsonNodeFactory.instance.arrayNode();
        json.add(column);
        json.add(mutator);
        json.add(value);
        return json;
    }

    @Override
    public String toString() {
        return column + " " + mutator + " " + value;
    }
}
