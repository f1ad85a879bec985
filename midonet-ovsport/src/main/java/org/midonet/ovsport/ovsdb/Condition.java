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
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * A {@code [column, function, value]} condition of a where clause.
 */
public final class Condition {

    public static final String EQUALS = "==";

    private final String column;
    private final String function;
    private final JsonNode value;

    private Condition(String column, String function, JsonNode value) {
        this.column = column;
        this.function = function;
        this.value = value;
    }

    public static Condition equalTo(String column, JsonNode value) {
        return new Condition(column, EQUALS, value);
    }

    public static Condition equalTo(String column, String value) {
        return equalTo(column, TextNode.valueOf(value));
    }

    public String getColumn() {
        return column;
    }

    public String getFunction() {
        return function;
    }

    public JsonNode getValue() {
        return value;
    }

    public ArrayNode toJson() {
        ArrayNode json = JsonNodeFactory.instance.arrayNode();
        json.add(column);
        json.add(function);
        json.add(value);
        return json;
    }

    @Override
    public String toString() {
        return column + " " + function + " " + value;
    }
}
