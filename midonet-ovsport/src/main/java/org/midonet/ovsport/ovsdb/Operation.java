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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One operation of an OVSDB {@code transact} request.
 */
public abstract class Operation {

    protected static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private final String op;
    private final String table;

    protected Operation(String op, String table) {
        this.op = op;
        this.table = table;
    }

    /** The operation name on the wire, e.g. "insert". */
    public String getOp() {
        return op;
    }

    public String getTable() {
        return table;
    }

    /**
     * Serializes this operation as an element of the transact params.
     */
    public ObjectNode toJson() {
        ObjectNode json = nodes.objectNode();
        json.put("op", op);
        json.put("table", table);
        fill(json);
        return json;
    }

    protected abstract void fill(ObjectNode json);

    @Override
    public String toString() {
        return op + " on " + table;
    }
}
