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

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Inserts a row. The row may be referenced by later operations of the same
 * transaction with {@link OvsdbValues#namedUuid(String)} and its uuid-name.
 */
public class Insert extends Operation {

    private final ObjectNode row;
    private final String uuidName;

    public Insert(String table, ObjectNode row, String uuidName) {
        super("insert", table);
        this.row = row.deepCopy();
        this.uuidName = uuidName;
    }

    @Override
    protected void fill(ObjectNode json) {
        json.set("row", row.deepCopy());
        if (uuidName != null) {
            json.put("uuid-name", uuidName);
        }
    }

    @Override
    public String toString() {
        return super.toString() + " as " + uuidName;
    }
}
