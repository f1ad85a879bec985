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

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An immutable copy of one row of the local table mirror.
 */
public final class Row {

    private final String table;
    private final String uuid;
    private final ObjectNode fields;

    public Row(String table, String uuid, ObjectNode fields) {
        this.table = table;
        this.uuid = uuid;
        this.fields = fields.deepCopy();
    }

    public String getTable() {
        return table;
    }

    public String getUuid() {
        return uuid;
    }

    /** The column value, or null if the column is not mirrored. */
    public JsonNode get(String column) {
        return fields.get(column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        Row that = (Row) o;
        return table.equals(that.table) && uuid.equals(that.uuid)
               && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, uuid, fields);
    }

    @Override
    public String toString() {
        return table + "[" + uuid + "]" + fields;
    }
}
