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

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A batch of row changes, keyed by table name then by row uuid. This is
 * both the result of a {@code monitor} request (the initial snapshot, all
 * rows as inserts) and the payload of each {@code update} notification.
 */
public final class TableUpdates {

    private final Map<String, Map<String, RowUpdate>> updates;

    private TableUpdates(Map<String, Map<String, RowUpdate>> updates) {
        this.updates = updates;
    }

    public static TableUpdates empty() {
        return new TableUpdates(
            Collections.<String, Map<String, RowUpdate>>emptyMap());
    }

    /**
     * Parses a {@code <table-updates>} object.
     *
     * @throws IllegalArgumentException if the value is not an object of
     *         objects
     */
    public static TableUpdates fromJson(JsonNode json) {
        if (json == null || json.isNull()) {
            return empty();
        }
        if (!json.isObject()) {
            throw new IllegalArgumentException(
                "table-updates must be an object: " + json);
        }
        Builder builder = builder();
        Iterator<Map.Entry<String, JsonNode>> tables = json.fields();
        while (tables.hasNext()) {
            Map.Entry<String, JsonNode> table = tables.next();
            if (!table.getValue().isObject()) {
                throw new IllegalArgumentException(
                    "table-update must be an object: " + table.getValue());
            }
            builder.table(table.getKey());
            Iterator<Map.Entry<String, JsonNode>> rows =
                table.getValue().fields();
            while (rows.hasNext()) {
                Map.Entry<String, JsonNode> row = rows.next();
                builder.row(table.getKey(), row.getKey(),
                            RowUpdate.fromJson(row.getValue()));
            }
        }
        return builder.build();
    }

    public Map<String, Map<String, RowUpdate>> tables() {
        return updates;
    }

    public boolean isEmpty() {
        return updates.isEmpty();
    }

    @Override
    public String toString() {
        return "TableUpdates" + updates;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Map<String, RowUpdate>> updates =
            new LinkedHashMap<>();

        private Builder() { }

        /** Mentions a table, even with no row changes. */
        public Builder table(String table) {
            updates.computeIfAbsent(table, t -> new LinkedHashMap<>());
            return this;
        }

        public Builder row(String table, String uuid, RowUpdate update) {
            table(table).updates.get(table).put(uuid, update);
            return this;
        }

        public Builder upsert(String table, String uuid, ObjectNode row) {
            return row(table, uuid, new RowUpdate(null, row));
        }

        public Builder delete(String table, String uuid) {
            return row(table, uuid, new RowUpdate(null, null));
        }

        public TableUpdates build() {
            Map<String, Map<String, RowUpdate>> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, RowUpdate>> e :
                    updates.entrySet()) {
                copy.put(e.getKey(), Collections.unmodifiableMap(
                    new LinkedHashMap<>(e.getValue())));
            }
            return new TableUpdates(Collections.unmodifiableMap(copy));
        }
    }
}
