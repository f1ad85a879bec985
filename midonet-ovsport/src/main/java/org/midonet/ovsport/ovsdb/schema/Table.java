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

package org.midonet.ovsport.ovsdb.schema;

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import org.midonet.ovsport.ovsdb.OvsdbValues;
import org.midonet.ovsport.ovsdb.Row;

/**
 * Generic ovsdb table schema. Subclasses know the columns this client
 * reads and writes, build the operations touching their table, and decode
 * the values of mirrored rows so callers never handle the raw notation.
 */
public abstract class Table {

    public static final String COL_NAME = "name";

    private final String name;
    private final List<String> columns;

    protected Table(String name, String... columns) {
        this.name = name;
        this.columns = ImmutableList.copyOf(columns);
    }

    public String getName() {
        return name;
    }

    /** The columns requested when monitoring this table. */
    public List<String> getColumns() {
        return columns;
    }

    /** The name column of a row of this table, null if unset. */
    public String name(Row row) {
        return extractString(row, COL_NAME);
    }

    /**
     * Extract a string from a column, treating empty values as unset.
     */
    protected String extractString(Row row, String column) {
        String value = (row == null) ? null
                                     : OvsdbValues.string(row.get(column));
        return (value == null || value.isEmpty()) ? null : value;
    }

    /**
     * Extract the uuids of a reference column, protecting against null
     * values.
     */
    protected Set<String> extractUuids(Row row, String column) {
        return OvsdbValues.uuids(row == null ? null : row.get(column));
    }

    @Override
    public String toString() {
        return name;
    }
}
