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

import java.util.Set;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.midonet.ovsport.ovsdb.Insert;
import org.midonet.ovsport.ovsdb.OvsdbValues;
import org.midonet.ovsport.ovsdb.Row;

/**
 * The Port table: a named attachment point of a bridge, backed by one or
 * more interfaces.
 */
public final class PortTable extends Table {

    public static final String TABLE_NAME = "Port";
    public static final String COL_INTERFACES = "interfaces";

    public static final PortTable INSTANCE = new PortTable();

    private PortTable() {
        super(TABLE_NAME, COL_NAME, COL_INTERFACES);
    }

    /**
     * Inserts a port backed by a single interface inserted earlier in the
     * same transaction.
     *
     * @param interfaceUuidName the uuid-name of that interface's insert
     */
    public Insert insert(String name, String interfaceUuidName,
                         String uuidName) {
        ObjectNode row = JsonNodeFactory.instance.objectNode();
        row.put(COL_NAME, name);
        row.set(COL_INTERFACES, OvsdbValues.namedUuid(interfaceUuidName));
        return new Insert(TABLE_NAME, row, uuidName);
    }

    public Set<String> interfaces(Row row) {
        return extractUuids(row, COL_INTERFACES);
    }
}
