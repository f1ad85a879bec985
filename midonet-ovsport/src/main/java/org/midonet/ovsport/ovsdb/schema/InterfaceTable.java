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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.midonet.ovsport.ovsdb.Insert;
import org.midonet.ovsport.ovsdb.Row;

/**
 * The Interface table: one row per network device the switch handles.
 */
public final class InterfaceTable extends Table {

    public static final String TABLE_NAME = "Interface";
    public static final String COL_TYPE = "type";

    /**
     * The interface type for internal ports: a virtual device created by
     * the switch and visible to the kernel.
     */
    public static final String TYPE_INTERNAL = "internal";

    public static final InterfaceTable INSTANCE = new InterfaceTable();

    private InterfaceTable() {
        super(TABLE_NAME, COL_NAME, COL_TYPE);
    }

    /**
     * Inserts an internal interface named after the port it will back.
     */
    public Insert insertInternal(String name, String uuidName) {
        ObjectNode row = JsonNodeFactory.instance.objectNode();
        row.put(COL_NAME, name);
        row.put(COL_TYPE, TYPE_INTERNAL);
        return new Insert(TABLE_NAME, row, uuidName);
    }

    /** The type of the interface; an empty type means a system device. */
    public String type(Row row) {
        return extractString(row, COL_TYPE);
    }
}
