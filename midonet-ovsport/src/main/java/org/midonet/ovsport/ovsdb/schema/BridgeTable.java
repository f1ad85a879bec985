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

import java.util.Collections;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import org.midonet.ovsport.ovsdb.Condition;
import org.midonet.ovsport.ovsdb.Mutate;
import org.midonet.ovsport.ovsdb.Mutation;
import org.midonet.ovsport.ovsdb.OvsdbValues;
import org.midonet.ovsport.ovsdb.Row;
import org.midonet.ovsport.ovsdb.TableCache;

/**
 * The Bridge table. Bridges are created and owned elsewhere; this client
 * only adds ports to them.
 */
public final class BridgeTable extends Table {

    public static final String TABLE_NAME = "Bridge";
    public static final String COL_PORTS = "ports";

    public static final BridgeTable INSTANCE = new BridgeTable();

    private BridgeTable() {
        super(TABLE_NAME, COL_NAME, COL_PORTS);
    }

    /**
     * Adds a port inserted earlier in the same transaction to the ports of
     * the bridge with the given name. The reply's count tells whether such
     * a bridge existed.
     *
     * @param portUuidName the uuid-name of the port's insert
     */
    public Mutate addPort(String bridgeName, String portUuidName) {
        return new Mutate(
            TABLE_NAME,
            Collections.singletonList(
                Condition.equalTo(COL_NAME, bridgeName)),
            Collections.singletonList(
                Mutation.insert(COL_PORTS, OvsdbValues.set(
                    OvsdbValues.namedUuid(portUuidName)))));
    }

    public Set<String> ports(Row row) {
        return extractUuids(row, COL_PORTS);
    }

    /**
     * Looks a bridge up by name in a session's mirror.
     *
     * @return the row, or null if no such bridge is known
     */
    @Nullable
    public Row find(TableCache cache, String bridgeName) {
        List<Row> rows = cache.findByName(TABLE_NAME, bridgeName);
        return rows.isEmpty() ? null : rows.get(0);
    }
}
