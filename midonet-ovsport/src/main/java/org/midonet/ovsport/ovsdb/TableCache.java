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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;

/**
 * Local mirror of the monitored tables: table name to row uuid to row.
 *
 * Updates are applied in the order they are handed in. Applying a row
 * change is an overwrite or a removal, so applying the same update twice
 * is the same as applying it once. The session's reader thread writes and
 * any thread may read; a read-write lock guards the maps.
 */
public class TableCache {

    private final Map<String, Map<String, ObjectNode>> tables =
        new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void applyUpdate(TableUpdates update) {
        lock.writeLock().lock();
        try {
            for (Map.Entry<String, Map<String, RowUpdate>> table :
                    update.tables().entrySet()) {
                Map<String, ObjectNode> rows = tables.computeIfAbsent(
                    table.getKey(), t -> new LinkedHashMap<>());
                for (Map.Entry<String, RowUpdate> row :
                        table.getValue().entrySet()) {
                    RowUpdate change = row.getValue();
                    if (change.isDeletion()) {
                        rows.remove(row.getKey());
                    } else {
                        rows.put(row.getKey(), change.getNew().deepCopy());
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** The row, or null if it is not in the mirror. */
    @Nullable
    public Row row(String table, String uuid) {
        lock.readLock().lock();
        try {
            Map<String, ObjectNode> rows = tables.get(table);
            ObjectNode fields = rows == null ? null : rows.get(uuid);
            return fields == null ? null : new Row(table, uuid, fields);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Row> rows(String table) {
        lock.readLock().lock();
        try {
            Map<String, ObjectNode> rows = tables.get(table);
            List<Row> result = new ArrayList<>();
            if (rows != null) {
                for (Map.Entry<String, ObjectNode> e : rows.entrySet()) {
                    result.add(new Row(table, e.getKey(), e.getValue()));
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Rows whose {@code name} column equals the given name. The schema
     * makes names unique in the Bridge, Port and Interface tables, so this
     * holds at most one row for them.
     */
    public List<Row> findByName(String table, String name) {
        List<Row> result = new ArrayList<>();
        for (Row row : rows(table)) {
            if (name.equals(OvsdbValues.string(row.get("name")))) {
                result.add(row);
            }
        }
        return result;
    }

    public int size(String table) {
        lock.readLock().lock();
        try {
            Map<String, ObjectNode> rows = tables.get(table);
            return rows == null ? 0 : rows.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Names of the tables seen so far, including empty ones. */
    public Set<String> tables() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(tables.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * A deep copy of the whole mirror, for comparisons and diagnostics.
     */
    public Map<String, Map<String, ObjectNode>> snapshot() {
        lock.readLock().lock();
        try {
            ImmutableMap.Builder<String, Map<String, ObjectNode>> copy =
                ImmutableMap.builder();
            for (Map.Entry<String, Map<String, ObjectNode>> t :
                    tables.entrySet()) {
                ImmutableMap.Builder<String, ObjectNode> rows =
                    ImmutableMap.builder();
                for (Map.Entry<String, ObjectNode> r :
                        t.getValue().entrySet()) {
                    rows.put(r.getKey(), r.getValue().deepCopy());
                }
                copy.put(t.getKey(), rows.build());
            }
            return copy.build();
        } finally {
            lock.readLock().unlock();
        }
    }

    void clear() {
        lock.writeLock().lock();
        try {
            tables.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
