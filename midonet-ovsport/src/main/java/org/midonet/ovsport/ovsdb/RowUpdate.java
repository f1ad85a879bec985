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
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The {@code {"old": ..., "new": ...}} pair describing the change of one
 * row. An absent or empty new value means the row was deleted.
 */
public final class RowUpdate {

    private final ObjectNode oldRow;
    private final ObjectNode newRow;

    public RowUpdate(ObjectNode oldRow, ObjectNode newRow) {
        this.oldRow = oldRow;
        this.newRow = newRow;
    }

    public static RowUpdate fromJson(JsonNode json) {
        return new RowUpdate(object(json.get("old")), object(json.get("new")));
    }

    private static ObjectNode object(JsonNode node) {
        return node != null && node.isObject() ? (ObjectNode) node : null;
    }

    /** May be null. */
    public ObjectNode getOld() {
        return oldRow;
    }

    /** May be null. */
    public ObjectNode getNew() {
        return newRow;
    }

    public boolean isDeletion() {
        return newRow == null || newRow.size() == 0;
    }

    @Override
    public String toString() {
        return "{old=" + oldRow + ", new=" + newRow + "}";
    }
}
