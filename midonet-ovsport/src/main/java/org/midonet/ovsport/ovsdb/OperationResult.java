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

/**
 * The reply to one operation of a transaction. Every field is optional on
 * the wire: inserts report a {@code uuid}, mutations and updates a
 * {@code count}, and failed operations an {@code error} with optional
 * {@code details}. A JSON {@code null} stands for an operation the server
 * did not execute because an earlier one failed.
 */
public final class OperationResult {

    private static final OperationResult NOT_EXECUTED =
        new OperationResult(false, -1, null, null, null);

    private final boolean executed;
    private final int count;
    private final String uuid;
    private final String error;
    private final String details;

    public OperationResult(boolean executed, int count, String uuid,
                           String error, String details) {
        this.executed = executed;
        this.count = count;
        this.uuid = uuid;
        this.error = error;
        this.details = details;
    }

    public static OperationResult notExecuted() {
        return NOT_EXECUTED;
    }

    public static OperationResult fromJson(JsonNode json) {
        if (json == null || json.isNull()) {
            return NOT_EXECUTED;
        }
        JsonNode count = json.get("count");
        JsonNode uuid = json.get("uuid");
        return new OperationResult(
            true,
            count == null ? -1 : count.asInt(),
            OvsdbValues.isReference(uuid) ? uuid.get(1).asText() : null,
            text(json.get("error")),
            text(json.get("details")));
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    public boolean isExecuted() {
        return executed;
    }

    /** Number of rows matched, or -1 when the reply has no count. */
    public int getCount() {
        return count;
    }

    /** Uuid assigned to an inserted row, null for other operations. */
    public String getUuid() {
        return uuid;
    }

    public String getError() {
        return error;
    }

    public String getDetails() {
        return details;
    }

    public boolean hasError() {
        return error != null && !error.trim().isEmpty();
    }

    @Override
    public String toString() {
        if (!executed) {
            return "OperationResult{not executed}";
        }
        return "OperationResult{count=" + count + ", uuid=" + uuid
               + ", error=" + error + ", details=" + details + "}";
    }
}
