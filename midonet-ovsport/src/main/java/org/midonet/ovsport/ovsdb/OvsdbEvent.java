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
import com.google.common.base.Preconditions;

/**
 * A message pushed by the database server outside of any reply. Only
 * {@link Kind#UPDATED} carries state; lock events and echo requests are
 * part of the protocol but hold nothing this client mirrors.
 */
public final class OvsdbEvent {

    public enum Kind {
        /** A monitor update notification. */
        UPDATED,
        /** A previously requested lock was acquired. */
        LOCKED,
        /** A held lock was stolen by another client. */
        STOLEN,
        /** A keepalive request from the server. */
        ECHO
    }

    private final Kind kind;
    private final TableUpdates updates;
    private final JsonNode params;

    private OvsdbEvent(Kind kind, TableUpdates updates, JsonNode params) {
        this.kind = kind;
        this.updates = updates;
        this.params = params;
    }

    public static OvsdbEvent updated(TableUpdates updates) {
        return new OvsdbEvent(Kind.UPDATED,
                              Preconditions.checkNotNull(updates), null);
    }

    public static OvsdbEvent locked(JsonNode params) {
        return new OvsdbEvent(Kind.LOCKED, null, params);
    }

    public static OvsdbEvent stolen(JsonNode params) {
        return new OvsdbEvent(Kind.STOLEN, null, params);
    }

    public static OvsdbEvent echo(JsonNode params) {
        return new OvsdbEvent(Kind.ECHO, null, params);
    }

    /**
     * Builds the event for a server-initiated JSON-RPC method.
     *
     * @return the event, or null for a method this client does not know
     * @throws IllegalArgumentException if an update is malformed
     */
    public static OvsdbEvent fromNotification(String method, JsonNode params) {
        switch (method) {
            case "update":
                // params: [<json-value> monitor id, <table-updates>]
                if (params == null || !params.isArray() || params.size() < 2) {
                    throw new IllegalArgumentException(
                        "malformed update notification: " + params);
                }
                return updated(TableUpdates.fromJson(params.get(1)));
            case "locked":
                return locked(params);
            case "stolen":
                return stolen(params);
            case "echo":
                return echo(params);
            default:
                return null;
        }
    }

    public Kind getKind() {
        return kind;
    }

    /** The row changes of an {@link Kind#UPDATED} event, else null. */
    public TableUpdates getUpdates() {
        return updates;
    }

    /** The raw params of the other kinds, may be null. */
    public JsonNode getParams() {
        return params;
    }

    @Override
    public String toString() {
        return kind == Kind.UPDATED ? "UPDATED " + updates
                                    : kind + " " + params;
    }
}
