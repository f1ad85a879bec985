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

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.ovsport.OvsPortException.ConnectionFailedException;
import org.midonet.ovsport.OvsPortException.TransactionFailedException;
import org.midonet.ovsport.config.OvsPortConfig;
import org.midonet.ovsport.ovsdb.schema.BridgeTable;
import org.midonet.ovsport.ovsdb.schema.InterfaceTable;
import org.midonet.ovsport.ovsdb.schema.PortTable;
import org.midonet.ovsport.ovsdb.schema.Table;

/**
 * A session with the switch's control database: one connection, one
 * {@link TableCache} kept current by a {@link ChangeNotifier}, and a
 * blocking {@link #transact} primitive.
 *
 * Sessions share no state with each other, so several may be open at the
 * same time against the same or different servers.
 */
public class OvsdbSession implements Closeable {

    private static final Logger log =
        LoggerFactory.getLogger(OvsdbSession.class);

    /** The tables mirrored by default. */
    public static final List<Table> DEFAULT_TABLES = ImmutableList.of(
        BridgeTable.INSTANCE, PortTable.INSTANCE, InterfaceTable.INSTANCE);

    private static final String MONITOR_ID = "ovsport";

    private final String database;
    private final TableCache cache = new TableCache();
    private final ChangeNotifier notifier = new ChangeNotifier(cache);
    private OvsdbConnection connection;

    private OvsdbSession(String database) {
        this.database = database;
    }

    /**
     * Connects to the server named in the configuration and loads the
     * initial state of the default tables.
     */
    public static OvsdbSession connect(OvsPortConfig config)
            throws ConnectionFailedException {
        return connect(config.ovsdbHost(), config.ovsdbPort(),
                       config.ovsdbDatabase(), config.connectTimeoutMillis(),
                       config.requestTimeoutMillis(), DEFAULT_TABLES);
    }

    /**
     * Connects, subscribes to the given tables and installs their current
     * rows in the cache. Any failure, including a rejected monitor request,
     * closes the connection and fails the whole call.
     */
    public static OvsdbSession connect(String host, int port, String database,
                                       long connectTimeoutMillis,
                                       long requestTimeoutMillis,
                                       List<Table> tables)
            throws ConnectionFailedException {
        final OvsdbSession session = new OvsdbSession(database);
        session.connection = OvsdbConnection.open(
            host, port, connectTimeoutMillis, requestTimeoutMillis,
            session::onNotification);
        try {
            session.monitor(tables);
        } catch (ConnectionFailedException e) {
            session.close();
            throw e;
        }
        return session;
    }

    private void onNotification(String method, JsonNode params) {
        OvsdbEvent event;
        try {
            event = OvsdbEvent.fromNotification(method, params);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping {} notification: {}", method, e.getMessage());
            return;
        }
        if (event == null) {
            log.debug("Ignoring unknown method {}", method);
            return;
        }
        notifier.onEvent(event);
    }

    private void monitor(List<Table> tables) throws ConnectionFailedException {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode requests = nodes.objectNode();
        for (Table table : tables) {
            ObjectNode request = requests.putObject(table.getName());
            ArrayNode columns = request.putArray("columns");
            for (String column : table.getColumns()) {
                columns.add(column);
            }
        }
        ArrayNode params = nodes.arrayNode();
        params.add(database);
        params.add(MONITOR_ID);
        params.add(requests);

        JsonNode response = connection.call("monitor", params);
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            throw new ConnectionFailedException(
                "monitor request rejected by " + connection.getEndpoint()
                + ": " + error);
        }
        TableUpdates snapshot;
        try {
            snapshot = TableUpdates.fromJson(response.get("result"));
        } catch (IllegalArgumentException e) {
            throw new ConnectionFailedException(
                "malformed monitor snapshot: " + e.getMessage(), e);
        }
        notifier.prime(snapshot);
        log.info("Monitoring {} on {}", tables, connection.getEndpoint());
    }

    /**
     * Submits the operations as one transaction and waits for its reply.
     *
     * @return one result per reply entry, in order. The server may append
     *         extra entries for commit-level errors; use
     *         {@link TransactionResults#check} to interpret them.
     * @throws ConnectionFailedException on I/O failure or timeout
     * @throws TransactionFailedException if the server rejects the request
     *         as a whole
     */
    public List<OperationResult> transact(List<? extends Operation> ops)
            throws ConnectionFailedException, TransactionFailedException {
        ArrayNode params = JsonNodeFactory.instance.arrayNode();
        params.add(database);
        for (Operation op : ops) {
            params.add(op.toJson());
        }

        JsonNode response = connection.call("transact", params);
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            throw new TransactionFailedException(
                "request rejected: " + error, -1, null,
                error.isObject() && error.has("error")
                    ? error.get("error").asText() : error.asText(),
                error.isObject() && error.has("details")
                    ? error.get("details").asText() : null);
        }
        JsonNode result = response.get("result");
        if (result == null || !result.isArray()) {
            throw new TransactionFailedException(
                "reply has no result array: " + response);
        }
        List<OperationResult> results = new ArrayList<>(result.size());
        for (JsonNode r : result) {
            results.add(OperationResult.fromJson(r));
        }
        log.debug("Transaction of {} operations returned {}", ops.size(),
                  results);
        return results;
    }

    public TableCache getCache() {
        return cache;
    }

    public String getDatabase() {
        return database;
    }

    public boolean isOpen() {
        return connection != null && connection.isOpen();
    }

    @Override
    public void close() {
        if (connection != null) {
            connection.close();
        }
        cache.clear();
    }
}
