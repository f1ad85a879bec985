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
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An in-memory Open vSwitch database server for tests. It speaks JSON-RPC
 * on a loopback socket and supports monitor, transact (insert and mutate
 * with named-uuid references), and echo. Commits are serialized and pushed
 * to every monitoring client as update notifications.
 */
public class FakeOvsdbServer implements Closeable {

    private static final Logger log =
        LoggerFactory.getLogger(FakeOvsdbServer.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final ServerSocket serverSocket;
    private final Thread acceptor;
    private final List<Client> clients = new CopyOnWriteArrayList<>();

    private final Map<String, Map<String, ObjectNode>> tables =
        new HashMap<>();

    private final BlockingQueue<JsonNode> echoReplies =
        new LinkedBlockingQueue<>();

    private volatile long replyDelayMillis = 0;
    private volatile String monitorError = null;
    private String failingOp = null;
    private String failingError = null;
    private String failingDetails = null;
    private volatile boolean closed = false;

    public FakeOvsdbServer() throws IOException {
        serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        acceptor = new Thread(this::acceptLoop, "fake-ovsdb-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
    }

    public String getHost() {
        return serverSocket.getInetAddress().getHostAddress();
    }

    public int getPort() {
        return serverSocket.getLocalPort();
    }

    /** Adds a bridge with no ports and returns its uuid. */
    public synchronized String addBridge(String name) {
        ObjectNode row = objectMapper.createObjectNode();
        row.put("name", name);
        row.set("ports", OvsdbValues.emptySet());
        String uuid = UUID.randomUUID().toString();
        table(tables, "Bridge").put(uuid, row);
        return uuid;
    }

    /** A copy of the named row of the table, or null. */
    public synchronized ObjectNode findRow(String table, String name) {
        Map<String, ObjectNode> rows = tables.get(table);
        if (rows == null) {
            return null;
        }
        for (ObjectNode row : rows.values()) {
            if (name.equals(OvsdbValues.string(row.get("name")))) {
                return row.deepCopy();
            }
        }
        return null;
    }

    public synchronized String findUuid(String table, String name) {
        Map<String, ObjectNode> rows = tables.get(table);
        if (rows != null) {
            for (Map.Entry<String, ObjectNode> e : rows.entrySet()) {
                if (name.equals(OvsdbValues.string(e.getValue().get("name")))) {
                    return e.getKey();
                }
            }
        }
        return null;
    }

    public synchronized int size(String table) {
        Map<String, ObjectNode> rows = tables.get(table);
        return rows == null ? 0 : rows.size();
    }

    /** Delays every reply to a request by the given time. */
    public void setReplyDelay(long millis) {
        this.replyDelayMillis = millis;
    }

    /** Makes monitor requests fail with the given error. */
    public void rejectMonitor(String error) {
        this.monitorError = error;
    }

    /**
     * Makes the next operation of the given kind fail with the given error,
     * aborting its transaction.
     */
    public synchronized void failNext(String op, String error,
                                      String details) {
        this.failingOp = op;
        this.failingError = error;
        this.failingDetails = details;
    }

    /** Sends an echo request to every connected client. */
    public void sendEcho(String id, JsonNode params) throws IOException {
        ObjectNode echo = objectMapper.createObjectNode();
        echo.put("method", "echo");
        echo.set("params", params);
        echo.put("id", id);
        for (Client client : clients) {
            client.send(echo);
        }
    }

    public JsonNode awaitEchoReply(long timeoutMillis)
            throws InterruptedException {
        return echoReplies.poll(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Inserts a row outside of any client transaction, as another database
     * client would, and notifies the monitors. Returns the new uuid.
     */
    public String insertRow(String table, ObjectNode row) {
        String uuid = UUID.randomUUID().toString();
        Map<String, Map<String, RowUpdate>> changes = new LinkedHashMap<>();
        synchronized (this) {
            table(tables, table).put(uuid, row.deepCopy());
            changes.computeIfAbsent(table, t -> new LinkedHashMap<>())
                   .put(uuid, new RowUpdate(null, row.deepCopy()));
            publish(changes);
        }
        return uuid;
    }

    private void acceptLoop() {
        while (!closed) {
            try {
                Socket socket = serverSocket.accept();
                Client client = new Client(socket);
                clients.add(client);
                client.start();
            } catch (IOException e) {
                if (!closed) {
                    log.warn("Accept failed", e);
                }
                return;
            }
        }
    }

    private ObjectNode handle(Client client, String method, JsonNode params) {
        switch (method) {
            case "monitor":
                return monitor(client, params);
            case "transact":
                return transact(params);
            default:
                return error("unknown method " + method);
        }
    }

    private ObjectNode monitor(Client client, JsonNode params) {
        if (monitorError != null) {
            return error(monitorError);
        }
        ObjectNode snapshot = objectMapper.createObjectNode();
        synchronized (this) {
            JsonNode requests = params.get(2);
            requests.fieldNames().forEachRemaining(table -> {
                ObjectNode rows = snapshot.putObject(table);
                Map<String, ObjectNode> current = tables.get(table);
                if (current != null) {
                    for (Map.Entry<String, ObjectNode> e : current.entrySet()) {
                        rows.putObject(e.getKey())
                            .set("new", e.getValue().deepCopy());
                    }
                }
            });
            client.monitorId = params.get(1);
        }
        return reply(snapshot);
    }

    private ObjectNode transact(JsonNode params) {
        ArrayNode results = objectMapper.createArrayNode();
        Map<String, Map<String, RowUpdate>> changes = new LinkedHashMap<>();
        synchronized (this) {
            Map<String, Map<String, ObjectNode>> work = copy(tables);
            Map<String, String> namedUuids = new HashMap<>();
            boolean failed = false;
            for (int i = 1; i < params.size(); i++) {
                if (failed) {
                    results.add(NullNode.getInstance());
                    continue;
                }
                JsonNode op = params.get(i);
                String kind = op.get("op").asText();
                if (kind.equals(failingOp)) {
                    failingOp = null;
                    ObjectNode r = results.addObject();
                    r.put("error", failingError);
                    r.put("details", failingDetails);
                    failed = true;
                    continue;
                }
                switch (kind) {
                    case "insert":
                        results.add(insert(work, namedUuids, op, changes));
                        break;
                    case "mutate":
                        results.add(mutate(work, namedUuids, op, changes));
                        break;
                    default:
                        ObjectNode r = results.addObject();
                        r.put("error", "not supported");
                        r.put("details", kind);
                        failed = true;
                }
            }
            if (!failed) {
                tables.clear();
                tables.putAll(work);
                publish(changes);
            }
        }
        return reply(results);
    }

    private ObjectNode insert(Map<String, Map<String, ObjectNode>> work,
                              Map<String, String> namedUuids, JsonNode op,
                              Map<String, Map<String, RowUpdate>> changes) {
        String table = op.get("table").asText();
        String uuid = UUID.randomUUID().toString();
        if (op.has("uuid-name")) {
            namedUuids.put(op.get("uuid-name").asText(), uuid);
        }
        ObjectNode row = (ObjectNode) resolve(op.get("row"), namedUuids);
        table(work, table).put(uuid, row);
        changes.computeIfAbsent(table, t -> new LinkedHashMap<>())
               .put(uuid, new RowUpdate(null, row.deepCopy()));

        ObjectNode result = objectMapper.createObjectNode();
        result.set("uuid", OvsdbValues.uuid(uuid));
        return result;
    }

    private ObjectNode mutate(Map<String, Map<String, ObjectNode>> work,
                              Map<String, String> namedUuids, JsonNode op,
                              Map<String, Map<String, RowUpdate>> changes) {
        String table = op.get("table").asText();
        int count = 0;
        for (Map.Entry<String, ObjectNode> e : table(work, table).entrySet()) {
            if (!matches(e.getValue(), op.get("where"))) {
                continue;
            }
            ObjectNode old = e.getValue().deepCopy();
            for (JsonNode mutation : op.get("mutations")) {
                String column = mutation.get(0).asText();
                JsonNode value = resolve(mutation.get(2), namedUuids);
                ArrayNode members = objectMapper.createArrayNode();
                for (JsonNode atom : OvsdbValues.atoms(e.getValue().get(column))) {
                    members.add(atom);
                }
                for (JsonNode atom : OvsdbValues.atoms(value)) {
                    if (!contains(members, atom)) {
                        members.add(atom);
                    }
                }
                ArrayNode set = e.getValue().putArray(column);
                set.add(OvsdbValues.SET);
                set.add(members);
            }
            changes.computeIfAbsent(table, t -> new LinkedHashMap<>())
                   .put(e.getKey(),
                        new RowUpdate(old, e.getValue().deepCopy()));
            count++;
        }
        ObjectNode result = objectMapper.createObjectNode();
        result.put("count", count);
        return result;
    }

    private static boolean matches(ObjectNode row, JsonNode where) {
        for (JsonNode condition : where) {
            JsonNode actual = row.get(condition.get(0).asText());
            if (!"==".equals(condition.get(1).asText())
                || actual == null || !actual.equals(condition.get(2))) {
                return false;
            }
        }
        return true;
    }

    private static boolean contains(ArrayNode members, JsonNode atom) {
        for (JsonNode m : members) {
            if (m.equals(atom)) {
                return true;
            }
        }
        return false;
    }

    private static JsonNode resolve(JsonNode value,
                                    Map<String, String> namedUuids) {
        if (value.isArray() && value.size() == 2 && value.get(0).isTextual()
            && OvsdbValues.NAMED_UUID.equals(value.get(0).asText())) {
            String uuid = namedUuids.get(value.get(1).asText());
            return uuid == null ? value : OvsdbValues.uuid(uuid);
        }
        if (value.isArray()) {
            ArrayNode copy = objectMapper.createArrayNode();
            for (JsonNode v : value) {
                copy.add(resolve(v, namedUuids));
            }
            return copy;
        }
        if (value.isObject()) {
            ObjectNode copy = objectMapper.createObjectNode();
            value.fields().forEachRemaining(
                f -> copy.set(f.getKey(), resolve(f.getValue(), namedUuids)));
            return copy;
        }
        return value;
    }

    /** Called with the server lock held, so updates go out in commit order. */
    private void publish(Map<String, Map<String, RowUpdate>> changes) {
        if (changes.isEmpty()) {
            return;
        }
        ObjectNode updates = objectMapper.createObjectNode();
        for (Map.Entry<String, Map<String, RowUpdate>> t : changes.entrySet()) {
            ObjectNode rows = updates.putObject(t.getKey());
            for (Map.Entry<String, RowUpdate> r : t.getValue().entrySet()) {
                ObjectNode change = rows.putObject(r.getKey());
                if (r.getValue().getOld() != null) {
                    change.set("old", r.getValue().getOld());
                }
                if (r.getValue().getNew() != null) {
                    change.set("new", r.getValue().getNew());
                }
            }
        }
        for (Client client : clients) {
            if (client.monitorId == null) {
                continue;
            }
            ObjectNode notification = objectMapper.createObjectNode();
            notification.put("method", "update");
            ArrayNode params = notification.putArray("params");
            params.add(client.monitorId);
            params.add(updates);
            notification.putNull("id");
            try {
                client.send(notification);
            } catch (IOException e) {
                log.debug("Cannot notify client", e);
            }
        }
    }

    private static Map<String, ObjectNode> table(
            Map<String, Map<String, ObjectNode>> tables, String name) {
        return tables.computeIfAbsent(name, t -> new LinkedHashMap<>());
    }

    private static Map<String, Map<String, ObjectNode>> copy(
            Map<String, Map<String, ObjectNode>> source) {
        Map<String, Map<String, ObjectNode>> copy = new HashMap<>();
        for (Map.Entry<String, Map<String, ObjectNode>> t : source.entrySet()) {
            Map<String, ObjectNode> rows = new LinkedHashMap<>();
            for (Map.Entry<String, ObjectNode> r : t.getValue().entrySet()) {
                rows.put(r.getKey(), r.getValue().deepCopy());
            }
            copy.put(t.getKey(), rows);
        }
        return copy;
    }

    private static ObjectNode reply(JsonNode result) {
        ObjectNode reply = objectMapper.createObjectNode();
        reply.set("result", result);
        reply.putNull("error");
        return reply;
    }

    private static ObjectNode error(String error) {
        ObjectNode reply = objectMapper.createObjectNode();
        reply.putNull("result");
        reply.put("error", error);
        return reply;
    }

    @Override
    public void close() throws IOException {
        closed = true;
        serverSocket.close();
        for (Client client : clients) {
            client.close();
        }
    }

    private class Client {
        private final Socket socket;
        private final JsonParser parser;
        private final JsonGenerator generator;
        private final Thread thread;
        private volatile JsonNode monitorId;

        Client(Socket socket) throws IOException {
            this.socket = socket;
            parser = objectMapper.getFactory()
                .createParser(socket.getInputStream());
            generator = objectMapper.getFactory()
                .createGenerator(socket.getOutputStream());
            generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            thread = new Thread(this::serve, "fake-ovsdb-client");
            thread.setDaemon(true);
        }

        void start() {
            thread.start();
        }

        void send(JsonNode message) throws IOException {
            synchronized (generator) {
                objectMapper.writeTree(generator, message);
                generator.flush();
            }
        }

        private void serve() {
            try {
                JsonNode request;
                while ((request = objectMapper.readTree(parser)) != null) {
                    if (!request.has("method")) {
                        echoReplies.add(request);
                        continue;
                    }
                    if (replyDelayMillis > 0) {
                        Thread.sleep(replyDelayMillis);
                    }
                    ObjectNode reply = handle(
                        this, request.get("method").asText(),
                        request.get("params"));
                    reply.set("id", request.get("id"));
                    send(reply);
                }
            } catch (IOException e) {
                log.debug("Client connection ended", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                clients.remove(this);
                close();
            }
        }

        void close() {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("Error closing client socket", e);
            }
        }
    }
}
