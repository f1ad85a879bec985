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
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.ovsport.OvsPortException.ConnectionFailedException;

/**
 * A JSON-RPC 1.0 connection to an Open vSwitch database server.
 *
 * A daemon reader thread parses the stream of JSON values sent by the
 * server. Replies are handed to the caller waiting on the matching request
 * id; server-initiated messages ({@code update}, {@code locked},
 * {@code stolen}, {@code echo}) go to the {@link NotificationHandler}. The
 * two paths never mix. Echo requests are answered here, before the handler
 * sees them, to keep the server from dropping an idle session.
 */
public class OvsdbConnection implements Closeable {

    private static final Logger log =
        LoggerFactory.getLogger(OvsdbConnection.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /** Handed to waiting callers when the connection goes away. */
    private static final JsonNode CONNECTION_LOST = NullNode.getInstance();

    /**
     * Receives every message the server sends on its own initiative.
     * Invoked on the reader thread: it must not block and must not call
     * back into the connection.
     */
    public interface NotificationHandler {
        void onNotification(String method, JsonNode params);
    }

    private final Socket socket;
    private final String endpoint;
    private final long requestTimeoutMillis;
    private final NotificationHandler handler;

    private final JsonParser jsonParser;
    private final JsonGenerator jsonGenerator;

    private final AtomicLong nextRequestId = new AtomicLong(0);

    /**
     * The state of pending JSON-RPC 1.0 requests. Maps request IDs to result
     * placeholders. All accesses to this map must be synchronized on the map
     * itself.
     */
    private final Map<Long, BlockingQueue<JsonNode>> pendingJsonRpcRequests =
        new HashMap<>();

    private final Thread reader;
    private volatile boolean closed = false;

    OvsdbConnection(Socket socket, long requestTimeoutMillis,
                    NotificationHandler handler) throws IOException {
        this.socket = socket;
        this.endpoint = socket.getInetAddress().getHostAddress() + ":"
                        + socket.getPort();
        this.requestTimeoutMillis = requestTimeoutMillis;
        this.handler = handler;

        jsonParser = objectMapper.getFactory()
            .createParser(socket.getInputStream());
        jsonGenerator = objectMapper.getFactory()
            .createGenerator(socket.getOutputStream());
        jsonGenerator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

        reader = new Thread(this::readLoop, "ovsdb-reader-" + endpoint);
        reader.setDaemon(true);
        reader.start();
    }

    /**
     * Opens a TCP connection to the server.
     *
     * @throws ConnectionFailedException if the server cannot be reached
     */
    public static OvsdbConnection open(String host, int port,
                                       long connectTimeoutMillis,
                                       long requestTimeoutMillis,
                                       NotificationHandler handler)
            throws ConnectionFailedException {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port),
                           (int) connectTimeoutMillis);
            log.info("Connected to OVSDB server at {}:{}", host, port);
            return new OvsdbConnection(socket, requestTimeoutMillis, handler);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException ce) {
                e.addSuppressed(ce);
            }
            throw new ConnectionFailedException(
                "cannot connect to " + host + ":" + port + ": "
                + e.getMessage(), e);
        }
    }

    public String getEndpoint() {
        return endpoint;
    }

    public boolean isOpen() {
        return !closed;
    }

    /**
     * Sends a request and blocks until its reply arrives.
     *
     * @return the whole reply object, with its {@code result} and
     *         {@code error} members
     * @throws ConnectionFailedException if the request cannot be written,
     *         the connection closes before the reply, or no reply arrives
     *         within the request timeout
     */
    public JsonNode call(String method, ArrayNode params)
            throws ConnectionFailedException {
        long requestId = nextRequestId.getAndIncrement();
        BlockingQueue<JsonNode> queue = new ArrayBlockingQueue<>(1);
        synchronized (pendingJsonRpcRequests) {
            if (closed) {
                throw new ConnectionFailedException(
                    "connection to " + endpoint + " is closed");
            }
            pendingJsonRpcRequests.put(requestId, queue);
        }

        try {
            ObjectNode request = objectMapper.createObjectNode();
            request.put("method", method);
            request.set("params", params);
            request.put("id", requestId);
            log.debug("Sending {} #{} to {}", method, requestId, endpoint);
            write(request);

            JsonNode response;
            try {
                response = queue.poll(requestTimeoutMillis,
                                      TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionFailedException(
                    "interrupted while waiting for " + method + " #"
                    + requestId, e);
            }
            if (response == null) {
                throw new ConnectionFailedException(String.format(
                    "no reply to %s #%d from %s after %d ms", method,
                    requestId, endpoint, requestTimeoutMillis));
            }
            if (response == CONNECTION_LOST) {
                throw new ConnectionFailedException(
                    "connection to " + endpoint + " lost while waiting for "
                    + method + " #" + requestId);
            }
            return response;
        } finally {
            synchronized (pendingJsonRpcRequests) {
                pendingJsonRpcRequests.remove(requestId);
            }
        }
    }

    private void write(JsonNode message) throws ConnectionFailedException {
        synchronized (jsonGenerator) {
            try {
                objectMapper.writeTree(jsonGenerator, message);
                jsonGenerator.flush();
            } catch (IOException e) {
                throw new ConnectionFailedException(
                    "cannot write to " + endpoint + ": " + e.getMessage(), e);
            }
        }
    }

    private void readLoop() {
        try {
            while (!closed) {
                JsonNode json = objectMapper.readTree(jsonParser);
                if (json == null) {
                    log.info("OVSDB server at {} closed the connection",
                             endpoint);
                    break;
                }
                dispatch(json);
            }
        } catch (JsonProcessingException e) {
            log.error("Malformed message from {}, dropping the connection",
                      endpoint, e);
        } catch (IOException e) {
            if (!closed) {
                log.warn("Error reading from {}", endpoint, e);
            }
        } finally {
            shutdown();
        }
    }

    private void dispatch(JsonNode json) {
        JsonNode method = json.get("method");
        if (method != null && method.isTextual()) {
            JsonNode params = json.get("params");
            if ("echo".equals(method.asText())) {
                replyToEcho(json.get("id"), params);
            }
            try {
                handler.onNotification(method.asText(), params);
            } catch (RuntimeException e) {
                log.error("Failed to handle {} from {}", method.asText(),
                          endpoint, e);
            }
            return;
        }

        JsonNode id = json.get("id");
        if (id == null || !id.canConvertToLong()) {
            log.debug("Dropping reply with unexpected id from {}: {}",
                      endpoint, json);
            return;
        }
        synchronized (pendingJsonRpcRequests) {
            BlockingQueue<JsonNode> queue =
                pendingJsonRpcRequests.get(id.asLong());
            if (queue != null) {
                // Pass the JSON object to the caller, and notify it.
                queue.offer(json);
            } else {
                log.debug("Dropping late reply #{} from {}", id.asLong(),
                          endpoint);
            }
        }
    }

    private void replyToEcho(JsonNode id, JsonNode params) {
        ObjectNode reply = objectMapper.createObjectNode();
        reply.set("result", params == null
                            ? objectMapper.createArrayNode() : params);
        reply.putNull("error");
        reply.set("id", id);
        try {
            write(reply);
        } catch (ConnectionFailedException e) {
            log.warn("Cannot answer echo from {}", endpoint, e);
        }
    }

    private void shutdown() {
        List<BlockingQueue<JsonNode>> waiting;
        synchronized (pendingJsonRpcRequests) {
            closed = true;
            waiting = new ArrayList<>(pendingJsonRpcRequests.values());
            pendingJsonRpcRequests.clear();
        }
        for (BlockingQueue<JsonNode> queue : waiting) {
            queue.offer(CONNECTION_LOST);
        }
        try {
            socket.close();
        } catch (IOException e) {
            log.warn("Error closing connection to {}", endpoint, e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        log.debug("Closing connection to {}", endpoint);
        shutdown();
        try {
            reader.join(TimeUnit.SECONDS.toMillis(1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
