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

package org.midonet.ovsport.port;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.ovsport.OvsPortException;
import org.midonet.ovsport.OvsPortException.ConnectionFailedException;
import org.midonet.ovsport.config.OvsPortConfig;
import org.midonet.ovsport.ovsdb.Operation;
import org.midonet.ovsport.ovsdb.OperationResult;
import org.midonet.ovsport.ovsdb.OvsdbSession;
import org.midonet.ovsport.ovsdb.TransactionResults;
import org.midonet.ovsport.ovsdb.schema.BridgeTable;
import org.midonet.ovsport.ovsdb.schema.InterfaceTable;
import org.midonet.ovsport.ovsdb.schema.PortTable;

/**
 * Creates internal ports by talking to the control database directly.
 *
 * The interface insert, the port insert and the bridge mutation go in one
 * transaction, each referring to the previous one by uuid-name. The port
 * counts as created only if no operation reported an error and the
 * mutation matched the bridge.
 */
public class OvsdbPortProvisioner implements PortProvisioner {

    private static final Logger log =
        LoggerFactory.getLogger(OvsdbPortProvisioner.class);

    static final String INTERFACE_UUID_NAME = "intf";
    static final String PORT_UUID_NAME = "port";

    private final OvsPortConfig config;
    private final NameGenerator names;
    private final int nameLength;
    private OvsdbSession session;

    @Inject
    public OvsdbPortProvisioner(OvsPortConfig config, NameGenerator names) {
        this.config = config;
        this.names = names;
        this.nameLength = config.nameLength();
    }

    /**
     * Uses an already open session, which this provisioner then owns.
     */
    public OvsdbPortProvisioner(OvsdbSession session, NameGenerator names,
                                int nameLength) {
        this.config = null;
        this.session = session;
        this.names = names;
        this.nameLength = nameLength;
    }

    @Override
    public String createInternalPort(String namePrefix, String bridgeName)
            throws OvsPortException {
        String name = names.generate(namePrefix, nameLength);

        List<Operation> ops = ImmutableList.<Operation>of(
            InterfaceTable.INSTANCE.insertInternal(name, INTERFACE_UUID_NAME),
            PortTable.INSTANCE.insert(name, INTERFACE_UUID_NAME,
                                      PORT_UUID_NAME),
            BridgeTable.INSTANCE.addPort(bridgeName, PORT_UUID_NAME));

        log.debug("Creating internal port {} on bridge {}", name, bridgeName);
        List<OperationResult> results = session().transact(ops);
        TransactionResults.check(ops, results);

        log.info("Created internal port {} (port uuid {}) on bridge {}",
                 name, results.get(1).getUuid(), bridgeName);
        return name;
    }

    /**
     * The session, opened on first use.
     */
    public synchronized OvsdbSession session()
            throws ConnectionFailedException {
        if (session == null || !session.isOpen()) {
            if (config == null) {
                throw new ConnectionFailedException("session is closed");
            }
            session = OvsdbSession.connect(config);
        }
        return session;
    }

    @Override
    public synchronized void close() {
        if (session != null) {
            session.close();
            session = null;
        }
    }
}
