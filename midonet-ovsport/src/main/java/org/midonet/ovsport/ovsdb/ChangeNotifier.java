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
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives the events pushed by the server and keeps the {@link TableCache}
 * in step with them. It runs on the connection's reader thread: it only
 * touches local maps and never issues requests on the connection.
 *
 * Updates that arrive before the initial monitor snapshot has been applied
 * are held back and applied right after it, in arrival order, so a stale
 * snapshot never overwrites a newer change.
 */
public class ChangeNotifier {

    private static final Logger log =
        LoggerFactory.getLogger(ChangeNotifier.class);

    private final TableCache cache;
    private final List<TableUpdates> early = new ArrayList<>();
    private boolean primed = false;

    public ChangeNotifier(TableCache cache) {
        this.cache = cache;
    }

    public void onEvent(OvsdbEvent event) {
        switch (event.getKind()) {
            case UPDATED:
                synchronized (this) {
                    if (primed) {
                        cache.applyUpdate(event.getUpdates());
                    } else {
                        early.add(event.getUpdates());
                    }
                }
                break;
            case LOCKED:
            case STOLEN:
            case ECHO:
                log.trace("Ignoring {}", event);
                break;
        }
    }

    /**
     * Installs the monitor snapshot as the initial cache content, then
     * replays the updates received while it was in flight.
     */
    public synchronized void prime(TableUpdates snapshot) {
        cache.applyUpdate(snapshot);
        for (TableUpdates u : early) {
            cache.applyUpdate(u);
        }
        log.debug("Table cache primed with {} tables, {} early updates",
                  snapshot.tables().size(), early.size());
        early.clear();
        primed = true;
    }

    public synchronized boolean isPrimed() {
        return primed;
    }
}
