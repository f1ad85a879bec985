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

import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Mutates the columns of every row matching all the conditions. The reply
 * reports how many rows matched in its {@code count} field, and zero is not
 * an error for the server.
 */
public class Mutate extends Operation {

    private final List<Condition> where;
    private final List<Mutation> mutations;

    public Mutate(String table, List<Condition> where,
                  List<Mutation> mutations) {
        super("mutate", table);
        Preconditions.checkArgument(!mutations.isEmpty(),
                                    "a mutate needs at least one mutation");
        this.where = ImmutableList.copyOf(where);
        this.mutations = ImmutableList.copyOf(mutations);
    }

    @Override
    protected void fill(ObjectNode json) {
        ArrayNode whereJson = json.putArray("where");
        for (Condition c : where) {
            whereJson.add(c.toJson());
        }
        ArrayNode mutationsJson = json.putArray("mutations");
        for (Mutation m : mutations) {
            mutationsJson.add(m.toJson());
        }
    }

    @Override
    public String toString() {
        return super.toString() + " where " + where;
    }
}
