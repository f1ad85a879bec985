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

import org.midonet.ovsport.OvsPortException.TransactionFailedException;

/**
 * Decides whether a transaction reply means the whole transaction took
 * effect. OVSDB reports success per operation, so the caller has to look
 * at every entry: any error anywhere fails the batch, and so does a
 * conditional mutation that matched no row.
 */
public final class TransactionResults {

    private TransactionResults() { }

    public static void check(List<? extends Operation> ops,
                             List<OperationResult> results)
            throws TransactionFailedException {
        for (int i = 0; i < results.size(); i++) {
            OperationResult r = results.get(i);
            if (!r.hasError()) {
                continue;
            }
            if (i < ops.size()) {
                Operation op = ops.get(i);
                throw new TransactionFailedException(
                    String.format("%s failed: %s: %s", op, r.getError(),
                                  r.getDetails()),
                    i, op.toString(), r.getError(), r.getDetails());
            }
            // Errors past the last operation concern the commit itself.
            throw new TransactionFailedException(
                String.format("commit failed: %s: %s", r.getError(),
                              r.getDetails()),
                i, null, r.getError(), r.getDetails());
        }

        // A reply cut short at a failed operation was reported above.
        if (results.size() < ops.size()) {
            throw new TransactionFailedException(String.format(
                "expected at least %d results, got %d",
                ops.size(), results.size()));
        }

        for (int i = 0; i < ops.size(); i++) {
            Operation op = ops.get(i);
            OperationResult r = results.get(i);
            if (!r.isExecuted()) {
                throw new TransactionFailedException(
                    op + " was not executed", i, op.toString(), null, null);
            }
            if (op instanceof Mutate && r.getCount() < 1) {
                throw new TransactionFailedException(
                    op + " matched no rows", i, op.toString(), null,
                    "count=" + r.getCount());
            }
        }
    }
}
