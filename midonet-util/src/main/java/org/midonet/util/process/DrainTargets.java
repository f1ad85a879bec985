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
package org.midonet.util.process;

import java.util.List;

import org.slf4j.Logger;

import static org.midonet.util.process.ProcessOutputDrainer.DrainTarget;

/**
 * Stock {@link DrainTarget} implementations.
 */
public final class DrainTargets {

    private DrainTargets() { }

    /**
     * Discards every line.
     */
    public static DrainTarget noneTarget() {
        return new DrainTarget() {
            @Override
            public void outLine(String line) { }

            @Override
            public void errLine(String line) { }
        };
    }

    /**
     * Copies every line to the given logger at debug level, tagged with
     * the prefix and the stream it came from.
     */
    public static DrainTarget slf4jTarget(final Logger logger,
                                          final String prefix) {
        return collectorLogger(null, null, logger, prefix);
    }

    /**
     * Stores stdout and stderr lines in the given lists (either may be
     * null) and logs them.
     */
    public static DrainTarget collectorLogger(
            final List<String> stdOutStrList,
            final List<String> stdErrStrList,
            final Logger logger,
            final String prefix) {

        return new DrainTarget() {
            @Override
            public void outLine(String line) {
                if (stdOutStrList != null) {
                    stdOutStrList.add(line);
                }
                logger.debug("{}:<stdout> {}", prefix, line);
            }

            @Override
            public void errLine(String line) {
                if (stdErrStrList != null) {
                    stdErrStrList.add(line);
                }
                logger.debug("{}:<stderr> {}", prefix, line);
            }
        };
    }
}
