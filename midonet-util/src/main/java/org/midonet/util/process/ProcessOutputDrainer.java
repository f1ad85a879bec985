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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.IOUtils;
import org.apache.commons.io.LineIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pumps the stdout and stderr streams of a process, line by line, into a
 * {@link DrainTarget}. Both streams are read on their own thread and
 * {@link #drainOutput} returns once both reached end of stream.
 */
public class ProcessOutputDrainer {

    private static final Logger log =
        LoggerFactory.getLogger(ProcessOutputDrainer.class);

    private final Process process;

    public ProcessOutputDrainer(Process process) {
        this.process = process;
    }

    public void drainOutput(DrainTarget drainTarget) {
        Thread stdout = startDrainer(process.getInputStream(), drainTarget,
                                     false);
        Thread stderr = startDrainer(process.getErrorStream(), drainTarget,
                                     true);
        try {
            stdout.join();
            stderr.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Thread startDrainer(InputStream stream, DrainTarget target,
                                boolean stdErr) {
        Thread t = new Thread(new InputStreamDrainer(stream, target, stdErr),
                              stdErr ? "process-stderr" : "process-stdout");
        t.setDaemon(true);
        t.start();
        return t;
    }

    public interface DrainTarget {

        /**
         * Called when a line was printed on stdout.
         */
        void outLine(String line);

        /**
         * Called when a line was printed on stderr.
         */
        void errLine(String line);
    }

    private static class InputStreamDrainer implements Runnable {

        private final InputStream inputStream;
        private final DrainTarget drainTarget;
        private final boolean drainStdError;

        InputStreamDrainer(InputStream inputStream, DrainTarget drainTarget,
                           boolean drainStdError) {
            this.inputStream = inputStream;
            this.drainTarget = drainTarget;
            this.drainStdError = drainStdError;
        }

        @Override
        public void run() {
            LineIterator lines =
                IOUtils.lineIterator(inputStream, StandardCharsets.UTF_8);
            try {
                while (lines.hasNext()) {
                    String line = lines.nextLine();
                    if (drainStdError) {
                        drainTarget.errLine(line);
                    } else {
                        drainTarget.outLine(line);
                    }
                }
            } catch (IllegalStateException e) {
                // The stream was closed under us: the process is gone.
                log.trace("Stopped draining process output", e);
            } finally {
                try {
                    lines.close();
                } catch (IOException e) {
                    log.trace("Failed to close process stream", e);
                }
            }
        }
    }
}
