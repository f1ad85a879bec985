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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nonnull;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.midonet.util.process.ProcessOutputDrainer.DrainTarget;

/**
 * Launches local processes, drains their output so they never stall on a
 * full pipe, and reports their exit code.
 *
 * Commands are given as argument vectors and are never split on spaces, so
 * device names and addresses reach the child process untouched.
 */
public class ProcessHelper {

    private static final Logger log =
        LoggerFactory.getLogger(ProcessHelper.class);

    /**
     * Exit code reported when the process could not be launched or waited
     * for.
     */
    public static final int LAUNCH_FAILED = -1;

    public static RunnerConfiguration newProcess(@Nonnull String... command) {
        return newProcess(Arrays.asList(command));
    }

    public static RunnerConfiguration newProcess(
            @Nonnull final List<String> command) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Empty command line");
        }

        return new RunnerConfiguration() {
            DrainTarget drainTarget;
            List<String> procCommand = new ArrayList<>(command);

            @Override
            public RunnerConfiguration logOutput(Logger logger, String marker) {
                drainTarget = DrainTargets.slf4jTarget(logger, marker);
                return this;
            }

            @Override
            public RunnerConfiguration setDrainTarget(DrainTarget target) {
                this.drainTarget = target;
                return this;
            }

            @Override
            public int runAndWait() {
                String processName = String.join(" ", procCommand);
                Process p;
                try {
                    p = launchProcess();
                } catch (IOException e) {
                    log.error("Error while executing command: \"{}\"",
                              processName, e);
                    return LAUNCH_FAILED;
                }

                if (drainTarget == null) {
                    drainTarget = DrainTargets.noneTarget();
                }
                new ProcessOutputDrainer(p).drainOutput(drainTarget);

                try {
                    int exitValue = p.waitFor();
                    if (exitValue == 0) {
                        log.trace("Process \"{}\" exited with code: {}",
                                  processName, exitValue);
                    } else {
                        log.debug("Process \"{}\" exited with non zero code: {}",
                                  processName, exitValue);
                    }
                    return exitValue;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.error("Interrupted while waiting for command: \"{}\"",
                              processName, e);
                    p.destroy();
                    return LAUNCH_FAILED;
                } finally {
                    IOUtils.closeQuietly(p.getOutputStream());
                }
            }

            private Process launchProcess() throws IOException {
                return new ProcessBuilder(procCommand).start();
            }
        };
    }

    public interface RunnerConfiguration {

        RunnerConfiguration logOutput(Logger log, String marker);

        RunnerConfiguration setDrainTarget(DrainTarget drainTarget);

        /**
         * Runs the process to completion.
         *
         * @return the exit code, or {@link #LAUNCH_FAILED}
         */
        int runAndWait();
    }

    public static ProcessResult executeCommandLine(String... command) {
        return executeCommandLine(Arrays.asList(command));
    }

    public static ProcessResult executeCommandLine(List<String> command) {
        ProcessResult result = new ProcessResult();
        List<String> outputList =
            Collections.synchronizedList(new ArrayList<String>());
        List<String> errorList =
            Collections.synchronizedList(new ArrayList<String>());

        result.returnValue = newProcess(command)
            .setDrainTarget(DrainTargets.collectorLogger(
                outputList, errorList, log, command.get(0)))
            .runAndWait();
        result.consoleOutput = outputList;
        result.errorOutput = errorList;

        if (result.returnValue != 0 && !errorList.isEmpty()) {
            log.warn("Process \"{}\" generated errors:",
                     String.join(" ", command));
            for (String s : errorList) log.warn(s);
        }

        return result;
    }

    public static class ProcessResult {
        public List<String> consoleOutput;
        public List<String> errorOutput;
        public int returnValue;

        public ProcessResult() {
            this.returnValue = 0;
            this.consoleOutput = Collections.emptyList();
            this.errorOutput = Collections.emptyList();
        }

        public boolean succeeded() {
            return returnValue == 0;
        }

        /**
         * The stderr lines joined into one string, for error reports.
         */
        public String errorText() {
            return String.join("\n", errorOutput);
        }
    }
}
