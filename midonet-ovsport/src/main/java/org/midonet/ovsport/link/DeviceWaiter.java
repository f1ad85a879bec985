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

package org.midonet.ovsport.link;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import com.google.inject.Inject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.ovsport.OvsPortException.DeviceOperationFailedException;
import org.midonet.ovsport.config.OvsPortConfig;

/**
 * Waits for a link created by the switch to become visible to the kernel
 * tools. The switch commits the port before its datapath creates the
 * device, so the first link operation may otherwise not find it.
 */
public class DeviceWaiter {

    private static final Logger log =
        LoggerFactory.getLogger(DeviceWaiter.class);

    public static final String STEP = "wait for device";

    private final LinkControl links;
    private final long timeoutMillis;
    private final long pollIntervalMillis;

    @Inject
    public DeviceWaiter(LinkControl links, OvsPortConfig config) {
        this(links, config.deviceWaitTimeoutMillis(),
             config.devicePollIntervalMillis());
    }

    public DeviceWaiter(LinkControl links, long timeoutMillis,
                        long pollIntervalMillis) {
        this.links = links;
        this.timeoutMillis = timeoutMillis;
        this.pollIntervalMillis = Math.max(1, pollIntervalMillis);
    }

    /**
     * Polls until the device exists or the timeout elapses. The device is
     * checked at least once.
     */
    public void await(String device) throws DeviceOperationFailedException {
        long deadline = System.nanoTime()
                        + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                if (links.exists(device)) {
                    log.debug("Device {} visible after {} checks", device,
                              attempts);
                    return;
                }
            } catch (IOException e) {
                throw new DeviceOperationFailedException(device, STEP, null, e);
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new DeviceOperationFailedException(
                    device, STEP, null, String.format(
                        "not visible after %d ms (%d checks)", timeoutMillis,
                        attempts));
            }
            try {
                Thread.sleep(pollIntervalMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DeviceOperationFailedException(device, STEP, null, e);
            }
        }
    }
}
