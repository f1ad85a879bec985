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

package org.midonet.ovsport.config;

import java.io.File;

import com.typesafe.config.ConfigException;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import org.midonet.ovsport.OvsPortException.ConfigurationInvalidException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class OvsPortConfigTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testDefaults() {
        OvsPortConfig config = OvsPortConfig.fromString("");

        assertThat(config.ovsdbHost(), is("127.0.0.1"));
        assertThat(config.ovsdbPort(), is(6640));
        assertThat(config.ovsdbDatabase(), is("Open_vSwitch"));
        assertThat(config.connectTimeoutMillis(), is(5000L));
        assertThat(config.requestTimeoutMillis(), is(10000L));
        assertThat(config.deviceName(), is("eth0"));
        assertThat(config.deviceWaitTimeoutMillis(), is(5000L));
        assertThat(config.devicePollIntervalMillis(), is(50L));
        assertThat(config.nameLength(), is(7));
        assertThat(config.provisioner(),
                   is(OvsPortConfig.ProvisionerType.OVSDB));
        assertThat(config.ipCommand(), is("ip"));
        assertThat(config.ovsVsctlCommand(), is("ovs-vsctl"));
        assertThat(config.useSudo(), is(false));
    }

    @Test
    public void testOverrides() {
        OvsPortConfig config = OvsPortConfig.fromString(
            "ovsport {\n"
            + "  ovsdb { host = \"10.0.0.5\", request_timeout = 500ms }\n"
            + "  provisioner = VSCTL\n"
            + "  device.name = \"net0\"\n"
            + "}");

        assertThat(config.ovsdbHost(), is("10.0.0.5"));
        assertThat(config.ovsdbPort(), is(6640));
        assertThat(config.requestTimeoutMillis(), is(500L));
        assertThat(config.provisioner(),
                   is(OvsPortConfig.ProvisionerType.VSCTL));
        assertThat(config.deviceName(), is("net0"));
    }

    @Test
    public void testBadProvisioner() {
        OvsPortConfig config =
            OvsPortConfig.fromString("ovsport.provisioner = netlink");
        try {
            config.provisioner();
            fail("netlink is not a provisioner");
        } catch (ConfigException.BadValue e) {
            assertThat(e.getMessage(), containsString("netlink"));
        }
    }

    @Test
    public void testLoadFile() throws Exception {
        File file = folder.newFile("ovsport.conf");
        FileUtils.writeStringToFile(file, "ovsport.ovsdb.port = 6641\n",
                                    "UTF-8");

        assertThat(OvsPortConfig.load(file).ovsdbPort(), is(6641));
    }

    private void assertRejected(String content, String setting)
            throws Exception {
        File file = folder.newFile();
        FileUtils.writeStringToFile(file, content, "UTF-8");
        try {
            OvsPortConfig.load(file);
            fail("\"" + content + "\" should be rejected at load time");
        } catch (ConfigurationInvalidException e) {
            assertThat(e.getMessage(), containsString(setting));
        }
    }

    @Test
    public void testBadValuesAreRejectedAtLoad() throws Exception {
        assertRejected("ovsport.provisioner = foo", "provisioner");
        assertRejected("ovsport.ovsdb.port = abc", "ovsdb.port");
        assertRejected("ovsport.ovsdb.port = 70000", "ovsdb.port");
        assertRejected("ovsport.ovsdb.request_timeout = soon",
                       "request_timeout");
        assertRejected("ovsport.name_length = 0", "name_length");
    }

    @Test(expected = ConfigurationInvalidException.class)
    public void testMissingFile() throws Exception {
        OvsPortConfig.load(new File(folder.getRoot(), "missing.conf"));
    }

    @Test(expected = ConfigurationInvalidException.class)
    public void testUnparsableFile() throws Exception {
        File file = folder.newFile("broken.conf");
        FileUtils.writeStringToFile(file, "ovsport { ovsdb {", "UTF-8");
        OvsPortConfig.load(file);
    }
}
