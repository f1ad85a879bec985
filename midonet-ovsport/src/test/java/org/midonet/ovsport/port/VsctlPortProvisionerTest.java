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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import org.midonet.ovsport.OvsPortException.TransactionFailedException;
import org.midonet.util.process.ProcessHelper.ProcessResult;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class VsctlPortProvisionerTest {

    private static final NameGenerator FIXED =
        (prefix, length) -> prefix + "1234567";

    /** Records the command lines instead of running them. */
    private static class RecordingProvisioner extends VsctlPortProvisioner {
        final List<List<String>> commands = new ArrayList<>();
        private final ProcessResult result;

        RecordingProvisioner(boolean sudo, ProcessResult result) {
            super("ovs-vsctl", sudo, FIXED, 7);
            this.result = result;
        }

        @Override
        protected ProcessResult execute(List<String> command) {
            commands.add(command);
            return result;
        }
    }

    private static ProcessResult exit(int code, String... stderr) {
        ProcessResult result = new ProcessResult();
        result.returnValue = code;
        result.errorOutput = Arrays.asList(stderr);
        return result;
    }

    @Test
    public void testAddPortCommand() throws Exception {
        RecordingProvisioner provisioner =
            new RecordingProvisioner(false, exit(0));

        assertThat(provisioner.createInternalPort("veth", "br0"),
                   is("veth1234567"));
        assertThat(provisioner.commands.get(0), contains(
            "ovs-vsctl", "add-port", "br0", "veth1234567", "--", "set",
            "Interface", "veth1234567", "type=internal"));
    }

    @Test
    public void testSudo() throws Exception {
        RecordingProvisioner provisioner =
            new RecordingProvisioner(true, exit(0));
        provisioner.createInternalPort("veth", "br0");
        assertThat(provisioner.commands.get(0).get(0), is("sudo"));
    }

    @Test
    public void testFailureCarriesStderr() throws Exception {
        RecordingProvisioner provisioner = new RecordingProvisioner(
            false, exit(1, "ovs-vsctl: no bridge named br9"));
        try {
            provisioner.createInternalPort("veth", "br9");
            fail("A failing ovs-vsctl should fail the call");
        } catch (TransactionFailedException e) {
            assertThat(e.getDetails(), containsString("no bridge named br9"));
            assertThat(e.getMessage(), containsString("exit code 1"));
        }
    }
}
