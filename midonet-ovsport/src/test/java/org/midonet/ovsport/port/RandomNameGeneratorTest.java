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

import java.util.HashSet;
import java.util.Set;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;

public class RandomNameGeneratorTest {

    private final RandomNameGenerator generator = new RandomNameGenerator();

    @Test
    public void testPrefixAndLength() {
        for (int length = 1; length <= 12; length++) {
            String name = generator.generate("veth", length);
            assertThat(name, name.matches("veth[0-9a-f]{" + length + "}"),
                       is(true));
        }
    }

    @Test
    public void testNamesDiffer() {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            names.add(generator.generate("veth", 7));
        }
        assertThat(names.size(), greaterThan(95));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroLength() {
        generator.generate("veth", 0);
    }
}
