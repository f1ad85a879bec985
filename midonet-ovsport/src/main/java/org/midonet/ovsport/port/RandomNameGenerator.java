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

import java.security.SecureRandom;

import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;

/**
 * Appends lowercase hex digits drawn from a {@link SecureRandom}.
 */
public class RandomNameGenerator implements NameGenerator {

    private final SecureRandom random = new SecureRandom();

    @Override
    public String generate(String prefix, int length) {
        Preconditions.checkArgument(length > 0, "length must be positive");
        byte[] bytes = new byte[(length + 1) / 2];
        random.nextBytes(bytes);
        return prefix
               + BaseEncoding.base16().lowerCase().encode(bytes)
                             .substring(0, length);
    }
}
