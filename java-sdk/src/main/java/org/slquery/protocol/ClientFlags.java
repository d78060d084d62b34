/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.slquery.protocol;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable set of {@link ClientFlag}s, encoded on the wire as a single byte.
 */
public final class ClientFlags {

    private static final ClientFlags NONE = new ClientFlags(EnumSet.noneOf(ClientFlag.class));

    private final Set<ClientFlag> flags;

    private ClientFlags(EnumSet<ClientFlag> flags) {
        this.flags = Collections.unmodifiableSet(flags);
    }

    public static ClientFlags none() {
        return NONE;
    }

    public static ClientFlags of(ClientFlag first, ClientFlag... rest) {
        return new ClientFlags(EnumSet.of(first, rest));
    }

    /**
     * Decodes flags from their wire representation. Unknown bits are ignored.
     *
     * @param bits the flags byte
     * @return the decoded flags
     */
    public static ClientFlags fromBits(int bits) {
        EnumSet<ClientFlag> decoded = EnumSet.noneOf(ClientFlag.class);
        for (ClientFlag flag : ClientFlag.values()) {
            if ((bits & flag.mask()) != 0) {
                decoded.add(flag);
            }
        }
        return new ClientFlags(decoded);
    }

    public ClientFlags with(ClientFlag flag) {
        if (flags.contains(flag)) {
            return this;
        }
        EnumSet<ClientFlag> copy = flags.isEmpty() ? EnumSet.noneOf(ClientFlag.class) : EnumSet.copyOf(flags);
        copy.add(flag);
        return new ClientFlags(copy);
    }

    public boolean contains(ClientFlag flag) {
        return flags.contains(flag);
    }

    public Set<ClientFlag> asSet() {
        return flags;
    }

    public int toBits() {
        int bits = 0;
        for (ClientFlag flag : flags) {
            bits |= flag.mask();
        }
        return bits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClientFlags)) {
            return false;
        }
        return flags.equals(((ClientFlags) o).flags);
    }

    @Override
    public int hashCode() {
        return flags.hashCode();
    }

    @Override
    public String toString() {
        return flags.toString();
    }
}
