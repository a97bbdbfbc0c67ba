package io.nosqlbench.griddata.keys;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
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

/// How a keyring is applied to an array.
public enum AccessStrategy {
    /// One combined indexing pass. Integer and slice keys give views, and at most
    /// one list key is allowed, with no integer key beside it.
    DIRECT,
    /// One axis at a time. Reading yields a copy; writing loops over list elements.
    COMPOUND;

    /// Choose the strategy a keyring needs.
    ///
    /// @param keyring the keyring, preferably simplified
    /// @return the strategy
    public static AccessStrategy of(Keyring keyring) {
        int lists = 0;
        boolean ints = false;
        for (Key key : keyring.keys()) {
            if (key.kind() == Key.Kind.LIST) {
                lists++;
            } else if (key.kind() == Key.Kind.INT) {
                ints = true;
            }
        }
        if (lists > 1 || (lists == 1 && ints)) {
            return COMPOUND;
        }
        return DIRECT;
    }
}
