/*
 * Copyright 2025 The seedcashj developers
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.seedcashj.crypto;

/**
 * Thrown when a key cannot be derived from its parent along a BIP 32 path.
 */
@SuppressWarnings("serial")
public class HDDerivationException extends RuntimeException {
    public HDDerivationException(String message) {
        super(message);
    }

    /**
     * The derived scalar was zero or not below the curve order, or the derived public point was the point at
     * infinity. The probability is below 1 in 2^127; callers may move on to the next index.
     */
    public static class ScalarOutOfRangeException extends HDDerivationException {
        public ScalarOutOfRangeException(String message) {
            super(message);
        }
    }

    /**
     * A hardened child was requested from a key that has no private part.
     */
    public static class HardenedPublicDerivationException extends HDDerivationException {
        public HardenedPublicDerivationException(ChildNumber childNumber) {
            super("Can't use private derivation with public keys only: " + childNumber);
        }
    }
}
