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

import com.google.common.collect.ImmutableList;
import org.bouncycastle.math.ec.ECPoint;
import org.seedcashj.core.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Implementation of the <a href="https://github.com/bitcoin/bips/blob/master/bip-0032.mediawiki">BIP 32</a>
 * deterministic wallet child key generation algorithm.
 */
public final class HDKeyDerivation {
    private static final Logger log = LoggerFactory.getLogger(HDKeyDerivation.class);

    private HDKeyDerivation() { }

    /**
     * Child derivation may fail (although with extremely low probability); in such case it is re-attempted.
     * This is the maximum number of re-attempts (to avoid an infinite loop in case of bugs etc.).
     */
    public static final int MAX_CHILD_DERIVATION_ATTEMPTS = 100;

    /**
     * Generates a new deterministic key from the given seed, which can be any arbitrary byte array. However resist
     * the temptation to use a string as the seed - any key derived from a password is likely to be weak and easily
     * broken by attackers. This method checks that the given seed is at least 64 bits long.
     *
     * @throws HDDerivationException.ScalarOutOfRangeException if generated master key is invalid (private key 0 or >= n).
     * @throws IllegalArgumentException if the seed is less than 8 bytes and could be brute forced.
     */
    public static DeterministicKey createMasterPrivateKey(byte[] seed) throws HDDerivationException {
        checkArgument(seed.length > 8, "Seed is too short and could be brute forced");
        // Calculate I = HMAC-SHA512(key="Bitcoin seed", msg=S)
        byte[] i = HDUtils.hmacSha512(HDUtils.masterKeySalt(), seed);
        // Split I into two 32-byte sequences, Il and Ir.
        // Use Il as master secret key, and Ir as master chain code.
        checkState(i.length == 64, i.length);
        byte[] il = Arrays.copyOfRange(i, 0, 32);
        byte[] ir = Arrays.copyOfRange(i, 32, 64);
        Arrays.fill(i, (byte) 0);
        BigInteger priv = new BigInteger(1, il);
        Arrays.fill(il, (byte) 0);
        assertNonZero(priv, "Generated master key is invalid.");
        assertLessThanN(priv, "Generated master key is invalid.");
        DeterministicKey masterPrivKey = new DeterministicKey(ImmutableList.<ChildNumber>of(), ir, priv, null);
        Arrays.fill(ir, (byte) 0);
        return masterPrivKey;
    }

    /**
     * Derives a key given the "extended" child number, ie. the 0x80000000 bit of the value that you
     * pass for {@code childNumber} will determine whether to use hardened derivation or not.
     * Consider whether your code would benefit from the clarity of the equivalent, but explicit, form
     * of this method that takes a {@code ChildNumber} rather than an {@code int}, for example:
     * {@code deriveChildKey(parent, new ChildNumber(childNumber, true))}
     * where the value of the hardened bit of {@code childNumber} is zero.
     */
    public static DeterministicKey deriveChildKey(DeterministicKey parent, int childNumber) {
        return deriveChildKey(parent, new ChildNumber(childNumber));
    }

    /**
     * Derives a key from the given parent. A parent with a private part yields a child with one (CKDpriv); a
     * public-only parent yields a public-only child (CKDpub), which is only possible for non-hardened indexes.
     *
     * @throws HDDerivationException.HardenedPublicDerivationException if a hardened child of a public-only key is asked for
     * @throws HDDerivationException.ScalarOutOfRangeException if the derived key is invalid; try the next index
     */
    public static DeterministicKey deriveChildKey(DeterministicKey parent, ChildNumber childNumber)
            throws HDDerivationException {
        if (parent.isPubKeyOnly()) {
            RawKeyBytes rawKey = deriveChildKeyBytesFromPublic(parent, childNumber);
            return new DeterministicKey(
                    HDUtils.append(parent.getPath(), childNumber),
                    rawKey.chainCode,
                    ECKey.decodePoint(rawKey.keyBytes),
                    parent);
        } else {
            RawKeyBytes rawKey = deriveChildKeyBytesFromPrivate(parent, childNumber);
            BigInteger priv = new BigInteger(1, rawKey.keyBytes);
            Arrays.fill(rawKey.keyBytes, (byte) 0);
            return new DeterministicKey(
                    HDUtils.append(parent.getPath(), childNumber),
                    rawKey.chainCode,
                    priv,
                    parent);
        }
    }

    /**
     * Derives the child at {@code childNumber}, or if that index yields an invalid key, the next one that does.
     * The hardened bit of {@code childNumber} is kept on every attempt.
     *
     * @throws HDDerivationException if no valid key is found within {@link #MAX_CHILD_DERIVATION_ATTEMPTS} indexes, or
     *         the indexes run out
     */
    public static DeterministicKey deriveThisOrNextChildKey(DeterministicKey parent, int childNumber) {
        int nAttempts = 0;
        ChildNumber first = new ChildNumber(childNumber);
        while (nAttempts < MAX_CHILD_DERIVATION_ATTEMPTS) {
            ChildNumber child = nextChildNumber(first, nAttempts);
            try {
                return deriveChildKey(parent, child);
            } catch (HDDerivationException.ScalarOutOfRangeException e) {
                log.warn("Skipping child {} of {}: {}", child, parent.getPathAsString(), e.getMessage());
            }
            nAttempts++;
        }
        throw new HDDerivationException("Maximum number of child derivation attempts reached, this is probably an indication of a bug.");
    }

    /**
     * Returns the child number {@code offset} places after {@code first}, with the same hardened bit.
     *
     * @throws HDDerivationException if that would go past index 2^31-1
     */
    static ChildNumber nextChildNumber(ChildNumber first, int offset) {
        long num = (long) first.num() + offset;
        if (num > Integer.MAX_VALUE)
            throw new HDDerivationException("No child index left after " + first);
        return new ChildNumber((int) num, first.isHardened());
    }

    /**
     * Derives every element of the path in turn, starting from {@code root}.
     */
    public static DeterministicKey derivePath(DeterministicKey root, List<ChildNumber> path) {
        DeterministicKey key = root;
        for (ChildNumber childNumber : path)
            key = deriveChildKey(key, childNumber);
        return key;
    }

    public static RawKeyBytes deriveChildKeyBytesFromPrivate(DeterministicKey parent,
                                                              ChildNumber childNumber) throws HDDerivationException {
        checkArgument(parent.hasPrivKey(), "Parent key must have private key bytes for this method.");
        byte[] parentPublicKey = parent.getPubKey();
        checkState(parentPublicKey.length == 33, "Parent pubkey must be 33 bytes, but is " + parentPublicKey.length);
        ByteBuffer data = ByteBuffer.allocate(37);
        if (childNumber.isHardened()) {
            data.put((byte) 0);
            data.put(parent.getPrivKeyBytes());
        } else {
            data.put(parentPublicKey);
        }
        data.putInt(childNumber.i());
        byte[] i = HDUtils.hmacSha512(parent.getChainCode(), data.array());
        Arrays.fill(data.array(), (byte) 0);
        checkState(i.length == 64, i.length);
        byte[] il = Arrays.copyOfRange(i, 0, 32);
        byte[] chainCode = Arrays.copyOfRange(i, 32, 64);
        Arrays.fill(i, (byte) 0);
        BigInteger ilInt = new BigInteger(1, il);
        Arrays.fill(il, (byte) 0);
        assertLessThanN(ilInt, "Illegal derived key: I_L >= n");
        final BigInteger priv = parent.getPrivKey();
        BigInteger ki = priv.add(ilInt).mod(ECKey.CURVE.getN());
        assertNonZero(ki, "Illegal derived key: derived private key equals 0.");
        return new RawKeyBytes(Utils.bigIntegerToBytes(ki, 32), chainCode);
    }

    public static RawKeyBytes deriveChildKeyBytesFromPublic(DeterministicKey parent, ChildNumber childNumber)
            throws HDDerivationException {
        if (childNumber.isHardened())
            throw new HDDerivationException.HardenedPublicDerivationException(childNumber);
        byte[] parentPublicKey = parent.getPubKey();
        checkState(parentPublicKey.length == 33, "Parent pubkey must be 33 bytes, but is " + parentPublicKey.length);
        ByteBuffer data = ByteBuffer.allocate(37);
        data.put(parentPublicKey);
        data.putInt(childNumber.i());
        byte[] i = HDUtils.hmacSha512(parent.getChainCode(), data.array());
        checkState(i.length == 64, i.length);
        byte[] il = Arrays.copyOfRange(i, 0, 32);
        byte[] chainCode = Arrays.copyOfRange(i, 32, 64);
        BigInteger ilInt = new BigInteger(1, il);
        assertLessThanN(ilInt, "Illegal derived key: I_L >= n");

        ECPoint Ki = ECKey.publicPointFromPrivate(ilInt).add(parent.getPubKeyPoint());
        assertNonInfinity(Ki, "Illegal derived key: derived public key equals infinity.");
        return new RawKeyBytes(Ki.getEncoded(true), chainCode);
    }

    private static void assertNonZero(BigInteger integer, String errorMessage) {
        if (integer.equals(BigInteger.ZERO))
            throw new HDDerivationException.ScalarOutOfRangeException(errorMessage);
    }

    private static void assertNonInfinity(ECPoint point, String errorMessage) {
        if (point.equals(ECKey.CURVE.getCurve().getInfinity()))
            throw new HDDerivationException.ScalarOutOfRangeException(errorMessage);
    }

    private static void assertLessThanN(BigInteger integer, String errorMessage) {
        if (integer.compareTo(ECKey.CURVE.getN()) >= 0)
            throw new HDDerivationException.ScalarOutOfRangeException(errorMessage);
    }

    public static class RawKeyBytes {
        public final byte[] keyBytes, chainCode;

        public RawKeyBytes(byte[] keyBytes, byte[] chainCode) {
            this.keyBytes = keyBytes;
            this.chainCode = chainCode;
        }
    }
}
