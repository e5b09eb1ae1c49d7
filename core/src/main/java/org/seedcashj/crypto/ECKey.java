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

import com.google.common.base.MoreObjects;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.math.ec.FixedPointUtil;
import org.seedcashj.core.Utils;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Represents a secp256k1 key pair, or just the public half of one. Public keys are always held and encoded in
 * compressed form (33 bytes, prefix {@code 02} or {@code 03}).</p>
 *
 * <p>Instances are immutable. The private key, when present, is never included in {@link #toString()}.</p>
 */
public class ECKey {
    // The parameters of the secp256k1 curve that Bitcoin Cash uses.
    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");

    /** The parameters of the secp256k1 curve. */
    public static final ECDomainParameters CURVE;

    /** Length of a compressed public key. */
    public static final int PUBLIC_KEY_LENGTH = 33;
    /** Length of a private key scalar when encoded big-endian. */
    public static final int PRIVATE_KEY_LENGTH = 32;

    static {
        // Tell Bouncy Castle to precompute data that's needed during secp256k1 calculations.
        FixedPointUtil.precompute(CURVE_PARAMS.getG());
        CURVE = new ECDomainParameters(CURVE_PARAMS.getCurve(), CURVE_PARAMS.getG(), CURVE_PARAMS.getN(),
                CURVE_PARAMS.getH());
    }

    @Nullable protected final BigInteger priv;
    protected final ECPoint pub;

    protected ECKey(@Nullable BigInteger priv, ECPoint pub) {
        if (priv != null)
            checkArgument(isValidPrivateKey(priv), "Private key is not in range [1, n-1]");
        this.priv = priv;
        this.pub = checkNotNull(pub).normalize();
        checkArgument(!this.pub.isInfinity(), "Public key is the point at infinity");
    }

    /** Creates a key pair from a private key scalar. */
    public static ECKey fromPrivate(BigInteger privKey) {
        return new ECKey(privKey, publicPointFromPrivate(privKey));
    }

    /** Creates a key pair from a 32 byte big-endian private key. */
    public static ECKey fromPrivate(byte[] privKeyBytes) {
        checkArgument(privKeyBytes.length == PRIVATE_KEY_LENGTH, "Private key must be 32 bytes");
        return fromPrivate(new BigInteger(1, privKeyBytes));
    }

    /**
     * Creates a public-only key from an encoded point.
     *
     * @throws IllegalArgumentException if the bytes do not encode a point on the curve
     */
    public static ECKey fromPublicOnly(byte[] pub) {
        return new ECKey(null, decodePoint(pub));
    }

    /**
     * Decodes a compressed or uncompressed point.
     *
     * @throws IllegalArgumentException if the bytes do not encode a point on the curve
     */
    public static ECPoint decodePoint(byte[] encoded) {
        return CURVE.getCurve().decodePoint(encoded);
    }

    /**
     * Returns public key point from the given private key. To convert a byte array into a BigInteger,
     * use {@code new BigInteger(1, bytes);}
     */
    public static ECPoint publicPointFromPrivate(BigInteger privKey) {
        // FixedPointCombMultiplier does not accept scalars longer than the group order.
        if (privKey.bitLength() > CURVE.getN().bitLength()) {
            privKey = privKey.mod(CURVE.getN());
        }
        return new FixedPointCombMultiplier().multiply(CURVE.getG(), privKey);
    }

    /** Returns true if the scalar is a usable secp256k1 private key, that is in the range [1, n-1]. */
    public static boolean isValidPrivateKey(BigInteger scalar) {
        return scalar.signum() > 0 && scalar.compareTo(CURVE.getN()) < 0;
    }

    /** Returns true if this key doesn't have access to private key bytes. */
    public boolean isPubKeyOnly() {
        return priv == null;
    }

    public boolean hasPrivKey() {
        return priv != null;
    }

    /** Gets the compressed public key (33 bytes). */
    public byte[] getPubKey() {
        return pub.getEncoded(true);
    }

    /** Gets the public key in the form of an elliptic curve point object from Bouncy Castle. */
    public ECPoint getPubKeyPoint() {
        return pub;
    }

    /** Gets the hash160 form of the public key, as seen in addresses. */
    public byte[] getPubKeyHash() {
        return Utils.sha256hash160(getPubKey());
    }

    /**
     * Gets the private key in the form of an integer field element.
     *
     * @throws IllegalStateException if the private key bytes are not available.
     */
    public BigInteger getPrivKey() {
        if (priv == null)
            throw new IllegalStateException("Private key bytes not available");
        return priv;
    }

    /**
     * Returns a copy of the private key bytes, padded with zeros to 32 bytes.
     *
     * @throws IllegalStateException if the private key bytes are not available.
     */
    public byte[] getPrivKeyBytes() {
        return Utils.bigIntegerToBytes(getPrivKey(), PRIVATE_KEY_LENGTH);
    }

    public String getPublicKeyAsHex() {
        return Utils.HEX.encode(getPubKey());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ECKey other = (ECKey) o;
        return Objects.equals(this.priv, other.priv) && Arrays.equals(getPubKey(), other.getPubKey());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(getPubKey());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("pub", getPublicKeyAsHex())
                .add("isPubKeyOnly", isPubKeyOnly())
                .toString();
    }
}
