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
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import org.bouncycastle.math.ec.ECPoint;
import org.seedcashj.core.AddressFormatException;
import org.seedcashj.core.Base58;
import org.seedcashj.core.NetworkParameters;
import org.seedcashj.core.Utils;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.seedcashj.core.Utils.HEX;

/**
 * A deterministic key is a node in a BIP 32 hierarchy. As per
 * <a href="https://github.com/bitcoin/bips/blob/master/bip-0032.mediawiki">BIP 32</a> it is a pair
 * (key, chaincode). If you know its path in the tree and its chain code you can derive more keys from this. To obtain
 * one of these, you can call {@link HDKeyDerivation#createMasterPrivateKey(byte[])}.
 *
 * <p>Keys are immutable. A key does not hold a reference to its parent, only the parent's fingerprint, so that
 * dropping a private account key also drops every private key above it.</p>
 */
public class DeterministicKey extends ECKey {
    /** Length of the chain code in bytes. */
    public static final int CHAIN_CODE_LENGTH = 32;
    /** Length of a serialized extended key, without the base58 checksum. */
    public static final int SERIALIZED_LENGTH = 78;

    private final ImmutableList<ChildNumber> childNumberPath;
    private final int depth;
    private final int parentFingerprint;
    private final byte[] chainCode;

    /** Constructs a key from its components. This is not normally something you should use. */
    public DeterministicKey(ImmutableList<ChildNumber> childNumberPath,
                            byte[] chainCode,
                            @Nullable BigInteger priv,
                            ECPoint publicAsPoint,
                            int depth,
                            int parentFingerprint) {
        super(priv, publicAsPoint);
        checkArgument(chainCode.length == CHAIN_CODE_LENGTH, "Chain code must be 32 bytes");
        checkArgument(depth >= 0 && depth <= 255, "Depth must fit in a byte: %s", depth);
        checkArgument(depth > 0 || parentFingerprint == 0, "Depth is 0 but parent fingerprint is not");
        this.childNumberPath = checkNotNull(childNumberPath);
        this.chainCode = Arrays.copyOf(chainCode, chainCode.length);
        this.depth = depth;
        this.parentFingerprint = parentFingerprint;
    }

    /** Constructs a private key derived from the given parent, or a master key if the parent is null. */
    public DeterministicKey(ImmutableList<ChildNumber> childNumberPath,
                            byte[] chainCode,
                            BigInteger priv,
                            @Nullable DeterministicKey parent) {
        this(childNumberPath, chainCode, priv, ECKey.publicPointFromPrivate(priv),
                parent == null ? 0 : parent.depth + 1,
                parent == null ? 0 : parent.getFingerprint());
    }

    /** Constructs a public-only key derived from the given parent. */
    public DeterministicKey(ImmutableList<ChildNumber> childNumberPath,
                            byte[] chainCode,
                            ECPoint publicAsPoint,
                            @Nullable DeterministicKey parent) {
        this(childNumberPath, chainCode, null, publicAsPoint,
                parent == null ? 0 : parent.depth + 1,
                parent == null ? 0 : parent.getFingerprint());
    }

    /**
     * Returns the path from the master key to this key. A key that was deserialized without access to its
     * ancestors knows only the last element.
     */
    public ImmutableList<ChildNumber> getPath() {
        return childNumberPath;
    }

    /**
     * Returns the path of this key as a human readable string starting with m to indicate the master key.
     */
    public String getPathAsString() {
        return HDUtils.formatPath(getPath());
    }

    /**
     * Return this key's depth in the hierarchy, where the root node is at depth zero.
     * This may be different than the number of segments in the path if this key was
     * deserialized without access to its parent.
     */
    public int getDepth() {
        return depth;
    }

    /** Returns the last element of the path returned by {@link DeterministicKey#getPath()} */
    public ChildNumber getChildNumber() {
        return childNumberPath.isEmpty() ? ChildNumber.ZERO : childNumberPath.get(childNumberPath.size() - 1);
    }

    /**
     * Returns the chain code associated with this key. See BIP 32 to learn more about chain codes.
     */
    public byte[] getChainCode() {
        return Arrays.copyOf(chainCode, chainCode.length);
    }

    /**
     * Returns RIPE-MD160(SHA256(pub key bytes)).
     */
    public byte[] getIdentifier() {
        return Utils.sha256hash160(getPubKey());
    }

    /** Returns the first 32 bits of the result of {@link #getIdentifier()}. */
    public int getFingerprint() {
        return ByteBuffer.wrap(Arrays.copyOfRange(getIdentifier(), 0, 4)).getInt();
    }

    /**
     * Return the fingerprint of the key from which this key was derived, or zero if this key is the
     * root node of the key hierarchy.
     */
    public int getParentFingerprint() {
        return parentFingerprint;
    }

    /**
     * Returns a copy of this key without the private part. The public key, chain code, path, depth and parent
     * fingerprint are kept.
     */
    public DeterministicKey dropPrivateBytes() {
        if (isPubKeyOnly())
            return this;
        return new DeterministicKey(childNumberPath, chainCode, null, pub, depth, parentFingerprint);
    }

    private byte[] serialize(NetworkParameters params, boolean pub) {
        ByteBuffer ser = ByteBuffer.allocate(SERIALIZED_LENGTH);
        ser.putInt(pub ? params.getBip32HeaderP2PKHpub() : params.getBip32HeaderP2PKHpriv());
        ser.put((byte) getDepth());
        ser.putInt(getParentFingerprint());
        ser.putInt(getChildNumber().i());
        ser.put(chainCode);
        if (pub) {
            ser.put(getPubKey());
        } else {
            ser.put((byte) 0);
            ser.put(getPrivKeyBytes());
        }
        checkArgument(ser.position() == SERIALIZED_LENGTH);
        return ser.array();
    }

    public byte[] serializePublic(NetworkParameters params) {
        return serialize(params, true);
    }

    /**
     * @throws IllegalStateException if this key has no private part
     */
    public byte[] serializePrivate(NetworkParameters params) {
        return serialize(params, false);
    }

    /** Encodes the public part as an xpub (or tpub) string. */
    public String serializePubB58(NetworkParameters params) {
        return Base58.encodeChecked(serializePublic(params));
    }

    /**
     * Encodes the key as an xprv (or tprv) string.
     *
     * @throws IllegalStateException if this key has no private part
     */
    public String serializePrivB58(NetworkParameters params) {
        return Base58.encodeChecked(serializePrivate(params));
    }

    /**
     * Deserialize a base-58-encoded HD key, trying every known network.
     *
     * @throws AddressFormatException if the string is not a valid extended key of any known network
     */
    public static DeterministicKey deserializeB58(String base58) {
        return deserializeB58(null, base58);
    }

    /**
     * Deserialize a base-58-encoded HD key. If params is null, the network is chosen from the version bytes.
     *
     * @throws AddressFormatException.InvalidChecksum if the checksum does not validate
     * @throws AddressFormatException.InvalidDataLength if the payload is not 78 bytes
     * @throws AddressFormatException.InvalidPrefix if the version bytes are not an extended key header
     * @throws AddressFormatException.WrongNetwork if the version bytes belong to another network
     * @throws AddressFormatException if the key data or the depth is malformed
     */
    public static DeterministicKey deserializeB58(@Nullable NetworkParameters params, String base58) {
        return deserialize(params, Base58.decodeChecked(base58));
    }

    /**
     * Deserialize an HD key from its 78 byte binary form.
     */
    public static DeterministicKey deserialize(@Nullable NetworkParameters params, byte[] serializedKey) {
        if (serializedKey.length != SERIALIZED_LENGTH)
            throw new AddressFormatException.InvalidDataLength(
                    "Extended key must be " + SERIALIZED_LENGTH + " bytes, got " + serializedKey.length);
        ByteBuffer buffer = ByteBuffer.wrap(serializedKey);
        int header = buffer.getInt();
        boolean pub = isPublicHeader(params, header);
        int depth = buffer.get() & 0xFF;
        int parentFingerprint = buffer.getInt();
        ChildNumber childNumber = new ChildNumber(buffer.getInt());
        byte[] chainCode = new byte[CHAIN_CODE_LENGTH];
        buffer.get(chainCode);
        byte[] data = new byte[ECKey.PUBLIC_KEY_LENGTH];
        buffer.get(data);
        if (depth == 0 && parentFingerprint != 0)
            throw new AddressFormatException("Depth is 0 but parent fingerprint is " + Integer.toHexString(parentFingerprint));
        if (depth == 0 && childNumber.i() != 0)
            throw new AddressFormatException("Depth is 0 but child number is " + childNumber);
        ImmutableList<ChildNumber> path = depth == 0 ? ImmutableList.<ChildNumber>of() : ImmutableList.of(childNumber);
        if (pub) {
            if (data[0] != 0x02 && data[0] != 0x03)
                throw new AddressFormatException("Invalid public key prefix: " + HEX.encode(data, 0, 1));
            ECPoint point;
            try {
                point = ECKey.decodePoint(data);
            } catch (IllegalArgumentException x) {
                throw new AddressFormatException("Public key is not on the curve: " + x.getMessage());
            }
            return new DeterministicKey(path, chainCode, null, point, depth, parentFingerprint);
        } else {
            if (data[0] != 0x00)
                throw new AddressFormatException("Private key data must start with 0x00");
            BigInteger priv = new BigInteger(1, Arrays.copyOfRange(data, 1, data.length));
            if (!ECKey.isValidPrivateKey(priv))
                throw new AddressFormatException("Private key is not in range [1, n-1]");
            return new DeterministicKey(path, chainCode, priv, ECKey.publicPointFromPrivate(priv), depth,
                    parentFingerprint);
        }
    }

    private static boolean isPublicHeader(@Nullable NetworkParameters params, int header) {
        if (params != null) {
            if (header == params.getBip32HeaderP2PKHpub())
                return true;
            if (header == params.getBip32HeaderP2PKHpriv())
                return false;
        }
        for (NetworkParameters network : NetworkParameters.networks()) {
            if (header == network.getBip32HeaderP2PKHpub() || header == network.getBip32HeaderP2PKHpriv()) {
                if (params != null)
                    throw new AddressFormatException.WrongNetwork(header);
                return header == network.getBip32HeaderP2PKHpub();
            }
        }
        throw new AddressFormatException.InvalidPrefix("Unknown extended key header: " + Integer.toHexString(header));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeterministicKey other = (DeterministicKey) o;
        return super.equals(other)
                && Arrays.equals(this.chainCode, other.chainCode)
                && this.depth == other.depth
                && this.parentFingerprint == other.parentFingerprint
                && Objects.equal(this.childNumberPath, other.childNumberPath);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(super.hashCode(), Arrays.hashCode(chainCode), childNumberPath, depth);
    }

    @Override
    public String toString() {
        final MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this).omitNullValues();
        helper.add("pub", getPublicKeyAsHex());
        helper.add("chainCode", HEX.encode(chainCode));
        helper.add("path", getPathAsString());
        helper.add("depth", depth);
        helper.add("parentFingerprint", String.format("%08x", parentFingerprint));
        helper.add("isPubKeyOnly", isPubKeyOnly());
        return helper.toString();
    }
}
