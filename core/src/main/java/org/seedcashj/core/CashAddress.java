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

package org.seedcashj.core;

import com.google.common.base.Objects;

import javax.annotation.Nullable;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Implementation of CashAddr addresses, the textual form Bitcoin Cash wallets display by default, for example
 * {@code bitcoincash:qr6m7j9njldwwzlg9v7v53unlr4jkmx6eylep8ekg2}.</p>
 *
 * <p>A CashAddr carries the same 20-byte hash as the equivalent {@link LegacyAddress}; only the encoding and the
 * checksum differ. Use {@link #toLegacy()} to switch between the two.</p>
 */
public class CashAddress extends Address {
    public static final int LENGTH = 20;

    private final int type;

    private CashAddress(NetworkParameters params, int type, byte[] hash) throws AddressFormatException {
        super(params, hash);
        if (hash.length != LENGTH)
            throw new AddressFormatException.InvalidDataLength(
                    "CashAddr hashes must be 20 bytes, but got: " + hash.length);
        if (type != CashAddr.TYPE_P2PKH && type != CashAddr.TYPE_P2SH)
            throw new AddressFormatException("Unsupported CashAddr type: " + type);
        this.type = type;
    }

    /**
     * Construct a P2PKH {@link CashAddress} that represents the given pubkey hash.
     *
     * @param params
     *            network this address is valid for
     * @param hash160
     *            20-byte pubkey hash
     * @return constructed address
     */
    public static CashAddress fromPubKeyHash(NetworkParameters params, byte[] hash160) throws AddressFormatException {
        return new CashAddress(params, CashAddr.TYPE_P2PKH, Arrays.copyOf(checkNotNull(hash160), hash160.length));
    }

    /**
     * Construct a P2PKH {@link CashAddress} that represents the public part of the given compressed key.
     */
    public static CashAddress fromKey(NetworkParameters params, byte[] pubKey) {
        return new CashAddress(params, CashAddr.TYPE_P2PKH, hashOfKey(pubKey));
    }

    /**
     * Construct a {@link CashAddress} from its textual form. The prefix may be left out when a network is given.
     *
     * @param params
     *            expected network this address is valid for, or null if the network should be derived from the
     *            prefix
     * @param str
     *            textual form of the address
     * @throws AddressFormatException
     *             if the given string doesn't parse or the checksum is invalid
     * @throws AddressFormatException.WrongNetwork
     *             if the given address is valid but for a different chain (eg testnet vs mainnet)
     */
    public static CashAddress fromString(@Nullable NetworkParameters params, String str)
            throws AddressFormatException {
        CashAddr.CashAddrData data = CashAddr.decode(str, params != null ? params.getCashAddrPrefix() : null);
        if (params == null) {
            params = NetworkParameters.fromCashAddrPrefix(data.prefix);
            if (params == null)
                throw new AddressFormatException.InvalidPrefix("No network found for " + str);
        } else if (!params.getCashAddrPrefix().equals(data.prefix)) {
            throw new AddressFormatException.WrongNetwork(data.prefix);
        }
        return new CashAddress(params, data.type, data.hash);
    }

    @Override
    public byte[] getHash() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public Format getFormat() {
        return Format.CASHADDR;
    }

    @Override
    public boolean isP2SH() {
        return type == CashAddr.TYPE_P2SH;
    }

    /** Returns the legacy form of this address on the same network. */
    public LegacyAddress toLegacy() {
        if (isP2SH())
            return LegacyAddress.fromScriptHash(params, bytes);
        return LegacyAddress.fromPubKeyHash(params, bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CashAddress other = (CashAddress) o;
        return this.params.equals(other.params) && Arrays.equals(this.bytes, other.bytes) && this.type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(params, Arrays.hashCode(bytes), type);
    }

    /** Returns the lower case textual form, prefix included. */
    @Override
    public String toString() {
        return CashAddr.encode(params.getCashAddrPrefix(), type, bytes);
    }
}
