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

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>
 * Base class for receiving addresses. Two textual forms exist for the same 20-byte hash: the legacy Base58Check
 * form ({@link LegacyAddress}) and the CashAddr form ({@link CashAddress}).
 * </p>
 *
 * <p>
 * Use {@link #fromString(NetworkParameters, String)} to conveniently construct any kind of address from its textual
 * form.
 * </p>
 */
public abstract class Address {

    /** Textual form of an address. */
    public enum Format {
        LEGACY,
        CASHADDR
    }

    protected final NetworkParameters params;
    protected final byte[] bytes;

    protected Address(NetworkParameters params, byte[] bytes) {
        this.params = checkNotNull(params);
        this.bytes = checkNotNull(bytes);
    }

    /**
     * Construct an address from its textual form.
     *
     * @param params
     *            the expected network this address is valid for, or null if the network should be derived from the
     *            textual form
     * @param str
     *            the textual form of the address, such as "1PQPheJQSauxRPTxzNMUco1XmoCyPoEJCp" or
     *            "bitcoincash:qr6m7j9njldwwzlg9v7v53unlr4jkmx6eylep8ekg2"
     * @return constructed address
     * @throws AddressFormatException
     *             if the given string doesn't parse or the checksum is invalid
     * @throws AddressFormatException.WrongNetwork
     *             if the given string is valid but not for the expected network (eg testnet vs mainnet)
     */
    public static Address fromString(@Nullable NetworkParameters params, String str) throws AddressFormatException {
        checkNotNull(str);
        if (str.indexOf(CashAddr.SEPARATOR) >= 0)
            return CashAddress.fromString(params, str);
        try {
            return LegacyAddress.fromBase58(params, str);
        } catch (AddressFormatException.WrongNetwork x) {
            throw x;
        } catch (AddressFormatException x) {
            if (params == null)
                throw x;
            // CashAddr strings may be written without their prefix
            return CashAddress.fromString(params, str);
        }
    }

    /**
     * Construct an address of the given format for a compressed public key.
     *
     * @throws AddressFormatException.InvalidDataLength if the key is not a 33 byte compressed public key
     */
    public static Address fromKey(NetworkParameters params, byte[] pubKey, Format format) {
        switch (format) {
            case LEGACY:
                return LegacyAddress.fromKey(params, pubKey);
            case CASHADDR:
                return CashAddress.fromKey(params, pubKey);
            default:
                throw new IllegalArgumentException("Unknown address format: " + format);
        }
    }

    /**
     * Get the network this address works on.
     */
    public NetworkParameters getParameters() {
        return params;
    }

    /**
     * Get either the public key hash or script hash that is encoded in the address.
     *
     * @return hash that is encoded in the address
     */
    public abstract byte[] getHash();

    /**
     * Get the textual form this address is rendered in.
     */
    public abstract Format getFormat();

    /** Returns true if this address pays to a script hash rather than a public key hash. */
    public abstract boolean isP2SH();

    static byte[] hashOfKey(byte[] pubKey) {
        checkNotNull(pubKey);
        if (pubKey.length != 33 || (pubKey[0] != 0x02 && pubKey[0] != 0x03))
            throw new AddressFormatException.InvalidDataLength(
                    "Expected a 33 byte compressed public key, got " + pubKey.length + " bytes");
        return Utils.sha256hash160(pubKey);
    }
}
