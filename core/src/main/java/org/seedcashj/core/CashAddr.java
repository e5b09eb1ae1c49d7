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
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Locale;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Implementation of the CashAddr address format: a prefix, a separator ({@code :}) and a base32 payload protected
 * by a 40-bit BCH checksum.</p>
 *
 * <p>The payload is a version byte followed by a hash. The top bits of the version byte carry the address type
 * ({@code 0} for P2PKH) and the low three bits encode the hash length.</p>
 */
public class CashAddr {
    /** The CashAddr character set for encoding. */
    public static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";

    /** The CashAddr character set for decoding. */
    private static final byte[] CHARSET_REV = new byte[128];
    static {
        Arrays.fill(CHARSET_REV, (byte) -1);
        for (int i = 0; i < CHARSET.length(); i++) {
            CHARSET_REV[CHARSET.charAt(i)] = (byte) i;
        }
    }

    public static final char SEPARATOR = ':';
    public static final int CHECKSUM_LENGTH = 8; // 5-bit groups

    public static final int TYPE_P2PKH = 0;
    public static final int TYPE_P2SH = 1;

    private static final int[] HASH_SIZES = {20, 24, 28, 32, 40, 48, 56, 64};

    private static final long[] GENERATORS = {
            0x98f2bc8e61L, 0x79b76d99e2L, 0xf33e5fb3c4L, 0xae2eabe2a8L, 0x1e4f43e470L
    };

    private CashAddr() {
    }

    public static class CashAddrData {
        public final String prefix;
        public final int type;
        public final byte[] hash;

        private CashAddrData(String prefix, int type, byte[] hash) {
            this.prefix = prefix;
            this.type = type;
            this.hash = hash;
        }
    }

    /**
     * Find the polynomial with value coefficients mod the generator as 40-bit, XOR-ed with 1. A string with a valid
     * checksum yields zero.
     */
    static long polymod(byte[] values) {
        long c = 1;
        for (byte v : values) {
            long c0 = c >>> 35;
            c = ((c & 0x07ffffffffL) << 5) ^ (v & 0xff);
            for (int i = 0; i < GENERATORS.length; i++) {
                if (((c0 >>> i) & 1) != 0)
                    c ^= GENERATORS[i];
            }
        }
        return c ^ 1;
    }

    /** Expand the prefix into values for checksum computation: the lower 5 bits of each character, then a zero. */
    private static byte[] expandPrefix(String prefix) {
        byte[] ret = new byte[prefix.length() + 1];
        for (int i = 0; i < prefix.length(); ++i) {
            ret[i] = (byte) (prefix.charAt(i) & 0x1f);
        }
        ret[prefix.length()] = 0;
        return ret;
    }

    private static byte[] concat(byte[] a, byte[] b, int trailingZeros) {
        byte[] out = new byte[a.length + b.length + trailingZeros];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    /** Create a checksum of eight 5-bit groups. */
    static byte[] createChecksum(String prefix, byte[] payload5) {
        long mod = polymod(concat(expandPrefix(prefix), payload5, CHECKSUM_LENGTH));
        byte[] ret = new byte[CHECKSUM_LENGTH];
        for (int i = 0; i < CHECKSUM_LENGTH; ++i) {
            ret[i] = (byte) ((mod >>> (5 * (7 - i))) & 0x1f);
        }
        return ret;
    }

    /** Verify a checksum over the prefix and the full data part, checksum groups included. */
    static boolean verifyChecksum(String prefix, byte[] values) {
        return polymod(concat(expandPrefix(prefix), values, 0)) == 0;
    }

    /**
     * Regroups a sequence of {@code fromBits}-bit values into {@code toBits}-bit values. With {@code pad} the last
     * group is zero padded; without it, leftover bits must be zero and fewer than {@code fromBits}.
     *
     * @throws AddressFormatException if an input value is out of range or the padding is invalid
     */
    public static byte[] convertBits(byte[] in, int inStart, int inLen, int fromBits, int toBits, boolean pad)
            throws AddressFormatException {
        int acc = 0;
        int bits = 0;
        ByteArrayOutputStream out = new ByteArrayOutputStream(64);
        final int maxv = (1 << toBits) - 1;
        final int maxAcc = (1 << (fromBits + toBits - 1)) - 1;
        for (int i = 0; i < inLen; i++) {
            int value = in[i + inStart] & 0xff;
            if ((value >>> fromBits) != 0) {
                throw new AddressFormatException(
                        String.format(Locale.US, "Input value '%X' exceeds '%d' bit size", value, fromBits));
            }
            acc = ((acc << fromBits) | value) & maxAcc;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                out.write((acc >>> bits) & maxv);
            }
        }
        if (pad) {
            if (bits > 0)
                out.write((acc << (toBits - bits)) & maxv);
        } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxv) != 0) {
            throw new AddressFormatException("Could not convert bits, invalid padding");
        }
        return out.toByteArray();
    }

    public static byte[] convertBits(byte[] in, int fromBits, int toBits, boolean pad) throws AddressFormatException {
        return convertBits(in, 0, in.length, fromBits, toBits, pad);
    }

    /**
     * Encode a hash of the given type as a CashAddr string, prefix and separator included.
     *
     * @throws AddressFormatException.InvalidDataLength if the hash size has no CashAddr size code
     */
    public static String encode(String prefix, int type, byte[] hash) throws AddressFormatException {
        checkNotNull(prefix);
        checkNotNull(hash);
        int sizeCode = Arrays.binarySearch(HASH_SIZES, hash.length);
        if (sizeCode < 0)
            throw new AddressFormatException.InvalidDataLength("Hash has unsupported length: " + hash.length);
        if (type < 0 || type > 15)
            throw new AddressFormatException.InvalidDataLength("Type not in range: " + type);
        String lowerPrefix = prefix.toLowerCase(Locale.ROOT);
        byte[] payload = new byte[1 + hash.length];
        payload[0] = (byte) ((type << 3) | sizeCode);
        System.arraycopy(hash, 0, payload, 1, hash.length);
        byte[] payload5 = convertBits(payload, 8, 5, true);
        byte[] checksum = createChecksum(lowerPrefix, payload5);
        StringBuilder sb = new StringBuilder(lowerPrefix.length() + 1 + payload5.length + checksum.length);
        sb.append(lowerPrefix).append(SEPARATOR);
        for (byte b : payload5)
            sb.append(CHARSET.charAt(b));
        for (byte b : checksum)
            sb.append(CHARSET.charAt(b));
        return sb.toString();
    }

    /**
     * Decode a CashAddr string. The prefix may be omitted from the string, in which case {@code defaultPrefix} is
     * used for the checksum.
     *
     * @throws AddressFormatException if the string is not a valid CashAddr
     */
    public static CashAddrData decode(String str, @Nullable String defaultPrefix) throws AddressFormatException {
        checkNotNull(str);
        boolean lower = false, upper = false;
        for (int i = 0; i < str.length(); ++i) {
            char c = str.charAt(i);
            if (c < 33 || c > 126) throw new AddressFormatException.InvalidCharacter(c, i);
            if (c >= 'a' && c <= 'z') lower = true;
            if (c >= 'A' && c <= 'Z') upper = true;
        }
        if (lower && upper)
            throw new AddressFormatException("Cannot mix upper and lower cases");
        str = str.toLowerCase(Locale.ROOT);

        final int pos = str.lastIndexOf(SEPARATOR);
        final String prefix;
        final int dataStart;
        if (pos >= 0) {
            prefix = str.substring(0, pos);
            dataStart = pos + 1;
        } else if (defaultPrefix != null) {
            prefix = defaultPrefix.toLowerCase(Locale.ROOT);
            dataStart = 0;
        } else {
            throw new AddressFormatException.InvalidPrefix("Missing prefix");
        }
        if (prefix.isEmpty())
            throw new AddressFormatException.InvalidPrefix("Empty prefix");
        for (int i = 0; i < prefix.length(); ++i) {
            char c = prefix.charAt(i);
            if (!((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')))
                throw new AddressFormatException.InvalidCharacter(c, i);
        }

        final int dataLength = str.length() - dataStart;
        if (dataLength <= CHECKSUM_LENGTH)
            throw new AddressFormatException.InvalidDataLength("Data part too short: " + dataLength);
        byte[] values = new byte[dataLength];
        for (int i = 0; i < dataLength; ++i) {
            char c = str.charAt(i + dataStart);
            if (CHARSET_REV[c] == -1) throw new AddressFormatException.InvalidCharacter(c, i + dataStart);
            values[i] = CHARSET_REV[c];
        }
        if (!verifyChecksum(prefix, values))
            throw new AddressFormatException.InvalidChecksum();

        byte[] payload = convertBits(values, 0, values.length - CHECKSUM_LENGTH, 5, 8, false);
        if (payload.length < 1)
            throw new AddressFormatException.InvalidDataLength("Empty payload");
        int version = payload[0] & 0xff;
        if ((version & 0x80) != 0)
            throw new AddressFormatException("Reserved version bit set: " + version);
        byte[] hash = Arrays.copyOfRange(payload, 1, payload.length);
        if (hash.length != HASH_SIZES[version & 0x07])
            throw new AddressFormatException.InvalidDataLength(
                    "Hash length " + hash.length + " does not match version " + version);
        return new CashAddrData(prefix, version >>> 3, hash);
    }
}
