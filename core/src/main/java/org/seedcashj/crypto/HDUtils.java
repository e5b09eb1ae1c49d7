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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Static utilities used in BIP 32 Hierarchical Deterministic Wallets (HDW).
 */
public final class HDUtils {
    private static final Splitter PATH_SPLITTER = Splitter.on('/').trimResults().omitEmptyStrings();
    private static final Joiner PATH_JOINER = Joiner.on("/");

    private HDUtils() { }

    static HMac createHmacSha512Digest(byte[] key) {
        SHA512Digest digest = new SHA512Digest();
        HMac hMac = new HMac(digest);
        hMac.init(new KeyParameter(key));
        return hMac;
    }

    static byte[] hmacSha512(HMac hmacSha512, byte[] input) {
        hmacSha512.reset();
        hmacSha512.update(input, 0, input.length);
        byte[] out = new byte[64];
        hmacSha512.doFinal(out, 0);
        return out;
    }

    public static byte[] hmacSha512(byte[] key, byte[] data) {
        return hmacSha512(createHmacSha512Digest(key), data);
    }

    /** Returns the key used for master key generation, {@code "Bitcoin seed"} in ASCII. */
    static byte[] masterKeySalt() {
        return "Bitcoin seed".getBytes(StandardCharsets.US_ASCII);
    }

    /** Append a derivation level to an existing path */
    public static ImmutableList<ChildNumber> append(List<ChildNumber> path, ChildNumber childNumber) {
        return ImmutableList.<ChildNumber>builder().addAll(path).add(childNumber).build();
    }

    /** Concatenate two derivation paths */
    public static ImmutableList<ChildNumber> concat(List<ChildNumber> path, List<ChildNumber> path2) {
        return ImmutableList.<ChildNumber>builder().addAll(path).addAll(path2).build();
    }

    /** Convert to a string path, starting with "m/" and using apostrophes for hardened elements. */
    public static String formatPath(List<ChildNumber> path) {
        List<String> elements = new ArrayList<>(path.size() + 1);
        elements.add("m");
        for (ChildNumber childNumber : path)
            elements.add(childNumber.toString(true));
        return PATH_JOINER.join(elements);
    }

    /**
     * The path is a human-friendly representation of the deterministic path. For example:
     *
     * "m/44'/145'/0'"
     *
     * Where a letter "H" or an apostrophe means hardened key. A leading "m" or "M" is optional.
     *
     * @throws IllegalArgumentException if an element is not a number in [0, 2^31-1] with an optional hardened marker
     */
    public static ImmutableList<ChildNumber> parsePath(String path) {
        List<String> parsedNodes = new ArrayList<>(PATH_SPLITTER.splitToList(path));
        if (!parsedNodes.isEmpty() && (parsedNodes.get(0).equals("m") || parsedNodes.get(0).equals("M")))
            parsedNodes.remove(0);
        ImmutableList.Builder<ChildNumber> nodes = ImmutableList.builder();

        for (String n : parsedNodes) {
            boolean isHard = n.endsWith("H") || n.endsWith("h") || n.endsWith("'");
            if (isHard)
                n = n.substring(0, n.length() - 1);
            long nodeNumber;
            try {
                nodeNumber = Long.parseLong(n);
            } catch (NumberFormatException x) {
                throw new IllegalArgumentException("Invalid path element: " + n, x);
            }
            if (nodeNumber < 0 || nodeNumber > Integer.MAX_VALUE)
                throw new IllegalArgumentException("Path element out of range: " + n);
            nodes.add(new ChildNumber((int) nodeNumber, isHard));
        }

        return nodes.build();
    }
}
