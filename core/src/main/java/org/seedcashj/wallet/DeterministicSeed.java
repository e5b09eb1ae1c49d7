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

package org.seedcashj.wallet;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.seedcashj.core.Utils;
import org.seedcashj.crypto.MnemonicCode;
import org.seedcashj.crypto.MnemonicException;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Holds a BIP 39 mnemonic together with the passphrase and the 64 byte seed derived from both. Instances are
 * immutable; a different passphrase gives a different seed and so a different wallet.
 */
public class DeterministicSeed {
    public static final int SEED_LENGTH = 64;

    private final ImmutableList<String> mnemonicCode;
    private final String passphrase;
    private final byte[] seed;

    private DeterministicSeed(List<String> mnemonicCode, String passphrase, byte[] seed) {
        this.mnemonicCode = ImmutableList.copyOf(mnemonicCode);
        this.passphrase = checkNotNull(passphrase);
        this.seed = checkNotNull(seed);
    }

    /**
     * Constructs a seed from a BIP 39 mnemonic code. The words are validated against the word list and their
     * checksum before the seed is derived.
     * @param code the word list to validate against
     * @param mnemonicCode A list of words.
     * @param passphrase A user supplied passphrase, or an empty string if there is no passphrase
     */
    public static DeterministicSeed fromMnemonic(MnemonicCode code, List<String> mnemonicCode, String passphrase)
            throws MnemonicException {
        checkNotNull(passphrase, "A null passphrase is not allowed.");
        code.check(mnemonicCode);
        return new DeterministicSeed(mnemonicCode, passphrase, MnemonicCode.toSeed(mnemonicCode, passphrase));
    }

    /**
     * Constructs a seed from entropy, as if the mnemonic for that entropy had been typed in.
     * @param entropy 16, 20, 24, 28 or 32 bytes
     */
    public static DeterministicSeed fromEntropy(MnemonicCode code, byte[] entropy, String passphrase)
            throws MnemonicException.MnemonicLengthException {
        checkNotNull(passphrase, "A null passphrase is not allowed.");
        List<String> words = code.toMnemonic(entropy);
        return new DeterministicSeed(words, passphrase, MnemonicCode.toSeed(words, passphrase));
    }

    /** Splits a space separated mnemonic sentence into words. */
    public static List<String> decodeMnemonicCode(String mnemonicCode) {
        return Utils.WHITESPACE_SPLITTER.splitToList(mnemonicCode);
    }

    /** Returns a seed for the same words under another passphrase. */
    public DeterministicSeed withPassphrase(String passphrase) {
        checkNotNull(passphrase, "A null passphrase is not allowed.");
        return new DeterministicSeed(mnemonicCode, passphrase, MnemonicCode.toSeed(mnemonicCode, passphrase));
    }

    /** Get the mnemonic code. */
    public List<String> getMnemonicCode() {
        return mnemonicCode;
    }

    /** The words joined by single spaces, exactly as they enter the seed derivation. */
    public String getMnemonicString() {
        return Utils.SPACE_JOINER.join(mnemonicCode);
    }

    public String getPassphrase() {
        return passphrase;
    }

    public boolean hasPassphrase() {
        return !passphrase.isEmpty();
    }

    /** Returns a copy of the 64 seed bytes. */
    public byte[] getSeedBytes() {
        return Arrays.copyOf(seed, seed.length);
    }

    /** The mnemonic in Unicode normalization form C, for display only. */
    public String getMnemonicDisplayString() {
        return Normalizer.normalize(getMnemonicString(), Normalizer.Form.NFC);
    }

    /** The passphrase in Unicode normalization form C, for display only. */
    public String getPassphraseDisplay() {
        return Normalizer.normalize(passphrase, Normalizer.Form.NFC);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("words", mnemonicCode.size())
                .add("hasPassphrase", hasPassphrase())
                .toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(seed, ((DeterministicSeed) o).seed);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(seed);
    }
}
