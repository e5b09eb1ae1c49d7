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

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.seedcashj.core.Sha256Hash;
import org.seedcashj.core.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A MnemonicCode object may be used to convert between binary seed values and
 * lists of words per <a href="https://github.com/bitcoin/bips/blob/master/bip-0039.mediawiki">BIP 39</a>.
 *
 * <p>Instances are immutable and can be shared between threads. Construct one when the application starts and pass
 * it to whatever needs it.</p>
 */
public class MnemonicCode {
    private static final Logger log = LoggerFactory.getLogger(MnemonicCode.class);

    public static final String BIP39_ENGLISH_RESOURCE_NAME = "mnemonic/wordlist/english.txt";
    public static final String BIP39_ENGLISH_SHA256 = "ad90bf3beb7b0eb7e5acd74727dc0da96e0a280a258354e7293fb7e211ac03db";

    /** Number of words in the list. Each word encodes 11 bits. */
    public static final int WORD_LIST_SIZE = 2048;
    private static final int BITS_PER_WORD = 11;

    /** Mnemonic lengths, in words, this class accepts. */
    public static final ImmutableSet<Integer> WORD_COUNTS = ImmutableSet.of(12, 15, 18, 21, 24);

    private static final int PBKDF2_ROUNDS = 2048;
    private static final int SEED_LENGTH = 64; // bytes

    private final ImmutableList<String> wordList;
    private final ImmutableMap<String, Integer> wordIndex;
    private final SecureRandom secureRandom;

    /** Initialise from the English word list bundled with this library. */
    public MnemonicCode() throws IOException {
        this(openDefaultWords(), BIP39_ENGLISH_SHA256);
    }

    private static InputStream openDefaultWords() throws IOException {
        InputStream stream = MnemonicCode.class.getResourceAsStream(BIP39_ENGLISH_RESOURCE_NAME);
        if (stream == null)
            throw new FileNotFoundException(BIP39_ENGLISH_RESOURCE_NAME);
        return stream;
    }

    /**
     * Creates an MnemonicCode object, initializing with words read from the supplied input stream.  If a wordListDigest
     * is supplied the digest of the words will be checked.
     * @param wordstream input stream of 2048 line-seperated words
     * @param wordListDigest hex-encoded Sha256 digest to check against
     * @throws IOException if there was a problem reading the steam
     * @throws IllegalArgumentException if list size is not 2048 or digest mismatch
     */
    public MnemonicCode(InputStream wordstream, @Nullable String wordListDigest) throws IOException, IllegalArgumentException {
        ImmutableList.Builder<String> words = ImmutableList.builder();
        ImmutableMap.Builder<String, Integer> index = ImmutableMap.builder();
        MessageDigest md = Sha256Hash.newDigest();
        int count = 0;
        try (BufferedReader br = new BufferedReader(new InputStreamReader(wordstream, StandardCharsets.UTF_8))) {
            String word;
            while ((word = br.readLine()) != null) {
                md.update(word.getBytes(StandardCharsets.UTF_8));
                words.add(word);
                index.put(word, count++);
            }
        }
        if (count != WORD_LIST_SIZE)
            throw new IllegalArgumentException("input stream did not contain 2048 words");
        this.wordList = words.build();
        this.wordIndex = index.buildOrThrow();

        // If a wordListDigest is supplied check to make sure it matches.
        if (wordListDigest != null) {
            byte[] digest = md.digest();
            String hexdigest = Utils.HEX.encode(digest);
            if (!hexdigest.equals(wordListDigest))
                throw new IllegalArgumentException("wordlist digest mismatch");
        }
        this.secureRandom = new SecureRandom();
        log.info("Loaded mnemonic word list of {} words", count);
    }

    /**
     * Gets the word list this code uses.
     */
    public List<String> getWordList() {
        return wordList;
    }

    /** Returns the position of the word in the list, or -1 if the word is not in it. */
    public int indexOf(String word) {
        Integer index = wordIndex.get(word);
        return index == null ? -1 : index;
    }

    public boolean contains(String word) {
        return wordIndex.containsKey(word);
    }

    /**
     * Convert mnemonic word list to seed. No Unicode normalization is applied to either argument: the words joined
     * by single spaces and the passphrase are used as their UTF-8 bytes.
     */
    public static byte[] toSeed(List<String> words, String passphrase) {
        checkNotNull(passphrase, "A null passphrase is not allowed.");

        // To create binary seed from mnemonic, we use PBKDF2 function
        // with mnemonic sentence (in UTF-8) used as a password and
        // string "mnemonic" + passphrase (again in UTF-8) used as a
        // salt. Iteration count is set to 2048 and HMAC-SHA512 is
        // used as a pseudo-random function. Desired length of the
        // derived key is 512 bits (= 64 bytes).
        //
        String pass = Utils.SPACE_JOINER.join(words);
        String salt = "mnemonic" + passphrase;

        final Stopwatch watch = Stopwatch.createStarted();
        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA512Digest());
        generator.init(pass.getBytes(StandardCharsets.UTF_8), salt.getBytes(StandardCharsets.UTF_8), PBKDF2_ROUNDS);
        byte[] seed = ((KeyParameter) generator.generateDerivedMacParameters(SEED_LENGTH * 8)).getKey();
        watch.stop();
        log.info("PBKDF2 took {}", watch);
        return seed;
    }

    /**
     * Convert mnemonic word list to original entropy value.
     */
    public byte[] toEntropy(List<String> words) throws MnemonicException.MnemonicLengthException,
            MnemonicException.MnemonicWordException, MnemonicException.MnemonicChecksumException {
        checkNotNull(words);
        // Look up all the words in the list and construct the
        // concatenation of the original entropy and the checksum.
        boolean[] concatBits = wordsToBits(words);
        if (!WORD_COUNTS.contains(words.size()))
            throw new MnemonicException.MnemonicLengthException(
                    "Word list size must be one of " + WORD_COUNTS + ", got " + words.size() + " (" + concatBits.length + " bits)");

        int checksumLengthBits = concatBits.length / 33;
        int entropyLengthBits = concatBits.length - checksumLengthBits;

        // Extract original entropy as bytes.
        byte[] entropy = bitsToBytes(concatBits, entropyLengthBits);

        // Take the digest of the entropy.
        boolean[] hashBits = bytesToBits(Sha256Hash.hash(entropy));

        // Check all the checksum bits.
        for (int i = 0; i < checksumLengthBits; ++i)
            if (concatBits[entropyLengthBits + i] != hashBits[i])
                throw new MnemonicException.MnemonicChecksumException();

        return entropy;
    }

    /**
     * Convert entropy data to mnemonic word list.
     * @param entropy entropy bits, length must be 16, 20, 24, 28 or 32 bytes
     * @return the mnemonic, 12 to 24 words
     * @throws MnemonicException.MnemonicLengthException if the entropy has an unsupported length
     */
    public List<String> toMnemonic(byte[] entropy) throws MnemonicException.MnemonicLengthException {
        checkNotNull(entropy);
        if (entropy.length % 4 > 0)
            throw new MnemonicException.MnemonicLengthException("Entropy length not multiple of 32 bits.");

        if (entropy.length == 0)
            throw new MnemonicException.MnemonicLengthException("Entropy is empty.");

        if (entropy.length < 16 || entropy.length > 32)
            throw new MnemonicException.MnemonicLengthException("Entropy must be 16 to 32 bytes, got " + entropy.length);

        // We take initial entropy of ENT bits and compute its
        // checksum by taking first ENT / 32 bits of its SHA256 hash.

        byte[] hash = Sha256Hash.hash(entropy);
        boolean[] hashBits = bytesToBits(hash);

        boolean[] entropyBits = bytesToBits(entropy);
        int checksumLengthBits = entropyBits.length / 32;

        // We append these bits to the end of the initial entropy.
        boolean[] concatBits = new boolean[entropyBits.length + checksumLengthBits];
        System.arraycopy(entropyBits, 0, concatBits, 0, entropyBits.length);
        System.arraycopy(hashBits, 0, concatBits, entropyBits.length, checksumLengthBits);

        // Next we take these concatenated bits and split them into
        // groups of 11 bits. Each group encodes number from 0-2047
        // which is a position in a wordlist.  We convert numbers into
        // words and use joined words as mnemonic sentence.

        List<String> words = new ArrayList<>();
        int nwords = concatBits.length / BITS_PER_WORD;
        for (int i = 0; i < nwords; ++i) {
            int index = 0;
            for (int j = 0; j < BITS_PER_WORD; ++j) {
                index <<= 1;
                if (concatBits[(i * BITS_PER_WORD) + j])
                    index |= 0x1;
            }
            words.add(this.wordList.get(index));
        }

        return words;
    }

    /**
     * Check to see if a mnemonic word list is valid.
     */
    public void check(List<String> words) throws MnemonicException {
        toEntropy(words);
    }

    /**
     * Completes a mnemonic whose last word is chosen by hand. All words but the last are given; the caller supplies
     * the entropy bits the last word carries (for example from coin flips) as a string of {@code '0'} and
     * {@code '1'} characters, and the checksum bits are computed from the assembled entropy.
     *
     * @param precedingWords all words except the last one
     * @param finalBits {@code 11 - checksum length} characters, each {@code '0'} or {@code '1'}
     * @return the full mnemonic, last word included
     * @throws MnemonicException.MnemonicLengthException if the word count or the number of final bits is wrong
     * @throws MnemonicException.MnemonicWordException if a preceding word is not in the list
     */
    public List<String> toMnemonicWithFinalBits(List<String> precedingWords, String finalBits)
            throws MnemonicException.MnemonicLengthException, MnemonicException.MnemonicWordException {
        checkNotNull(precedingWords);
        checkNotNull(finalBits);
        int totalWords = precedingWords.size() + 1;
        if (!WORD_COUNTS.contains(totalWords))
            throw new MnemonicException.MnemonicLengthException(
                    "Word list size must be one of " + WORD_COUNTS + ", got " + totalWords);
        int checksumLengthBits = totalWords * BITS_PER_WORD / 33;
        int finalEntropyBits = BITS_PER_WORD - checksumLengthBits;
        if (finalBits.length() != finalEntropyBits)
            throw new MnemonicException.MnemonicLengthException(
                    "Expected " + finalEntropyBits + " final bits for " + totalWords + " words, got " + finalBits.length());

        boolean[] precedingBits = wordsToBits(precedingWords);
        boolean[] entropyBits = new boolean[precedingBits.length + finalEntropyBits];
        System.arraycopy(precedingBits, 0, entropyBits, 0, precedingBits.length);
        for (int i = 0; i < finalEntropyBits; i++) {
            char c = finalBits.charAt(i);
            checkArgument(c == '0' || c == '1', "Final bits must be 0 or 1: %s", finalBits);
            entropyBits[precedingBits.length + i] = c == '1';
        }
        return toMnemonic(bitsToBytes(entropyBits, entropyBits.length));
    }

    /**
     * Generates a new mnemonic from entropy drawn from a {@link SecureRandom}. The entropy is not kept.
     *
     * @param numWords 12, 15, 18, 21 or 24
     */
    public List<String> generateRandom(int numWords) throws MnemonicException.MnemonicLengthException {
        if (!WORD_COUNTS.contains(numWords))
            throw new MnemonicException.MnemonicLengthException(
                    "Word list size must be one of " + WORD_COUNTS + ", got " + numWords);
        byte[] entropy = new byte[numWords * 4 / 3];
        secureRandom.nextBytes(entropy);
        List<String> words = toMnemonic(entropy);
        Arrays.fill(entropy, (byte) 0);
        log.info("Generated {}-word mnemonic with {} bits of entropy", numWords, entropy.length * 8);
        return words;
    }

    private boolean[] wordsToBits(List<String> words) throws MnemonicException.MnemonicWordException {
        boolean[] bits = new boolean[words.size() * BITS_PER_WORD];
        int wordindex = 0;
        for (String word : words) {
            Integer ndx = wordIndex.get(word);
            if (ndx == null)
                throw new MnemonicException.MnemonicWordException(word);

            // Set the next 11 bits to the value of the index.
            for (int ii = 0; ii < BITS_PER_WORD; ++ii)
                bits[(wordindex * BITS_PER_WORD) + ii] = (ndx & (1 << (10 - ii))) != 0;
            ++wordindex;
        }
        return bits;
    }

    private static byte[] bitsToBytes(boolean[] bits, int lengthBits) {
        checkArgument(lengthBits % 8 == 0, "Bit length %s is not a whole number of bytes", lengthBits);
        byte[] bytes = new byte[lengthBits / 8];
        for (int ii = 0; ii < bytes.length; ++ii)
            for (int jj = 0; jj < 8; ++jj)
                if (bits[(ii * 8) + jj])
                    bytes[ii] |= 1 << (7 - jj);
        return bytes;
    }

    private static boolean[] bytesToBits(byte[] data) {
        boolean[] bits = new boolean[data.length * 8];
        for (int i = 0; i < data.length; ++i)
            for (int j = 0; j < 8; ++j)
                bits[(i * 8) + j] = (data[i] & (1 << (7 - j))) != 0;
        return bits;
    }
}
