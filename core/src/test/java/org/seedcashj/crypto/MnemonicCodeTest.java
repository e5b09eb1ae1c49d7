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
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.seedcashj.core.Utils.HEX;
import static org.seedcashj.core.Utils.SPACE_JOINER;
import static org.seedcashj.core.Utils.WHITESPACE_SPLITTER;
import static org.junit.Assert.*;

/**
 * Test the various guard clauses of {@link MnemonicCode}.
 *
 * See {@link MnemonicCodeVectorsTest} test vectors.
 */
public class MnemonicCodeTest {

    private MnemonicCode mc;

    @Before
    public void setup() throws Exception {
        mc = new MnemonicCode();
    }

    @Test
    public void sharedBetweenThreads() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int t = 0; t < 64; t++) {
                final byte[] entropy = new byte[16 + (t % 5) * 4];
                Arrays.fill(entropy, (byte) t);
                results.add(executor.submit(new Callable<Boolean>() {
                    @Override
                    public Boolean call() throws Exception {
                        for (int i = 0; i < 50; i++) {
                            List<String> words = mc.toMnemonic(entropy);
                            if (!Arrays.equals(entropy, mc.toEntropy(words)))
                                return false;
                        }
                        return true;
                    }
                }));
            }
            for (Future<Boolean> result : results)
                assertTrue(result.get(60, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void wordList() {
        List<String> words = mc.getWordList();
        assertEquals(2048, words.size());
        assertEquals("abandon", words.get(0));
        assertEquals("zoo", words.get(2047));
        assertEquals(0, mc.indexOf("abandon"));
        assertEquals(3, mc.indexOf("about"));
        assertEquals(-1, mc.indexOf("xyzzy"));
        assertTrue(mc.contains("vote"));
        assertFalse(mc.contains("Vote"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void wordListIsImmutable() {
        mc.getWordList().set(0, "xyzzy");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWordListDigestMismatch() throws Exception {
        String words = SPACE_JOINER.join(mc.getWordList()).replace(' ', '\n');
        new MnemonicCode(new ByteArrayInputStream(words.getBytes(StandardCharsets.UTF_8)),
                "0000000000000000000000000000000000000000000000000000000000000000");
    }

    @Test
    public void testWordListWithoutDigest() throws Exception {
        String words = SPACE_JOINER.join(mc.getWordList()).replace(' ', '\n');
        MnemonicCode other = new MnemonicCode(new ByteArrayInputStream(words.getBytes(StandardCharsets.UTF_8)), null);
        assertEquals(mc.getWordList(), other.getWordList());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testShortWordList() throws Exception {
        new MnemonicCode(new ByteArrayInputStream("abandon\nability\n".getBytes(StandardCharsets.UTF_8)), null);
    }

    @Test(expected = MnemonicException.MnemonicLengthException.class)
    public void testBadEntropyLength() throws Exception {
        byte[] entropy = HEX.decode("7f7f7f7f7f7f7f7f7f7f7f7f7f7f7f");
        mc.toMnemonic(entropy);
    }

    @Test(expected = MnemonicException.MnemonicLengthException.class)
    public void testEntropyTooLong() throws Exception {
        mc.toMnemonic(new byte[36]);
    }

    @Test(expected = MnemonicException.MnemonicLengthException.class)
    public void testEntropyTooShort() throws Exception {
        mc.toMnemonic(new byte[12]);
    }

    @Test(expected = MnemonicException.MnemonicLengthException.class)
    public void testBadLength() throws Exception {
        List<String> words = WHITESPACE_SPLITTER.splitToList("risk tiger venture dinner age assume float denial penalty hello");
        mc.check(words);
    }

    @Test(expected = MnemonicException.MnemonicLengthException.class)
    public void testEmptyMnemonic() throws Exception {
        List<String> words = new ArrayList<>();
        mc.check(words);
    }

    @Test
    public void testBadWord() throws Exception {
        List<String> words = WHITESPACE_SPLITTER.splitToList("risk tiger venture dinner xyzzy assume float denial penalty hello game wing");
        try {
            mc.check(words);
            fail();
        } catch (MnemonicException.MnemonicWordException x) {
            assertEquals("xyzzy", x.badWord);
        }
    }

    @Test(expected = MnemonicException.MnemonicChecksumException.class)
    public void testBadChecksum() throws Exception {
        mc.check(Collections.nCopies(12, "abandon"));
    }

    @Test(expected = MnemonicException.MnemonicWordException.class)
    public void testWordsAreCaseSensitive() throws Exception {
        List<String> words = WHITESPACE_SPLITTER.splitToList(
                "Abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon about");
        mc.check(words);
    }

    @Test(expected = NullPointerException.class)
    public void testNullPassphrase() throws Exception {
        List<String> code = WHITESPACE_SPLITTER.splitToList("legal winner thank year wave sausage worth useful legal winner thank yellow");
        MnemonicCode.toSeed(code, null);
    }

    @Test
    public void testPassphraseIsNotNormalized() throws Exception {
        List<String> code = WHITESPACE_SPLITTER.splitToList("legal winner thank year wave sausage worth useful legal winner thank yellow");
        byte[] composed = MnemonicCode.toSeed(code, "\u00e9");
        byte[] decomposed = MnemonicCode.toSeed(code, "e\u0301");
        assertFalse(Arrays.equals(composed, decomposed));
    }

    @Test
    public void testToEntropyRoundTrip() throws Exception {
        byte[] entropy = HEX.decode("000102030405060708090a0b0c0d0e0f10111213");
        List<String> words = mc.toMnemonic(entropy);
        assertEquals(15, words.size());
        assertArrayEquals(entropy, mc.toEntropy(words));
    }

    @Test
    public void testFinalWordForTwelveWords() throws Exception {
        List<String> preceding = Collections.nCopies(11, "abandon");
        assertEquals("about", last(mc.toMnemonicWithFinalBits(preceding, "0000000")));
        assertEquals("process", last(mc.toMnemonicWithFinalBits(preceding, "1010101")));

        preceding = WHITESPACE_SPLITTER.splitToList("legal winner thank year wave sausage worth useful legal winner thank");
        assertEquals("yellow", last(mc.toMnemonicWithFinalBits(preceding, "1111111")));

        preceding = WHITESPACE_SPLITTER.splitToList("letter advice cage absurd amount doctor acoustic avoid letter advice cage");
        assertEquals("above", last(mc.toMnemonicWithFinalBits(preceding, "0000000")));
    }

    @Test
    public void testFinalWordForTwentyFourWords() throws Exception {
        List<String> words = mc.toMnemonicWithFinalBits(Collections.nCopies(23, "zoo"), "111");
        assertEquals(24, words.size());
        assertEquals("vote", last(words));
        mc.check(words);
    }

    @Test
    public void testFinalWordResultIsValid() throws Exception {
        List<String> preceding = Collections.nCopies(14, "zoo");
        List<String> words = mc.toMnemonicWithFinalBits(preceding, "000000");
        assertEquals(15, words.size());
        assertEquals(preceding, words.subList(0, 14));
        mc.check(words);
    }

    @Test(expected = MnemonicException.MnemonicLengthException.class)
    public void testFinalWordWrongBitCount() throws Exception {
        mc.toMnemonicWithFinalBits(Collections.nCopies(11, "abandon"), "000");
    }

    @Test(expected = MnemonicException.MnemonicLengthException.class)
    public void testFinalWordWrongWordCount() throws Exception {
        mc.toMnemonicWithFinalBits(Collections.nCopies(12, "abandon"), "0000000");
    }

    @Test(expected = MnemonicException.MnemonicWordException.class)
    public void testFinalWordUnknownWord() throws Exception {
        List<String> preceding = ImmutableList.<String>builder()
                .addAll(Collections.nCopies(10, "abandon")).add("xyzzy").build();
        mc.toMnemonicWithFinalBits(preceding, "0000000");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFinalWordBadBitCharacter() throws Exception {
        mc.toMnemonicWithFinalBits(Collections.nCopies(11, "abandon"), "0000002");
    }

    @Test
    public void testGenerateRandom() throws Exception {
        for (int numWords : new int[] { 12, 15, 18, 21, 24 }) {
            List<String> words = mc.generateRandom(numWords);
            assertEquals(numWords, words.size());
            mc.check(words);
        }
    }

    @Test
    public void testGenerateRandomDiffers() throws Exception {
        HashSet<List<String>> seen = new HashSet<>();
        for (int i = 0; i < 8; i++)
            assertTrue(seen.add(mc.generateRandom(12)));
    }

    @Test(expected = MnemonicException.MnemonicLengthException.class)
    public void testGenerateRandomBadWordCount() throws Exception {
        mc.generateRandom(13);
    }

    private static String last(List<String> words) {
        return words.get(words.size() - 1);
    }
}
