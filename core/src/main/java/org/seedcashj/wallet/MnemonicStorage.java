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

import org.seedcashj.crypto.MnemonicCode;
import org.seedcashj.crypto.MnemonicException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Word-by-word entry buffer for a mnemonic that is being typed in or generated. Slots start empty ({@code null}) and
 * are filled in any order; once every slot holds a word the buffer can be turned into a {@link DeterministicSeed},
 * which empties it. The last seed produced stays available from {@link #getSeed()}.
 *
 * <p>Not thread-safe. The owner serializes access.</p>
 */
public class MnemonicStorage {
    private static final Logger log = LoggerFactory.getLogger(MnemonicStorage.class);

    public static final int DEFAULT_MNEMONIC_LENGTH = 12;

    private final MnemonicCode mnemonicCode;
    private String[] mnemonic;
    @Nullable private DeterministicSeed seed;

    public MnemonicStorage(MnemonicCode mnemonicCode) {
        this.mnemonicCode = checkNotNull(mnemonicCode);
        this.mnemonic = new String[DEFAULT_MNEMONIC_LENGTH];
    }

    /**
     * Resizes the buffer to {@code length} empty slots.
     *
     * @throws IllegalArgumentException if the length is not 12, 15, 18, 21 or 24
     */
    public void setMnemonicLength(int length) {
        checkArgument(MnemonicCode.WORD_COUNTS.contains(length),
                "Invalid mnemonic length %s, must be one of %s", length, MnemonicCode.WORD_COUNTS);
        wipe();
        this.mnemonic = new String[length];
        log.info("Mnemonic length set to {} words.", length);
    }

    public int getMnemonicLength() {
        return mnemonic.length;
    }

    /**
     * Replaces the word at {@code index}. A negative index counts from the end, so -1 is the last word.
     *
     * @throws IndexOutOfBoundsException if the index is outside the buffer
     */
    public void updateWord(int index, String word) {
        mnemonic[slot(index)] = checkNotNull(word);
    }

    /**
     * Returns the word at {@code index}, or null if that slot is still empty. A negative index counts from the end.
     *
     * @throws IndexOutOfBoundsException if the index is outside the buffer
     */
    @Nullable
    public String getWord(int index) {
        return mnemonic[slot(index)];
    }

    private int slot(int index) {
        int slot = index < 0 ? mnemonic.length + index : index;
        if (slot < 0 || slot >= mnemonic.length)
            throw new IndexOutOfBoundsException("Index " + index + " outside mnemonic of " + mnemonic.length + " words");
        return slot;
    }

    /** Returns a copy of the buffer. Empty slots are null. */
    public List<String> getMnemonic() {
        return Collections.unmodifiableList(Arrays.asList(Arrays.copyOf(mnemonic, mnemonic.length)));
    }

    /** Returns true once every slot holds a word. */
    public boolean isComplete() {
        for (String word : mnemonic)
            if (word == null)
                return false;
        return true;
    }

    /**
     * Fills the last slot with the word whose entropy bits are {@code finalBits} and whose checksum matches the
     * preceding words.
     *
     * @return the word written into the last slot
     * @throws IllegalStateException if any slot before the last is empty
     */
    public String completeWithFinalBits(String finalBits) throws MnemonicException {
        List<String> preceding = Arrays.asList(Arrays.copyOf(mnemonic, mnemonic.length - 1));
        checkState(!preceding.contains(null), "All words but the last must be entered first");
        List<String> words = mnemonicCode.toMnemonicWithFinalBits(preceding, finalBits);
        String finalWord = words.get(words.size() - 1);
        mnemonic[mnemonic.length - 1] = finalWord;
        return finalWord;
    }

    /**
     * Validates the buffered words and derives the seed. On success the buffer is discarded; on failure it is left
     * as it was so that a word can be corrected.
     *
     * @throws IllegalStateException if a slot is empty
     * @throws MnemonicException if a word is unknown or the checksum does not match
     */
    public DeterministicSeed convertToSeed(String passphrase) throws MnemonicException {
        checkState(isComplete(), "Mnemonic is incomplete");
        DeterministicSeed converted = DeterministicSeed.fromMnemonic(mnemonicCode, Arrays.asList(mnemonic), passphrase);
        this.seed = converted;
        discard();
        return converted;
    }

    /**
     * Returns the last seed produced by {@link #convertToSeed(String)}.
     *
     * @throws IllegalStateException if no seed has been produced
     */
    public DeterministicSeed getSeed() {
        if (seed == null)
            throw new IllegalStateException("Seed has not been initialized");
        return seed;
    }

    /** Empties every slot, keeping the current length. */
    public void discard() {
        int length = mnemonic.length;
        wipe();
        this.mnemonic = new String[length];
    }

    private void wipe() {
        Arrays.fill(mnemonic, null);
    }
}
