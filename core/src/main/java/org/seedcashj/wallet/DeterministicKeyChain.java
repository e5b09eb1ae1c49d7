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
import org.seedcashj.core.Address;
import org.seedcashj.core.NetworkParameters;
import org.seedcashj.crypto.ChildNumber;
import org.seedcashj.crypto.DeterministicKey;
import org.seedcashj.crypto.HDKeyDerivation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>A deterministic key chain derives the BIP 44 account key m/44'/coin'/0' from a {@link DeterministicSeed} and
 * hands out receive keys and addresses below it. Receive keys are always derived from the account's public key, so a
 * chain built from a seed and a chain {@link #watch watching} its xpub give the same addresses.</p>
 *
 * <p>A chain is immutable and can be shared between threads. The master private key is not kept once the account key
 * has been derived.</p>
 */
public class DeterministicKeyChain {
    private static final Logger log = LoggerFactory.getLogger(DeterministicKeyChain.class);

    private final NetworkParameters params;
    @Nullable private final DeterministicKey accountKey;
    private final DeterministicKey watchingKey;
    private final DeterministicKey receiveKey;
    @Nullable private final Integer masterFingerprint;

    private DeterministicKeyChain(NetworkParameters params, @Nullable DeterministicKey accountKey,
                                  DeterministicKey watchingKey, @Nullable Integer masterFingerprint) {
        this.params = checkNotNull(params);
        this.accountKey = accountKey;
        this.watchingKey = checkNotNull(watchingKey);
        this.masterFingerprint = masterFingerprint;
        List<ChildNumber> receivePath = DerivationPathFactory.get(params).receivePath();
        this.receiveKey = HDKeyDerivation.derivePath(watchingKey, receivePath);
    }

    /**
     * Derives the account key of the first BIP 44 account of the given network from a seed.
     *
     * @throws org.seedcashj.crypto.HDDerivationException.ScalarOutOfRangeException if a key along the path is invalid
     */
    public static DeterministicKeyChain fromSeed(NetworkParameters params, DeterministicSeed seed) {
        byte[] seedBytes = seed.getSeedBytes();
        try {
            return fromSeedBytes(params, seedBytes);
        } finally {
            Arrays.fill(seedBytes, (byte) 0);
        }
    }

    /**
     * Derives the account key from raw seed bytes, for seeds that did not come from a mnemonic.
     *
     * @throws IllegalArgumentException if the seed is shorter than 9 bytes
     */
    public static DeterministicKeyChain fromSeedBytes(NetworkParameters params, byte[] seedBytes) {
        DeterministicKey master = HDKeyDerivation.createMasterPrivateKey(seedBytes);
        ImmutableList<ChildNumber> accountPath = DerivationPathFactory.get(params).bip44AccountPath();
        DeterministicKey account = HDKeyDerivation.derivePath(master, accountPath);
        log.info("Derived account key {} with fingerprint {}", account.getPathAsString(),
                formatFingerprint(account.getFingerprint()));
        return new DeterministicKeyChain(params, account, account.dropPrivateBytes(), master.getFingerprint());
    }

    /**
     * Creates a watching chain from an account xpub. It can produce addresses but holds no private keys.
     *
     * @throws org.seedcashj.core.AddressFormatException if the string is not an extended public key of the network
     */
    public static DeterministicKeyChain watch(NetworkParameters params, String serializedWatchingKey) {
        DeterministicKey key = DeterministicKey.deserializeB58(params, serializedWatchingKey);
        checkArgument(key.isPubKeyOnly(), "Expected an extended public key");
        log.info("Watching key at depth {} with fingerprint {}", key.getDepth(),
                formatFingerprint(key.getFingerprint()));
        return new DeterministicKeyChain(params, null, key, null);
    }

    public NetworkParameters getParams() {
        return params;
    }

    /** Returns true if this chain holds no private keys. */
    public boolean isWatching() {
        return accountKey == null;
    }

    /**
     * Returns the account key with its private part.
     *
     * @throws IllegalStateException if this is a watching chain
     */
    public DeterministicKey getAccountKey() {
        if (accountKey == null)
            throw new IllegalStateException("Watching chain has no private account key");
        return accountKey;
    }

    /** Returns the public account key. */
    public DeterministicKey getWatchingKey() {
        return watchingKey;
    }

    /**
     * The account key as an xprv (tprv on test networks).
     *
     * @throws IllegalStateException if this is a watching chain
     */
    public String getExtendedPrivateKey() {
        return getAccountKey().serializePrivB58(params);
    }

    /** The account key as an xpub (tpub on test networks). */
    public String getExtendedPublicKey() {
        return watchingKey.serializePubB58(params);
    }

    /** First four bytes of the hash160 of the account public key, as eight lowercase hex digits. */
    public String getFingerprint() {
        return formatFingerprint(watchingKey.getFingerprint());
    }

    /** First four bytes of the hash160 of the master public key, or null for a watching chain. */
    @Nullable
    public String getMasterFingerprint() {
        return masterFingerprint == null ? null : formatFingerprint(masterFingerprint);
    }

    /**
     * Derives receive key {@code index} along account/0/index, from public keys only.
     *
     * @throws org.seedcashj.crypto.HDDerivationException.ScalarOutOfRangeException if the index yields no valid key
     */
    public DeterministicKey getReceiveKey(int index) {
        checkArgument(index >= 0, "Index must not be negative: %s", index);
        return HDKeyDerivation.deriveChildKey(receiveKey, new ChildNumber(index, false));
    }

    public Address getReceiveAddress(Address.Format format, int index) {
        return Address.fromKey(params, getReceiveKey(index).getPubKey(), format);
    }

    /**
     * Returns {@code count} consecutive receive addresses starting at index {@code from}.
     *
     * @throws IllegalArgumentException if the range does not fit below the hardened indexes
     */
    public List<Address> getReceiveAddresses(Address.Format format, int from, int count) {
        checkArgument(from >= 0, "From must not be negative: %s", from);
        checkArgument(count >= 0, "Count must not be negative: %s", count);
        checkArgument((long) from + count <= (long) Integer.MAX_VALUE + 1,
                "Range %s + %s goes past the last non-hardened index", from, count);
        ImmutableList.Builder<Address> addresses = ImmutableList.builder();
        for (int i = 0; i < count; i++)
            addresses.add(getReceiveAddress(format, from + i));
        return addresses.build();
    }

    private static String formatFingerprint(int fingerprint) {
        return String.format(Locale.US, "%08x", fingerprint);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("network", params.getId())
                .add("fingerprint", getFingerprint())
                .add("watching", isWatching())
                .toString();
    }
}
