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

import com.google.common.collect.ImmutableList;
import org.seedcashj.core.NetworkParameters;
import org.seedcashj.crypto.ChildNumber;

import java.util.HashMap;

/**
 * Builds the BIP 44 derivation paths this wallet uses for a network. Account paths are absolute, branch paths are
 * relative to the account key.
 */
public class DerivationPathFactory {

    private final NetworkParameters params;
    private final ChildNumber coinType;
    private static final ChildNumber PURPOSE = ChildNumber.PURPOSE_BIP44;
    private static final ChildNumber RECEIVE_BRANCH = ChildNumber.ZERO;
    private static final ChildNumber CHANGE_BRANCH = ChildNumber.ONE;

    public DerivationPathFactory(NetworkParameters params) {
        this.params = params;
        this.coinType = new ChildNumber(params.getCoinType(), true);
    }

    /** BIP 44 account path
     * m/44'/145'/(account)' (mainnet)
     * m/44'/1'/(account)' (testnet)
     */
    public ImmutableList<ChildNumber> bip44AccountPath(int account) {
        return ImmutableList.<ChildNumber>builder()
                .add(PURPOSE)
                .add(coinType)
                .add(new ChildNumber(account, true))
                .build();
    }

    /** The account path of the first account, m/44'/145'/0' on mainnet. */
    public ImmutableList<ChildNumber> bip44AccountPath() {
        return bip44AccountPath(0);
    }

    /** External chain, relative to an account key. */
    public ImmutableList<ChildNumber> receivePath() {
        return ImmutableList.of(RECEIVE_BRANCH);
    }

    /** Internal (change) chain, relative to an account key. */
    public ImmutableList<ChildNumber> changePath() {
        return ImmutableList.of(CHANGE_BRANCH);
    }

    /** Absolute path of a receive key of the first account, m/44'/145'/0'/0/(index) on mainnet. */
    public ImmutableList<ChildNumber> receiveKeyPath(int index) {
        return ImmutableList.<ChildNumber>builder()
                .addAll(bip44AccountPath())
                .addAll(receivePath())
                .add(new ChildNumber(index, false))
                .build();
    }

    private static final HashMap<String, DerivationPathFactory> instances = new HashMap<>();

    public static synchronized DerivationPathFactory get(NetworkParameters params) {
        if(instances.get(params.getId()) == null) {
            instances.put(params.getId(), new DerivationPathFactory(params));
        }
        return instances.get(params.getId());
    }

    public NetworkParameters getParams() {
        return params;
    }
}
