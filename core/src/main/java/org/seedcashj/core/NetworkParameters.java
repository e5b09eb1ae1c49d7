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
import com.google.common.collect.ImmutableList;
import org.seedcashj.params.MainNetParams;
import org.seedcashj.params.TestNet3Params;

import javax.annotation.Nullable;

/**
 * <p>NetworkParameters contains the data needed for working with an instantiation of a Bitcoin Cash chain: the
 * version bytes of legacy addresses, the CashAddr prefix, the BIP32 serialization headers and the SLIP-44 coin
 * type used in the account derivation path.</p>
 *
 * <p>This is an abstract class, concrete instantiations can be found in the params package. There are two:
 * one for the main network ({@link MainNetParams}) and one for the public test network
 * ({@link TestNet3Params}).</p>
 */
public abstract class NetworkParameters {
    /** The string returned by getId() for the main, production network where people trade things. */
    public static final String ID_MAINNET = "org.bitcoincash.production";
    /** The string returned by getId() for the testnet. */
    public static final String ID_TESTNET = "org.bitcoincash.test";

    protected String id;
    protected int addressHeader;
    protected int p2shHeader;
    protected String cashAddrPrefix;
    protected int bip32HeaderP2PKHpub;
    protected int bip32HeaderP2PKHpriv;
    protected int coinType;

    protected NetworkParameters() {
    }

    /** Returns all networks known to the library. */
    public static ImmutableList<NetworkParameters> networks() {
        return ImmutableList.of(MainNetParams.get(), TestNet3Params.get());
    }

    /** Returns the network parameters for the given string ID or NULL if not recognized. */
    @Nullable
    public static NetworkParameters fromID(String id) {
        for (NetworkParameters params : networks()) {
            if (params.getId().equals(id))
                return params;
        }
        return null;
    }

    /** Returns the network parameters whose CashAddr prefix matches, case insensitively, or NULL if none does. */
    @Nullable
    public static NetworkParameters fromCashAddrPrefix(String prefix) {
        for (NetworkParameters params : networks()) {
            if (params.getCashAddrPrefix().equalsIgnoreCase(prefix))
                return params;
        }
        return null;
    }

    /** Returns the network parameters whose legacy address header matches, or NULL if none does. */
    @Nullable
    public static NetworkParameters fromAddressHeader(int header) {
        for (NetworkParameters params : networks()) {
            if (params.getAddressHeader() == header || params.getP2SHHeader() == header)
                return params;
        }
        return null;
    }

    /**
     * A Java package style string acting as unique ID for these parameters
     */
    public String getId() {
        return id;
    }

    /**
     * First byte of a base58 encoded legacy P2PKH address.
     */
    public int getAddressHeader() {
        return addressHeader;
    }

    /**
     * First byte of a base58 encoded legacy P2SH address.
     */
    public int getP2SHHeader() {
        return p2shHeader;
    }

    /** Human readable part of CashAddr encoded addresses, without the separator. */
    public String getCashAddrPrefix() {
        return cashAddrPrefix;
    }

    /** Returns the 4 byte header for BIP32 wallet - public key part. */
    public int getBip32HeaderP2PKHpub() {
        return bip32HeaderP2PKHpub;
    }

    /** Returns the 4 byte header for BIP32 wallet - private key part. */
    public int getBip32HeaderP2PKHpriv() {
        return bip32HeaderP2PKHpriv;
    }

    /**
     * The SLIP-44 coin type used as the second element of the BIP44 derivation path.
     */
    public int getCoinType() {
        return coinType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getId().equals(((NetworkParameters) o).getId());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(getId());
    }

    @Override
    public String toString() {
        return getId();
    }
}
