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

package org.seedcashj.params;

import org.seedcashj.core.NetworkParameters;
import org.junit.Test;

import static org.junit.Assert.*;

public class NetworkParametersTest {
    private static final NetworkParameters MAINNET = MainNetParams.get();
    private static final NetworkParameters TESTNET = TestNet3Params.get();

    @Test
    public void mainNetConstants() {
        assertEquals(0, MAINNET.getAddressHeader());
        assertEquals(5, MAINNET.getP2SHHeader());
        assertEquals("bitcoincash", MAINNET.getCashAddrPrefix());
        assertEquals(0x0488b21e, MAINNET.getBip32HeaderP2PKHpub());
        assertEquals(0x0488ade4, MAINNET.getBip32HeaderP2PKHpriv());
        assertEquals(145, MAINNET.getCoinType());
    }

    @Test
    public void testNetConstants() {
        assertEquals(111, TESTNET.getAddressHeader());
        assertEquals(196, TESTNET.getP2SHHeader());
        assertEquals("bchtest", TESTNET.getCashAddrPrefix());
        assertEquals(0x043587cf, TESTNET.getBip32HeaderP2PKHpub());
        assertEquals(0x04358394, TESTNET.getBip32HeaderP2PKHpriv());
        assertEquals(1, TESTNET.getCoinType());
    }

    @Test
    public void singletons() {
        assertSame(MAINNET, MainNetParams.get());
        assertSame(TESTNET, TestNet3Params.get());
        assertNotEquals(MAINNET, TESTNET);
    }

    @Test
    public void lookups() {
        assertEquals(MAINNET, NetworkParameters.fromID(NetworkParameters.ID_MAINNET));
        assertEquals(TESTNET, NetworkParameters.fromID(NetworkParameters.ID_TESTNET));
        assertNull(NetworkParameters.fromID("org.bitcoincash.regtest"));

        assertEquals(MAINNET, NetworkParameters.fromCashAddrPrefix("bitcoincash"));
        assertEquals(TESTNET, NetworkParameters.fromCashAddrPrefix("BCHTEST"));
        assertNull(NetworkParameters.fromCashAddrPrefix("bchreg"));

        assertEquals(MAINNET, NetworkParameters.fromAddressHeader(5));
        assertEquals(TESTNET, NetworkParameters.fromAddressHeader(111));
        assertNull(NetworkParameters.fromAddressHeader(76));
    }
}
