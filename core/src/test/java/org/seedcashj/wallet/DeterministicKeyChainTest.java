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

import org.seedcashj.core.Address;
import org.seedcashj.core.NetworkParameters;
import org.seedcashj.crypto.DeterministicKey;
import org.seedcashj.crypto.HDKeyDerivation;
import org.seedcashj.crypto.MnemonicCode;
import org.seedcashj.params.MainNetParams;
import org.seedcashj.params.TestNet3Params;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.seedcashj.core.Utils.HEX;
import static org.junit.Assert.*;

public class DeterministicKeyChainTest {
    private static final NetworkParameters MAINNET = MainNetParams.get();
    private static final NetworkParameters TESTNET = TestNet3Params.get();

    private static final String MNEMONIC = "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon about";

    private static final String XPRV = "xprv9xywTsqYa9uDLdJs8QpXf7xwRWgPw4rq5FtkcShsDoZTqfNQjVQ3dDCdyedXX3FqB18U8e8PfVMeFqkhzPGseKVMDjGe5rPdiUXMxy7BQNJ";
    private static final String XPUB = "xpub6ByHsPNSQXTWZ7PLESMY2FufyYWtLXagSUpMQq7Un96SiThZH2iJB1X7pwviH1WtKVeDP6K8d6xxFzzoaFzF3s8BKCZx8oEDdDkNnp4owAZ";

    private MnemonicCode mc;
    private DeterministicKeyChain chain;

    @Before
    public void setUp() throws Exception {
        mc = new MnemonicCode();
        DeterministicSeed seed = DeterministicSeed.fromMnemonic(mc, DeterministicSeed.decodeMnemonicCode(MNEMONIC), "");
        chain = DeterministicKeyChain.fromSeed(MAINNET, seed);
    }

    @Test
    public void accountKey() {
        assertEquals(XPRV, chain.getExtendedPrivateKey());
        assertEquals(XPUB, chain.getExtendedPublicKey());
        assertEquals("cba3794d", chain.getFingerprint());
        assertEquals("73c5da0a", chain.getMasterFingerprint());

        DeterministicKey account = chain.getAccountKey();
        assertEquals("m/44'/145'/0'", account.getPathAsString());
        assertEquals(3, account.getDepth());
        assertEquals(0x2b72f5b7, account.getParentFingerprint());
        assertFalse(chain.isWatching());
    }

    @Test
    public void receiveAddresses() {
        assertEquals("02bbe7dbcdf8b2261530a867df7180b17a90b482f74f2736b8a30d3f756e42e217",
                chain.getReceiveKey(0).getPublicKeyAsHex());
        assertEquals("m/44'/145'/0'/0/0", chain.getReceiveKey(0).getPathAsString());
        assertEquals("1mW6fDEMjKrDHvLvoEsaeLxSCzZBf3Bfg",
                chain.getReceiveAddress(Address.Format.LEGACY, 0).toString());
        assertEquals("bitcoincash:qqyx49mu0kkn9ftfj6hje6g2wfer34yfnq5tahq3q6",
                chain.getReceiveAddress(Address.Format.CASHADDR, 0).toString());
        assertEquals("18Cp2ivkLHyJwHMm9NzDRBh6Gi7m4MC2we",
                chain.getReceiveAddress(Address.Format.LEGACY, 1).toString());
        assertEquals("bitcoincash:qp8sfdhgjlq68hlzka9lcsxtcnvuvnd0xqxugfzzc5",
                chain.getReceiveAddress(Address.Format.CASHADDR, 1).toString());
        assertEquals("1HLQEX1yj1b6tRGgVR4nb6KeEMZTRL6p6n",
                chain.getReceiveAddress(Address.Format.LEGACY, 19).toString());
        assertEquals("bitcoincash:qzej6n6wmvmhj9ck0g484r6yewq5nm5fwcrmvkm27u",
                chain.getReceiveAddress(Address.Format.CASHADDR, 19).toString());
    }

    @Test
    public void receiveAddressRange() {
        List<Address> addresses = chain.getReceiveAddresses(Address.Format.LEGACY, 0, 2);
        assertEquals(2, addresses.size());
        assertEquals("1mW6fDEMjKrDHvLvoEsaeLxSCzZBf3Bfg", addresses.get(0).toString());
        assertEquals("18Cp2ivkLHyJwHMm9NzDRBh6Gi7m4MC2we", addresses.get(1).toString());
        assertTrue(chain.getReceiveAddresses(Address.Format.CASHADDR, 5, 0).isEmpty());
    }

    @Test
    public void receiveAddressRangeEndingAtLastIndex() {
        List<Address> addresses = chain.getReceiveAddresses(Address.Format.CASHADDR, Integer.MAX_VALUE - 1, 2);
        assertEquals(2, addresses.size());
        assertEquals(chain.getReceiveAddress(Address.Format.CASHADDR, Integer.MAX_VALUE), addresses.get(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void receiveAddressRangePastLastIndex() {
        chain.getReceiveAddresses(Address.Format.CASHADDR, Integer.MAX_VALUE - 1, 5);
    }

    @Test
    public void publicDerivationMatchesPrivateDerivation() {
        DeterministicKey account = chain.getAccountKey();
        DeterministicKey branch = HDKeyDerivation.deriveChildKey(account, 0);
        for (int i = 0; i < 20; i++) {
            DeterministicKey priv = HDKeyDerivation.deriveChildKey(branch, i);
            assertTrue(priv.hasPrivKey());
            assertArrayEquals(priv.getPubKey(), chain.getReceiveKey(i).getPubKey());
        }
    }

    @Test
    public void passphraseGivesAnotherWallet() throws Exception {
        DeterministicSeed seed = DeterministicSeed.fromMnemonic(mc, DeterministicSeed.decodeMnemonicCode(MNEMONIC), "TREZOR");
        DeterministicKeyChain trezor = DeterministicKeyChain.fromSeed(MAINNET, seed);
        assertEquals("xprv9zEmMTGgtQHNVWDmJH8DQ8xhUHcK63aMWhnq66ZxPBEMubcULq9o5ohF8a1XRoZxcGGmrC6rRPizQw8ZbKJSuHC8c4nEuUXK8PhRqYrPmzj",
                trezor.getExtendedPrivateKey());
        assertEquals("xpub6DE7kxoaimqfhzJEQJfDmGuS2KSoVWJCsviRtUyZwWmLnPwctNU3dc1iyrNKoGggd4bjCc93MesXJxu74NUwD81g8jvLugVYBe41KD5fMrU",
                trezor.getExtendedPublicKey());
        assertEquals("c6d64878", trezor.getFingerprint());
        assertEquals("b4e3f5ed", trezor.getMasterFingerprint());
        assertEquals(0xd646df12, trezor.getAccountKey().getParentFingerprint());
        assertEquals("1BpiPFc567BR2H9Aa5po1YZXJ26kPcPbSj",
                trezor.getReceiveAddress(Address.Format.LEGACY, 0).toString());
        assertEquals("bitcoincash:qz4q4kzwdfc32ejsapzq0uupxca6gj0ym5kawa5zur",
                trezor.getReceiveAddress(Address.Format.CASHADDR, 1).toString());
        assertNotEquals(chain.getFingerprint(), trezor.getFingerprint());
    }

    @Test
    public void literalSeed() {
        byte[] seed = HEX.decode("000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f"
                + "202122232425262728292a2b2c2d2e2f303132333435363738393a3b3c3d3e3f");
        DeterministicKeyChain literal = DeterministicKeyChain.fromSeedBytes(MAINNET, seed);
        assertEquals("xprv9zEGmZ7do57TRAMBL98cKwWXgrqePo2v9Wrys9uDDDd58gPjnCrmhXJM75aEBFyWwLRFVbN1KoSbVYUExJHujUyL8xHrw3KuZKjyKfGshaf",
                literal.getExtendedPrivateKey());
        assertEquals("xpub6DDdB4eXdSfkdeReSAfch5TGEtg8oFkmWjnafYJpmZA41UitKkB2FKcpxL1TxauH6sLuoarVhGHFimSAnKhQ9WgpWpA7LHtww5eaekpdUX8",
                literal.getExtendedPublicKey());
        assertEquals("5eb846e5", literal.getFingerprint());

        seed[0] ^= 0x01;
        DeterministicKeyChain flipped = DeterministicKeyChain.fromSeedBytes(MAINNET, seed);
        assertEquals("xprv9zH28LmiGZibLZa7kZeqg7FJBUJjfMvH9diBik89yZW6Et9fevPD2BFPqCb2dhBCTi7dZ12wtKxhpWQWXHRijeKoBvacyXJsqV4ACet4v4R",
                flipped.getExtendedPrivateKey());
    }

    @Test
    public void watchingChain() {
        DeterministicKeyChain watching = DeterministicKeyChain.watch(MAINNET, XPUB);
        assertTrue(watching.isWatching());
        assertEquals(XPUB, watching.getExtendedPublicKey());
        assertEquals("cba3794d", watching.getFingerprint());
        assertNull(watching.getMasterFingerprint());
        for (int i = 0; i < 5; i++) {
            assertEquals(chain.getReceiveAddress(Address.Format.CASHADDR, i),
                    watching.getReceiveAddress(Address.Format.CASHADDR, i));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void watchingChainHasNoPrivateKey() {
        DeterministicKeyChain.watch(MAINNET, XPUB).getExtendedPrivateKey();
    }

    @Test(expected = IllegalArgumentException.class)
    public void watchRejectsPrivateKey() {
        DeterministicKeyChain.watch(MAINNET, XPRV);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeIndex() {
        chain.getReceiveKey(-1);
    }

    @Test
    public void testNet() throws Exception {
        DeterministicSeed seed = DeterministicSeed.fromMnemonic(mc, DeterministicSeed.decodeMnemonicCode(MNEMONIC), "");
        DeterministicKeyChain test = DeterministicKeyChain.fromSeed(TESTNET, seed);
        assertEquals("tprv8fPDJN9UQqg6pFsQsrVxTwHZmXLvHpfGGcsCA9rtnatUgVtBKxhtFeqiyaYKSWydunKpjhvgJf6PwTwgirwuCbFq8YKgpQiaVJf3JCrNmkR",
                test.getExtendedPrivateKey());
        assertEquals("tpubDC5FSnBiZDMmhiuCmWAYsLwgLYrrT9rAqvTySfuCCrgsWz8wxMXUS9Tb9iVMvcRbvFcAHGkMD5Kx8koh4GquNGNTfohfk7pgjhaPCdXpoba",
                test.getExtendedPublicKey());
        assertEquals("4334c988", test.getFingerprint());
        assertEquals("mkpZhYtJu2r87Js3pDiWJDmPte2NRZ8bJV",
                test.getReceiveAddress(Address.Format.LEGACY, 0).toString());
        assertEquals("bchtest:qrfuppcw3cf6nmpjpufgpzy3y74ptfxq5yxdy864k4",
                test.getReceiveAddress(Address.Format.CASHADDR, 1).toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void watchRejectsOtherNetwork() {
        DeterministicKeyChain.watch(TESTNET, XPUB);
    }

    @Test
    public void toStringHidesKeys() {
        assertFalse(chain.toString().contains(XPRV));
        assertTrue(chain.toString().contains("cba3794d"));
    }
}
