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

import org.seedcashj.crypto.HDUtils;
import org.seedcashj.params.MainNetParams;
import org.seedcashj.params.TestNet3Params;
import org.junit.Test;

import static org.junit.Assert.*;

public class DerivationPathFactoryTest {
    @Test
    public void mainNetPaths() {
        DerivationPathFactory factory = DerivationPathFactory.get(MainNetParams.get());
        assertEquals("m/44'/145'/0'", HDUtils.formatPath(factory.bip44AccountPath()));
        assertEquals("m/44'/145'/3'", HDUtils.formatPath(factory.bip44AccountPath(3)));
        assertEquals("m/0", HDUtils.formatPath(factory.receivePath()));
        assertEquals("m/1", HDUtils.formatPath(factory.changePath()));
        assertEquals("m/44'/145'/0'/0/7", HDUtils.formatPath(factory.receiveKeyPath(7)));
    }

    @Test
    public void testNetUsesCoinTypeOne() {
        DerivationPathFactory factory = DerivationPathFactory.get(TestNet3Params.get());
        assertEquals(HDUtils.parsePath("m/44'/1'/0'"), factory.bip44AccountPath());
    }

    @Test
    public void instancesAreShared() {
        assertSame(DerivationPathFactory.get(MainNetParams.get()), DerivationPathFactory.get(MainNetParams.get()));
        assertEquals(MainNetParams.get(), DerivationPathFactory.get(MainNetParams.get()).getParams());
    }
}
