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

package org.seedcashj.tools;

import org.seedcashj.core.Utils;
import org.seedcashj.crypto.HDDerivationException;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class SeedToolTest {
    private static final String MNEMONIC = "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon about";
    private static final String XPUB = "xpub6ByHsPNSQXTWZ7PLESMY2FufyYWtLXagSUpMQq7Un96SiThZH2iJB1X7pwviH1WtKVeDP6K8d6xxFzzoaFzF3s8BKCZx8oEDdDkNnp4owAZ";

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private SeedTool tool;

    @Before
    public void setUp() throws Exception {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        tool = new SeedTool(new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"));
    }

    private String out() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void restore() {
        assertEquals(0, tool.run(new String[] { "restore", "--mnemonic=" + MNEMONIC }));
        String output = out();
        assertTrue(output, output.contains("fingerprint: cba3794d"));
        assertTrue(output, output.contains("xpub:        " + XPUB));
        assertTrue(output, output.contains("xprv:        xprv9xywTsqYa9uDLdJs8QpXf7xwRWgPw4rq5FtkcShsDoZTqfNQjVQ3dDCdyedXX3FqB18U8e8PfVMeFqkhzPGseKVMDjGe5rPdiUXMxy7BQNJ"));
        assertFalse(output, output.contains("passphrase"));
    }

    @Test
    public void restoreWithPassphrase() {
        assertEquals(0, tool.run(new String[] { "restore", "--mnemonic=" + MNEMONIC, "--passphrase=TREZOR" }));
        assertTrue(out().contains("fingerprint: c6d64878"));
        assertTrue(out().contains("passphrase:  TREZOR"));
    }

    @Test
    public void restoreBadChecksum() {
        String words = MNEMONIC.replace("about", "abandon");
        assertEquals(1, tool.run(new String[] { "restore", "--mnemonic=" + words }));
        assertTrue(err(), err().contains("checksum mismatch"));
        assertEquals("", out());
    }

    @Test
    public void restoreUnknownWord() {
        String words = MNEMONIC.replace("about", "xyzzy");
        assertEquals(1, tool.run(new String[] { "restore", "--mnemonic=" + words }));
        assertTrue(err(), err().contains("unknown word xyzzy"));
    }

    @Test
    public void restoreWithoutMnemonic() {
        assertEquals(1, tool.run(new String[] { "restore" }));
        assertTrue(err(), err().contains("Missing --mnemonic"));
    }

    @Test
    public void addresses() {
        assertEquals(0, tool.run(new String[] { "addresses", "--xpub=" + XPUB, "--count=2" }));
        List<String> lines = Utils.WHITESPACE_SPLITTER.splitToList(out());
        assertEquals("0", lines.get(0));
        assertEquals("bitcoincash:qqyx49mu0kkn9ftfj6hje6g2wfer34yfnq5tahq3q6", lines.get(1));
        assertEquals("1", lines.get(2));
        assertEquals("bitcoincash:qp8sfdhgjlq68hlzka9lcsxtcnvuvnd0xqxugfzzc5", lines.get(3));
        assertEquals(4, lines.size());
    }

    @Test
    public void legacyAddressesFromIndex() {
        assertEquals(0, tool.run(new String[] { "addresses", "--xpub=" + XPUB, "--format=legacy", "--from=19", "--count=1" }));
        assertEquals("19 1HLQEX1yj1b6tRGgVR4nb6KeEMZTRL6p6n", out().trim());
    }

    @Test
    public void addressesFromMalformedXpub() {
        assertEquals(1, tool.run(new String[] { "addresses", "--xpub=" + XPUB.substring(0, XPUB.length() - 1) }));
        assertTrue(err(), err().startsWith("Error:"));
    }

    @Test
    public void addressesOnWrongNetwork() {
        assertEquals(1, tool.run(new String[] { "addresses", "--xpub=" + XPUB, "--net=TEST" }));
    }

    @Test
    public void addressesPastLastIndex() {
        assertEquals(1, tool.run(new String[] { "addresses", "--xpub=" + XPUB, "--from=2147483646", "--count=5" }));
        assertTrue(err(), err().startsWith("Error:"));
        assertEquals("", out());
    }

    @Test
    public void derivationFailureIsReported() {
        SeedTool failing = new SeedTool(new PrintStream(out, true), new PrintStream(err, true)) {
            @Override
            void addresses(Map<String, String> options) {
                throw new HDDerivationException.ScalarOutOfRangeException("Illegal derived key: I_L >= n");
            }
        };
        assertEquals(1, failing.run(new String[] { "addresses", "--xpub=" + XPUB }));
        assertEquals("Error: Illegal derived key: I_L >= n", err().trim());
    }

    @Test
    public void generate() {
        assertEquals(0, tool.run(new String[] { "generate", "--words=24", "--net=TEST" }));
        String output = out();
        String mnemonicLine = output.substring(0, output.indexOf('\n')).trim();
        assertTrue(mnemonicLine.startsWith("mnemonic:"));
        assertEquals(25, Utils.WHITESPACE_SPLITTER.splitToList(mnemonicLine).size());
        assertTrue(output, output.contains("xpub:        tpub"));
    }

    @Test
    public void generateBadWordCount() {
        assertEquals(1, tool.run(new String[] { "generate", "--words=13" }));
        assertTrue(err(), err().startsWith("Invalid mnemonic:"));
    }

    @Test
    public void usage() {
        assertEquals(1, tool.run(new String[0]));
        assertTrue(err().startsWith("Usage:"));
        assertEquals(1, tool.run(new String[] { "sign" }));
        assertTrue(err().contains("Unknown command: sign"));
    }

    @Test
    public void unknownOption() {
        assertEquals(1, tool.run(new String[] { "generate", "--colour=red" }));
        assertTrue(err(), err().contains("Unknown option --colour"));
    }
}
