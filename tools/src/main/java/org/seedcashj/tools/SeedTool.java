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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import org.seedcashj.core.Address;
import org.seedcashj.core.NetworkParameters;
import org.seedcashj.crypto.HDDerivationException;
import org.seedcashj.crypto.MnemonicCode;
import org.seedcashj.crypto.MnemonicException;
import org.seedcashj.params.MainNetParams;
import org.seedcashj.params.TestNet3Params;
import org.seedcashj.wallet.DeterministicKeyChain;
import org.seedcashj.wallet.DeterministicSeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command line front end for generating and restoring wallets.
 *
 * <pre>
 * SeedTool generate [--words=12] [--net=MAIN|TEST]
 * SeedTool restore --mnemonic="word ..." [--passphrase=...] [--net=MAIN|TEST]
 * SeedTool addresses --xpub=... [--format=LEGACY|CASHADDR] [--from=0] [--count=5] [--net=MAIN|TEST]
 * </pre>
 */
public class SeedTool {
    private static final Logger log = LoggerFactory.getLogger(SeedTool.class);

    private static final String USAGE =
            "Usage: SeedTool generate [--words=12] [--net=MAIN|TEST]\n" +
            "       SeedTool restore --mnemonic=\"word ...\" [--passphrase=...] [--net=MAIN|TEST]\n" +
            "       SeedTool addresses --xpub=... [--format=LEGACY|CASHADDR] [--from=0] [--count=5] [--net=MAIN|TEST]";

    private static final Set<String> GENERATE_OPTIONS = ImmutableSet.of("words", "net");
    private static final Set<String> RESTORE_OPTIONS = ImmutableSet.of("mnemonic", "passphrase", "net");
    private static final Set<String> ADDRESSES_OPTIONS = ImmutableSet.of("xpub", "format", "from", "count", "net");

    private final PrintStream out;
    private final PrintStream err;

    public SeedTool(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new SeedTool(System.out, System.err).run(args));
    }

    /** Runs one command and returns the process exit status. */
    public int run(String[] args) {
        if (args.length < 1) {
            err.println(USAGE);
            return 1;
        }
        try {
            String command = args[0];
            if (command.equals("generate")) {
                generate(parseOptions(args, GENERATE_OPTIONS));
            } else if (command.equals("restore")) {
                restore(parseOptions(args, RESTORE_OPTIONS));
            } else if (command.equals("addresses")) {
                addresses(parseOptions(args, ADDRESSES_OPTIONS));
            } else {
                err.println("Unknown command: " + command);
                err.println(USAGE);
                return 1;
            }
            return 0;
        } catch (MnemonicException x) {
            err.println("Invalid mnemonic: " + describe(x));
        } catch (IllegalArgumentException | IllegalStateException | HDDerivationException x) {
            err.println("Error: " + x.getMessage());
        } catch (IOException x) {
            log.error("Failed to load word list", x);
            err.println("Failed: " + x.getMessage());
        }
        return 1;
    }

    private void generate(Map<String, String> options) throws IOException, MnemonicException {
        int words = parseInt(options, "words", 12);
        NetworkParameters params = network(options);
        MnemonicCode code = new MnemonicCode();
        List<String> mnemonic = code.generateRandom(words);
        DeterministicSeed seed = DeterministicSeed.fromMnemonic(code, mnemonic, "");
        DeterministicKeyChain chain = DeterministicKeyChain.fromSeed(params, seed);
        out.println("mnemonic:    " + seed.getMnemonicDisplayString());
        out.println("fingerprint: " + chain.getFingerprint());
        out.println("xpub:        " + chain.getExtendedPublicKey());
    }

    private void restore(Map<String, String> options) throws IOException, MnemonicException {
        String sentence = required(options, "mnemonic");
        String passphrase = options.containsKey("passphrase") ? options.get("passphrase") : "";
        NetworkParameters params = network(options);
        MnemonicCode code = new MnemonicCode();
        DeterministicSeed seed = DeterministicSeed.fromMnemonic(code, DeterministicSeed.decodeMnemonicCode(sentence),
                passphrase);
        DeterministicKeyChain chain = DeterministicKeyChain.fromSeed(params, seed);
        if (seed.hasPassphrase())
            out.println("passphrase:  " + seed.getPassphraseDisplay());
        out.println("fingerprint: " + chain.getFingerprint());
        out.println("xpub:        " + chain.getExtendedPublicKey());
        out.println("xprv:        " + chain.getExtendedPrivateKey());
    }

    void addresses(Map<String, String> options) {
        String xpub = required(options, "xpub");
        NetworkParameters params = network(options);
        Address.Format format = Address.Format.valueOf(
                options.containsKey("format") ? options.get("format").toUpperCase(Locale.US) : "CASHADDR");
        int from = parseInt(options, "from", 0);
        int count = parseInt(options, "count", 5);
        DeterministicKeyChain chain = DeterministicKeyChain.watch(params, xpub);
        int index = from;
        for (Address address : chain.getReceiveAddresses(format, from, count))
            out.println(index++ + " " + address);
    }

    private static Map<String, String> parseOptions(String[] args, Set<String> allowed) {
        Map<String, String> options = new HashMap<>();
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--") || !arg.contains("="))
                throw new IllegalArgumentException("Expected --name=value, got " + arg);
            List<String> parts = Splitter.on('=').limit(2).splitToList(arg.substring(2));
            if (!allowed.contains(parts.get(0)))
                throw new IllegalArgumentException("Unknown option --" + parts.get(0));
            options.put(parts.get(0), parts.get(1));
        }
        return options;
    }

    private static String required(Map<String, String> options, String name) {
        String value = options.get(name);
        if (value == null || value.isEmpty())
            throw new IllegalArgumentException("Missing --" + name);
        return value;
    }

    private static int parseInt(Map<String, String> options, String name, int defaultValue) {
        String value = options.get(name);
        if (value == null)
            return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException x) {
            throw new IllegalArgumentException("--" + name + " is not a number: " + value);
        }
    }

    private static NetworkParameters network(Map<String, String> options) {
        String net = options.containsKey("net") ? options.get("net").toUpperCase(Locale.US) : "MAIN";
        if (net.equals("MAIN"))
            return MainNetParams.get();
        if (net.equals("TEST"))
            return TestNet3Params.get();
        throw new IllegalArgumentException("Unknown network: " + net);
    }

    private static String describe(MnemonicException x) {
        if (x instanceof MnemonicException.MnemonicWordException)
            return "unknown word " + ((MnemonicException.MnemonicWordException) x).badWord;
        if (x instanceof MnemonicException.MnemonicChecksumException)
            return "checksum mismatch";
        return x.getMessage();
    }
}
