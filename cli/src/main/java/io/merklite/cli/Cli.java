// file: cli/src/main/java/io/merklite/cli/Cli.java
package io.merklite.cli;

import io.merklite.core.AuditPath;
import io.merklite.core.MerkleException;
import io.merklite.core.MerkleTree;
import io.merklite.core.TextContent;
import io.merklite.core.hash.HashAlgorithmException;
import io.merklite.core.hash.HashStrategies;
import io.merklite.core.hash.HashStrategy;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line front end over the Merkle tree. Each line of an input file is one item.
 *
 * Usage:
 *   merklite [options] root   <file>
 *   merklite [options] dump   <file>
 *   merklite [options] verify <file>
 *   merklite [options] prove  <file> <item>
 *   merklite [options] check  <proof.json> <item>
 *
 * Examples:
 *   merklite root items.txt
 *   merklite --hash keccak-256 prove items.txt Hola > hola.json
 *   merklite check hola.json Hola
 *
 * Exit codes: 0 ok, 1 usage/input error, 2 unexpected failure, 3 verification failed.
 */
public final class Cli {
    private static final Logger log = Logger.getLogger(Cli.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_CRASH = 2;
    static final int EXIT_INVALID = 3;

    private final CliConfig cfg;
    private final HashStrategy hash;
    private final PrintStream out;

    private Cli(CliConfig cfg, PrintStream out) {
        this.cfg = cfg;
        this.hash = HashStrategies.forName(cfg.hashStrategy());
        this.out = out;
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            CliConfig cfg = CliConfig.fromArgs(args);
            List<String> rest = cfg.positional();
            if (rest.isEmpty()) {
                throw new CliException("missing command");
            }

            Cli cli = new Cli(cfg, out);
            String cmd = rest.get(0);
            int code = switch (cmd) {
                case "root" -> {
                    expectOperands(rest, 1, "root requires <file>");
                    yield cli.root(Path.of(rest.get(1)));
                }
                case "dump" -> {
                    expectOperands(rest, 1, "dump requires <file>");
                    yield cli.dump(Path.of(rest.get(1)));
                }
                case "verify" -> {
                    expectOperands(rest, 1, "verify requires <file>");
                    yield cli.verify(Path.of(rest.get(1)));
                }
                case "prove" -> {
                    expectOperands(rest, 2, "prove requires <file> <item>");
                    yield cli.prove(Path.of(rest.get(1)), rest.get(2));
                }
                case "check" -> {
                    expectOperands(rest, 2, "check requires <proof.json> <item>");
                    yield cli.check(Path.of(rest.get(1)), rest.get(2));
                }
                default -> throw new CliException("unknown command: " + cmd);
            };
            log.log(Level.INFO, "{0} -> exit {1}", new Object[]{cmd, code});
            return code;
        } catch (CliConfig.UsageRequested e) {
            out.println(usage());
            return EXIT_OK;
        } catch (CliException | MerkleException | HashAlgorithmException e) {
            err.println("error: " + e.getMessage());
            if (e instanceof CliException) {
                err.println(usage());
            }
            return EXIT_ERROR;
        } catch (Exception e) {
            log.log(Level.SEVERE, "unexpected failure", e);
            e.printStackTrace(err);
            return EXIT_CRASH;
        }
    }

    // ---------------- commands ----------------

    private int root(Path file) throws IOException {
        out.println(buildTree(file).rootHex());
        return EXIT_OK;
    }

    private int dump(Path file) throws IOException {
        out.print(buildTree(file).toDisplayString(cfg.elideDuplicates()));
        return EXIT_OK;
    }

    /**
     * Structural check, then every item re-hashed and folded to the root.
     * The tree is built from the file right here, so this is a self-check of the
     * build: INCONSISTENT only shows up when the hash strategy is not
     * deterministic. Tampering with stored input is caught by {@code check}
     * against a previously published root.
     */
    private int verify(Path file) throws IOException {
        MerkleTree<TextContent> tree = buildTree(file);
        if (!tree.verifyTree()) {
            out.println("INCONSISTENT");
            return EXIT_INVALID;
        }
        for (TextContent item : tree.contents()) {
            if (!tree.verifyContent(item)) {
                out.println("INCONSISTENT at item: " + item);
                return EXIT_INVALID;
            }
        }
        out.println("OK (" + tree.leafCount() + " items, root " + tree.rootHex() + ")");
        return EXIT_OK;
    }

    private int prove(Path file, String item) throws IOException {
        MerkleTree<TextContent> tree = buildTree(file);
        AuditPath path = tree.merklePath(TextContent.of(item));
        out.println(ProofDocument.of(tree, path).toJson());
        return EXIT_OK;
    }

    private int check(Path proofFile, String item) throws IOException {
        ProofDocument doc = ProofDocument.fromJson(readFile(proofFile));
        // the proof names its own strategy; a --hash flag would only cause mismatches
        HashStrategy proofHash = HashStrategies.forName(doc.hashStrategy);
        byte[] expectedRoot = cfg.trustedRootHex() != null
                ? ProofDocument.decodeHex(cfg.trustedRootHex(), "--root")
                : doc.rootBytes();

        boolean valid = doc.toAuditPath().verify(TextContent.of(item), expectedRoot, proofHash);
        out.println(valid ? "VALID" : "INVALID");
        return valid ? EXIT_OK : EXIT_INVALID;
    }

    // ---------------- helpers ----------------

    private MerkleTree<TextContent> buildTree(Path file) throws IOException {
        List<TextContent> items = readItems(file, cfg.skipBlankLines());
        if (items.isEmpty()) {
            throw new CliException("no items in " + file);
        }
        return MerkleTree.build(items, hash);
    }

    static List<TextContent> readItems(Path file, boolean skipBlankLines) throws IOException {
        List<TextContent> items = new ArrayList<>();
        for (String line : Files.readAllLines(requireFile(file), StandardCharsets.UTF_8)) {
            if (skipBlankLines && line.isBlank()) continue;
            items.add(TextContent.of(line));
        }
        return items;
    }

    private static String readFile(Path file) throws IOException {
        return Files.readString(requireFile(file), StandardCharsets.UTF_8);
    }

    private static Path requireFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new CliException("no such file: " + file);
        }
        return file;
    }

    private static void expectOperands(List<String> rest, int n, String msg) {
        if (rest.size() != n + 1) {
            throw new CliException(msg);
        }
    }

    /** Load the bundled logging.properties unless the JVM was pointed at another one. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Cli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "could not load bundled logging.properties", e);
        }
    }

    static String usage() {
        return """
                Usage:
                  merklite [options] root   <file>
                  merklite [options] dump   <file>
                  merklite [options] verify <file>
                  merklite [options] prove  <file> <item>
                  merklite [options] check  <proof.json> <item>

                Options:
                  --config, -c <path>   JSON config file (hashStrategy, elideDuplicates, skipBlankLines)
                  --hash,   -H <name>   sha-256 (default), keccak-256, or a JCA digest name
                  --root       <hex>    trusted root for "check" (default: the proof's own root)
                  --elide-duplicates    hide padding nodes in "dump"
                  --keep-blank-lines    treat blank lines as items
                  --help,   -h          show this help
                """;
    }
}
