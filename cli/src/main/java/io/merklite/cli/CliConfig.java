// file: cli/src/main/java/io/merklite/cli/CliConfig.java
package io.merklite.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.merklite.core.hash.HashStrategies;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for one CLI invocation, parsed from args and an optional JSON file.
 *
 * Supports:
 *  - hashStrategy:    digest primitive name (sha-256, keccak-256, or any JCA name)
 *  - elideDuplicates: hide padding nodes in "dump"
 *  - skipBlankLines:  ignore blank lines of the input file
 *  - trustedRootHex:  root to check proofs against instead of the one stored in the proof
 *  - positional:      command followed by its operands
 *
 * Precedence: CLI flag > config file > default.
 */
public record CliConfig(
        String hashStrategy,
        boolean elideDuplicates,
        boolean skipBlankLines,
        String trustedRootHex,
        List<String> positional
) {

    public CliConfig {
        positional = List.copyOf(positional);
    }

    /**
     * Supported flags:
     *   --config, -c  <path>   JSON config file
     *   --hash,   -H  <name>   hash strategy
     *   --root        <hex>    trusted root for "check"
     *   --elide-duplicates
     *   --keep-blank-lines
     *   --help,   -h
     * Everything else is positional.
     */
    public static CliConfig fromArgs(String[] args) {
        String configPath = null;
        String hash = null;
        Boolean elide = null;
        Boolean skipBlank = null;
        String root = null;
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> throw new UsageRequested();

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                case "--hash", "-H" -> {
                    ensureValue(args, i);
                    hash = args[++i];
                }

                case "--root" -> {
                    ensureValue(args, i);
                    root = args[++i];
                }

                case "--elide-duplicates" -> elide = true;

                case "--keep-blank-lines" -> skipBlank = false;

                default -> {
                    if (args[i].startsWith("--")) {
                        throw new CliException("unknown option: " + args[i]);
                    }
                    positional.add(args[i]);
                }
            }
        }

        JsonCliConfig file = configPath == null ? new JsonCliConfig() : readJson(Path.of(configPath));

        return new CliConfig(
                firstNonNull(hash, file.hashStrategy, HashStrategies.SHA_256),
                firstNonNull(elide, file.elideDuplicates, false),
                firstNonNull(skipBlank, file.skipBlankLines, true),
                root,
                positional
        );
    }

    static JsonCliConfig readJson(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new CliException("config file not found: " + path);
        }
        ObjectMapper mapper = new ObjectMapper();
        try {
            return mapper.readValue(path.toFile(), JsonCliConfig.class);
        } catch (IOException e) {
            throw new CliException("failed to load config from " + path + ": " + e.getMessage(), e);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException("missing value for option: " + args[i]);
        }
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... candidates) {
        for (T c : candidates) {
            if (c != null) return c;
        }
        return null;
    }

    /** Thrown by --help; the CLI prints usage and exits 0. */
    static final class UsageRequested extends RuntimeException {
        UsageRequested() {
            super(null, null, false, false);
        }
    }
}
