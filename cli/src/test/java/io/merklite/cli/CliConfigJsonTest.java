// file: cli/src/test/java/io/merklite/cli/CliConfigJsonTest.java
package io.merklite.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies CLI settings can be loaded from JSON and overridden by flags.
 */
class CliConfigJsonTest {

    @TempDir
    Path tmp;

    @Test
    void defaults_without_config() {
        CliConfig cfg = CliConfig.fromArgs(new String[]{"root", "items.txt"});

        assertEquals("sha-256", cfg.hashStrategy());
        assertFalse(cfg.elideDuplicates());
        assertTrue(cfg.skipBlankLines());
        assertNull(cfg.trustedRootHex());
        assertEquals(List.of("root", "items.txt"), cfg.positional());
    }

    @Test
    void loads_settings_from_json() throws Exception {
        Path cfgPath = tmp.resolve("merklite.json");
        Files.writeString(cfgPath, """
                {
                  "hashStrategy": "keccak-256",
                  "elideDuplicates": true,
                  "skipBlankLines": false
                }
                """);

        CliConfig cfg = CliConfig.fromArgs(new String[]{"--config", cfgPath.toString(), "dump", "f.txt"});

        assertEquals("keccak-256", cfg.hashStrategy());
        assertTrue(cfg.elideDuplicates());
        assertFalse(cfg.skipBlankLines());
        assertEquals(List.of("dump", "f.txt"), cfg.positional());
    }

    @Test
    void flags_override_file() throws Exception {
        Path cfgPath = tmp.resolve("merklite.json");
        Files.writeString(cfgPath, "{\"hashStrategy\": \"keccak-256\"}");

        CliConfig cfg = CliConfig.fromArgs(new String[]{"-c", cfgPath.toString(), "-H", "SHA-512", "root", "f"});

        assertEquals("SHA-512", cfg.hashStrategy());
    }

    @Test
    void unknown_key_in_file_is_rejected() throws Exception {
        Path cfgPath = tmp.resolve("bad.json");
        Files.writeString(cfgPath, "{\"hashAlgo\": \"sha-256\"}");

        assertThrows(CliException.class,
                () -> CliConfig.fromArgs(new String[]{"--config", cfgPath.toString(), "root", "f"}));
    }

    @Test
    void missing_option_value_is_rejected() {
        assertThrows(CliException.class, () -> CliConfig.fromArgs(new String[]{"root", "f", "--hash"}));
        assertThrows(CliException.class, () -> CliConfig.fromArgs(new String[]{"--bogus", "root"}));
    }
}
