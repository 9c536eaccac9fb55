// file: cli/src/test/java/io/merklite/cli/CliTest.java
package io.merklite.cli;

import io.merklite.core.MerkleTree;
import io.merklite.core.TextContent;
import io.merklite.core.hash.HashStrategies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end CLI behavior: commands run in-process against temp files.
 */
class CliTest {

    @TempDir
    Path tmp;

    private Path items;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() throws Exception {
        items = tmp.resolve("items.txt");
        Files.writeString(items, "Hello\nHi\n\nHey\nHola\n");
    }

    private int run(String... args) {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        return Cli.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8)
        );
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private static MerkleTree<TextContent> expected(String... lines) {
        return MerkleTree.build(List.of(lines).stream().map(TextContent::of).toList());
    }

    @Test
    void root_prints_root_hex_skipping_blank_lines() {
        assertEquals(Cli.EXIT_OK, run("root", items.toString()));
        assertEquals(expected("Hello", "Hi", "Hey", "Hola").rootHex(), stdout().trim());
    }

    @Test
    void keep_blank_lines_changes_root() {
        assertEquals(Cli.EXIT_OK, run("--keep-blank-lines", "root", items.toString()));
        assertEquals(expected("Hello", "Hi", "", "Hey", "Hola").rootHex(), stdout().trim());
    }

    @Test
    void hash_flag_selects_strategy() {
        assertEquals(Cli.EXIT_OK, run("--hash", "keccak-256", "root", items.toString()));

        var keccak = MerkleTree.build(
                List.of("Hello", "Hi", "Hey", "Hola").stream().map(TextContent::of).toList(),
                HashStrategies.keccak256()
        );
        assertEquals(keccak.rootHex(), stdout().trim());
    }

    @Test
    void verify_reports_ok() {
        assertEquals(Cli.EXIT_OK, run("verify", items.toString()));
        assertTrue(stdout().startsWith("OK (4 items"));
    }

    @Test
    void dump_shows_levels() {
        assertEquals(Cli.EXIT_OK, run("dump", items.toString()));
        assertTrue(stdout().contains("level 2 (root)"));
        assertTrue(stdout().contains("Hola"));
    }

    @Test
    void prove_then_check_round_trip() throws Exception {
        assertEquals(Cli.EXIT_OK, run("prove", items.toString(), "Hey"));
        Path proof = tmp.resolve("hey.json");
        Files.writeString(proof, stdout());

        assertEquals(Cli.EXIT_OK, run("check", proof.toString(), "Hey"));
        assertEquals("VALID", stdout().trim());

        assertEquals(Cli.EXIT_INVALID, run("check", proof.toString(), "Hay"));
        assertEquals("INVALID", stdout().trim());
    }

    @Test
    void check_against_trusted_root() throws Exception {
        assertEquals(Cli.EXIT_OK, run("prove", items.toString(), "Hi"));
        Path proof = tmp.resolve("hi.json");
        Files.writeString(proof, stdout());

        String trusted = expected("Hello", "Hi", "Hey", "Hola").rootHex();
        assertEquals(Cli.EXIT_OK, run("--root", trusted, "check", proof.toString(), "Hi"));

        String other = expected("Hello", "Hi", "Hey", "Ciao").rootHex();
        assertEquals(Cli.EXIT_INVALID, run("--root", other, "check", proof.toString(), "Hi"));
    }

    @Test
    void prove_missing_item_is_an_error() {
        assertEquals(Cli.EXIT_ERROR, run("prove", items.toString(), "Bonjour"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("not found"));
    }

    @Test
    void empty_file_is_an_error() throws Exception {
        Path empty = tmp.resolve("empty.txt");
        Files.writeString(empty, "\n\n");

        assertEquals(Cli.EXIT_ERROR, run("root", empty.toString()));
    }

    @Test
    void unknown_hash_algorithm_is_an_error() {
        assertEquals(Cli.EXIT_ERROR, run("--hash", "NOPE-1", "root", items.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("NOPE-1"));
    }

    @Test
    void structurally_broken_proof_is_an_error() throws Exception {
        Path negative = tmp.resolve("negative.json");
        Files.writeString(negative, "{\"hashStrategy\":\"sha-256\",\"leafIndex\":-1,\"root\":\"00\",\"steps\":[]}");
        assertEquals(Cli.EXIT_ERROR, run("check", negative.toString(), "Hi"));

        Path noSteps = tmp.resolve("no-steps.json");
        Files.writeString(noSteps, "{\"hashStrategy\":\"sha-256\",\"leafIndex\":0,\"root\":\"00\",\"steps\":null}");
        assertEquals(Cli.EXIT_ERROR, run("check", noSteps.toString(), "Hi"));
    }

    @Test
    void usage_errors() {
        assertEquals(Cli.EXIT_ERROR, run());
        assertEquals(Cli.EXIT_ERROR, run("frobnicate"));
        assertEquals(Cli.EXIT_ERROR, run("prove", items.toString()));
        assertEquals(Cli.EXIT_ERROR, run("root", tmp.resolve("missing.txt").toString()));
        assertEquals(Cli.EXIT_OK, run("--help"));
        assertTrue(stdout().contains("Usage:"));
    }
}
