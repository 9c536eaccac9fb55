// file: cli/src/test/java/io/merklite/cli/ProofDocumentTest.java
package io.merklite.cli;

import io.merklite.core.AuditPath;
import io.merklite.core.MerkleTree;
import io.merklite.core.TextContent;
import io.merklite.core.hash.HashStrategies;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The JSON proof must carry everything an outside verifier needs.
 */
class ProofDocumentTest {

    @Test
    void json_proof_verifies_without_the_tree() {
        var tree = MerkleTree.build(
                List.of(TextContent.of("a"), TextContent.of("b"), TextContent.of("c")),
                HashStrategies.keccak256()
        );
        String json = ProofDocument.of(tree, tree.merklePath(TextContent.of("c"))).toJson();

        ProofDocument doc = ProofDocument.fromJson(json);
        assertEquals("keccak-256", doc.hashStrategy);
        assertEquals(2, doc.leafIndex);
        assertEquals(tree.rootHex(), doc.root);

        AuditPath path = doc.toAuditPath();
        assertTrue(path.verify(TextContent.of("c"), doc.rootBytes(), HashStrategies.forName(doc.hashStrategy)));
    }

    @Test
    void json_uses_side_names() {
        var tree = MerkleTree.build(List.of(TextContent.of("a"), TextContent.of("b")));
        String json = ProofDocument.of(tree, tree.merklePath(TextContent.of("b"))).toJson();

        assertTrue(json.contains("\"LEFT\""), json);
    }

    @Test
    void malformed_input_is_reported() {
        assertThrows(CliException.class, () -> ProofDocument.fromJson("{not json"));

        ProofDocument doc = ProofDocument.fromJson("{\"hashStrategy\":\"sha-256\",\"leafIndex\":0,\"root\":\"zz\",\"steps\":[]}");
        assertThrows(CliException.class, doc::rootBytes);

        ProofDocument negative = ProofDocument.fromJson("{\"hashStrategy\":\"sha-256\",\"leafIndex\":-1,\"root\":\"00\",\"steps\":[]}");
        assertThrows(CliException.class, negative::toAuditPath);

        ProofDocument noSteps = ProofDocument.fromJson("{\"hashStrategy\":\"sha-256\",\"leafIndex\":0,\"root\":\"00\",\"steps\":null}");
        assertThrows(CliException.class, noSteps::toAuditPath);
    }
}
