// file: cli/src/main/java/io/merklite/cli/ProofDocument.java
package io.merklite.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.merklite.core.AuditPath;
import io.merklite.core.MerkleTree;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of an inclusion proof, digests hex-encoded:
 * <pre>
 * {
 *   "hashStrategy": "sha-256",
 *   "leafIndex": 2,
 *   "root": "...",
 *   "steps": [ {"side": "RIGHT", "sibling": "..."}, ... ]
 * }
 * </pre>
 * "side" is the side the sibling takes in the next hash step.
 */
public class ProofDocument {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String hashStrategy;
    public int leafIndex;
    public String root;
    public List<JsonStep> steps = new ArrayList<>();

    public static class JsonStep {
        public AuditPath.Side side;
        public String sibling;
    }

    static ProofDocument of(MerkleTree<?> tree, AuditPath path) {
        ProofDocument doc = new ProofDocument();
        doc.hashStrategy = tree.hashStrategy().name();
        doc.leafIndex = path.leafIndex();
        doc.root = tree.rootHex();
        for (AuditPath.Step step : path.steps()) {
            JsonStep js = new JsonStep();
            js.side = step.side();
            js.sibling = Hex.toHexString(step.sibling());
            doc.steps.add(js);
        }
        return doc;
    }

    AuditPath toAuditPath() {
        if (leafIndex < 0) throw new CliException("proof leafIndex must be >= 0, got " + leafIndex);
        if (steps == null) throw new CliException("proof has no steps");
        List<AuditPath.Step> out = new ArrayList<>(steps.size());
        for (JsonStep js : steps) {
            if (js.side == null || js.sibling == null) {
                throw new CliException("proof step is missing side or sibling");
            }
            out.add(new AuditPath.Step(decodeHex(js.sibling, "sibling"), js.side));
        }
        return new AuditPath(leafIndex, out);
    }

    byte[] rootBytes() {
        if (root == null) throw new CliException("proof has no root");
        return decodeHex(root, "root");
    }

    String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("proof serialization failed", e);
        }
    }

    static ProofDocument fromJson(String json) {
        try {
            return MAPPER.readValue(json, ProofDocument.class);
        } catch (JsonProcessingException e) {
            throw new CliException("malformed proof: " + e.getOriginalMessage(), e);
        }
    }

    static byte[] decodeHex(String hex, String what) {
        try {
            return Hex.decode(hex.trim());
        } catch (DecoderException e) {
            throw new CliException("invalid hex in " + what + ": " + hex, e);
        }
    }
}
