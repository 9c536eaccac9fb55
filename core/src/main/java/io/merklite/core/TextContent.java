// file: core/src/main/java/io/merklite/core/TextContent.java
package io.merklite.core;

import io.merklite.core.hash.HashStrategy;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** UTF-8 text item. Digest = H(utf8(text)). */
public record TextContent(String text) implements Content {

    public TextContent {
        Objects.requireNonNull(text, "text");
    }

    public static TextContent of(String text) {
        return new TextContent(text);
    }

    @Override
    public byte[] digest(HashStrategy hash) {
        return hash.hash(text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public boolean contentEquals(Content other) {
        if (other instanceof TextContent t) {
            return text.equals(t.text);
        }
        throw new ContentTypeMismatchException(TextContent.class, other);
    }

    @Override
    public String toString() {
        return text;
    }
}
