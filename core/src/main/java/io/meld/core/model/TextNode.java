package io.meld.core.model;

import java.util.Objects;

/** Literal document text, emitted verbatim. Also used for directive replacement output. */
public record TextNode(String content, SourceLocation location) implements Node {

    public TextNode {
        Objects.requireNonNull(content, "content must not be null");
    }

    /** A synthesized text node with no source location. */
    public static TextNode of(String content) {
        return new TextNode(content, null);
    }

    @Override
    public String type() {
        return "Text";
    }
}
