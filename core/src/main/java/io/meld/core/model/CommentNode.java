package io.meld.core.model;

/** A {@code >>} comment line. Interpreting it has no effect and it never reaches the output. */
public record CommentNode(String content, SourceLocation location) implements Node {

    @Override
    public String type() {
        return "Comment";
    }
}
