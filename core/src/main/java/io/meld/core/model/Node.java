package io.meld.core.model;

/**
 * A program node. The node list of a state is the document in order: plain text, comments, code
 * fences and directives. Implementations are immutable records, so two nodes with the same type,
 * content and location are structurally equal.
 */
public interface Node {

    /** Node type name: {@code Text}, {@code Comment}, {@code CodeFence} or {@code Directive}. */
    String type();

    /** Source location, or {@code null} for synthesized nodes. */
    SourceLocation location();
}
