package io.meld.core.spi;

import io.meld.core.error.DocumentParseException;
import io.meld.core.model.CodeFenceNode;
import io.meld.core.model.CommentNode;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.ImportSpecifier;
import io.meld.core.model.Node;
import io.meld.core.model.SourceLocation;
import io.meld.core.model.TextNode;
import java.util.ArrayList;
import java.util.List;

/** Turns document text into program nodes. */
public interface DocumentParser {

    /**
     * Parses {@code content} into nodes in document order.
     *
     * @throws DocumentParseException if the content is malformed
     */
    List<Node> parse(String content);

    /** Like {@link #parse}, with every node location tagged with {@code filePath}. */
    default List<Node> parseWithLocations(String content, String filePath) {
        List<Node> result = new ArrayList<>();
        for (Node node : parse(content)) {
            result.add(withFilePath(node, filePath));
        }
        return result;
    }

    /**
     * Parses an import list: {@code *}, {@code name}, {@code name as alias} or {@code name:alias},
     * comma separated.
     *
     * @throws DocumentParseException if the list is malformed
     */
    List<ImportSpecifier> parseImportList(String list);

    private static Node withFilePath(Node node, String filePath) {
        SourceLocation location = node.location();
        if (location == null) {
            return node;
        }
        SourceLocation tagged = location.withFilePath(filePath);
        if (node instanceof TextNode text) {
            return new TextNode(text.content(), tagged);
        }
        if (node instanceof CommentNode comment) {
            return new CommentNode(comment.content(), tagged);
        }
        if (node instanceof CodeFenceNode fence) {
            return new CodeFenceNode(fence.language(), fence.content(), fence.backticks(), tagged);
        }
        if (node instanceof DirectiveNode directive) {
            return new DirectiveNode(directive.kind(), directive.directive(), tagged);
        }
        return node;
    }
}
