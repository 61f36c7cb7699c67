package io.meld.core.resolution;

import io.meld.core.model.CodeFenceNode;
import io.meld.core.model.Node;
import io.meld.core.model.TextNode;
import java.util.List;

/**
 * Renders nodes back to source text: text verbatim, code fences reconstructed with their own
 * backtick count, comments and directives skipped.
 */
public final class ContentResolver {

    public String resolve(List<Node> nodes) {
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes) {
            if (node instanceof TextNode text) {
                sb.append(text.content());
            } else if (node instanceof CodeFenceNode fence) {
                sb.append(fence.fenced()).append('\n');
            }
        }
        return sb.toString();
    }
}
