package io.meld.core.engine;

import io.meld.core.model.CodeFenceNode;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.Node;
import io.meld.core.model.TextNode;
import io.meld.core.state.StateService;
import java.util.List;

/**
 * Renders an interpreted state back to markdown.
 *
 * <p>
 * Without transformation the plain node list is rendered: definition directives disappear and
 * {@code run}/{@code embed} leave a placeholder line. With transformation the transformed node
 * list is rendered, where those directives have already been replaced by their output.
 */
public final class MarkdownRenderer {

    public static final String RUN_PLACEHOLDER = "[run directive output placeholder]";
    public static final String DIRECTIVE_PLACEHOLDER = "[directive output placeholder]";

    public String render(StateService state) {
        List<Node> nodes = state.isTransformationEnabled() ? state.getTransformedNodes() : state.getNodes();
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            boolean last = i == nodes.size() - 1;
            Node node = nodes.get(i);
            if (node instanceof TextNode text) {
                out.append(text.content());
                // replacement output has no line break of its own
                if (!last && !text.content().isEmpty() && !text.content().endsWith("\n")) {
                    out.append('\n');
                }
            } else if (node instanceof CodeFenceNode fence) {
                out.append(fence.fenced()).append('\n');
            } else if (node instanceof DirectiveNode directive) {
                String placeholder = placeholder(directive.kind());
                if (placeholder != null) {
                    out.append(placeholder).append('\n');
                }
            }
        }
        return out.toString();
    }

    private static String placeholder(String kind) {
        return switch (kind) {
            case "run" -> RUN_PLACEHOLDER;
            case "embed" -> DIRECTIVE_PLACEHOLDER;
            default -> null;
        };
    }
}
