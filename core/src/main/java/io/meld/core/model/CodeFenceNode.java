package io.meld.core.model;

/**
 * A fenced code block. Its content is never resolved; directives inside a fence are plain text.
 *
 * @param language  info string after the opening fence, or {@code null}
 * @param content   body between the fences, without the fence lines
 * @param backticks number of backticks in the opening and closing fence (at least 3)
 */
public record CodeFenceNode(String language, String content, int backticks, SourceLocation location)
        implements Node {

    public CodeFenceNode {
        if (backticks < 3) {
            throw new IllegalArgumentException("code fence needs at least 3 backticks, got " + backticks);
        }
        content = content == null ? "" : content;
    }

    @Override
    public String type() {
        return "CodeFence";
    }

    /** The block as it appeared in the source, fences included. */
    public String fenced() {
        String fence = "`".repeat(backticks);
        StringBuilder sb = new StringBuilder(fence);
        if (language != null) {
            sb.append(language);
        }
        sb.append('\n');
        if (!content.isEmpty()) {
            sb.append(content).append('\n');
        }
        return sb.append(fence).toString();
    }
}
