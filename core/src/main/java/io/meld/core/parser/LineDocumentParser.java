package io.meld.core.parser;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.meld.core.error.DocumentParseException;
import io.meld.core.model.CodeFenceNode;
import io.meld.core.model.CommentNode;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.ImportSpecifier;
import io.meld.core.model.Node;
import io.meld.core.model.SourceLocation;
import io.meld.core.model.TextNode;
import io.meld.core.spi.DocumentParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented {@link DocumentParser}.
 *
 * <ul>
 * <li>{@code @text}, {@code @data}, {@code @path}, {@code @define}, {@code @run}, {@code @import}
 * and {@code @embed} at the start of a line begin a one-line directive</li>
 * <li>{@code @import} takes {@code [path]}, {@code [path] list} or {@code [list] from [path]}, where
 * the list is {@code *} or comma-separated names with optional {@code as} aliases</li>
 * <li>{@code >>} begins a comment line</li>
 * <li>three or more backticks open a code fence, closed by a line of the same backticks</li>
 * <li>everything else is text; consecutive text lines form one node, newlines kept</li>
 * </ul>
 */
public final class LineDocumentParser implements DocumentParser {

    private static final Set<String> KINDS = Set.of("text", "data", "path", "define", "run", "import", "embed");

    private static final Pattern DIRECTIVE = Pattern.compile("^@([a-z]+)(?:\\s+(.*))?$");
    private static final Pattern FENCE = Pattern.compile("^(`{3,})\\s*([^`\\s]*)\\s*$");
    private static final Pattern ASSIGNMENT = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.+)$");
    private static final Pattern DEFINE =
            Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*(?:\\.[^\\s(=]+)?)\\s*(?:\\(([^)]*)\\))?\\s*=\\s*(.+)$");
    private static final String OUTPUT_SUFFIX =
            "(?:\\s+as\\s+([A-Za-z_][A-Za-z0-9_]*))?(?:\\s+error\\s+([A-Za-z_][A-Za-z0-9_]*))?\\s*$";
    private static final Pattern RUN_BRACKET = Pattern.compile("^\\[(.*)\\]" + OUTPUT_SUFFIX);
    private static final Pattern RUN_REFERENCE = Pattern.compile("^(\\$[A-Za-z0-9_]+\\([^)]*\\))" + OUTPUT_SUFFIX);
    private static final Pattern IMPORT_FROM = Pattern.compile("^\\[(.+?)\\]\\s+from\\s+\\[(.+)\\]\\s*$");
    private static final Pattern BRACKETED = Pattern.compile("^\\[(.+)\\]\\s*$");
    private static final Pattern IMPORT_LIST_AFTER = Pattern.compile("^\\[([^\\]]+)\\]\\s+(.+?)\\s*$");
    private static final Pattern EMBED = Pattern.compile("^\\[([^\\]]+)\\](.*)$");
    private static final Pattern OPTION = Pattern.compile("([A-Za-z]+)=(\"[^\"]*\"|\\S+)");

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    @Override
    public List<Node> parse(String content) {
        List<Node> nodes = new ArrayList<>();
        String[] lines = content.split("\n", -1);
        int count = content.endsWith("\n") ? lines.length - 1 : lines.length;

        StringBuilder text = new StringBuilder();
        int textStart = -1;
        for (int i = 0; i < count; i++) {
            String line = stripCarriageReturn(lines[i]);
            int lineNo = i + 1;
            boolean lastLine = i == count - 1 && !content.endsWith("\n");

            Matcher fence = FENCE.matcher(line);
            Matcher directive = DIRECTIVE.matcher(line);
            boolean isDirective = directive.matches() && KINDS.contains(directive.group(1));
            if (fence.matches() || isDirective || line.startsWith(">>")) {
                flushText(nodes, text, textStart, lineNo - 1, lines);
                textStart = -1;
            }

            if (fence.matches()) {
                i = parseFence(nodes, lines, count, i, fence.group(1), fence.group(2));
            } else if (isDirective) {
                SourceLocation location = SourceLocation.of(lineNo, 1, lineNo, line.length() + 1);
                String rest = directive.group(2) == null ? "" : directive.group(2).trim();
                nodes.add(parseDirective(directive.group(1), rest, location));
            } else if (line.startsWith(">>")) {
                nodes.add(new CommentNode(
                        line.substring(2).trim(), SourceLocation.of(lineNo, 1, lineNo, line.length() + 1)));
            } else {
                if (textStart < 0) {
                    textStart = lineNo;
                }
                text.append(line);
                if (!lastLine) {
                    text.append('\n');
                }
            }
        }
        flushText(nodes, text, textStart, count, lines);
        return nodes;
    }

    @Override
    public List<ImportSpecifier> parseImportList(String list) {
        return ImportListParser.parse(list);
    }

    private static void flushText(List<Node> nodes, StringBuilder text, int start, int endLine, String[] lines) {
        if (start < 0 || text.length() == 0) {
            text.setLength(0);
            return;
        }
        int endColumn = stripCarriageReturn(lines[endLine - 1]).length() + 1;
        nodes.add(new TextNode(text.toString(), SourceLocation.of(start, 1, endLine, endColumn)));
        text.setLength(0);
    }

    private static int parseFence(List<Node> nodes, String[] lines, int count, int open, String ticks, String lang) {
        StringBuilder body = new StringBuilder();
        for (int j = open + 1; j < count; j++) {
            String line = stripCarriageReturn(lines[j]);
            if (line.trim().equals(ticks)) {
                SourceLocation location = SourceLocation.of(open + 1, 1, j + 1, line.length() + 1);
                nodes.add(new CodeFenceNode(lang.isEmpty() ? null : lang, body.toString(), ticks.length(), location));
                return j;
            }
            if (j > open + 1) {
                body.append('\n');
            }
            body.append(line);
        }
        throw new DocumentParseException(
                "Unclosed code fence opened at line " + (open + 1), SourceLocation.of(open + 1, 1, open + 1, 1));
    }

    private static DirectiveNode parseDirective(String kind, String rest, SourceLocation location) {
        ObjectNode payload = JSON.objectNode();
        switch (kind) {
            case "text", "data", "path" -> {
                Matcher m = require(ASSIGNMENT, rest, kind, location);
                payload.put("identifier", m.group(1));
                payload.put("value", m.group(2).trim());
            }
            case "define" -> {
                Matcher m = require(DEFINE, rest, kind, location);
                payload.put("identifier", m.group(1));
                if (m.group(2) != null) {
                    ArrayNode params = payload.putArray("parameters");
                    for (String param : m.group(2).split(",")) {
                        if (!param.isBlank()) {
                            params.add(param.trim());
                        }
                    }
                }
                payload.put("value", unquote(m.group(3).trim()));
            }
            case "run" -> {
                Matcher m = RUN_BRACKET.matcher(rest);
                if (!m.matches()) {
                    m = require(RUN_REFERENCE, rest, kind, location);
                }
                payload.put("command", m.group(1).trim());
                if (m.group(2) != null) {
                    payload.put("output", m.group(2));
                }
                if (m.group(3) != null) {
                    payload.put("errorOutput", m.group(3));
                }
            }
            case "import" -> {
                Matcher m = IMPORT_FROM.matcher(rest);
                Matcher whole = BRACKETED.matcher(rest);
                if (m.matches()) {
                    payload.put("imports", m.group(1).trim());
                    payload.put("path", m.group(2).trim());
                } else if (whole.matches()) {
                    payload.put("path", whole.group(1).trim());
                } else {
                    Matcher after = require(IMPORT_LIST_AFTER, rest, kind, location);
                    payload.put("path", after.group(1).trim());
                    payload.put("imports", after.group(2));
                }
            }
            case "embed" -> parseEmbed(payload, rest, location);
            default -> throw new DocumentParseException("Unknown directive @" + kind, location);
        }
        return new DirectiveNode(kind, payload, location);
    }

    private static void parseEmbed(ObjectNode payload, String rest, SourceLocation location) {
        Matcher m = require(EMBED, rest, "embed", location);
        String target = m.group(1);
        int hash = target.indexOf('#');
        if (hash >= 0) {
            payload.put("path", target.substring(0, hash).trim());
            String section = target.substring(hash + 1).trim();
            if (section.isEmpty()) {
                throw new DocumentParseException(
                        "Empty section name in @embed at line " + location.start().line(), location);
            }
            payload.put("section", section);
        } else {
            payload.put("path", target.trim());
        }

        String options = m.group(2).trim();
        Matcher option = OPTION.matcher(options);
        int consumed = 0;
        while (option.find()) {
            if (!options.substring(consumed, option.start()).isBlank()) {
                break;
            }
            consumed = option.end();
            String value = unquote(option.group(2));
            try {
                switch (option.group(1)) {
                    case "fuzzy" -> payload.put("fuzzy", Double.parseDouble(value));
                    case "level" -> payload.put("headingLevel", Integer.parseInt(value));
                    case "under" -> payload.put("underHeader", value);
                    default -> throw new DocumentParseException(
                            "Unknown @embed option '" + option.group(1) + "' at line " + location.start().line(),
                            location);
                }
            } catch (NumberFormatException e) {
                throw new DocumentParseException(
                        "Invalid value for @embed option '" + option.group(1) + "': " + value, e, location);
            }
        }
        if (!options.substring(consumed).isBlank()) {
            throw new DocumentParseException(
                    "Invalid @embed options at line " + location.start().line() + ": " + options, location);
        }
    }

    private static Matcher require(Pattern pattern, String rest, String kind, SourceLocation location) {
        Matcher m = pattern.matcher(rest);
        if (!m.matches()) {
            throw new DocumentParseException(
                    "Invalid @" + kind + " directive at line " + location.start().line() + ": " + rest, location);
        }
        return m;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
