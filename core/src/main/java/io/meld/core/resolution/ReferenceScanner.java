package io.meld.core.resolution;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds variable references in a raw value: {@code ${text}}, {@code #{data}},
 * {@code $command(args)} and bare {@code $path}. A bare path reference is never the name part of a
 * command reference.
 */
public final class ReferenceScanner {

    static final Pattern TEXT_REF = Pattern.compile("\\$\\{([^}]+)\\}");
    static final Pattern DATA_REF = Pattern.compile("#\\{([^}]+)\\}");
    static final Pattern COMMAND_REF = Pattern.compile("\\$([A-Za-z0-9_]+)\\(([^)]*)\\)");
    static final Pattern PATH_REF = Pattern.compile("\\$([A-Za-z0-9_]+)(?![A-Za-z0-9_(])");

    private ReferenceScanner() {}

    /** One match: the full reference text and its captured name/expression and arguments. */
    public record Reference(String match, String name, String arguments) {}

    /** References of each kind, in order of first appearance, duplicates removed. */
    public record References(
            List<Reference> text, List<Reference> data, List<Reference> command, List<Reference> path) {

        public boolean isEmpty() {
            return text.isEmpty() && data.isEmpty() && command.isEmpty() && path.isEmpty();
        }

        /** Names of all text and data references, without field suffixes. */
        public Set<String> variableNames() {
            Set<String> names = new LinkedHashSet<>();
            text.forEach(r -> names.add(baseName(r.name())));
            data.forEach(r -> names.add(baseName(r.name())));
            return names;
        }
    }

    public static References scan(String value) {
        if (value == null || value.isEmpty()) {
            return new References(List.of(), List.of(), List.of(), List.of());
        }
        return new References(
                find(TEXT_REF, value, false),
                find(DATA_REF, value, false),
                find(COMMAND_REF, value, true),
                find(PATH_REF, value, false));
    }

    private static List<Reference> find(Pattern pattern, String value, boolean withArgs) {
        List<Reference> refs = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Matcher m = pattern.matcher(value);
        while (m.find()) {
            if (seen.add(m.group())) {
                refs.add(new Reference(m.group(), m.group(1).trim(), withArgs ? m.group(2) : null));
            }
        }
        return refs;
    }

    /** Distinct {@code ${name}} placeholder names in a command template, in order. */
    public static List<String> placeholders(String template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher m = TEXT_REF.matcher(template);
        while (m.find()) {
            names.add(m.group(1).trim());
        }
        return new ArrayList<>(names);
    }

    /** The variable name of an expression such as {@code user.name} or {@code list[0]}. */
    public static String baseName(String expression) {
        int end = expression.length();
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '.' || c == '[') {
                end = i;
                break;
            }
        }
        return expression.substring(0, end).trim();
    }
}
