package io.meld.core.resolution;

import io.meld.core.error.ResolutionErrorCode;
import io.meld.core.error.ResolutionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a markdown section by heading. A case-insensitive exact match wins; otherwise the
 * heading with the highest normalized Levenshtein similarity is taken if it reaches the threshold.
 * The section runs from its heading line up to, not including, the next heading of the same or a
 * higher level, with trailing whitespace removed.
 */
public final class SectionExtractor {

    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+?)\\s*$");

    private record Heading(int line, int level, String title) {}

    public String extract(String content, String heading, double threshold) {
        String wanted = normalize(heading);
        String[] lines = content.split("\n", -1);
        List<Heading> headings = headings(lines);

        Heading found = null;
        for (Heading h : headings) {
            if (normalize(h.title()).equals(wanted)) {
                found = h;
                break;
            }
        }

        Heading closest = null;
        if (found == null) {
            double best = -1;
            for (Heading h : headings) {
                double score = similarity(normalize(h.title()), wanted);
                if (score > best) {
                    best = score;
                    closest = h;
                }
            }
            if (closest != null && best >= threshold) {
                found = closest;
            }
        }
        if (found == null) {
            String hint = closest != null ? closest.title() : null;
            throw new ResolutionException(
                    "Section not found: " + heading + (hint != null ? " (closest match: " + hint + ")" : ""),
                    ResolutionErrorCode.SECTION_NOT_FOUND,
                    heading,
                    hint,
                    null);
        }

        int end = lines.length;
        for (Heading h : headings) {
            if (h.line() > found.line() && h.level() <= found.level()) {
                end = h.line();
                break;
            }
        }
        StringBuilder sb = new StringBuilder();
        for (int i = found.line(); i < end; i++) {
            if (i > found.line()) {
                sb.append('\n');
            }
            sb.append(lines[i]);
        }
        return sb.toString().stripTrailing();
    }

    private static List<Heading> headings(String[] lines) {
        List<Heading> headings = new ArrayList<>();
        boolean inFence = false;
        for (int i = 0; i < lines.length; i++) {
            String line = stripCarriageReturn(lines[i]);
            if (line.startsWith("```")) {
                inFence = !inFence;
                continue;
            }
            if (inFence) {
                continue;
            }
            Matcher m = HEADING.matcher(line);
            if (m.matches()) {
                headings.add(new Heading(i, m.group(1).length(), m.group(2)));
            }
        }
        return headings;
    }

    private static String normalize(String heading) {
        String s = heading.trim();
        while (s.startsWith("#")) {
            s = s.substring(1);
        }
        return s.trim().toLowerCase(Locale.ROOT);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /** {@code 1 - distance / maxLength}; 1.0 for two empty strings. */
    static double similarity(String a, String b) {
        int max = Math.max(a.length(), b.length());
        if (max == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / max;
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }
}
