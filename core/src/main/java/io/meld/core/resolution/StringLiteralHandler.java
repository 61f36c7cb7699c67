package io.meld.core.resolution;

import io.meld.core.error.ResolutionErrorCode;
import io.meld.core.error.ResolutionException;

/**
 * Quoted string literals: {@code 'single'}, {@code "double"} and {@code `backtick`}. Only
 * backtick literals may span lines. Inside a literal, the quote character is escaped with a
 * backslash; the other quote characters must be escaped too.
 */
public final class StringLiteralHandler {

    private static final String QUOTES = "'\"`";

    /** Whether {@code value} is wrapped in matching quotes with no unescaped quote inside. */
    public boolean isStringLiteral(String value) {
        if (value == null || value.length() < 2) {
            return false;
        }
        char first = value.charAt(0);
        if (QUOTES.indexOf(first) < 0 || value.charAt(value.length() - 1) != first) {
            return false;
        }
        boolean escaped = false;
        for (int i = 1; i < value.length() - 1; i++) {
            char c = value.charAt(i);
            if (c == '\\') {
                escaped = !escaped;
            } else if (c == first && !escaped) {
                return false;
            } else {
                escaped = false;
            }
        }
        return true;
    }

    /** @throws ResolutionException with {@link ResolutionErrorCode#SYNTAX_ERROR} if the literal is malformed */
    public void validateLiteral(String value) {
        if (value == null || value.length() < 2) {
            throw syntax("String literal is empty or too short", value);
        }
        char first = value.charAt(0);
        if (QUOTES.indexOf(first) < 0) {
            throw syntax("String literal must start with a quote (', \", or `)", value);
        }
        if (value.charAt(value.length() - 1) != first) {
            throw syntax("String literal has mismatched quotes", value);
        }
        String content = value.substring(1, value.length() - 1);
        for (char quote : QUOTES.toCharArray()) {
            if (quote != first && hasUnescaped(content, quote)) {
                throw syntax("String literal contains unescaped mixed quotes", value);
            }
        }
        if (content.isEmpty()) {
            throw syntax("String literal content is empty", value);
        }
        if (first != '`' && content.contains("\n")) {
            throw syntax("Single and double quoted strings cannot contain newlines", value);
        }
    }

    /** Validates and unquotes a literal, unescaping its own quote character. */
    public String parseLiteral(String value) {
        validateLiteral(value);
        char quote = value.charAt(0);
        return value.substring(1, value.length() - 1).replace("\\" + quote, String.valueOf(quote));
    }

    private static boolean hasUnescaped(String content, char quote) {
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == quote && !isEscaped(content, i)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isEscaped(String s, int pos) {
        int backslashes = 0;
        for (int i = pos - 1; i >= 0 && s.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private static ResolutionException syntax(String message, String value) {
        return new ResolutionException(message, ResolutionErrorCode.SYNTAX_ERROR, value);
    }
}
