package io.meld.core.error;

import java.util.List;

/** Thrown when a file is entered again while it is still being imported or embedded. */
public final class CircularImportException extends MeldException {

    private static final long serialVersionUID = 1L;

    private final List<String> chain;

    public CircularImportException(List<String> chain) {
        super("Circular import detected: " + String.join(" -> ", chain), Phase.DIRECTIVE, null);
        this.chain = List.copyOf(chain);
    }

    /** The in-flight stack followed by the repeated file, e.g. {@code [a, b, a]}. */
    public List<String> chain() {
        return chain;
    }
}
