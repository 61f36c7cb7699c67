package io.meld.core.error;

/**
 * Thrown when a reference cannot be resolved: undefined variable, disallowed reference kind,
 * circular chain, exceeded expansion budget, bad field access or a path outside the allowed roots.
 */
public final class ResolutionException extends MeldException {

    private static final long serialVersionUID = 1L;

    private final ResolutionErrorCode code;
    private final String value;
    private final String closestMatch;

    public ResolutionException(String message, ResolutionErrorCode code, String value) {
        this(message, code, value, null, null);
    }

    public ResolutionException(String message, ResolutionErrorCode code, String value, Throwable cause) {
        this(message, code, value, null, cause);
    }

    public ResolutionException(
            String message, ResolutionErrorCode code, String value, String closestMatch, Throwable cause) {
        super(message, cause, Phase.RESOLUTION, null);
        this.code = code;
        this.value = value;
        this.closestMatch = closestMatch;
    }

    public ResolutionErrorCode code() {
        return code;
    }

    /** The reference, expression or heading that failed to resolve. */
    public String value() {
        return value;
    }

    /**
     * For {@link ResolutionErrorCode#SECTION_NOT_FOUND}: the heading that came closest to the
     * requested one, or {@code null} if the document has no headings.
     */
    public String closestMatch() {
        return closestMatch;
    }
}
