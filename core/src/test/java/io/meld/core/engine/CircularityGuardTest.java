package io.meld.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.meld.core.error.CircularImportException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CircularityGuard")
class CircularityGuardTest {

    private final CircularityGuard guard = new CircularityGuard();

    @Test
    @DisplayName("re-entering a file on the stack reports the full chain")
    void detectsCycle() {
        guard.beginImport("/a.meld");
        guard.beginImport("/b.meld");

        assertThatThrownBy(() -> guard.beginImport("/a.meld"))
                .isInstanceOf(CircularImportException.class)
                .hasMessage("Circular import detected: /a.meld -> /b.meld -> /a.meld")
                .satisfies(e -> assertThat(((CircularImportException) e).chain())
                        .containsExactly("/a.meld", "/b.meld", "/a.meld"));
        assertThat(guard.getImportStack()).containsExactly("/a.meld", "/b.meld");
    }

    @Test
    @DisplayName("sibling imports of the same file are not cycles")
    void siblingsAllowed() {
        guard.beginImport("/a.meld");
        guard.beginImport("/shared.meld");
        guard.endImport("/shared.meld");
        guard.beginImport("/shared.meld");

        assertThat(guard.isInStack("/shared.meld")).isTrue();
    }

    @Test
    @DisplayName("endImport removes the last occurrence and ignores unknown ids")
    void endImport() {
        guard.beginImport("/a.meld");
        guard.endImport("/unknown.meld");
        assertThat(guard.getImportStack()).containsExactly("/a.meld");

        guard.endImport("/a.meld");
        assertThat(guard.getImportStack()).isEmpty();
    }

    @Test
    @DisplayName("reset clears the stack")
    void reset() {
        guard.beginImport("/a.meld");
        guard.reset();

        assertThat(guard.isInStack("/a.meld")).isFalse();
    }
}
