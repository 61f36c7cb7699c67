package io.meld.core.model;

import java.util.Objects;

/**
 * One entry of an import list: {@code *}, {@code name}, {@code name as alias} or {@code name:alias}.
 *
 * @param name  imported name, or {@code *}
 * @param alias name to store under, or {@code null} to keep {@code name}
 */
public record ImportSpecifier(String name, String alias) {

    public static final ImportSpecifier WILDCARD = new ImportSpecifier("*", null);

    public ImportSpecifier {
        Objects.requireNonNull(name, "name must not be null");
    }

    public boolean isWildcard() {
        return "*".equals(name);
    }

    /** The name the import is stored under in the importing state. */
    public String targetName() {
        return alias != null ? alias : name;
    }
}
