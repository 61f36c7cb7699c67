package io.meld.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named, parameterized command created by {@code @define}.
 *
 * @param command     template, usually {@code @run [...]} with {@code ${param}} placeholders
 * @param parameters  ordered, unique parameter names
 * @param risk        optional risk annotation
 * @param description optional description
 */
public record CommandDefinition(String command, List<String> parameters, RiskLevel risk, String description) {

    public CommandDefinition {
        Objects.requireNonNull(command, "command must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static CommandDefinition of(String command, List<String> parameters) {
        return new CommandDefinition(command, parameters, null, null);
    }
}
