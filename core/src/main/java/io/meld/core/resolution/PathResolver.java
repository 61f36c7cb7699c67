package io.meld.core.resolution;

import io.meld.core.error.ResolutionErrorCode;
import io.meld.core.error.ResolutionException;
import io.meld.core.model.ResolutionContext;
import io.meld.core.model.ResolutionContext.PathValidation;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Looks up a path variable. {@code ~} is an alias of {@code HOMEPATH} and {@code .} of
 * {@code PROJECTPATH}. When the context carries path validation the value must be absolute (if
 * required) and literally start with the value of one of the allowed root variables.
 */
public final class PathResolver {

    public static final String HOME_PATH = "HOMEPATH";
    public static final String PROJECT_PATH = "PROJECTPATH";

    /** Maps the {@code ~} and {@code .} aliases to their variable names. */
    public static String canonicalName(String identifier) {
        if ("~".equals(identifier)) {
            return HOME_PATH;
        }
        if (".".equals(identifier)) {
            return PROJECT_PATH;
        }
        return identifier;
    }

    public String resolve(String identifier, ResolutionContext context) {
        if (!context.allowed().path()) {
            throw new ResolutionException(
                    "Path variables are not allowed in this context", ResolutionErrorCode.INVALID_CONTEXT, identifier);
        }
        String name = canonicalName(identifier);
        String value = context.state().getPathVar(name);
        if (value == null) {
            throw new ResolutionException(
                    "Undefined path variable: " + name, ResolutionErrorCode.UNDEFINED_VARIABLE, name);
        }
        validate(value, context);
        return value;
    }

    /** Applies the context's path validation, if any, to an already resolved path. */
    public void validate(String path, ResolutionContext context) {
        PathValidation validation = context.pathValidation();
        if (validation == null) {
            return;
        }
        if (validation.requireAbsolute() && !Paths.get(path).isAbsolute()) {
            throw new ResolutionException("Path must be absolute: " + path, ResolutionErrorCode.INVALID_PATH, path);
        }
        if (validation.allowedRoots().isEmpty()) {
            return;
        }
        List<String> roots = new ArrayList<>();
        for (String rootName : validation.allowedRoots()) {
            String root = context.state().getPathVar(canonicalName(rootName));
            if (root != null) {
                if (path.startsWith(root)) {
                    return;
                }
                roots.add(root);
            }
        }
        throw new ResolutionException(
                "Path must start with one of " + roots + ": " + path, ResolutionErrorCode.INVALID_PATH, path);
    }
}
