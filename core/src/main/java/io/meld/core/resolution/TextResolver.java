package io.meld.core.resolution;

import io.meld.core.error.ResolutionErrorCode;
import io.meld.core.error.ResolutionException;
import io.meld.core.model.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Looks up a text variable by name. An undefined {@code ENV_} variable warns and yields "". */
public final class TextResolver {

    private static final Logger LOG = LoggerFactory.getLogger(TextResolver.class);

    public String resolve(String identifier, ResolutionContext context) {
        if (!context.allowed().text()) {
            throw new ResolutionException(
                    "Text variables are not allowed in this context", ResolutionErrorCode.INVALID_CONTEXT, identifier);
        }
        String value = context.state().getTextVar(identifier);
        if (value != null) {
            return value;
        }
        if (identifier.startsWith(VariableReferenceResolver.ENV_PREFIX)) {
            LOG.warn("Environment variable {} is not defined, resolving to empty string", identifier);
            return "";
        }
        throw new ResolutionException(
                "Undefined text variable: " + identifier, ResolutionErrorCode.UNDEFINED_VARIABLE, identifier);
    }
}
