package io.meld.core.resolution;

import io.meld.core.model.ResolutionContext;
import io.meld.core.model.ResolutionContext.AllowedVariableTypes;
import io.meld.core.model.ResolutionContext.PathValidation;
import io.meld.core.state.StateService;
import java.util.List;

/** Preset resolution contexts, one per directive kind. */
public final class ResolutionContexts {

    private static final AllowedVariableTypes RUN = new AllowedVariableTypes(true, false, true, true);
    private static final AllowedVariableTypes PATH = new AllowedVariableTypes(true, false, true, false);
    private static final AllowedVariableTypes IMPORT = new AllowedVariableTypes(true, true, true, false);
    private static final AllowedVariableTypes COMMAND_PARAMETERS =
            new AllowedVariableTypes(true, true, false, false);

    private ResolutionContexts() {}

    /** Everything allowed. */
    public static ResolutionContext create(StateService state, String filePath) {
        return new ResolutionContext(filePath, AllowedVariableTypes.ALL, null, state);
    }

    public static ResolutionContext forText(StateService state, String filePath) {
        return create(state, filePath);
    }

    public static ResolutionContext forData(StateService state, String filePath) {
        return create(state, filePath);
    }

    /** Text, path and command references; no data. */
    public static ResolutionContext forRun(StateService state, String filePath) {
        return new ResolutionContext(filePath, RUN, null, state);
    }

    /** Text and path references. */
    public static ResolutionContext forPath(StateService state, String filePath) {
        return new ResolutionContext(filePath, PATH, null, state);
    }

    /** Text, data and path references; commands cannot be invoked from an import or embed path. */
    public static ResolutionContext forImport(StateService state, String filePath) {
        return new ResolutionContext(filePath, IMPORT, null, state);
    }

    /** Text and data references only. */
    public static ResolutionContext forCommandParameters(StateService state, String filePath) {
        return new ResolutionContext(filePath, COMMAND_PARAMETERS, null, state);
    }

    /** Path context whose result must be absolute and rooted under one of the named path variables. */
    public static ResolutionContext forRootedPath(StateService state, String filePath, List<String> allowedRoots) {
        return forPath(state, filePath).withPathValidation(new PathValidation(true, allowedRoots));
    }
}
