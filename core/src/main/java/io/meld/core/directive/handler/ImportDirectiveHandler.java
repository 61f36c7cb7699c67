package io.meld.core.directive.handler;

import io.meld.core.engine.CircularityGuard;
import io.meld.core.engine.InterpreterService;
import io.meld.core.error.CircularImportException;
import io.meld.core.error.DirectiveErrorCode;
import io.meld.core.error.DocumentParseException;
import io.meld.core.model.DirectiveContext;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.DirectiveResult;
import io.meld.core.model.ImportSpecifier;
import io.meld.core.model.InterpretOptions;
import io.meld.core.model.Node;
import io.meld.core.model.TextNode;
import io.meld.core.resolution.ResolutionContexts;
import io.meld.core.resolution.ResolutionService;
import io.meld.core.spi.DocumentParser;
import io.meld.core.spi.FileSystemService;
import io.meld.core.state.StateService;
import java.io.IOException;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code @import [list] from [path]}: interprets another file into a fresh child state and copies
 * the listed definitions (all of them for {@code *} or no list) into the importing state. Import
 * has no visible output; in transformation mode it is replaced by an empty text node.
 */
public final class ImportDirectiveHandler extends AbstractDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ImportDirectiveHandler.class);

    private final ResolutionService resolution;
    private final FileSystemService fileSystem;
    private final DocumentParser parser;
    private final CircularityGuard guard;
    private final Supplier<InterpreterService> interpreter;

    public ImportDirectiveHandler(
            ResolutionService resolution,
            FileSystemService fileSystem,
            DocumentParser parser,
            CircularityGuard guard,
            Supplier<InterpreterService> interpreter) {
        this.resolution = resolution;
        this.fileSystem = fileSystem;
        this.parser = parser;
        this.guard = guard;
        this.interpreter = interpreter;
    }

    @Override
    public String kind() {
        return "import";
    }

    @Override
    public DirectiveResult execute(DirectiveNode node, DirectiveContext context) {
        String raw = requireText(node, "path");
        String resolved = resolution.resolvePath(
                raw, ResolutionContexts.forImport(context.state(), context.currentFilePath()));
        String path = absolutePath(resolved, context, fileSystem);
        if (!fileSystem.exists(path)) {
            throw failure("Import file not found: " + path, DirectiveErrorCode.FILE_NOT_FOUND, node, null);
        }
        List<ImportSpecifier> imports = importList(node);

        try {
            guard.beginImport(path);
        } catch (CircularImportException e) {
            throw failure(e.getMessage(), DirectiveErrorCode.CIRCULAR_IMPORT, node, e);
        }
        try {
            String content = read(path, node);
            List<Node> nodes = parser.parseWithLocations(content, path);
            StateService child = context.state().createChildState();
            child.setCurrentFilePath(path);
            StateService imported = interpreter.get().interpret(nodes, new InterpretOptions(child, path, true));

            StateService state = context.state().clone();
            copyDefinitions(imported, state, imports, node);
            state.addImport(path);
            LOG.debug("Imported {} from {}", imports, path);

            if (state.isTransformationEnabled()) {
                return new DirectiveResult.WithReplacement(state, new TextNode("", node.location()));
            }
            return new DirectiveResult.StateOnly(state);
        } finally {
            guard.endImport(path);
        }
    }

    private List<ImportSpecifier> importList(DirectiveNode node) {
        String list = node.text("imports");
        if (list == null || list.isBlank()) {
            return List.of(ImportSpecifier.WILDCARD);
        }
        try {
            return parser.parseImportList(list);
        } catch (DocumentParseException e) {
            throw failure("Invalid import list syntax: " + list, DirectiveErrorCode.VALIDATION_FAILED, node, e);
        }
    }

    private String read(String path, DirectiveNode node) {
        try {
            return fileSystem.readFile(path);
        } catch (IOException e) {
            throw failure("Failed to read import file " + path, DirectiveErrorCode.EXECUTION_FAILED, node, e);
        }
    }

    private void copyDefinitions(
            StateService source, StateService target, List<ImportSpecifier> imports, DirectiveNode node) {
        for (ImportSpecifier spec : imports) {
            if (spec.isWildcard()) {
                source.getAllTextVars().forEach(target::setTextVar);
                source.getAllDataVars().forEach(target::setDataVar);
                source.getAllPathVars().forEach(target::setPathVar);
                source.getAllCommands().forEach(target::setCommand);
                continue;
            }
            String name = spec.name();
            String as = spec.targetName();
            boolean found = false;
            if (source.getTextVar(name) != null) {
                target.setTextVar(as, source.getTextVar(name));
                found = true;
            }
            if (source.getDataVar(name) != null) {
                target.setDataVar(as, source.getDataVar(name));
                found = true;
            }
            if (source.getPathVar(name) != null) {
                target.setPathVar(as, source.getPathVar(name));
                found = true;
            }
            if (source.getCommand(name) != null) {
                target.setCommand(as, source.getCommand(name));
                found = true;
            }
            if (!found) {
                throw failure(
                        "Variable not found in imported file: " + name,
                        DirectiveErrorCode.VARIABLE_NOT_FOUND,
                        node,
                        null);
            }
        }
    }
}
