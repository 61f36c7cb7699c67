package io.meld.core.directive.handler;

import io.meld.core.engine.CircularityGuard;
import io.meld.core.engine.InterpreterService;
import io.meld.core.error.CircularImportException;
import io.meld.core.error.DirectiveErrorCode;
import io.meld.core.model.DirectiveContext;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.DirectiveResult;
import io.meld.core.model.InterpretOptions;
import io.meld.core.model.Node;
import io.meld.core.model.ResolutionContext;
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
 * {@code @embed [path # Section]}: reads a file, optionally narrows it to one section, interprets
 * it into a fresh child state and merges every definition of that child into the embedding state.
 *
 * <p>
 * In transformation mode the directive is replaced by the embedded text itself, after the
 * optional heading-level prefix ({@code #} repeated {@code headingLevel} times) or under-header
 * wrap ({@code header\n\ncontent}). The replacement is built from the text as read, not from the
 * interpreted nodes.
 */
public final class EmbedDirectiveHandler extends AbstractDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(EmbedDirectiveHandler.class);

    private final ResolutionService resolution;
    private final FileSystemService fileSystem;
    private final DocumentParser parser;
    private final CircularityGuard guard;
    private final Supplier<InterpreterService> interpreter;

    public EmbedDirectiveHandler(
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
        return "embed";
    }

    @Override
    public DirectiveResult execute(DirectiveNode node, DirectiveContext context) {
        ResolutionContext resolutionContext =
                ResolutionContexts.forImport(context.state(), context.currentFilePath());
        String resolved = resolution.resolvePath(requireText(node, "path"), resolutionContext);
        String path = absolutePath(resolved, context, fileSystem);
        if (!fileSystem.exists(path)) {
            throw failure("Embed file not found: " + path, DirectiveErrorCode.FILE_NOT_FOUND, node, null);
        }
        Integer headingLevel = headingLevel(node);

        try {
            guard.beginImport(path);
        } catch (CircularImportException e) {
            throw failure(e.getMessage(), DirectiveErrorCode.CIRCULAR_IMPORT, node, e);
        }
        try {
            String content = read(path, node);
            if (node.has("section")) {
                Double fuzzy = node.has("fuzzy") ? node.field("fuzzy").asDouble() : null;
                content = resolution.extractSection(
                        content, resolution.resolveInContext(node.text("section"), resolutionContext), fuzzy);
            }

            List<Node> nodes = parser.parseWithLocations(content, path);
            StateService child = context.state().createChildState();
            child.setCurrentFilePath(path);
            StateService embedded = interpreter.get().interpret(nodes, new InterpretOptions(child, path, true));

            StateService state = context.state().clone();
            embedded.getAllTextVars().forEach(state::setTextVar);
            embedded.getAllDataVars().forEach(state::setDataVar);
            embedded.getAllPathVars().forEach(state::setPathVar);
            embedded.getAllCommands().forEach(state::setCommand);
            embedded.getImports().forEach(state::addImport);
            LOG.debug("Embedded {}", path);

            if (!state.isTransformationEnabled()) {
                return new DirectiveResult.StateOnly(state);
            }
            if (headingLevel != null) {
                content = "#".repeat(headingLevel) + " " + content;
            } else if (node.has("underHeader")) {
                String header = resolution.resolveInContext(node.text("underHeader"), resolutionContext);
                content = header + "\n\n" + content;
            }
            return new DirectiveResult.WithReplacement(state, new TextNode(content, node.location()));
        } finally {
            guard.endImport(path);
        }
    }

    private Integer headingLevel(DirectiveNode node) {
        if (!node.has("headingLevel")) {
            return null;
        }
        int level = node.field("headingLevel").asInt(-1);
        if (level < 1 || level > 6) {
            throw failure(
                    "Invalid heading level: " + node.text("headingLevel") + ". Must be between 1 and 6",
                    DirectiveErrorCode.VALIDATION_FAILED,
                    node,
                    null);
        }
        return level;
    }

    private String read(String path, DirectiveNode node) {
        try {
            return fileSystem.readFile(path);
        } catch (IOException e) {
            throw failure("Failed to read embed file " + path, DirectiveErrorCode.EXECUTION_FAILED, node, e);
        }
    }
}
