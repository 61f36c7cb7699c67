package io.meld.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.meld.core.config.ConfigLoader;
import io.meld.core.config.MeldConfig;
import io.meld.core.directive.DirectiveService;
import io.meld.core.error.InterpreterException;
import io.meld.core.fs.LocalFileSystemService;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.InterpretOptions;
import io.meld.core.model.Node;
import io.meld.core.parser.LineDocumentParser;
import io.meld.core.resolution.PathResolver;
import io.meld.core.resolution.ResolutionService;
import io.meld.core.spi.DirectiveValidator;
import io.meld.core.spi.DocumentParser;
import io.meld.core.spi.FileSystemService;
import io.meld.core.state.StateService;
import io.meld.core.validation.SchemaDirectiveValidator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Top-level entry point: wires parser, validator, filesystem, resolution, dispatcher and
 * interpreter from a {@link MeldConfig}.
 *
 * <p>
 * One engine serves one root run at a time; the circularity guard is shared by every import
 * and embed of that run. Not thread-safe.
 */
public final class MeldEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MeldEngine.class);

    private final MeldConfig config;
    private final DocumentParser parser;
    private final FileSystemService fileSystem;
    private final CircularityGuard guard = new CircularityGuard();
    private final ResolutionService resolution;
    private final DirectiveService directives;
    private final InterpreterService interpreter;
    private final MarkdownRenderer renderer = new MarkdownRenderer();

    /** Engine with the default configuration and environment overrides. */
    public static MeldEngine create() {
        return new MeldEngine(ConfigLoader.defaults());
    }

    public MeldEngine(MeldConfig config) {
        this(
                config,
                new LocalFileSystemService(Path.of(config.projectPath())),
                new LineDocumentParser(),
                System::getenv);
    }

    /**
     * Wires the resolution, directive and interpreter services around the given collaborators.
     *
     * @param config     engine configuration
     * @param fileSystem file and process access
     * @param parser     document parser
     * @param envLookup  environment lookup for {@code ENV_} references
     */
    public MeldEngine(
            MeldConfig config,
            FileSystemService fileSystem,
            DocumentParser parser,
            Function<String, String> envLookup) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.resolution = new ResolutionService(
                config.maxResolutionDepth(),
                config.maxResolutionIterations(),
                config.sectionFuzzyThreshold(),
                envLookup);
        DirectiveValidator validator =
                config.validationEnabled() ? new SchemaDirectiveValidator() : DirectiveValidator.NONE;
        this.directives = new DirectiveService(validator);
        directives.initialize(resolution, fileSystem, parser, guard, new ObjectMapper());
        this.interpreter = new InterpreterService(directives, config.projectPath());
        directives.bindInterpreter(interpreter);
    }

    /**
     * Reads, parses and interprets {@code file} into a fresh root state.
     *
     * @throws InterpreterException if the file cannot be read or any node fails
     */
    public StateService process(Path file) {
        String filePath = file.toAbsolutePath().normalize().toString().replace('\\', '/');
        String content;
        try {
            content = fileSystem.readFile(filePath);
        } catch (IOException e) {
            throw new InterpreterException(
                    "Failed to read " + filePath + ": " + e.getMessage(), e, null, null, filePath);
        }
        return processContent(content, filePath);
    }

    /** Parses and interprets {@code content} as if read from {@code filePath} (may be {@code null}). */
    public StateService processContent(String content, String filePath) {
        LOG.info("Interpreting {}", filePath != null ? filePath : "<inline>");
        guard.reset();
        List<Node> nodes = filePath != null ? parser.parseWithLocations(content, filePath) : parser.parse(content);
        StateService result = interpret(nodes, InterpretOptions.into(newRootState(filePath)));
        LOG.info(
                "Interpreted {}: {} nodes, {} text vars, {} data vars, {} commands",
                filePath != null ? filePath : "<inline>",
                result.getNodes().size(),
                result.getAllTextVars().size(),
                result.getAllDataVars().size(),
                result.getAllCommands().size());
        return result;
    }

    /**
     * A root state for {@code filePath}: {@code HOMEPATH} and {@code PROJECTPATH} predefined and
     * transformation set from the configuration.
     */
    public StateService newRootState(String filePath) {
        StateService root = filePath != null ? StateService.forFile(filePath) : new StateService();
        root.setPathVar(PathResolver.HOME_PATH, config.homePath());
        root.setPathVar(PathResolver.PROJECT_PATH, config.projectPath());
        if (config.transformationEnabled()) {
            root.enableTransformation();
        }
        return root;
    }

    public String render(StateService state) {
        return renderer.render(state);
    }

    public StateService interpret(List<Node> nodes, InterpretOptions options) {
        return interpreter.interpret(nodes, options);
    }

    public StateService processDirective(DirectiveNode node, StateService state, String currentFilePath) {
        return directives.processDirective(node, state, currentFilePath);
    }

    public MeldConfig config() {
        return config;
    }

    public InterpreterService interpreter() {
        return interpreter;
    }

    public DirectiveService directives() {
        return directives;
    }
}
