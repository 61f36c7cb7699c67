package io.meld.core.directive.handler;

import io.meld.core.error.DirectiveErrorCode;
import io.meld.core.model.CommandOutput;
import io.meld.core.model.DirectiveContext;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.DirectiveResult;
import io.meld.core.model.TextNode;
import io.meld.core.resolution.ResolutionContexts;
import io.meld.core.resolution.ResolutionService;
import io.meld.core.spi.FileSystemService;
import io.meld.core.state.StateService;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code @run [command]}: resolves the command, runs it and stores stdout and stderr, under
 * {@code stdout}/{@code stderr} unless the directive names the variables. In transformation mode
 * the directive is replaced by the command's visible output.
 */
public final class RunDirectiveHandler extends AbstractDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(RunDirectiveHandler.class);

    static final String DEFAULT_STDOUT = "stdout";
    static final String DEFAULT_STDERR = "stderr";

    private final ResolutionService resolution;
    private final FileSystemService fileSystem;

    public RunDirectiveHandler(ResolutionService resolution, FileSystemService fileSystem) {
        this.resolution = resolution;
        this.fileSystem = fileSystem;
    }

    @Override
    public String kind() {
        return "run";
    }

    @Override
    public DirectiveResult execute(DirectiveNode node, DirectiveContext context) {
        String raw = requireText(node, "command");
        String command = resolution.resolveInContext(
                raw, ResolutionContexts.forRun(context.state(), context.currentFilePath()));
        String cwd = workingDirectory(context, fileSystem);

        LOG.debug("Running command in {}: {}", cwd, command);
        CommandOutput output;
        try {
            output = fileSystem.executeCommand(command, cwd);
        } catch (IOException e) {
            throw failure("Failed to execute command: " + command, DirectiveErrorCode.EXECUTION_FAILED, node, e);
        }

        StateService state = context.state().clone();
        String stdoutVar = node.has("output") ? node.text("output") : DEFAULT_STDOUT;
        String stderrVar = node.has("errorOutput") ? node.text("errorOutput") : DEFAULT_STDERR;
        state.setTextVar(stdoutVar, output.stdout());
        state.setTextVar(stderrVar, output.stderr());

        if (state.isTransformationEnabled()) {
            return new DirectiveResult.WithReplacement(state, new TextNode(output.combined(), node.location()));
        }
        return new DirectiveResult.StateOnly(state);
    }
}
