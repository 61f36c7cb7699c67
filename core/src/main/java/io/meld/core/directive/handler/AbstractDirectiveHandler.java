package io.meld.core.directive.handler;

import io.meld.core.directive.DirectiveHandler;
import io.meld.core.error.DirectiveErrorCode;
import io.meld.core.error.DirectiveException;
import io.meld.core.model.DirectiveContext;
import io.meld.core.model.DirectiveNode;
import io.meld.core.spi.FileSystemService;
import java.nio.file.Path;
import java.nio.file.Paths;

/** Payload access and failure helpers shared by the built-in handlers. */
abstract class AbstractDirectiveHandler implements DirectiveHandler {

    /** Required string field of the payload. */
    protected String requireText(DirectiveNode node, String field) {
        String value = node.text(field);
        if (value == null) {
            throw failure(
                    kind() + " directive requires '" + field + "'", DirectiveErrorCode.VALIDATION_FAILED, node, null);
        }
        return value;
    }

    protected DirectiveException failure(
            String message, DirectiveErrorCode code, DirectiveNode node, Throwable cause) {
        return new DirectiveException(message, kind(), code, node, cause);
    }

    /**
     * Makes a resolved path absolute: relative paths resolve against the directory of the current
     * file, or the working directory when there is no current file. Separators become {@code /}.
     */
    protected static String absolutePath(String resolved, DirectiveContext context, FileSystemService fs) {
        Path path = Paths.get(resolved);
        if (!path.isAbsolute()) {
            Path base = null;
            if (context.currentFilePath() != null) {
                base = Paths.get(context.currentFilePath()).toAbsolutePath().getParent();
            }
            if (base == null) {
                base = Paths.get(context.workingDirectory() != null ? context.workingDirectory() : fs.getCwd());
            }
            path = base.resolve(path);
        }
        return path.normalize().toString().replace('\\', '/');
    }

    /** Directory commands run in: the context's working directory, else the process cwd. */
    protected static String workingDirectory(DirectiveContext context, FileSystemService fs) {
        return context.workingDirectory() != null ? context.workingDirectory() : fs.getCwd();
    }
}
