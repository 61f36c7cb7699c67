package io.meld.core.spi;

import io.meld.core.model.CommandOutput;
import java.io.IOException;

/**
 * File and process access. Paths are already resolved strings; relative ones are relative to
 * {@link #getCwd()}.
 */
public interface FileSystemService {

    boolean exists(String path);

    /** Reads a file as UTF-8. */
    String readFile(String path) throws IOException;

    /**
     * Runs a shell command and waits for it to finish.
     *
     * @param command shell command line
     * @param cwd     working directory, or {@code null} for {@link #getCwd()}
     */
    CommandOutput executeCommand(String command, String cwd) throws IOException;

    String getCwd();
}
