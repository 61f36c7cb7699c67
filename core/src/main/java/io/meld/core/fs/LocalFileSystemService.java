package io.meld.core.fs;

import io.meld.core.model.CommandOutput;
import io.meld.core.spi.FileSystemService;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FileSystemService} over the local disk. Commands run through {@code sh -c} and are waited
 * for without a timeout; one trailing newline is trimmed from each output stream.
 */
public final class LocalFileSystemService implements FileSystemService {

    private static final Logger LOG = LoggerFactory.getLogger(LocalFileSystemService.class);

    private final Path root;

    /**
     * Creates a service rooted at {@code root}.
     *
     * @param root directory relative paths resolve against
     */
    public LocalFileSystemService(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /** Creates a service rooted at the working directory of the JVM. */
    public LocalFileSystemService() {
        this(Paths.get(System.getProperty("user.dir")));
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(resolve(path));
    }

    @Override
    public String readFile(String path) throws IOException {
        return Files.readString(resolve(path), StandardCharsets.UTF_8);
    }

    @Override
    public CommandOutput executeCommand(String command, String cwd) throws IOException {
        Path dir = cwd != null ? resolve(cwd) : root;
        LOG.debug("Executing '{}' in {}", command, dir);
        Process process = new ProcessBuilder("sh", "-c", command).directory(dir.toFile()).start();
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        boolean finished = false;
        try {
            String stdout = readAll(process.getInputStream());
            int exit = process.waitFor();
            String err = stderr.get();
            if (exit != 0) {
                LOG.debug("Command '{}' exited with {}", command, exit);
            }
            finished = true;
            return new CommandOutput(trimNewline(stdout), trimNewline(err));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while running command: " + command, e);
        } catch (ExecutionException e) {
            throw new IOException("Failed to read stderr of command: " + command, e.getCause());
        } finally {
            if (!finished) {
                process.destroy();
                stderr.cancel(true);
            }
        }
    }

    @Override
    public String getCwd() {
        return root.toString();
    }

    private Path resolve(String path) {
        Path p = Paths.get(path);
        return p.isAbsolute() ? p : root.resolve(p).normalize();
    }

    private static String readAll(InputStream in) throws IOException {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String drain(InputStream in) {
        try {
            return readAll(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String trimNewline(String s) {
        if (s.endsWith("\r\n")) {
            return s.substring(0, s.length() - 2);
        }
        if (s.endsWith("\n")) {
            return s.substring(0, s.length() - 1);
        }
        return s;
    }
}
