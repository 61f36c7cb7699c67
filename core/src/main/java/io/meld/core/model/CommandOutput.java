package io.meld.core.model;

/** Captured output of a shell command. Neither field is null. */
public record CommandOutput(String stdout, String stderr) {

    public CommandOutput {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    /** Visible output: stdout, stderr, or both separated by a newline when both are non-empty. */
    public String combined() {
        if (!stdout.isEmpty() && !stderr.isEmpty()) {
            return stdout + "\n" + stderr;
        }
        return stdout.isEmpty() ? stderr : stdout;
    }
}
