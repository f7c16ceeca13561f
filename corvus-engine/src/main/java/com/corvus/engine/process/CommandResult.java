package com.corvus.engine.process;

import java.util.List;

/**
 * Outcome of an external command: exit status plus captured output streams.
 */
public record CommandResult(
    List<String> command,
    int exitCode,
    String stdout,
    String stderr
) {
    public CommandResult {
        command = List.copyOf(command);
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
