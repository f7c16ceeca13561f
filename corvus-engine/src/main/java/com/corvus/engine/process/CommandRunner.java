package com.corvus.engine.process;

import com.corvus.core.exception.CommandExecutionException;

import java.util.List;

/**
 * Runs an external command to completion and captures its result.
 * A non-zero exit status is reported in the result, not thrown.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * Run {@code command} (program followed by its arguments).
     *
     * @throws CommandExecutionException if the process cannot be started, times out,
     *                                   or the calling thread is interrupted while waiting
     */
    CommandResult run(List<String> command) throws CommandExecutionException;
}
