package com.corvus.core.exception;

import java.util.List;

/**
 * Thrown when an external command cannot be started, times out, or exits unsuccessfully.
 */
public class CommandExecutionException extends OperationException {
    
    public static final String ERROR_CODE = "COMMAND_FAILED";
    
    private final List<String> command;
    private final int exitCode;
    
    public CommandExecutionException(List<String> command, int exitCode, String message) {
        super(ERROR_CODE, message);
        this.command = List.copyOf(command);
        this.exitCode = exitCode;
    }
    
    public CommandExecutionException(List<String> command, String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.command = List.copyOf(command);
        this.exitCode = -1;
    }
    
    public List<String> getCommand() {
        return command;
    }
    
    /**
     * Process exit status, or -1 when the process never produced one.
     */
    public int getExitCode() {
        return exitCode;
    }
}
