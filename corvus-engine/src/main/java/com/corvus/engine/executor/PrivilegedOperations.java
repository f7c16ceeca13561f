package com.corvus.engine.executor;

import com.corvus.core.exception.CommandExecutionException;
import com.corvus.core.model.TaskKind;
import com.corvus.engine.process.CommandResult;
import com.corvus.engine.process.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Operations delegated to external utilities because they may need elevated privilege
 * or have no portable Java API: ownership changes and unmounting.
 *
 * <p>Failure capture is the same for both: a non-zero exit status fails the task with the
 * command's stderr text, or with the exit code when stderr is empty.
 */
public class PrivilegedOperations {

    private static final Logger log = LoggerFactory.getLogger(PrivilegedOperations.class);

    private final CommandRunner commandRunner;
    private final List<String> elevationCommand;
    private final String chownCommand;
    private final String unmountCommand;

    /**
     * @param elevationCommand prefix that runs the next command with privilege, e.g. {@code [sudo]};
     *                         empty to run chown directly
     */
    public PrivilegedOperations(CommandRunner commandRunner, List<String> elevationCommand,
                                String chownCommand, String unmountCommand) {
        this.commandRunner = Objects.requireNonNull(commandRunner, "commandRunner");
        this.elevationCommand = List.copyOf(elevationCommand);
        this.chownCommand = Objects.requireNonNull(chownCommand, "chownCommand");
        this.unmountCommand = Objects.requireNonNull(unmountCommand, "unmountCommand");
    }

    public void chown(TaskKind.Chown kind) throws CommandExecutionException {
        List<String> command = new ArrayList<>(elevationCommand);
        command.add(chownCommand);
        command.add(kind.owner());
        command.add(kind.path().toString());
        runChecked(command);
    }

    public void unmount(TaskKind.Unmount kind) throws CommandExecutionException {
        runChecked(List.of(unmountCommand, kind.path().toString()));
    }

    private void runChecked(List<String> command) throws CommandExecutionException {
        CommandResult result = commandRunner.run(command);
        if (!result.isSuccess()) {
            String stderr = result.stderr().trim();
            String reason = stderr.isEmpty()
                ? String.format("%s exited with code %d", command.get(0), result.exitCode())
                : stderr;
            throw new CommandExecutionException(command, result.exitCode(), reason);
        }
        log.debug("{} succeeded", String.join(" ", command));
    }
}
