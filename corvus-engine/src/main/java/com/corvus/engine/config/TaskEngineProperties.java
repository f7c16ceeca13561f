package com.corvus.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for the background task engine, bound from {@code corvus.tasks.*}.
 */
@ConfigurationProperties(prefix = "corvus.tasks")
public class TaskEngineProperties {

    /** Events the progress channel holds before senders block. */
    private int channelCapacity = 100;

    private String threadNamePrefix = "corvus-task-";

    /** How long close() waits for running executors before interrupting them. */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /** Prefix used to run chown with privilege. Empty runs chown directly. */
    private List<String> elevationCommand = new ArrayList<>(List.of("sudo"));

    private String chownCommand = "chown";
    private String unmountCommand = "umount";

    /** Upper bound for an external command; zero waits indefinitely. */
    private Duration commandTimeout = Duration.ofMinutes(5);

    public int getChannelCapacity() { return channelCapacity; }
    public void setChannelCapacity(int channelCapacity) { this.channelCapacity = channelCapacity; }
    public String getThreadNamePrefix() { return threadNamePrefix; }
    public void setThreadNamePrefix(String threadNamePrefix) { this.threadNamePrefix = threadNamePrefix; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }
    public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
    public List<String> getElevationCommand() { return elevationCommand; }
    public void setElevationCommand(List<String> elevationCommand) { this.elevationCommand = elevationCommand; }
    public String getChownCommand() { return chownCommand; }
    public void setChownCommand(String chownCommand) { this.chownCommand = chownCommand; }
    public String getUnmountCommand() { return unmountCommand; }
    public void setUnmountCommand(String unmountCommand) { this.unmountCommand = unmountCommand; }
    public Duration getCommandTimeout() { return commandTimeout; }
    public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }
}
