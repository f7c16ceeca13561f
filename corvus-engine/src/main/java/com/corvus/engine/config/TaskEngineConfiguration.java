package com.corvus.engine.config;

import com.corvus.core.repository.TaskRepository;
import com.corvus.engine.archive.ArchiveBuilder;
import com.corvus.engine.channel.ProgressChannel;
import com.corvus.engine.coordinator.TaskManager;
import com.corvus.engine.executor.FileSystemOperations;
import com.corvus.engine.executor.OperationDispatcher;
import com.corvus.engine.executor.PrivilegedOperations;
import com.corvus.engine.metrics.TaskMetrics;
import com.corvus.engine.persistence.InMemoryTaskRepository;
import com.corvus.engine.process.CommandRunner;
import com.corvus.engine.process.ProcessCommandRunner;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the task engine. Every bean backs off if the application defines its own,
 * which is how tests swap in a fake {@link CommandRunner}.
 */
@Configuration
@EnableConfigurationProperties(TaskEngineProperties.class)
public class TaskEngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public TaskRepository taskRepository() {
        return new InMemoryTaskRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProgressChannel progressChannel(TaskEngineProperties properties) {
        return new ProgressChannel(properties.getChannelCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandRunner commandRunner(TaskEngineProperties properties) {
        return new ProcessCommandRunner(properties.getCommandTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public OperationDispatcher operationDispatcher(CommandRunner commandRunner, TaskEngineProperties properties) {
        PrivilegedOperations privileged = new PrivilegedOperations(
            commandRunner,
            properties.getElevationCommand(),
            properties.getChownCommand(),
            properties.getUnmountCommand());
        return new OperationDispatcher(new FileSystemOperations(), privileged, new ArchiveBuilder());
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskMetrics taskMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new TaskMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    /**
     * Unbounded pool: one thread per running task, idle threads reclaimed.
     * Shutdown is owned by {@link TaskManager#close()}.
     */
    @Bean(name = "corvusTaskExecutor", destroyMethod = "")
    public ExecutorService corvusTaskExecutor(TaskEngineProperties properties) {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory(properties.getThreadNamePrefix()));
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskManager taskManager(
            TaskRepository taskRepository,
            ProgressChannel progressChannel,
            OperationDispatcher operationDispatcher,
            ExecutorService corvusTaskExecutor,
            TaskMetrics taskMetrics,
            TaskEngineProperties properties) {
        return new TaskManager(
            taskRepository,
            progressChannel,
            operationDispatcher,
            corvusTaskExecutor,
            taskMetrics,
            properties.getShutdownTimeout());
    }
}
