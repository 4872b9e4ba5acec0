package com.clusterops.command.load;

import com.clusterops.command.consumer.ExecutionCommand;
import com.clusterops.config.AgentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the command.json written for a task into the agent data directory and wraps it in an
 * {@link ExecutionCommand}. File name: {@code <prefix><taskId>.json} (see {@link AgentConfig#getCommandFile(String)}).
 */
public final class CommandFileLoader {

    private static final Logger log = LoggerFactory.getLogger(CommandFileLoader.class);

    private final AgentConfig config;

    public CommandFileLoader(AgentConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Loader over {@link AgentConfig#fromEnvironment()}. */
    public static CommandFileLoader fromEnvironment() {
        return new CommandFileLoader(AgentConfig.fromEnvironment());
    }

    /**
     * One attempt to load the command for a task. Returns empty if the file is missing, unreadable or not valid JSON.
     *
     * @throws IllegalArgumentException if the task id would resolve outside the data directory
     */
    public Optional<ExecutionCommand> tryLoad(String taskId) {
        Path file = config.getCommandFile(Objects.requireNonNull(taskId, "taskId"));
        Optional<ExecutionCommand> command = tryLoadFile(file);
        if (command.isPresent()) {
            log.info("Command loaded for task={} from {}", taskId, file);
        }
        return command;
    }

    /**
     * Loads the command for a task.
     *
     * @return the command (never null)
     * @throws IllegalStateException if the file is missing, unreadable or not valid JSON
     */
    public ExecutionCommand load(String taskId) {
        return tryLoad(taskId).orElseThrow(() -> new IllegalStateException(
                "No valid command file for task=" + taskId + " at " + config.getCommandFile(taskId)));
    }

    /**
     * Loads a command from an explicit file path. Returns empty if the file is missing, unreadable or not valid JSON.
     */
    public Optional<ExecutionCommand> tryLoadFile(Path file) {
        Optional<String> json = readFile(file);
        if (json.isEmpty()) return Optional.empty();
        return parseCommand(json.get(), file);
    }

    private Optional<ExecutionCommand> parseCommand(String json, Path source) {
        try {
            return Optional.of(ExecutionCommand.fromJson(json));
        } catch (RuntimeException e) {
            log.warn("Failed to parse command file {}: {}", source, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> readFile(Path file) {
        if (!Files.isRegularFile(file)) {
            log.warn("Command file not found: {}", file);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            log.warn("Failed to read command file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
