package com.clusterops.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * Agent settings loaded from environment variables.
 * <p>
 * Command files: CLUSTEROPS_AGENT_DATA_DIR, CLUSTEROPS_COMMAND_FILE_PREFIX. Each task's payload is stored as
 * {@code <dataDir>/<prefix><taskId>.json}.
 */
public final class AgentConfig {

    private static final String ENV_DATA_DIR = "CLUSTEROPS_AGENT_DATA_DIR";
    private static final String ENV_COMMAND_FILE_PREFIX = "CLUSTEROPS_COMMAND_FILE_PREFIX";

    private static final String DEFAULT_DATA_DIR = "/var/lib/clusterops-agent/data";
    private static final String DEFAULT_COMMAND_FILE_PREFIX = "command-";
    private static final String COMMAND_FILE_SUFFIX = ".json";

    private final Path dataDir;
    private final String commandFilePrefix;

    private AgentConfig(Builder b) {
        this.dataDir = b.dataDir;
        this.commandFilePrefix = b.commandFilePrefix;
    }

    /** Directory holding the command files written for this agent. Default {@value #DEFAULT_DATA_DIR}. */
    public Path getDataDir() {
        return dataDir;
    }

    /** File name prefix of command files. Default {@value #DEFAULT_COMMAND_FILE_PREFIX}. */
    public String getCommandFilePrefix() {
        return commandFilePrefix;
    }

    /**
     * File name of the command payload for a task, e.g. {@code command-42.json} for task id "42".
     *
     * @throws IllegalArgumentException if the task id is blank, contains a path separator, or is "." or ".."
     */
    public String getCommandFileName(String taskId) {
        return commandFilePrefix + checkTaskId(taskId) + COMMAND_FILE_SUFFIX;
    }

    /** Full path of the command payload for a task: {@code <dataDir>/<prefix><taskId>.json}. */
    public Path getCommandFile(String taskId) {
        return dataDir.resolve(getCommandFileName(taskId));
    }

    public static AgentConfig fromEnvironment() {
        return fromLookup(System::getenv);
    }

    /**
     * Builds the config from an arbitrary variable source (environment, properties, test map).
     * Missing or blank values fall back to defaults.
     */
    public static AgentConfig fromLookup(Function<String, String> env) {
        return builder()
                .dataDir(Path.of(getEnv(env, ENV_DATA_DIR, DEFAULT_DATA_DIR)))
                .commandFilePrefix(getEnv(env, ENV_COMMAND_FILE_PREFIX, DEFAULT_COMMAND_FILE_PREFIX))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String checkTaskId(String taskId) {
        Objects.requireNonNull(taskId, "taskId");
        if (taskId.isBlank() || taskId.contains("/") || taskId.contains("\\")
                || ".".equals(taskId) || "..".equals(taskId)) {
            throw new IllegalArgumentException("Invalid task id: '" + taskId + "'");
        }
        return taskId;
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "AgentConfig{dataDir=" + dataDir
                + ", commandFilePrefix=" + commandFilePrefix + "}";
    }

    public static final class Builder {
        private Path dataDir = Path.of(DEFAULT_DATA_DIR);
        private String commandFilePrefix = DEFAULT_COMMAND_FILE_PREFIX;

        public Builder dataDir(Path dataDir) {
            this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
            return this;
        }

        public Builder commandFilePrefix(String commandFilePrefix) {
            this.commandFilePrefix = commandFilePrefix != null ? commandFilePrefix : "";
            return this;
        }

        public AgentConfig build() {
            return new AgentConfig(this);
        }
    }
}
