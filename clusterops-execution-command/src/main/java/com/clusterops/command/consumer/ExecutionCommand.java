package com.clusterops.command.consumer;

import com.clusterops.command.lookup.FieldPath;
import com.clusterops.command.lookup.LookupResult;
import com.clusterops.command.lookup.PathLookup;
import com.clusterops.command.lookup.ValueCoercion;
import com.clusterops.command.lookup.ValueCoercionException;
import com.clusterops.command.model.CommandDocument;
import com.clusterops.command.moduleconfig.ModuleConfigs;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, read-only view of one command.json: one getter per field the agent needs, each reading a fixed path.
 * <p>
 * Callers must read configuration through {@link #getModuleConfigs()} rather than the raw document.
 * Instances are immutable; every getter returns the same result no matter how often or in which order it is called.
 */
public final class ExecutionCommand implements CommandValues {

    private static final String AMBARI = "ambariLevelParams/";
    private static final String STACK = "stackSettings/";
    private static final String AGENT = "agentLevelParams/";
    private static final String HOST = "hostLevelParams/";
    private static final String COMPONENT = "componentLevelParams/";
    private static final String COMMAND = "commandParams/";
    private static final String ROLE = "roleParams/";
    private static final String CLUSTER_HOST_INFO = "clusterHostInfo/";

    /** The only component whose host list key has no {@code _hosts} suffix. */
    private static final String OOZIE_SERVER = "oozie_server";
    private static final String DEFAULT_INSTANCE_NAME = "default";
    private static final int DEFAULT_AGENT_STACK_RETRY_COUNT = 5;

    private final CommandDocument document;
    private final ModuleConfigs moduleConfigs;

    public ExecutionCommand(CommandDocument document) {
        this.document = Objects.requireNonNull(document, "document");
        this.moduleConfigs = new ModuleConfigs(
                getValue("configurations").orElse(null),
                getValue("configurationAttributes").orElse(null));
    }

    /**
     * Parses a command.json payload. Throws {@link java.io.UncheckedIOException} on malformed JSON.
     */
    public static ExecutionCommand fromJson(String json) {
        return new ExecutionCommand(CommandDocument.fromJson(json));
    }

    public CommandDocument getDocument() {
        return document;
    }

    // Generic access

    @Override
    public Optional<JsonNode> getValue(String path) {
        return raw(path).asOptional();
    }

    @Override
    public JsonNode getValue(String path, JsonNode defaultValue) {
        return PathLookup.lookup(document.getRoot(), path, defaultValue);
    }

    @Override
    public Optional<String> getStringValue(String path) {
        return ValueCoercion.toText(raw(path)).asOptional();
    }

    @Override
    public String getStringValue(String path, String defaultValue) {
        return ValueCoercion.toText(raw(path)).orElse(defaultValue);
    }

    @Override
    public Optional<Integer> getIntValue(String path) {
        return ValueCoercion.toInteger(raw(path)).optionalOrThrow();
    }

    @Override
    public int getIntValue(String path, int defaultValue) {
        return ValueCoercion.toInteger(raw(path)).orElse(defaultValue);
    }

    @Override
    public Optional<Boolean> getBooleanValue(String path) {
        return ValueCoercion.toBoolean(raw(path)).asOptional();
    }

    @Override
    public boolean getBooleanValue(String path, boolean defaultValue) {
        return ValueCoercion.toBoolean(raw(path)).orElse(defaultValue);
    }

    @Override
    public List<String> getStringList(String path) {
        return ValueCoercion.toStringList(raw(path)).orElse(List.of());
    }

    private LookupResult<JsonNode> raw(String path) {
        return PathLookup.find(document.getRoot(), FieldPath.of(path));
    }

    // Global

    public ModuleConfigs getModuleConfigs() {
        return moduleConfigs;
    }

    /** Service name, e.g. "zookeeper", "hdfs". */
    public Optional<String> getModuleName() {
        return getStringValue("serviceName");
    }

    /** Host role, e.g. "ZOOKEEPER_SERVER". */
    public Optional<String> getComponentType() {
        return getStringValue("role");
    }

    /**
     * Always "default": component instances are not yet addressed individually, so the document is not consulted.
     */
    public String getComponentInstanceName() {
        return DEFAULT_INSTANCE_NAME;
    }

    /** Service group name; a service group maps 1:1 to an mpack. */
    public Optional<String> getServicegroupName() {
        return getStringValue("serviceGroupName");
    }

    public Optional<String> getClusterName() {
        return getStringValue("clusterName");
    }

    /** Repository descriptor of the mpack (an object with repo ids, URLs, etc.). */
    public Optional<JsonNode> getRepositoryFile() {
        return getValue("repositoryFile");
    }

    /** Components installed on this host, e.g. ["ZOOKEEPER_CLIENT"]. */
    public List<String> getLocalComponents() {
        return getStringList("localComponents");
    }

    // Ambari level

    /** Base URL the JDK is downloaded from, e.g. "http://server:8080/resources/". */
    public Optional<String> getJdkLocation() {
        return getStringValue(AMBARI + "jdk_location");
    }

    public Optional<String> getJdkName() {
        return getStringValue(AMBARI + "jdk_name");
    }

    public Optional<String> getJavaHome() {
        return getStringValue(AMBARI + "java_home");
    }

    /**
     * Java major version; {@code "8"} reads as 8.
     *
     * @throws ValueCoercionException if the value is present but not an integer
     */
    public Optional<Integer> getJavaVersion() {
        return getIntValue(AMBARI + "java_version");
    }

    public Optional<String> getJceName() {
        return getStringValue(AMBARI + "jce_name");
    }

    /** e.g. "mysql-connector-java.jar" */
    public Optional<String> getDbDriverFileName() {
        return getStringValue(AMBARI + "db_driver_filename");
    }

    public Optional<String> getDbName() {
        return getStringValue(AMBARI + "db_name");
    }

    public Optional<String> getOracleJdbcUrl() {
        return getStringValue(AMBARI + "oracle_jdbc_url");
    }

    public Optional<String> getMysqlJdbcUrl() {
        return getStringValue(AMBARI + "mysql_jdbc_url");
    }

    /** Retries for stack deployment on the agent. Default 5, also when the value is not an integer. */
    public int getAgentStackRetryCount() {
        return getIntValue(AMBARI + "agent_stack_retry_count", DEFAULT_AGENT_STACK_RETRY_COUNT);
    }

    /** Whether stack deployment should be retried while the repository is unavailable; empty if not sent. */
    public Optional<Boolean> checkAgentStackWantRetryOnUnavailability() {
        return getBooleanValue(AMBARI + "agent_stack_retry_on_unavailability");
    }

    public Optional<String> getAmbariServerHost() {
        return getStringValue(AMBARI + "ambari_server_host");
    }

    public Optional<String> getAmbariServerPort() {
        return getStringValue(AMBARI + "ambari_server_port");
    }

    public boolean isAmbariServerUseSsl() {
        return getBooleanValue(AMBARI + "ambari_server_use_ssl", false);
    }

    /** Global flag for the sysprep feature (hosts prepared out of band). */
    public boolean isHostSystemPrepared() {
        return getBooleanValue(AMBARI + "host_sys_prepped", false);
    }

    public boolean isGplLicenseAccepted() {
        return getBooleanValue(AMBARI + "gpl_license_accepted", false);
    }

    // Stack settings

    public Optional<String> getMpackName() {
        return getStringValue(STACK + "stack_name");
    }

    public Optional<String> getMpackVersion() {
        return getStringValue(STACK + "stack_version");
    }

    /** User → groups; usually sent as a JSON-encoded string, returned as received. */
    public Optional<JsonNode> getUserGroups() {
        return getValue(STACK + "user_groups");
    }

    public Optional<JsonNode> getGroupList() {
        return getValue(STACK + "group_list");
    }

    public Optional<JsonNode> getUserList() {
        return getValue(STACK + "user_list");
    }

    // Agent

    /** Name of the host the agent runs on. */
    public Optional<String> getHostName() {
        return getStringValue(AGENT + "hostname");
    }

    /** Non-zero when config commands may run in parallel on the agent. Default 0. */
    public int checkAgentConfigExecuteInParallel() {
        return getIntValue("agentConfigParams/agent/parallel_execution", 0);
    }

    /** Root directory for the agent's cache, e.g. "/var/lib/ambari-agent/cache". */
    public Optional<String> getAgentCacheDir() {
        return getStringValue(AGENT + "agentCacheDir");
    }

    // Host

    public Optional<JsonNode> getRepoInfo() {
        return getValue(HOST + "repoInfo");
    }

    public Optional<JsonNode> getServiceRepoInfo() {
        return getValue(HOST + "service_repo_info");
    }

    // Component

    public boolean checkUnlimitedKeyJceRequired() {
        return getBooleanValue(COMPONENT + "unlimited_key_jce_required", false);
    }

    // Command

    /** Target mpack version sent on RESTART during a rolling upgrade. */
    public Optional<String> getNewMpackVersionForUpgrade() {
        return getStringValue(COMMAND + "version");
    }

    public boolean checkCommandRetryEnabled() {
        return getBooleanValue(COMMAND + "command_retry_enabled", false);
    }

    /** "upgrade" or "downgrade" while an upgrade is in progress. */
    public Optional<String> checkUpgradeDirection() {
        return getStringValue(COMMAND + "upgrade_direction");
    }

    /** Upgrade type, or "" outside an upgrade. */
    public String getUpgradeType() {
        return getStringValue(COMMAND + "upgrade_type", "");
    }

    public boolean isRollingRestartInUpgrade() {
        return getBooleanValue(COMMAND + "rolling_restart", false);
    }

    public boolean isUpdateFilesOnly() {
        return getBooleanValue(COMMAND + "update_files_only", false);
    }

    public Optional<String> getDeployPhase() {
        return getStringValue(COMMAND + "phase");
    }

    public Optional<String> getDfsType() {
        return getStringValue(COMMAND + "dfs_type");
    }

    public Optional<String> getModulePackageFolder() {
        return getStringValue(COMMAND + "service_package_folder");
    }

    public Optional<String> getAmbariJavaHome() {
        return getStringValue(COMMAND + "ambari_java_home");
    }

    public Optional<String> getAmbariJavaName() {
        return getStringValue(COMMAND + "ambari_java_name");
    }

    public Optional<String> getAmbariJceName() {
        return getStringValue(COMMAND + "ambari_jce_name");
    }

    public Optional<String> getAmbariJdkName() {
        return getStringValue(COMMAND + "ambari_jdk_name");
    }

    public boolean needRefreshTopology() {
        return getBooleanValue(COMMAND + "refresh_topology", false);
    }

    /** Same field as {@link #isUpdateFilesOnly()}. */
    public boolean checkOnlyUpdateFiles() {
        return getBooleanValue(COMMAND + "update_files_only", false);
    }

    /**
     * Role ("active" or "standby") this NameNode should take. Only sent during a non-rolling upgrade with HA,
     * where the server decides which of the two NameNodes becomes active.
     */
    public Optional<String> getDesiredNamenodeRole() {
        return getStringValue(COMMAND + "desired_namenode_role");
    }

    /**
     * Host of the NameNode of the given type: {@code getNode("active")} reads {@code commandParams/activenode}.
     */
    public Optional<String> getNode(String type) {
        return getStringValue(COMMAND + Objects.requireNonNull(type, "type") + "node");
    }

    // Role

    public boolean isUpgradeSuspended() {
        return getBooleanValue(ROLE + "upgrade_suspended", false);
    }

    // Cluster host info

    /**
     * Hosts running a component, read from {@code clusterHostInfo/<component>_hosts}. {@code oozie_server}
     * is sent under its bare name instead.
     */
    public List<String> getComponentHosts(String componentName) {
        String key = CLUSTER_HOST_INFO + Objects.requireNonNull(componentName, "componentName") + "_hosts";
        if (OOZIE_SERVER.equals(componentName)) {
            key = CLUSTER_HOST_INFO + componentName;
        }
        return getStringList(key);
    }

    /** Reads {@code clusterHostInfo/<component>_host}; empty list if absent. */
    public List<String> getComponentHost(String componentName) {
        return getStringList(CLUSTER_HOST_INFO + Objects.requireNonNull(componentName, "componentName") + "_host");
    }

    public List<String> getAllHosts() {
        return getStringList(CLUSTER_HOST_INFO + "all_hosts");
    }

    public List<String> getAllRacks() {
        return getStringList(CLUSTER_HOST_INFO + "all_racks");
    }

    public List<String> getAllIpv4Ips() {
        return getStringList(CLUSTER_HOST_INFO + "all_ipv4_ips");
    }
}
