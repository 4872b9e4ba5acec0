package com.clusterops.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AgentConfigTest {

    @Test
    void fromLookup_usesDefaultsWhenNothingSet() {
        AgentConfig config = AgentConfig.fromLookup(key -> null);

        assertEquals(Path.of("/var/lib/clusterops-agent/data"), config.getDataDir());
        assertEquals("command-", config.getCommandFilePrefix());
    }

    @Test
    void fromLookup_readsAndTrimsValues() {
        Map<String, String> env = Map.of(
                "CLUSTEROPS_AGENT_DATA_DIR", " /tmp/agent/data ",
                "CLUSTEROPS_COMMAND_FILE_PREFIX", "   ");
        AgentConfig config = AgentConfig.fromLookup(env::get);

        assertEquals(Path.of("/tmp/agent/data"), config.getDataDir());
        assertEquals("command-", config.getCommandFilePrefix());
    }

    @Test
    void getCommandFile_resolvesUnderDataDir() {
        AgentConfig config = AgentConfig.builder()
                .dataDir(Path.of("/data"))
                .commandFilePrefix("command-")
                .build();

        assertEquals("command-42.json", config.getCommandFileName("42"));
        assertEquals(Path.of("/data/command-42.json"), config.getCommandFile("42"));
    }

    @Test
    void getCommandFileName_rejectsNullTaskId() {
        AgentConfig config = AgentConfig.builder().build();
        assertThrows(NullPointerException.class, () -> config.getCommandFileName(null));
    }

    @Test
    void getCommandFileName_rejectsIdsEscapingDataDir() {
        AgentConfig config = AgentConfig.builder().dataDir(Path.of("/data")).build();

        assertThrows(IllegalArgumentException.class, () -> config.getCommandFile("../x"));
        assertThrows(IllegalArgumentException.class, () -> config.getCommandFile("a/b"));
        assertThrows(IllegalArgumentException.class, () -> config.getCommandFile("..\\x"));
        assertThrows(IllegalArgumentException.class, () -> config.getCommandFile(".."));
        assertThrows(IllegalArgumentException.class, () -> config.getCommandFile(" "));
    }

    @Test
    void fromEnvironment_matchesProcessEnvironment() {
        AgentConfig fromEnv = AgentConfig.fromEnvironment();
        AgentConfig expected = AgentConfig.fromLookup(System::getenv);

        assertEquals(expected.getDataDir(), fromEnv.getDataDir());
        assertEquals(expected.getCommandFilePrefix(), fromEnv.getCommandFilePrefix());
    }
}
