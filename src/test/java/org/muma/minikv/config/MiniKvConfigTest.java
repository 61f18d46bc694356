package org.muma.minikv.config;

import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MiniKvConfigTest {

    @Test
    void testDefaults() {
        MiniKvConfig config = new MiniKvConfig();
        assertEquals(6379, config.getPort());
        assertFalse(config.isReplica());
        assertEquals(Optional.empty(), config.getSnapshotFile());
        assertNull(config.get("dir"));
    }

    @Test
    void testParseArgs() {
        MiniKvConfig config = new MiniKvConfig();
        config.parseArgs(new String[]{"--port", "6380", "--dir", "/tmp/redis-files", "--dbfilename", "dump.rdb"});

        assertEquals(6380, config.getPort());
        assertEquals("/tmp/redis-files", config.get("dir"));
        assertEquals("dump.rdb", config.get("DBFILENAME"));
        assertEquals(Optional.of(new File("/tmp/redis-files", "dump.rdb")), config.getSnapshotFile());
        assertNull(config.get("port"));
    }

    @Test
    void testReplicaOfQuotedForm() {
        MiniKvConfig config = new MiniKvConfig();
        config.parseArgs(new String[]{"--replicaof", "localhost 6379", "--port", "6380"});

        assertTrue(config.isReplica());
        assertEquals("localhost", config.getReplicaOfHost());
        assertEquals(6379, config.getReplicaOfPort());
        assertEquals(6380, config.getPort());
    }

    @Test
    void testReplicaOfTwoTokenForm() {
        MiniKvConfig config = new MiniKvConfig();
        config.parseArgs(new String[]{"--replicaof", "10.0.0.5", "7000"});

        assertEquals("10.0.0.5", config.getReplicaOfHost());
        assertEquals(7000, config.getReplicaOfPort());
    }

    @Test
    void testInvalidValues() {
        MiniKvConfig config = new MiniKvConfig();
        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--port", "70000"}));
        assertThrows(IllegalArgumentException.class,
                () -> config.parseArgs(new String[]{"--replicaof", "a b c"}));
    }

    @Test
    void testLoadFromClasspath() {
        MiniKvConfig config = new MiniKvConfig();
        config.loadConfig("replica-test.properties");

        assertEquals(7001, config.getPort());
        assertEquals("/tmp/minikv", config.getDir());
        assertEquals("dump.rdb", config.getDbFilename());
        assertEquals("localhost", config.getReplicaOfHost());
        assertEquals(6379, config.getReplicaOfPort());
    }

    @Test
    void testArgsOverrideConfigFile() {
        MiniKvConfig config = MiniKvConfig.fromArgs(new String[]{"--config", "replica-test.properties", "--port", "7002"});

        assertEquals(7002, config.getPort());
        assertEquals("/tmp/minikv", config.getDir());
        assertTrue(config.isReplica());
    }

    @Test
    void testMissingConfigFileKeepsDefaults() {
        MiniKvConfig config = new MiniKvConfig();
        config.loadConfig("does-not-exist.properties");
        assertEquals(MiniKvConfig.DEFAULT_PORT, config.getPort());
    }
}
