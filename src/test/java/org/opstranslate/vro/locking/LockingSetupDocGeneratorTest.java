package org.opstranslate.vro.locking;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LockingSetupDocGeneratorTest {

    @Test
    void shouldRenderBackendSpecificSection() {
        String redis = LockingSetupDocGenerator.generate("redis");
        String file = LockingSetupDocGenerator.generate("file");

        assertTrue(redis.contains("**Current backend**: redis"));
        assertTrue(redis.contains("## Redis Setup"));
        assertFalse(redis.contains("## Consul Setup"));
        assertTrue(redis.contains("every 5 seconds, at least 12 times"));
        assertTrue(file.contains("NOT suitable for distributed systems"));
    }

    @Test
    void shouldWriteGuideToFile(@TempDir Path tempDir) throws IOException {
        Path output = tempDir.resolve("docs").resolve("LOCKING_SETUP.md");

        LockingSetupDocGenerator.write("consul", output);

        assertTrue(Files.readString(output).contains("## Consul Setup"));
    }

    @Test
    void shouldRejectUnknownBackend() {
        assertThrows(IllegalArgumentException.class, () -> LockingSetupDocGenerator.generate("etcd"));
    }
}
