package taskboard.coordinator.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BoardConfigTest {

    @TempDir
    Path dir;

    @Test
    void defaults() {
        BoardConfig config = BoardConfig.defaults();

        assertEquals(Path.of("boards"), config.boardDirectory());
        assertEquals(Path.of("boards", "backups"), config.backupDirectory());
        assertEquals(Duration.ofSeconds(10), config.lockTimeout());
        assertEquals(Duration.ofSeconds(60), config.lockStaleTtl());
        assertEquals(10, config.backupRetention());
        assertEquals(Duration.ofMinutes(30), config.reaperStaleThreshold());
        assertNotNull(config.holderId());
        assertFalse(config.holderId().isBlank());
    }

    @Test
    void fromEnvOverridesOnlyWhatIsSet() {
        BoardConfig config = BoardConfig.fromEnv(Map.of(
                "TASKBOARD_DIR", "/var/lib/boards",
                "TASKBOARD_LOCK_TIMEOUT_MS", " 2500 ",
                "TASKBOARD_HOLDER_ID", "worker-7",
                "TASKBOARD_LOCK_STALE_TTL_MS", ""));

        assertEquals(Path.of("/var/lib/boards"), config.boardDirectory());
        assertEquals(Duration.ofMillis(2500), config.lockTimeout());
        assertEquals("worker-7", config.holderId());
        assertEquals(Duration.ofSeconds(60), config.lockStaleTtl());
    }

    @Test
    void fromEnvRejectsGarbageNumbers() {
        assertThrows(NumberFormatException.class,
                () -> BoardConfig.fromEnv(Map.of("TASKBOARD_LOCK_TIMEOUT_MS", "soon")));
    }

    @Test
    void fromIniReadsAllSections() throws IOException {
        File ini = dir.resolve("taskboard.ini").toFile();
        Files.writeString(ini.toPath(), String.join("\n",
                "[board]",
                "directory = /srv/boards",
                "holder_id = node-1",
                "",
                "[lock]",
                "timeout_ms = 500",
                "stale_ttl_ms = 2000",
                "backoff_initial_ms = 5",
                "backoff_max_ms = 50",
                "backoff_multiplier = 1.5",
                "",
                "[backup]",
                "retention = 3",
                "",
                "[reaper]",
                "stale_threshold_ms = 60000",
                "interval_ms = 1000",
                "reconcile_interval_ms = 2000",
                ""), StandardCharsets.UTF_8);

        BoardConfig config = BoardConfig.fromIni(ini);

        assertEquals(Path.of("/srv/boards"), config.boardDirectory());
        assertEquals("node-1", config.holderId());
        assertEquals(Duration.ofMillis(500), config.lockTimeout());
        assertEquals(Duration.ofMillis(2000), config.lockStaleTtl());
        assertEquals(Duration.ofMillis(5), config.backoffPolicy().initialDelay());
        assertEquals(Duration.ofMillis(50), config.backoffPolicy().maxDelay());
        assertEquals(1.5, config.backoffPolicy().multiplier());
        assertEquals(3, config.backupRetention());
        assertEquals(Duration.ofMinutes(1), config.reaperStaleThreshold());
        assertEquals(Duration.ofSeconds(1), config.reaperInterval());
        assertEquals(Duration.ofSeconds(2), config.reconcileInterval());
    }

    @Test
    void fromIniKeepsDefaultsForMissingSections() throws IOException {
        File ini = dir.resolve("partial.ini").toFile();
        Files.writeString(ini.toPath(), "[lock]\ntimeout_ms = 750\n", StandardCharsets.UTF_8);

        BoardConfig config = BoardConfig.fromIni(ini);

        assertEquals(Duration.ofMillis(750), config.lockTimeout());
        assertEquals(Path.of("boards"), config.boardDirectory());
        assertEquals(10, config.backupRetention());
        assertEquals(Duration.ofSeconds(60), config.reaperInterval());
    }

    @Test
    void fromIniFailsOnMissingFile() {
        assertThrows(IOException.class, () -> BoardConfig.fromIni(dir.resolve("absent.ini").toFile()));
    }

    @Test
    void fluentSettersChain() {
        BoardConfig config = BoardConfig.defaults()
                .withBoardDirectory(dir)
                .withHolderId("h")
                .withLockTimeout(Duration.ofMillis(100))
                .withBackupRetention(0)
                .withBackoff(Duration.ofMillis(1), Duration.ofMillis(2), 2.0);

        assertEquals(dir, config.boardDirectory());
        assertEquals(dir.resolve("backups"), config.backupDirectory());
        assertEquals("h", config.holderId());
        assertEquals(0, config.backupRetention());
        assertEquals(2, config.backoffPolicy().delayMillis(2));
    }
}
