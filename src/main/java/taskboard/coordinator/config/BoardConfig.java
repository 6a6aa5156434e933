package taskboard.coordinator.config;

import taskboard.coordinator.lock.BackoffPolicy;
import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for the task board.
 * All settings have sensible defaults.
 */
public final class BoardConfig {

    // Board settings
    private Path boardDirectory = Path.of("boards");
    private String holderId = defaultHolderId();

    // Lock settings
    private Duration lockTimeout = Duration.ofSeconds(10);
    private Duration lockStaleTtl = Duration.ofSeconds(60);
    private Duration backoffInitial = Duration.ofMillis(10);
    private Duration backoffMax = Duration.ofMillis(250);
    private double backoffMultiplier = 2.0;

    // Backup settings
    private int backupRetention = 10; // 0 disables backups

    // Background maintenance
    private Duration reaperStaleThreshold = Duration.ofMinutes(30);
    private Duration reaperInterval = Duration.ofSeconds(60);
    private Duration reconcileInterval = Duration.ofSeconds(30);

    private BoardConfig() {
    }

    public static BoardConfig defaults() {
        return new BoardConfig();
    }

    public static BoardConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static BoardConfig fromEnv(Map<String, String> env) {
        BoardConfig config = new BoardConfig();

        String dir = env.get("TASKBOARD_DIR");
        if (dir != null && !dir.isBlank()) {
            config.boardDirectory = Path.of(dir);
        }

        String timeout = env.get("TASKBOARD_LOCK_TIMEOUT_MS");
        if (timeout != null && !timeout.isBlank()) {
            config.lockTimeout = Duration.ofMillis(Long.parseLong(timeout.trim()));
        }

        String staleTtl = env.get("TASKBOARD_LOCK_STALE_TTL_MS");
        if (staleTtl != null && !staleTtl.isBlank()) {
            config.lockStaleTtl = Duration.ofMillis(Long.parseLong(staleTtl.trim()));
        }

        String holder = env.get("TASKBOARD_HOLDER_ID");
        if (holder != null && !holder.isBlank()) {
            config.holderId = holder.trim();
        }

        return config;
    }

    /**
     * Read settings from an INI file with sections [board], [lock],
     * [backup] and [reaper]. Missing sections and keys keep their defaults.
     *
     * @throws IOException if the file cannot be read or parsed
     */
    public static BoardConfig fromIni(File file) throws IOException {
        Ini ini = new Ini(file);
        BoardConfig config = new BoardConfig();

        Profile.Section board = ini.get("board");
        String dir = opt(board, "directory");
        if (dir != null) {
            config.boardDirectory = Path.of(dir);
        }
        String holder = opt(board, "holder_id");
        if (holder != null) {
            config.holderId = holder;
        }

        Profile.Section lock = ini.get("lock");
        config.lockTimeout = millis(lock, "timeout_ms", config.lockTimeout);
        config.lockStaleTtl = millis(lock, "stale_ttl_ms", config.lockStaleTtl);
        config.backoffInitial = millis(lock, "backoff_initial_ms", config.backoffInitial);
        config.backoffMax = millis(lock, "backoff_max_ms", config.backoffMax);
        String multiplier = opt(lock, "backoff_multiplier");
        if (multiplier != null) {
            config.backoffMultiplier = Double.parseDouble(multiplier);
        }

        Profile.Section backup = ini.get("backup");
        String retention = opt(backup, "retention");
        if (retention != null) {
            config.backupRetention = Integer.parseInt(retention);
        }

        Profile.Section reaper = ini.get("reaper");
        config.reaperStaleThreshold = millis(reaper, "stale_threshold_ms", config.reaperStaleThreshold);
        config.reaperInterval = millis(reaper, "interval_ms", config.reaperInterval);
        config.reconcileInterval = millis(reaper, "reconcile_interval_ms", config.reconcileInterval);

        return config;
    }

    // Getters
    public Path boardDirectory() {
        return boardDirectory;
    }

    public String holderId() {
        return holderId;
    }

    public Duration lockTimeout() {
        return lockTimeout;
    }

    public Duration lockStaleTtl() {
        return lockStaleTtl;
    }

    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(backoffInitial, backoffMax, backoffMultiplier);
    }

    public int backupRetention() {
        return backupRetention;
    }

    public Path backupDirectory() {
        return boardDirectory.resolve("backups");
    }

    public Duration reaperStaleThreshold() {
        return reaperStaleThreshold;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public Duration reconcileInterval() {
        return reconcileInterval;
    }

    // Fluent setters for testing/customization
    public BoardConfig withBoardDirectory(Path directory) {
        this.boardDirectory = directory;
        return this;
    }

    public BoardConfig withHolderId(String holderId) {
        this.holderId = holderId;
        return this;
    }

    public BoardConfig withLockTimeout(Duration timeout) {
        this.lockTimeout = timeout;
        return this;
    }

    public BoardConfig withLockStaleTtl(Duration ttl) {
        this.lockStaleTtl = ttl;
        return this;
    }

    public BoardConfig withBackoff(Duration initial, Duration max, double multiplier) {
        this.backoffInitial = initial;
        this.backoffMax = max;
        this.backoffMultiplier = multiplier;
        return this;
    }

    public BoardConfig withBackupRetention(int retention) {
        this.backupRetention = retention;
        return this;
    }

    public BoardConfig withReaperStaleThreshold(Duration threshold) {
        this.reaperStaleThreshold = threshold;
        return this;
    }

    public BoardConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    public BoardConfig withReconcileInterval(Duration interval) {
        this.reconcileInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "BoardConfig{" +
                "boardDirectory=" + boardDirectory +
                ", holderId='" + holderId + '\'' +
                ", lockTimeout=" + lockTimeout +
                ", lockStaleTtl=" + lockStaleTtl +
                ", backupRetention=" + backupRetention +
                '}';
    }

    // pid@host, as reported by the runtime MX bean
    private static String defaultHolderId() {
        return ManagementFactory.getRuntimeMXBean().getName();
    }

    private static String opt(Profile.Section section, String key) {
        if (section == null) {
            return null;
        }
        String value = section.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Duration millis(Profile.Section section, String key, Duration fallback) {
        String value = opt(section, key);
        return value == null ? fallback : Duration.ofMillis(Long.parseLong(value));
    }
}
