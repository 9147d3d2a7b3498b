package com.ivamare.kernelbus;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the kernel bus.
 *
 * <p>Example configuration:
 * <pre>
 * kernelbus:
 *   enabled: true
 *   dispatcher:
 *     handler-timeout: 30s
 *     shutdown-timeout: 10s
 *   audit:
 *     path: data/audit/audit.jsonl
 *     checkpoint-path: data/audit/checkpoints.jsonl
 *     auto-start: true
 *     retry:
 *       max-attempts: 3
 *       backoff-ms: [50, 200]
 *   checkpoint:
 *     every-entries: 500
 *     interval: 1h
 *     secret-file: data/audit/checkpoint.key
 *     generate-secret: false
 *   health:
 *     handler-error-threshold: 5
 * </pre>
 */
@ConfigurationProperties(prefix = "kernelbus")
public class KernelBusProperties {

    /**
     * Enable/disable kernel bus auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Dispatcher configuration.
     */
    private DispatcherProperties dispatcher = new DispatcherProperties();

    /**
     * Audit chain configuration.
     */
    private AuditProperties audit = new AuditProperties();

    /**
     * Checkpoint configuration.
     */
    private CheckpointProperties checkpoint = new CheckpointProperties();

    /**
     * Health indicator configuration.
     */
    private HealthProperties health = new HealthProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public DispatcherProperties getDispatcher() {
        return dispatcher;
    }

    public void setDispatcher(DispatcherProperties dispatcher) {
        this.dispatcher = dispatcher;
    }

    public AuditProperties getAudit() {
        return audit;
    }

    public void setAudit(AuditProperties audit) {
        this.audit = audit;
    }

    public CheckpointProperties getCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(CheckpointProperties checkpoint) {
        this.checkpoint = checkpoint;
    }

    public HealthProperties getHealth() {
        return health;
    }

    public void setHealth(HealthProperties health) {
        this.health = health;
    }

    /**
     * Dispatcher-specific configuration.
     */
    public static class DispatcherProperties {

        /**
         * Ceiling on a single handler invocation; 0 disables it.
         */
        private Duration handlerTimeout = Duration.ofSeconds(30);

        /**
         * Time to wait for outstanding deliveries on shutdown.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        public Duration getHandlerTimeout() {
            return handlerTimeout;
        }

        public void setHandlerTimeout(Duration handlerTimeout) {
            this.handlerTimeout = handlerTimeout;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    /**
     * Audit chain configuration.
     */
    public static class AuditProperties {

        /**
         * Path of the audit entry store.
         */
        private String path = "data/audit/audit.jsonl";

        /**
         * Path of the checkpoint store.
         */
        private String checkpointPath = "data/audit/checkpoints.jsonl";

        /**
         * Load the chain and start the audit bridge when the application is ready.
         */
        private boolean autoStart = true;

        /**
         * Retry configuration for failed appends.
         */
        private RetryProperties retry = new RetryProperties();

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getCheckpointPath() {
            return checkpointPath;
        }

        public void setCheckpointPath(String checkpointPath) {
            this.checkpointPath = checkpointPath;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public RetryProperties getRetry() {
            return retry;
        }

        public void setRetry(RetryProperties retry) {
            this.retry = retry;
        }
    }

    /**
     * Retry configuration for the audit bridge.
     */
    public static class RetryProperties {

        /**
         * Maximum attempts per audit request, including the first.
         */
        private int maxAttempts = 3;

        /**
         * Delay in milliseconds before each retry.
         */
        private List<Long> backoffMs = List.of(50L, 200L);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public List<Long> getBackoffMs() {
            return backoffMs;
        }

        public void setBackoffMs(List<Long> backoffMs) {
            this.backoffMs = backoffMs;
        }
    }

    /**
     * Checkpoint configuration.
     */
    public static class CheckpointProperties {

        /**
         * Record a checkpoint after every N entries; 0 disables the count cadence.
         */
        private long everyEntries = 500;

        /**
         * Record a checkpoint when this much time has passed since the last one; 0 disables it.
         */
        private Duration interval = Duration.ofHours(1);

        /**
         * Inline HMAC secret (at least 32 bytes). Takes precedence over the secret file.
         */
        private String secret;

        /**
         * File holding the HMAC secret.
         */
        private String secretFile = "data/audit/checkpoint.key";

        /**
         * Generate the secret file with a random secret when it does not exist.
         */
        private boolean generateSecret = false;

        public long getEveryEntries() {
            return everyEntries;
        }

        public void setEveryEntries(long everyEntries) {
            this.everyEntries = everyEntries;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public String getSecretFile() {
            return secretFile;
        }

        public void setSecretFile(String secretFile) {
            this.secretFile = secretFile;
        }

        public boolean isGenerateSecret() {
            return generateSecret;
        }

        public void setGenerateSecret(boolean generateSecret) {
            this.generateSecret = generateSecret;
        }
    }

    /**
     * Health indicator configuration.
     */
    public static class HealthProperties {

        /**
         * Handler errors between two health checks at which the dispatcher is reported DOWN.
         */
        private int handlerErrorThreshold = 5;

        public int getHandlerErrorThreshold() {
            return handlerErrorThreshold;
        }

        public void setHandlerErrorThreshold(int handlerErrorThreshold) {
            this.handlerErrorThreshold = handlerErrorThreshold;
        }
    }
}
