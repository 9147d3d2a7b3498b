package com.ivamare.kernelbus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ivamare.kernelbus.api.EventDispatcher;
import com.ivamare.kernelbus.api.impl.DefaultEventDispatcher;
import com.ivamare.kernelbus.bridge.AuditBridge;
import com.ivamare.kernelbus.chain.ChainAppender;
import com.ivamare.kernelbus.chain.EntryHasher;
import com.ivamare.kernelbus.chain.impl.FileChainAppender;
import com.ivamare.kernelbus.checkpoint.CheckpointManager;
import com.ivamare.kernelbus.checkpoint.CheckpointSecrets;
import com.ivamare.kernelbus.checkpoint.CheckpointSigner;
import com.ivamare.kernelbus.checkpoint.impl.FileCheckpointManager;
import com.ivamare.kernelbus.handler.SubscriberRegistrar;
import com.ivamare.kernelbus.model.AuditEntry;
import com.ivamare.kernelbus.model.Checkpoint;
import com.ivamare.kernelbus.policy.RetryPolicy;
import com.ivamare.kernelbus.store.JsonLinesStore;
import com.ivamare.kernelbus.verify.IntegrityVerifier;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Auto-configuration for the kernel bus.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Event Dispatcher and {@code @Subscribe} discovery</li>
 *   <li>Audit chain (entry store, hasher, appender)</li>
 *   <li>Checkpoint Manager and signer</li>
 *   <li>Integrity Verifier</li>
 *   <li>Audit Bridge and its Retry Policy</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * kernelbus.enabled=false
 * </pre>
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ConditionalOnProperty(prefix = "kernelbus", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(KernelBusProperties.class)
@Import(AuditLifecycleConfiguration.class)
public class KernelBusAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper kernelBusObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock kernelBusClock() {
        return Clock.systemUTC();
    }

    // --- Dispatcher ---

    @Bean
    @ConditionalOnMissingBean
    public EventDispatcher eventDispatcher(KernelBusProperties properties) {
        return new DefaultEventDispatcher(properties.getDispatcher().getHandlerTimeout());
    }

    @Bean
    public static SubscriberRegistrar subscriberRegistrar(ObjectProvider<EventDispatcher> dispatcher) {
        return new SubscriberRegistrar(dispatcher);
    }

    // --- Audit chain ---

    @Bean
    @ConditionalOnMissingBean(name = "auditEntryStore")
    public JsonLinesStore<AuditEntry> auditEntryStore(KernelBusProperties properties, ObjectMapper objectMapper) {
        return new JsonLinesStore<>(Path.of(properties.getAudit().getPath()), objectMapper, AuditEntry.class);
    }

    @Bean
    @ConditionalOnMissingBean
    public EntryHasher entryHasher() {
        return new EntryHasher();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChainAppender chainAppender(
            @Qualifier("auditEntryStore") JsonLinesStore<AuditEntry> auditEntryStore,
            ObjectMapper objectMapper,
            EntryHasher entryHasher) {
        return new FileChainAppender(auditEntryStore, objectMapper, entryHasher);
    }

    // --- Checkpoints ---

    @Bean
    @ConditionalOnMissingBean
    public CheckpointSigner checkpointSigner(KernelBusProperties properties) {
        KernelBusProperties.CheckpointProperties cp = properties.getCheckpoint();
        Path secretFile = cp.getSecretFile() != null ? Path.of(cp.getSecretFile()) : null;
        return new CheckpointSigner(CheckpointSecrets.resolve(cp.getSecret(), secretFile, cp.isGenerateSecret()));
    }

    @Bean
    @ConditionalOnMissingBean(name = "checkpointStore")
    public JsonLinesStore<Checkpoint> checkpointStore(KernelBusProperties properties, ObjectMapper objectMapper) {
        return new JsonLinesStore<>(Path.of(properties.getAudit().getCheckpointPath()), objectMapper, Checkpoint.class);
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckpointManager checkpointManager(
            @Qualifier("checkpointStore") JsonLinesStore<Checkpoint> checkpointStore,
            ChainAppender chainAppender,
            CheckpointSigner checkpointSigner,
            KernelBusProperties properties,
            Clock clock) {
        KernelBusProperties.CheckpointProperties cp = properties.getCheckpoint();
        FileCheckpointManager manager = new FileCheckpointManager(
            checkpointStore,
            chainAppender,
            checkpointSigner,
            cp.getEveryEntries(),
            cp.getInterval(),
            clock
        );
        if (chainAppender instanceof FileChainAppender fileChainAppender) {
            fileChainAppender.setCheckpointManager(manager);
        }
        return manager;
    }

    // --- Verification ---

    @Bean
    @ConditionalOnMissingBean
    public IntegrityVerifier integrityVerifier(
            ChainAppender chainAppender,
            CheckpointManager checkpointManager,
            EntryHasher entryHasher,
            CheckpointSigner checkpointSigner) {
        return new IntegrityVerifier(chainAppender, checkpointManager, entryHasher, checkpointSigner);
    }

    // --- Audit Bridge ---

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy auditRetryPolicy(KernelBusProperties properties) {
        KernelBusProperties.RetryProperties retry = properties.getAudit().getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBackoffMs());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditBridge auditBridge(
            EventDispatcher eventDispatcher,
            ChainAppender chainAppender,
            RetryPolicy auditRetryPolicy,
            Clock clock) {
        return new AuditBridge(eventDispatcher, chainAppender, auditRetryPolicy, clock);
    }
}
