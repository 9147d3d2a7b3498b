package com.ivamare.kernelbus;

import com.ivamare.kernelbus.api.EventDispatcher;
import com.ivamare.kernelbus.bridge.AuditBridge;
import com.ivamare.kernelbus.chain.ChainAppender;
import com.ivamare.kernelbus.checkpoint.CheckpointManager;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

/**
 * Starts and stops the audit pipeline with the application.
 *
 * <p>On {@link ApplicationReadyEvent} the chain and checkpoints are loaded and the
 * audit bridge subscribes to {@code audit:log}. Disable with:
 * <pre>
 * kernelbus:
 *   audit:
 *     auto-start: false
 * </pre>
 *
 * <p>On shutdown the bridge is stopped and outstanding deliveries are drained.
 */
@Configuration(proxyBeanMethods = false)
public class AuditLifecycleConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AuditLifecycleConfiguration.class);

    private final EventDispatcher dispatcher;
    private final ChainAppender chainAppender;
    private final CheckpointManager checkpointManager;
    private final AuditBridge auditBridge;
    private final KernelBusProperties properties;

    public AuditLifecycleConfiguration(
            EventDispatcher dispatcher,
            ChainAppender chainAppender,
            CheckpointManager checkpointManager,
            AuditBridge auditBridge,
            KernelBusProperties properties) {
        this.dispatcher = dispatcher;
        this.chainAppender = chainAppender;
        this.checkpointManager = checkpointManager;
        this.auditBridge = auditBridge;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startAudit() {
        if (!properties.getAudit().isAutoStart()) {
            log.info("Audit auto-start disabled");
            return;
        }

        chainAppender.load();
        checkpointManager.load();
        auditBridge.start();

        log.info("Audit pipeline started ({} entries, {} checkpoints)",
            chainAppender.size(), checkpointManager.getCheckpoints().size());
    }

    @PreDestroy
    public void stopAudit() {
        auditBridge.stop();
        dispatcher.shutdown(properties.getDispatcher().getShutdownTimeout());
        log.info("Audit pipeline stopped");
    }
}
