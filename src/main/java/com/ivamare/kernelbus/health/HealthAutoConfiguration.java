package com.ivamare.kernelbus.health;

import com.ivamare.kernelbus.KernelBusAutoConfiguration;
import com.ivamare.kernelbus.KernelBusProperties;
import com.ivamare.kernelbus.api.EventDispatcher;
import com.ivamare.kernelbus.chain.ChainAppender;
import com.ivamare.kernelbus.verify.IntegrityVerifier;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for kernel bus health indicators.
 */
@AutoConfiguration(after = KernelBusAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnBean(EventDispatcher.class)
@ConditionalOnProperty(prefix = "kernelbus", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(DispatcherHealthIndicator.class)
    public DispatcherHealthIndicator dispatcherHealthIndicator(
            EventDispatcher eventDispatcher, KernelBusProperties properties) {
        return new DispatcherHealthIndicator(eventDispatcher, properties.getHealth().getHandlerErrorThreshold());
    }

    @Bean
    @ConditionalOnMissingBean(AuditChainHealthIndicator.class)
    @ConditionalOnBean(IntegrityVerifier.class)
    public AuditChainHealthIndicator auditChainHealthIndicator(
            ChainAppender chainAppender, IntegrityVerifier integrityVerifier, EventDispatcher eventDispatcher) {
        return new AuditChainHealthIndicator(chainAppender, integrityVerifier, eventDispatcher);
    }
}
