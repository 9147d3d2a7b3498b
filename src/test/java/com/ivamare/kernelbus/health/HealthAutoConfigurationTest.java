package com.ivamare.kernelbus.health;

import com.ivamare.kernelbus.KernelBusAutoConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HealthAutoConfiguration")
class HealthAutoConfigurationTest {

    @TempDir
    Path tempDir;

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(KernelBusAutoConfiguration.class, HealthAutoConfiguration.class))
            .withPropertyValues(
                "kernelbus.audit.path=" + tempDir.resolve("audit.jsonl"),
                "kernelbus.audit.checkpoint-path=" + tempDir.resolve("checkpoints.jsonl"),
                "kernelbus.checkpoint.secret=0123456789abcdef0123456789abcdef"
            );
    }

    @Test
    @DisplayName("should create health indicators when enabled")
    void shouldCreateHealthIndicatorsWhenEnabled() {
        contextRunner().run(context -> {
            assertThat(context).hasSingleBean(DispatcherHealthIndicator.class);
            assertThat(context).hasSingleBean(AuditChainHealthIndicator.class);
            assertThat(context.getBean(AuditChainHealthIndicator.class).health().getStatus().getCode())
                .isEqualTo("UP");
        });
    }

    @Test
    @DisplayName("should not create health indicators when disabled")
    void shouldNotCreateHealthIndicatorsWhenDisabled() {
        contextRunner()
            .withPropertyValues("kernelbus.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(DispatcherHealthIndicator.class);
                assertThat(context).doesNotHaveBean(AuditChainHealthIndicator.class);
            });
    }
}
