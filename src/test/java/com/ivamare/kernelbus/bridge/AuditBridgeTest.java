package com.ivamare.kernelbus.bridge;

import com.ivamare.kernelbus.AuditFixture;
import com.ivamare.kernelbus.api.impl.DefaultEventDispatcher;
import com.ivamare.kernelbus.chain.ChainAppender;
import com.ivamare.kernelbus.chain.EntryHasher;
import com.ivamare.kernelbus.event.KernelEvents;
import com.ivamare.kernelbus.exception.AuditStorageException;
import com.ivamare.kernelbus.model.AuditEntry;
import com.ivamare.kernelbus.model.AuditRecord;
import com.ivamare.kernelbus.model.AuditRequest;
import com.ivamare.kernelbus.model.AuditUnavailable;
import com.ivamare.kernelbus.model.TrustLevel;
import com.ivamare.kernelbus.policy.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AuditBridge")
class AuditBridgeTest {

    private static final AuditRequest LOGIN = new AuditRequest("login", "alice", TrustLevel.STANDARD, Map.of());

    @TempDir
    Path tempDir;

    private DefaultEventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new DefaultEventDispatcher();
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown(Duration.ofSeconds(5));
    }

    private void drain() throws Exception {
        dispatcher.drain().get(5, TimeUnit.SECONDS);
    }

    private void drainTwice() throws Exception {
        drain();
        drain();
    }

    @Nested
    @DisplayName("with a file chain")
    class FileChainTests {

        private AuditFixture fixture;
        private AuditBridge bridge;

        @BeforeEach
        void setUp() {
            fixture = new AuditFixture(tempDir).load();
            bridge = new AuditBridge(dispatcher, fixture.appender, RetryPolicy.defaultPolicy(), fixture.clock);
            bridge.start();
        }

        @Test
        @DisplayName("should chain three sequential login requests")
        void shouldChainThreeLogins() throws Exception {
            for (int i = 0; i < 3; i++) {
                dispatcher.publish(KernelEvents.AUDIT_LOG, LOGIN);
                drain();
            }

            List<AuditEntry> entries = fixture.appender.getEntries();
            assertThat(entries).extracting(AuditEntry::sequence).containsExactly(0L, 1L, 2L);
            assertThat(entries.get(0).prevHash()).isEqualTo(EntryHasher.GENESIS_HASH);
            assertThat(entries.get(1).prevHash()).isEqualTo(entries.get(0).hash());
            assertThat(entries.get(2).prevHash()).isEqualTo(entries.get(1).hash());
            assertThat(entries).allSatisfy(entry -> {
                assertThat(entry.action()).isEqualTo("login");
                assertThat(entry.actor()).isEqualTo("alice");
                assertThat(entry.trustLevel()).isEqualTo(TrustLevel.STANDARD);
                assertThat(entry.details()).isEmpty();
            });
            assertThat(fixture.verifier.verifyChain().valid()).isTrue();
        }

        @Test
        @DisplayName("should publish audit:logged with the appended entry")
        void shouldPublishLogged() throws Exception {
            List<AuditEntry> logged = Collections.synchronizedList(new ArrayList<>());
            dispatcher.subscribe(KernelEvents.AUDIT_LOGGED, event -> logged.add(event.payload()));

            dispatcher.publish(KernelEvents.AUDIT_LOG, LOGIN);
            drainTwice();

            assertThat(logged).containsExactlyElementsOf(fixture.appender.getEntries());
        }

        @Test
        @DisplayName("should stamp entries with the clock at millisecond precision")
        void shouldStampRecordedAt() throws Exception {
            fixture.clock.advance(Duration.ofNanos(1_234_567));

            dispatcher.publish(KernelEvents.AUDIT_LOG, LOGIN);
            drain();

            Instant recordedAt = fixture.appender.getEntries().get(0).recordedAt();
            assertThat(recordedAt).isEqualTo(Instant.parse("2024-05-01T09:00:00.001Z"));
        }

        @Test
        @DisplayName("should count an invalid request as a handler fault")
        void shouldCountInvalidRequest() throws Exception {
            dispatcher.publish(KernelEvents.AUDIT_LOG, null);
            dispatcher.publish(KernelEvents.AUDIT_LOG,
                new AuditRequest("login", "alice", TrustLevel.STANDARD, Map.of("socket", new Object())));
            drain();

            assertThat(dispatcher.handlerErrorCount()).isEqualTo(2);
            assertThat(fixture.appender.getEntries()).isEmpty();
        }

        @Test
        @DisplayName("should stop consuming after stop")
        void shouldStopConsuming() throws Exception {
            bridge.stop();

            dispatcher.publish(KernelEvents.AUDIT_LOG, LOGIN);
            drain();

            assertThat(bridge.isRunning()).isFalse();
            assertThat(dispatcher.listenerCount(KernelEvents.AUDIT_LOG)).isZero();
            assertThat(fixture.appender.getEntries()).isEmpty();
        }

        @Test
        @DisplayName("should subscribe only once when started twice")
        void shouldStartOnce() {
            bridge.start();

            assertThat(bridge.isRunning()).isTrue();
            assertThat(dispatcher.listenerCount(KernelEvents.AUDIT_LOG)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("with a failing chain")
    class RetryTests {

        private final ChainAppender appender = mock(ChainAppender.class);
        private final RetryPolicy policy = new RetryPolicy(3, List.of(5L, 5L));
        private AuditBridge bridge;

        @BeforeEach
        void setUp() {
            bridge = new AuditBridge(dispatcher, appender, policy, Clock.systemUTC());
            bridge.start();
        }

        private AuditEntry entry() {
            return new AuditEntry(0, "login", "alice", TrustLevel.STANDARD, Map.of(),
                Instant.now(), EntryHasher.GENESIS_HASH, "hash");
        }

        @Test
        @DisplayName("should retry storage failures and succeed")
        void shouldRetryAndSucceed() throws Exception {
            when(appender.append(any()))
                .thenThrow(new AuditStorageException(tempDir, "busy"))
                .thenThrow(new AuditStorageException(tempDir, "busy"))
                .thenReturn(entry());
            List<AuditUnavailable> unavailable = Collections.synchronizedList(new ArrayList<>());
            dispatcher.subscribe(KernelEvents.AUDIT_UNAVAILABLE, event -> unavailable.add(event.payload()));

            dispatcher.publish(KernelEvents.AUDIT_LOG, LOGIN);
            drainTwice();

            verify(appender, times(3)).append(any());
            assertThat(unavailable).isEmpty();
            assertThat(bridge.consecutiveFailures()).isZero();
            assertThat(dispatcher.handlerErrorCount()).isZero();
        }

        @Test
        @DisplayName("should retry with the same record")
        void shouldRetrySameRecord() throws Exception {
            when(appender.append(any()))
                .thenThrow(new AuditStorageException(tempDir, "busy"))
                .thenReturn(entry());

            dispatcher.publish(KernelEvents.AUDIT_LOG, LOGIN);
            drain();

            ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
            verify(appender, times(2)).append(captor.capture());
            assertThat(captor.getAllValues().get(0)).isEqualTo(captor.getAllValues().get(1));
        }

        @Test
        @DisplayName("should signal audit:unavailable when retries are exhausted")
        void shouldSignalUnavailable() throws Exception {
            when(appender.append(any())).thenThrow(new AuditStorageException(tempDir, "disk full"));
            List<AuditUnavailable> unavailable = Collections.synchronizedList(new ArrayList<>());
            dispatcher.subscribe(KernelEvents.AUDIT_UNAVAILABLE, event -> unavailable.add(event.payload()));

            dispatcher.publish(KernelEvents.AUDIT_LOG, LOGIN);
            drainTwice();

            verify(appender, times(3)).append(any());
            assertThat(unavailable).hasSize(1);
            assertThat(unavailable.get(0).action()).isEqualTo("login");
            assertThat(unavailable.get(0).attempts()).isEqualTo(3);
            assertThat(unavailable.get(0).reason()).contains("disk full");
            assertThat(bridge.consecutiveFailures()).isEqualTo(1);
            assertThat(dispatcher.handlerErrorCount()).isZero();
        }

        @Test
        @DisplayName("should reset consecutive failures after a success")
        void shouldResetConsecutiveFailures() throws Exception {
            when(appender.append(any()))
                .thenThrow(new AuditStorageException(tempDir, "disk full"))
                .thenThrow(new AuditStorageException(tempDir, "disk full"))
                .thenThrow(new AuditStorageException(tempDir, "disk full"))
                .thenReturn(entry());

            dispatcher.publish(KernelEvents.AUDIT_LOG, LOGIN);
            drain();
            assertThat(bridge.consecutiveFailures()).isEqualTo(1);

            dispatcher.publish(KernelEvents.AUDIT_LOG, LOGIN);
            drain();
            assertThat(bridge.consecutiveFailures()).isZero();
        }
    }
}
