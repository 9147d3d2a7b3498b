package com.ivamare.kernelbus.chain;

import com.ivamare.kernelbus.model.AuditEntry;
import com.ivamare.kernelbus.model.TrustLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EntryHasher")
class EntryHasherTest {

    private static final Instant AT = Instant.parse("2024-05-01T10:15:30.123Z");

    private final EntryHasher hasher = new EntryHasher();

    @Nested
    @DisplayName("canonical form")
    class CanonicalTests {

        @Test
        @DisplayName("should render fields as a compact array in fixed order")
        void shouldRenderCanonicalArray() {
            String canonical = hasher.canonicalize(0, "login", "alice", TrustLevel.STANDARD,
                Map.of(), AT, EntryHasher.GENESIS_HASH);

            assertThat(canonical).isEqualTo(
                "[0,\"login\",\"alice\",\"standard\",{},\"2024-05-01T10:15:30.123Z\",\""
                    + EntryHasher.GENESIS_HASH + "\"]");
        }

        @Test
        @DisplayName("should sort detail keys recursively")
        void shouldSortDetailKeys() {
            Map<String, Object> inner = new LinkedHashMap<>();
            inner.put("z", 1);
            inner.put("a", 2);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("second", inner);
            details.put("first", List.of(Map.of("y", true)));

            String canonical = hasher.canonicalize(3, "update", "bob", TrustLevel.OPERATOR,
                details, AT, "ab");

            assertThat(canonical).contains("{\"first\":[{\"y\":true}],\"second\":{\"a\":2,\"z\":1}}");
        }

        @Test
        @DisplayName("should not depend on detail insertion order")
        void shouldIgnoreInsertionOrder() {
            Map<String, Object> first = new LinkedHashMap<>();
            first.put("ip", "10.0.0.1");
            first.put("method", "password");
            Map<String, Object> second = new LinkedHashMap<>();
            second.put("method", "password");
            second.put("ip", "10.0.0.1");

            assertThat(hasher.hash(1, "login", "alice", TrustLevel.VERIFIED, first, AT, "p"))
                .isEqualTo(hasher.hash(1, "login", "alice", TrustLevel.VERIFIED, second, AT, "p"));
        }

        @Test
        @DisplayName("should keep null detail values")
        void shouldKeepNullValues() {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", null);

            String canonical = hasher.canonicalize(0, "logout", "alice", TrustLevel.STANDARD,
                details, AT, EntryHasher.GENESIS_HASH);

            assertThat(canonical).contains("{\"reason\":null}");
        }
    }

    @Nested
    @DisplayName("hashing")
    class HashTests {

        @Test
        @DisplayName("should produce lower-case SHA-256 hex")
        void shouldProduceSha256Hex() {
            assertThat(EntryHasher.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        }

        @Test
        @DisplayName("should change when any hashed field changes")
        void shouldChangeWithAnyField() {
            String base = hasher.hash(0, "login", "alice", TrustLevel.STANDARD, Map.of(), AT, "p");

            assertThat(hasher.hash(1, "login", "alice", TrustLevel.STANDARD, Map.of(), AT, "p")).isNotEqualTo(base);
            assertThat(hasher.hash(0, "logout", "alice", TrustLevel.STANDARD, Map.of(), AT, "p")).isNotEqualTo(base);
            assertThat(hasher.hash(0, "login", "bob", TrustLevel.STANDARD, Map.of(), AT, "p")).isNotEqualTo(base);
            assertThat(hasher.hash(0, "login", "alice", TrustLevel.SYSTEM, Map.of(), AT, "p")).isNotEqualTo(base);
            assertThat(hasher.hash(0, "login", "alice", TrustLevel.STANDARD, Map.of("k", 1), AT, "p"))
                .isNotEqualTo(base);
            assertThat(hasher.hash(0, "login", "alice", TrustLevel.STANDARD, Map.of(), AT.plusMillis(1), "p"))
                .isNotEqualTo(base);
            assertThat(hasher.hash(0, "login", "alice", TrustLevel.STANDARD, Map.of(), AT, "q")).isNotEqualTo(base);
        }

        @Test
        @DisplayName("should recompute a stored entry hash from its fields")
        void shouldRecomputeEntryHash() {
            String hash = hasher.hash(4, "login", "alice", TrustLevel.STANDARD, Map.of("n", 1), AT, "p");
            AuditEntry entry = new AuditEntry(4, "login", "alice", TrustLevel.STANDARD, Map.of("n", 1), AT, "p", hash);

            assertThat(hasher.hash(entry)).isEqualTo(hash);
            assertThat(hasher.rehash(entry, "other")).isNotEqualTo(hash);
        }

        @Test
        @DisplayName("should use 64 zeros as the genesis hash")
        void shouldDefineGenesisHash() {
            assertThat(EntryHasher.GENESIS_HASH).hasSize(64).matches("0+");
        }
    }
}
