package com.libragraph.registry.core.version;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.registry.core.authority.AssetVersion;
import com.libragraph.registry.core.authority.AuthorityException;
import com.libragraph.registry.core.authority.InMemoryAuthorityGateway;
import com.libragraph.registry.core.authority.VersionAuthority;
import com.libragraph.registry.types.AssetType;
import com.libragraph.registry.util.CanonicalJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class VersionAllocatorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T14:05:09.123456Z");
    private static final String TX = "ftx_20250301_140509_abc123";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private InMemoryAuthorityGateway gateway;
    private VersionAuthority authority;
    private VersionAllocator allocator;

    @BeforeEach
    void setUp() {
        gateway = new InMemoryAuthorityGateway();
        authority = new VersionAuthority(gateway);
        allocator = new VersionAllocator(authority, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void take(String assetName, String version) {
        ObjectNode payload = MAPPER.createObjectNode().put("v", version);
        authority.register(new AssetVersion(assetName, AssetType.FRAMEWORK, version,
                CanonicalJson.hash(payload), payload, NOW));
    }

    @Test
    void patchIncrementWhenFree() {
        AllocatedVersion allocated = allocator.allocate("cff", "v1.0.0", TX);

        assertThat(allocated.version()).isEqualTo("v1.0.1");
        assertThat(allocated.strategy()).isEqualTo(AllocationStrategy.PATCH_INCREMENT);
    }

    @Test
    void twoPartVersionGetsPatchComponent() {
        assertThat(allocator.allocate("cff", "1.0", TX).version()).isEqualTo("v1.0.1");
    }

    @Test
    void unparseableVersionStartsAtDateStamp() {
        AllocatedVersion allocated = allocator.allocate("cff", "experimental", TX);

        assertThat(allocated.version()).isEqualTo("v2025.03.01");
        assertThat(allocated.strategy()).isEqualTo(AllocationStrategy.DATE);
    }

    @Test
    void walksCandidatesInOrderUnderCollisions() {
        List<String> expected = List.of(
                "v1.0.1",
                "v2025.03.01",
                "v2025.03.01.14",
                "v2025.03.01.1405",
                "v2025.03.01.140509",
                "v2025.03.01.140509.123456",
                "v2025.03.01.140509.123456.abc123",
                "v2025.03.01.140509.123456.abc123-2",
                "v2025.03.01.140509.123456.abc123-3");

        List<String> allocated = new ArrayList<>();
        for (int i = 0; i < expected.size(); i++) {
            String next = allocator.allocate("cff", "v1.0.0", TX).version();
            allocated.add(next);
            take("cff", next);
        }

        assertThat(allocated).containsExactlyElementsOf(expected);
    }

    @Test
    void strategiesAreReported() {
        take("cff", "v1.0.1");
        take("cff", "v2025.03.01");
        assertThat(allocator.allocate("cff", "v1.0.0", TX).strategy()).isEqualTo(AllocationStrategy.DATE_HOUR);

        take("cff", "v2025.03.01.14");
        take("cff", "v2025.03.01.1405");
        take("cff", "v2025.03.01.140509");
        take("cff", "v2025.03.01.140509.123456");
        assertThat(allocator.allocate("cff", "v1.0.0", TX).strategy())
                .isEqualTo(AllocationStrategy.TRANSACTION_SUFFIX);
    }

    @Test
    void collisionsAreScopedToAssetName() {
        take("other", "v1.0.1");

        assertThat(allocator.allocate("cff", "v1.0.0", TX).version()).isEqualTo("v1.0.1");
    }

    @Test
    void collisionDetectedAcrossSpellings() {
        take("cff", "1.0.1");

        assertThat(allocator.allocate("cff", "v1.0.0", TX).version()).isEqualTo("v2025.03.01");
    }

    @Test
    void unreachableAuthorityYieldsAbsoluteFallback() {
        gateway.failLookups(new AuthorityException("connection refused"));

        AllocatedVersion allocated = allocator.allocate("cff", "v1.0.0", TX);

        assertThat(allocated.version()).isEqualTo("v2025.03.01.140509.123456.abc123");
        assertThat(allocated.strategy()).isEqualTo(AllocationStrategy.TRANSACTION_SUFFIX);
    }

    @Test
    void missingTransactionIdStillAllocates() {
        gateway.failLookups(new AuthorityException("down"));

        String version = allocator.allocate("cff", null, null).version();

        assertThat(version).matches("v2025\\.03\\.01\\.140509\\.123456\\.[0-9a-f]{6}");
    }

    @Test
    void maxPatchSkipsToDateStamp() {
        AllocatedVersion allocated = allocator.allocate("x", "v1.0.2147483647", "ftx_1");

        assertThat(allocated.version()).isEqualTo("v2025.03.01");
        assertThat(allocated.strategy()).isEqualTo(AllocationStrategy.DATE);
    }

    @Test
    void randomSuffixIsCheckedAfterNumberedSuffixes() {
        AtomicInteger randomChecks = new AtomicInteger();
        useGateway(new InMemoryAuthorityGateway() {
            @Override
            public synchronized Optional<AssetVersion> find(String assetName, List<String> candidates) {
                if (candidates.stream().anyMatch(VersionAllocatorTest::isRandomSuffix)) {
                    randomChecks.incrementAndGet();
                    return Optional.empty();
                }
                return Optional.of(occupied(assetName, candidates.get(0)));
            }
        });

        AllocatedVersion allocated = allocator.allocate("cff", "v1.0.0", TX);

        assertThat(allocated.version()).matches("v2025\\.03\\.01\\.140509\\.123456\\.abc123-[0-9a-f]{8}");
        assertThat(allocated.strategy()).isEqualTo(AllocationStrategy.TRANSACTION_SUFFIX);
        assertThat(randomChecks).hasValue(1);
    }

    @Test
    void everyCandidateTakenStillAllocates() {
        AtomicInteger randomChecks = new AtomicInteger();
        useGateway(new InMemoryAuthorityGateway() {
            @Override
            public synchronized Optional<AssetVersion> find(String assetName, List<String> candidates) {
                if (candidates.stream().anyMatch(VersionAllocatorTest::isRandomSuffix)) {
                    randomChecks.incrementAndGet();
                }
                return Optional.of(occupied(assetName, candidates.get(0)));
            }
        });

        AllocatedVersion allocated = allocator.allocate("cff", "v1.0.0", TX);

        assertThat(allocated.version()).matches("v2025\\.03\\.01\\.140509\\.123456\\.abc123-[0-9a-f]{8}");
        assertThat(randomChecks).hasValue(VersionAllocator.MAX_RANDOM_SUFFIXES);
    }

    private void useGateway(InMemoryAuthorityGateway replacement) {
        gateway = replacement;
        authority = new VersionAuthority(gateway);
        allocator = new VersionAllocator(authority, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static boolean isRandomSuffix(String version) {
        return version.matches(".*\\.abc123-[0-9a-f]{8}");
    }

    private static AssetVersion occupied(String assetName, String version) {
        ObjectNode payload = MAPPER.createObjectNode().put("v", version);
        return new AssetVersion(assetName, AssetType.FRAMEWORK, version, CanonicalJson.hash(payload), payload, NOW);
    }

    @Test
    void candidateListIsDeterministicForFixedClock() {
        List<AllocatedVersion> candidates = allocator.candidates("v3.1",
                NOW.atZone(ZoneOffset.UTC).toLocalDateTime());

        assertThat(candidates).extracting(AllocatedVersion::version).containsExactly(
                "v3.1.1", "v2025.03.01", "v2025.03.01.14", "v2025.03.01.1405",
                "v2025.03.01.140509", "v2025.03.01.140509.123456");
    }
}
