package com.libragraph.registry.core.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.registry.types.AssetType;
import com.libragraph.registry.util.ContentHash;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class ContentAddressableStoreTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path root;

    private ContentAddressableStore store;

    @BeforeEach
    void setUp() {
        store = new ContentAddressableStore(root);
    }

    private static ObjectNode framework(String name, int axes) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", name);
        node.put("axes", axes);
        node.putArray("anchors").add("care").add("harm");
        return node;
    }

    @Test
    void hashIgnoresKeyOrder() {
        ObjectNode a = MAPPER.createObjectNode().put("x", 1).put("y", 2);
        ObjectNode b = MAPPER.createObjectNode().put("y", 2).put("x", 1);

        assertThat(store.hash(a)).isEqualTo(store.hash(b));
        assertThat(store.hash(a).toHex()).hasSize(64);
    }

    @Test
    void pathIsShardedByHashPrefix() {
        ContentHash hash = store.hash(framework("mft", 5));
        String hex = hash.toHex();

        Path path = store.pathFor(hash, AssetType.FRAMEWORK);

        assertThat(path).isEqualTo(root.resolve("framework")
                .resolve(hex.substring(0, 2)).resolve(hex.substring(2, 4)).resolve(hex));
        assertThat(path).doesNotExist();
    }

    @Test
    void storeWritesPayloadAndSidecars() throws Exception {
        ObjectNode content = framework("mft", 5);

        StoreResult result = store.store(content, AssetType.FRAMEWORK, "mft", "v1.0.0", "/ws/mft/framework.yaml");

        assertThat(result.alreadyExisted()).isFalse();
        assertThat(result.path()).isEqualTo(store.pathFor(result.hash(), AssetType.FRAMEWORK));
        assertThat(result.path().resolve(ContentAddressableStore.PAYLOAD_FILE)).isRegularFile();
        assertThat(result.path().resolve(ContentAddressableStore.METADATA_FILE)).isRegularFile();
        assertThat(result.path().resolve(ContentAddressableStore.PROVENANCE_FILE)).isRegularFile();

        JsonNode metadata = MAPPER.readTree(result.path().resolve(ContentAddressableStore.METADATA_FILE).toFile());
        assertThat(metadata.get("asset_type").asText()).isEqualTo("framework");
        assertThat(metadata.get("asset_id").asText()).isEqualTo("mft");
        assertThat(metadata.get("version").asText()).isEqualTo("v1.0.0");
        assertThat(metadata.get("content_hash").asText()).isEqualTo(result.hash().toHex());
        assertThat(metadata.get("size").asLong())
                .isEqualTo(Files.size(result.path().resolve(ContentAddressableStore.PAYLOAD_FILE)));
        assertThat(metadata.get("created_at").isTextual()).isTrue();

        JsonNode provenance = MAPPER.readTree(result.path().resolve(ContentAddressableStore.PROVENANCE_FILE).toFile());
        assertThat(provenance.get("source_path").asText()).isEqualTo("/ws/mft/framework.yaml");
        assertThat(provenance.get("ingestion_method").asText()).isEqualTo(ContentAddressableStore.DIRECT_INGESTION);
    }

    @Test
    void storeIsIdempotent() throws Exception {
        ObjectNode content = framework("mft", 5);

        StoreResult first = store.store(content, AssetType.FRAMEWORK, "mft", "v1.0.0", "a");
        byte[] metadataBefore = Files.readAllBytes(first.path().resolve(ContentAddressableStore.METADATA_FILE));
        StoreResult second = store.store(content, AssetType.FRAMEWORK, "mft", "v9.9.9", "b");

        assertThat(second.alreadyExisted()).isTrue();
        assertThat(second.hash()).isEqualTo(first.hash());
        assertThat(second.path()).isEqualTo(first.path());
        assertThat(Files.readAllBytes(first.path().resolve(ContentAddressableStore.METADATA_FILE)))
                .isEqualTo(metadataBefore);
    }

    @Test
    void sameContentUnderDifferentTypesIsStoredSeparately() {
        ObjectNode content = framework("shared", 1);

        StoreResult asFramework = store.store(content, AssetType.FRAMEWORK, "shared", "v1", null);
        StoreResult asExperiment = store.store(content, AssetType.EXPERIMENT, "shared", "v1", null);

        assertThat(asExperiment.alreadyExisted()).isFalse();
        assertThat(asExperiment.hash()).isEqualTo(asFramework.hash());
        assertThat(asExperiment.path()).isNotEqualTo(asFramework.path());
    }

    @Test
    void concurrentIdenticalStoresProduceOneBlob() throws Exception {
        ObjectNode content = framework("race", 3);
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<StoreResult>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                Callable<StoreResult> call = () -> {
                    start.await();
                    return store.store(content, AssetType.FRAMEWORK, "race", "v1.0.0", "src");
                };
                futures.add(pool.submit(call));
            }
            start.countDown();

            List<StoreResult> results = new ArrayList<>();
            for (Future<StoreResult> f : futures) {
                results.add(f.get());
            }

            assertThat(results).extracting(StoreResult::hash).containsOnly(results.get(0).hash());
            assertThat(results).filteredOn(r -> !r.alreadyExisted()).hasSizeLessThanOrEqualTo(1);
        } finally {
            pool.shutdownNow();
        }

        Path shard = store.pathFor(store.hash(content), AssetType.FRAMEWORK).getParent();
        try (Stream<Path> entries = Files.list(shard)) {
            assertThat(entries.toList()).hasSize(1);
        }
        assertThat(store.verify(store.hash(content), AssetType.FRAMEWORK)).isTrue();
    }

    @Test
    void loadJsonReturnsCanonicalContent() {
        ObjectNode content = framework("mft", 5);
        StoreResult result = store.store(content, AssetType.FRAMEWORK, "mft", "v1", null);

        assertThat(store.loadJson(result.hash(), AssetType.FRAMEWORK)).contains(content);
        assertThat(new String(store.load(result.hash(), AssetType.FRAMEWORK).orElseThrow(), StandardCharsets.UTF_8))
                .startsWith("{\"anchors\":");
    }

    @Test
    void loadMissingIsEmpty() {
        ContentHash hash = ContentHash.of("nothing".getBytes(StandardCharsets.UTF_8));

        assertThat(store.load(hash, AssetType.FRAMEWORK)).isEmpty();
        assertThat(store.verify(hash, AssetType.FRAMEWORK)).isFalse();
        assertThat(store.describe(hash, AssetType.FRAMEWORK)).isEmpty();
    }

    @Test
    void corruptedBlobFailsVerification() throws Exception {
        StoreResult result = store.store(framework("mft", 5), AssetType.FRAMEWORK, "mft", "v1", null);
        assertThat(store.verify(result.hash(), AssetType.FRAMEWORK)).isTrue();

        Files.writeString(result.path().resolve(ContentAddressableStore.PAYLOAD_FILE), "{\"tampered\":true}");

        assertThat(store.verify(result.hash(), AssetType.FRAMEWORK)).isFalse();
        assertThatThrownBy(() -> store.loadVerified(result.hash(), AssetType.FRAMEWORK))
                .isInstanceOf(IntegrityException.class)
                .satisfies(e -> assertThat(((IntegrityException) e).expected()).isEqualTo(result.hash()));
    }

    @Test
    void describeReadsSidecarsBack() {
        StoreResult result = store.store(framework("mft", 5), AssetType.FRAMEWORK, "mft", "v2.0.0",
                "/src/mft.json", "transaction_import");

        StoredBlob blob = store.describe(result.hash(), AssetType.FRAMEWORK).orElseThrow();

        assertThat(blob.contentHash()).isEqualTo(result.hash());
        assertThat(blob.storagePath()).isEqualTo(result.path());
        assertThat(blob.metadata().assetId()).isEqualTo("mft");
        assertThat(blob.metadata().version()).isEqualTo("v2.0.0");
        assertThat(blob.provenance().ingestionMethod()).isEqualTo("transaction_import");
        assertThat(blob.provenance().sourcePath()).isEqualTo("/src/mft.json");
    }

    @Test
    void listEnumeratesBlobsOfOneType() {
        store.store(framework("a", 1), AssetType.FRAMEWORK, "a", "v1", null);
        store.store(framework("b", 2), AssetType.FRAMEWORK, "b", "v1", null);
        store.store(framework("c", 3), AssetType.EXPERIMENT, "c", "v1", null);

        List<BlobMetadata> frameworks = store.list(AssetType.FRAMEWORK);

        assertThat(frameworks).extracting(BlobMetadata::assetId).containsExactlyInAnyOrder("a", "b");
        assertThat(frameworks).extracting(BlobMetadata::contentHash).isSorted();
        assertThat(store.list(AssetType.PROMPT_TEMPLATE)).isEmpty();
    }

    @Test
    void storeBytesHashesRawBytes() {
        byte[] raw = "not json at all".getBytes(StandardCharsets.UTF_8);

        StoreResult result = store.storeBytes(raw, AssetType.PROMPT_TEMPLATE, "tpl", "v1", null, "direct");

        assertThat(result.hash()).isEqualTo(ContentHash.of(raw));
        assertThat(store.load(result.hash(), AssetType.PROMPT_TEMPLATE)).hasValueSatisfying(
                bytes -> assertThat(bytes).isEqualTo(raw));
    }
}
