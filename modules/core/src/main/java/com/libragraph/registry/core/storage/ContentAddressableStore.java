package com.libragraph.registry.core.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.libragraph.registry.types.AssetType;
import com.libragraph.registry.util.CanonicalJson;
import com.libragraph.registry.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Filesystem content-addressable storage for asset payloads.
 *
 * <p>Layout: {@code {root}/{assetType}/{tier1}/{tier2}/{hash}/}
 * where tier1 = hash[0:2], tier2 = hash[2:4]. Each blob directory holds the
 * canonical {@code payload} plus {@code .metadata} and {@code .provenance} sidecars.
 *
 * <p>Writes are staged in a hidden sibling directory and renamed into place, so a
 * blob directory is either complete or absent. Identical content always lands on the
 * same path; concurrent writers of the same content race on the rename and the
 * loser discards its staging copy.
 */
@ApplicationScoped
public class ContentAddressableStore {

    public static final String PAYLOAD_FILE = "payload";
    public static final String METADATA_FILE = ".metadata";
    public static final String PROVENANCE_FILE = ".provenance";
    public static final String DIRECT_INGESTION = "direct";

    private static final Logger log = Logger.getLogger(ContentAddressableStore.class);
    private static final int HEX_LENGTH = 64;

    private final Path root;
    private final ObjectMapper sidecarMapper;

    @Inject
    public ContentAddressableStore(
            @ConfigProperty(name = "registry.store.root", defaultValue = "asset_storage") String root) {
        this(Path.of(root));
    }

    public ContentAddressableStore(Path root) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        this.sidecarMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path root() {
        return root;
    }

    public ContentHash hash(JsonNode content) {
        return CanonicalJson.hash(content);
    }

    /**
     * Pure function of (hash, type). Does not touch the filesystem.
     */
    public Path pathFor(ContentHash hash, AssetType type) {
        String hex = hash.toHex();
        String tier1 = hex.substring(0, 2);
        String tier2 = hex.substring(2, 4);
        return root.resolve(type.label()).resolve(tier1).resolve(tier2).resolve(hex);
    }

    public StoreResult store(JsonNode content, AssetType type, String assetId,
                             String version, String sourcePath) {
        return store(content, type, assetId, version, sourcePath, DIRECT_INGESTION);
    }

    /**
     * Stores structured content in canonical form.
     */
    public StoreResult store(JsonNode content, AssetType type, String assetId,
                             String version, String sourcePath, String ingestionMethod) {
        return storeBytes(CanonicalJson.toBytes(content), type, assetId, version, sourcePath,
                ingestionMethod);
    }

    /**
     * Stores opaque bytes as-is. The hash is taken over exactly these bytes.
     */
    public StoreResult storeBytes(byte[] canonicalPayload, AssetType type, String assetId,
                                  String version, String sourcePath, String ingestionMethod) {
        ContentHash hash = ContentHash.of(canonicalPayload);
        Path target = pathFor(hash, type);
        if (Files.isDirectory(target)) {
            log.debugf("Blob already stored: type=%s hash=%s", type.label(), hash.shortHex());
            return new StoreResult(hash, target, true);
        }

        Path staging = null;
        try {
            Files.createDirectories(target.getParent());
            staging = Files.createTempDirectory(target.getParent(), "." + hash.toHex() + ".staging-");

            Instant now = Instant.now();
            Files.write(staging.resolve(PAYLOAD_FILE), canonicalPayload);
            sidecarMapper.writeValue(staging.resolve(METADATA_FILE).toFile(), new BlobMetadata(
                    type.label(), assetId, version, now, canonicalPayload.length, hash.toHex()));
            sidecarMapper.writeValue(staging.resolve(PROVENANCE_FILE).toFile(), new BlobProvenance(
                    sourcePath, ingestionMethod, now));

            try {
                Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                if (Files.isDirectory(target)) {
                    // Lost the rename race to an identical write
                    discardStaging(staging);
                    log.debugf("Concurrent store won: type=%s hash=%s", type.label(), hash.shortHex());
                    return new StoreResult(hash, target, true);
                }
                throw e;
            }
            log.infof("Blob stored: type=%s asset=%s version=%s hash=%s size=%d",
                    type.label(), assetId, version, hash.shortHex(), canonicalPayload.length);
            return new StoreResult(hash, target, false);
        } catch (IOException e) {
            if (staging != null) {
                discardStaging(staging);
            }
            throw new StorageException("Failed to store blob: " + hash, e);
        }
    }

    public Optional<byte[]> load(ContentHash hash, AssetType type) {
        Path payload = pathFor(hash, type).resolve(PAYLOAD_FILE);
        if (!Files.exists(payload)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(payload));
        } catch (IOException e) {
            throw new StorageException("Failed to read blob: " + hash, e);
        }
    }

    public Optional<JsonNode> loadJson(ContentHash hash, AssetType type) {
        return load(hash, type).map(CanonicalJson::parse);
    }

    /**
     * Loads a payload and checks it still hashes to its key.
     *
     * @throws IntegrityException if the bytes on disk no longer match {@code hash}
     */
    public Optional<byte[]> loadVerified(ContentHash hash, AssetType type) {
        Optional<byte[]> bytes = load(hash, type);
        if (bytes.isPresent()) {
            ContentHash actual = ContentHash.of(bytes.get());
            if (!actual.equals(hash)) {
                log.errorf("Integrity violation: type=%s expected=%s actual=%s path=%s",
                        type.label(), hash, actual, pathFor(hash, type));
                throw new IntegrityException(type, hash, actual);
            }
        }
        return bytes;
    }

    /**
     * Reloads and rehashes a blob. Returns false when the blob is absent or corrupt.
     */
    public boolean verify(ContentHash hash, AssetType type) {
        return load(hash, type)
                .map(bytes -> ContentHash.of(bytes).equals(hash))
                .orElse(false);
    }

    public Optional<StoredBlob> describe(ContentHash hash, AssetType type) {
        Path dir = pathFor(hash, type);
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        try {
            BlobMetadata metadata = sidecarMapper.readValue(
                    dir.resolve(METADATA_FILE).toFile(), BlobMetadata.class);
            BlobProvenance provenance = sidecarMapper.readValue(
                    dir.resolve(PROVENANCE_FILE).toFile(), BlobProvenance.class);
            return Optional.of(new StoredBlob(hash, dir, metadata, provenance));
        } catch (IOException e) {
            throw new StorageException("Failed to read sidecars for blob: " + hash, e);
        }
    }

    /**
     * Lists metadata of every blob stored under {@code type}, ordered by hash.
     */
    public List<BlobMetadata> list(AssetType type) {
        Path typeRoot = root.resolve(type.label());
        if (!Files.isDirectory(typeRoot)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(typeRoot, 3)) {
            List<Path> blobDirs = paths
                    .filter(Files::isDirectory)
                    .filter(p -> isHashName(p.getFileName().toString()))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
            List<BlobMetadata> result = new ArrayList<>(blobDirs.size());
            for (Path dir : blobDirs) {
                Path metadata = dir.resolve(METADATA_FILE);
                if (Files.exists(metadata)) {
                    result.add(sidecarMapper.readValue(metadata.toFile(), BlobMetadata.class));
                }
            }
            return result;
        } catch (IOException e) {
            throw new StorageException("Failed to list blobs for type: " + type.label(), e);
        }
    }

    private static boolean isHashName(String name) {
        if (name.length() != HEX_LENGTH) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (Character.digit(name.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private void discardStaging(Path staging) {
        try {
            deleteRecursively(staging);
        } catch (IOException cleanup) {
            log.warnf(cleanup, "Failed to remove staging directory %s", staging);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                    throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path d, IOException exc)
                    throws IOException {
                Files.delete(d);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
