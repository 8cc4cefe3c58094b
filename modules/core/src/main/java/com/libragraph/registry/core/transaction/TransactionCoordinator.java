package com.libragraph.registry.core.transaction;

import com.libragraph.registry.core.authority.ChangeDetector;
import com.libragraph.registry.core.authority.VersionAuthority;
import com.libragraph.registry.core.resolve.AssetFileReader;
import com.libragraph.registry.core.resolve.AssetFileResolver;
import com.libragraph.registry.core.storage.ContentAddressableStore;
import com.libragraph.registry.core.version.VersionAllocator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Opens asset transactions over the shared store and authority.
 */
@ApplicationScoped
public class TransactionCoordinator {

    private static final Logger log = Logger.getLogger(TransactionCoordinator.class);
    private static final DateTimeFormatter ID_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ContentAddressableStore store;
    private final VersionAuthority authority;
    private final ChangeDetector changeDetector;
    private final VersionAllocator allocator;
    private final AssetFileResolver resolver;
    private final AssetFileReader reader;
    private final Clock clock;

    @Inject
    public TransactionCoordinator(ContentAddressableStore store, VersionAuthority authority,
                                  ChangeDetector changeDetector, VersionAllocator allocator,
                                  AssetFileResolver resolver, AssetFileReader reader) {
        this(store, authority, changeDetector, allocator, resolver, reader, Clock.systemDefaultZone());
    }

    public TransactionCoordinator(ContentAddressableStore store, VersionAuthority authority,
                                  ChangeDetector changeDetector, VersionAllocator allocator,
                                  AssetFileResolver resolver, AssetFileReader reader, Clock clock) {
        this.store = store;
        this.authority = authority;
        this.changeDetector = changeDetector;
        this.allocator = allocator;
        this.resolver = resolver;
        this.reader = reader;
        this.clock = clock;
    }

    public AssetTransaction begin() {
        return begin(newTransactionId());
    }

    public AssetTransaction begin(String transactionId) {
        if (transactionId == null || transactionId.isBlank()) {
            throw new IllegalArgumentException("transactionId cannot be blank");
        }
        AssetTransaction tx = new AssetTransaction(transactionId, clock.instant(), this);
        log.infof("Transaction started: %s", transactionId);
        return tx;
    }

    /** {@code ftx_yyyyMMdd_HHmmss_<6 hex>} */
    String newTransactionId() {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 6);
        return "ftx_" + ID_STAMP.format(LocalDateTime.now(clock)) + "_" + random;
    }

    ContentAddressableStore store() {
        return store;
    }

    VersionAuthority authority() {
        return authority;
    }

    ChangeDetector changeDetector() {
        return changeDetector;
    }

    VersionAllocator allocator() {
        return allocator;
    }

    AssetFileResolver resolver() {
        return resolver;
    }

    AssetFileReader reader() {
        return reader;
    }

    Clock clock() {
        return clock;
    }
}
