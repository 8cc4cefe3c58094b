package com.libragraph.registry.core.authority;

import com.libragraph.registry.core.dao.AssetVersionDao;
import com.libragraph.registry.core.dao.AssetVersionRecord;
import com.libragraph.registry.types.AssetType;
import com.libragraph.registry.util.CanonicalJson;
import com.libragraph.registry.util.ContentHash;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relational AuthorityGateway over the {@code asset_version} table.
 *
 * <p>Each call runs in its own handle, so every insert or delete commits on its own.
 * A unique-constraint violation (SQLSTATE 23505) is reported as
 * {@link VersionAlreadyExistsException}; everything else as {@link AuthorityException}.
 */
@ApplicationScoped
@IfBuildProperty(name = "registry.authority.type", stringValue = "jdbc", enableIfMissing = true)
public class JdbiAuthorityGateway implements AuthorityGateway {

    private static final Logger log = Logger.getLogger(JdbiAuthorityGateway.class);
    private static final String UNIQUE_VIOLATION = "23505";

    private final Jdbi jdbi;

    @Inject
    public JdbiAuthorityGateway(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    @Override
    public Optional<AssetVersion> find(String assetName, List<String> versions) {
        List<AssetVersionRecord> rows = read("find " + assetName,
                () -> jdbi.withExtension(AssetVersionDao.class,
                        dao -> dao.findByVersions(assetName, versions)));
        for (String candidate : versions) {
            for (AssetVersionRecord row : rows) {
                if (row.version().equals(candidate)) {
                    return Optional.of(toVersion(row));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<AssetVersion> findLatest(String assetName) {
        return read("find latest " + assetName,
                () -> jdbi.withExtension(AssetVersionDao.class, dao -> dao.findLatest(assetName)))
                .map(JdbiAuthorityGateway::toVersion);
    }

    @Override
    public List<AssetVersion> listVersions(String assetName) {
        return read("list " + assetName,
                () -> jdbi.withExtension(AssetVersionDao.class, dao -> dao.findAll(assetName)))
                .stream()
                .map(JdbiAuthorityGateway::toVersion)
                .toList();
    }

    @Override
    public void insert(AssetVersion version) {
        String payload = new String(CanonicalJson.toBytes(version.payload()), StandardCharsets.UTF_8);
        try {
            jdbi.useExtension(AssetVersionDao.class, dao -> dao.insert(
                    version.assetName(),
                    version.assetType().label(),
                    version.version(),
                    version.contentHash().toHex(),
                    payload,
                    version.createdAt()));
            log.debugf("Inserted asset_version %s hash=%s",
                    version.label(), version.contentHash().shortHex());
        } catch (JdbiException e) {
            if (isUniqueViolation(e)) {
                throw new VersionAlreadyExistsException(version.assetName(), version.version());
            }
            throw new AuthorityException("Failed to insert " + version.label(), e);
        }
    }

    @Override
    public boolean delete(String assetName, String version) {
        try {
            int removed = jdbi.withExtension(AssetVersionDao.class,
                    dao -> dao.delete(assetName, version));
            return removed > 0;
        } catch (JdbiException e) {
            throw new AuthorityException("Failed to delete " + assetName + ":" + version, e);
        }
    }

    private static <T> T read(String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (JdbiException e) {
            throw new AuthorityException("Authority lookup failed: " + what, e);
        }
    }

    static boolean isUniqueViolation(Throwable t) {
        for (Throwable cause = t; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private static AssetVersion toVersion(AssetVersionRecord row) {
        return new AssetVersion(
                row.assetName(),
                AssetType.fromLabel(row.assetType()),
                row.version(),
                ContentHash.fromHex(row.contentHash().trim()),
                CanonicalJson.parse(row.payload().getBytes(StandardCharsets.UTF_8)),
                row.createdAt());
    }
}
