package com.libragraph.registry.core.version;

import com.libragraph.registry.core.authority.AuthorityException;
import com.libragraph.registry.core.authority.VersionAuthority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Mints a version string that is not yet registered for a given asset.
 *
 * <p>Candidates, each checked against the authority for that asset name only:
 * <ol>
 *   <li>patch increment of the current version ({@code v1.0.0 -> v1.0.1})</li>
 *   <li>{@code vYYYY.MM.DD}</li>
 *   <li>{@code vYYYY.MM.DD.HH}, {@code .HHMM}, {@code .HHMMSS}</li>
 *   <li>{@code vYYYY.MM.DD.HHMMSS.<micros>}</li>
 *   <li>the previous candidate plus a transaction id fragment, then numbered suffixes,
 *       then random 8-hex suffixes</li>
 * </ol>
 * A patch component already at {@code Integer.MAX_VALUE} has no increment; allocation starts at the date.
 * Allocation never fails. If the authority cannot answer existence checks, the
 * transaction-suffixed candidate is returned unchecked.
 */
@ApplicationScoped
public class VersionAllocator {

    private static final Logger log = Logger.getLogger(VersionAllocator.class);

    static final int MAX_NUMBERED_SUFFIXES = 1000;
    static final int MAX_RANDOM_SUFFIXES = 10;
    private static final int TRANSACTION_FRAGMENT_LENGTH = 6;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy.MM.dd");
    private static final DateTimeFormatter HOUR = DateTimeFormatter.ofPattern("HH");
    private static final DateTimeFormatter HOUR_MINUTE = DateTimeFormatter.ofPattern("HHmm");
    private static final DateTimeFormatter HOUR_MINUTE_SECOND = DateTimeFormatter.ofPattern("HHmmss");

    private final VersionAuthority authority;
    private final Clock clock;

    @Inject
    public VersionAllocator(VersionAuthority authority) {
        this(authority, Clock.systemDefaultZone());
    }

    public VersionAllocator(VersionAuthority authority, Clock clock) {
        this.authority = authority;
        this.clock = clock;
    }

    /**
     * @param currentVersion version the new one derives from; may be null or unparseable
     * @param transactionId  id of the requesting transaction, used only by the last-resort candidate
     */
    public AllocatedVersion allocate(String assetName, String currentVersion, String transactionId) {
        LocalDateTime now = LocalDateTime.now(clock);
        String suffixed = microsecondCandidate(now) + "." + transactionFragment(transactionId);

        try {
            for (AllocatedVersion candidate : candidates(currentVersion, now)) {
                if (!authority.exists(assetName, candidate.version())) {
                    log.debugf("Allocated %s:%s via %s", assetName, candidate.version(), candidate.strategy());
                    return candidate;
                }
                log.debugf("Version candidate taken: %s:%s (%s)", assetName, candidate.version(), candidate.strategy());
            }

            if (!authority.exists(assetName, suffixed)) {
                return new AllocatedVersion(suffixed, AllocationStrategy.TRANSACTION_SUFFIX);
            }
            for (int n = 2; n <= MAX_NUMBERED_SUFFIXES; n++) {
                String numbered = suffixed + "-" + n;
                if (!authority.exists(assetName, numbered)) {
                    return new AllocatedVersion(numbered, AllocationStrategy.TRANSACTION_SUFFIX);
                }
            }
            String random = null;
            for (int i = 0; i < MAX_RANDOM_SUFFIXES; i++) {
                random = suffixed + "-" + UUID.randomUUID().toString().substring(0, 8);
                if (!authority.exists(assetName, random)) {
                    log.warnf("Exhausted %d numbered suffixes for %s; using %s",
                            MAX_NUMBERED_SUFFIXES, assetName, random);
                    return new AllocatedVersion(random, AllocationStrategy.TRANSACTION_SUFFIX);
                }
            }
            log.warnf("Exhausted numbered and random suffixes for %s; using %s unchecked", assetName, random);
            return new AllocatedVersion(random, AllocationStrategy.TRANSACTION_SUFFIX);
        } catch (AuthorityException e) {
            log.warnf(e, "Version existence check failed for %s; falling back to %s", assetName, suffixed);
            return new AllocatedVersion(suffixed, AllocationStrategy.TRANSACTION_SUFFIX);
        }
    }

    /**
     * Ordered readable candidates before the transaction-suffixed fallback.
     */
    List<AllocatedVersion> candidates(String currentVersion, LocalDateTime now) {
        List<AllocatedVersion> candidates = new ArrayList<>();
        PatchVersion.parse(currentVersion).flatMap(PatchVersion::nextPatch).ifPresent(v ->
                candidates.add(new AllocatedVersion(v.toString(), AllocationStrategy.PATCH_INCREMENT)));

        String date = dateCandidate(now);
        candidates.add(new AllocatedVersion(date, AllocationStrategy.DATE));
        candidates.add(new AllocatedVersion(date + "." + HOUR.format(now), AllocationStrategy.DATE_HOUR));
        candidates.add(new AllocatedVersion(date + "." + HOUR_MINUTE.format(now), AllocationStrategy.DATE_HOUR_MINUTE));
        candidates.add(new AllocatedVersion(date + "." + HOUR_MINUTE_SECOND.format(now),
                AllocationStrategy.DATE_HOUR_MINUTE_SECOND));
        candidates.add(new AllocatedVersion(microsecondCandidate(now), AllocationStrategy.MICROSECOND));
        return candidates;
    }

    private static String dateCandidate(LocalDateTime now) {
        return "v" + DATE.format(now);
    }

    private static String microsecondCandidate(LocalDateTime now) {
        return dateCandidate(now) + "." + HOUR_MINUTE_SECOND.format(now) + "." + (now.getNano() / 1000);
    }

    private static String transactionFragment(String transactionId) {
        if (transactionId == null || transactionId.isBlank()) {
            return UUID.randomUUID().toString().replace("-", "").substring(0, TRANSACTION_FRAGMENT_LENGTH);
        }
        return transactionId.length() <= TRANSACTION_FRAGMENT_LENGTH
                ? transactionId
                : transactionId.substring(transactionId.length() - TRANSACTION_FRAGMENT_LENGTH);
    }
}
