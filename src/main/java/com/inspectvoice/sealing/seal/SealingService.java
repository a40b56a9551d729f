package com.inspectvoice.sealing.seal;

import com.inspectvoice.sealing.archive.BundlePaths;
import com.inspectvoice.sealing.crypto.ContentHasher;
import com.inspectvoice.sealing.crypto.SigningKey;
import com.inspectvoice.sealing.crypto.SigningKeyResolver;
import com.inspectvoice.sealing.domain.BundleFile;
import com.inspectvoice.sealing.domain.ManifestFileEntry;
import com.inspectvoice.sealing.domain.SealedBundle;
import com.inspectvoice.sealing.domain.SealedExportRow;
import com.inspectvoice.sealing.ledger.ChainConflictException;
import com.inspectvoice.sealing.ledger.ChainLedgerFacade;
import com.inspectvoice.sealing.ledger.LedgerException;
import com.inspectvoice.sealing.storage.BundleStorageFacade;
import com.inspectvoice.sealing.storage.StorageException;
import com.inspectvoice.sealing.util.AlertLogger;
import com.inspectvoice.sealing.util.SealingMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Seals exports into tamper-evident bundles and links them into the tenant chain.
 *
 * <p><b>Pipeline:</b>
 * <ol>
 *   <li>validate input and resolve the active signing key (no side effects yet)</li>
 *   <li>hash every file</li>
 *   <li>under the tenant lock: read the chain head, package, upload, append the ledger row</li>
 * </ol>
 *
 * <p><b>Failure semantics:</b>
 * <ul>
 *   <li>nothing reaches storage before the bundle is fully packaged</li>
 *   <li>an upload failure leaves no ledger row</li>
 *   <li>a ledger failure after upload leaves an orphaned, self-verifying archive, which is alerted</li>
 *   <li>a lost compare-and-append is retried with a fresh predecessor and a new bundle id</li>
 * </ul>
 * The ledger row is the commit point.
 */
@ApplicationScoped
public class SealingService {

    private static final Logger LOG = Logger.getLogger(SealingService.class);

    @ConfigProperty(name = "app.sealing.max-chain-attempts", defaultValue = "3")
    int maxChainAttempts;

    @ConfigProperty(name = "app.storage.upload.max-attempts", defaultValue = "3")
    int maxUploadAttempts;

    @ConfigProperty(name = "app.storage.upload.initial-backoff-ms", defaultValue = "200")
    long initialBackoffMs;

    @Inject
    SigningKeyResolver signingKeyResolver;

    @Inject
    BundleSealer bundleSealer;

    @Inject
    BundleStorageFacade bundleStorage;

    @Inject
    ChainLedgerFacade chainLedger;

    @Inject
    SealingMetrics sealingMetrics;

    Clock clock = Clock.systemUTC();

    Sleeper sleeper = Thread::sleep;

    private final Map<String, TenantLock> tenantLocks = new ConcurrentHashMap<>();

    /** Entries exist only while some thread holds or waits for the tenant lock. */
    private static final class TenantLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    /**
     * Seals the request and records it as the new head of the tenant chain.
     *
     * @return the persisted ledger row
     * @throws SealingException on invalid input, missing key, storage or ledger failure,
     *                          or when the chain head keeps moving
     */
    public SealedExportRow seal(SealRequest request) {
        long startNanos = System.nanoTime();
        try {
            validate(request);
            SigningKey signingKey = signingKeyResolver.activeKey();
            List<ManifestFileEntry> fileEntries = hashFiles(request.getFiles());

            SealedExportRow row = sealUnderTenantLock(request, fileEntries, signingKey);

            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            sealingMetrics.recordSealSuccess(durationMs, row.getTotalBytes());
            LOG.infof("Sealed bundle %s for tenant %s: type=%s, files=%d, bytes=%d, sequence=%d, %dms",
                    row.getBundleId(), row.getTenantId(), row.getExportType(), row.getFileCount(),
                    row.getTotalBytes(), row.getSequence(), durationMs);
            return row;
        } catch (SealingException e) {
            sealingMetrics.incrementSealFailure(e.getFailure());
            throw e;
        }
    }

    private SealedExportRow sealUnderTenantLock(SealRequest request,
                                                List<ManifestFileEntry> fileEntries,
                                                SigningKey signingKey) {
        String tenantId = request.getTenantId();
        TenantLock lock = acquireTenantLock(tenantId);
        try {
            for (int attempt = 1; attempt <= maxChainAttempts; attempt++) {
                String prevBundleHash = readChainHead(tenantId);
                String bundleId = UUID.randomUUID().toString();

                SealedBundle bundle = bundleSealer.seal(bundleId, request, fileEntries, prevBundleHash, signingKey);
                String storageKey = bundleStorage.objectKey(tenantId, bundleId);
                upload(bundle, storageKey, request);

                SealedExportRow row = SealedExportRow.forBundle(bundle, storageKey, clock.instant());
                try {
                    return chainLedger.append(row);
                } catch (ChainConflictException e) {
                    sealingMetrics.incrementChainConflict();
                    sealingMetrics.incrementOrphanedArchive();
                    AlertLogger.chainConflict(tenantId, bundleId, attempt, maxChainAttempts);
                    AlertLogger.orphanedArchive(bundleId, tenantId, storageKey, e.getMessage());
                } catch (LedgerException e) {
                    sealingMetrics.incrementOrphanedArchive();
                    AlertLogger.orphanedArchive(bundleId, tenantId, storageKey, e.getMessage());
                    throw new SealingException(SealingException.Failure.LEDGER_FAILED,
                            "Ledger write failed after upload; archive orphaned at " + storageKey,
                            bundleId, storageKey, e);
                }
            }
        } finally {
            releaseTenantLock(tenantId, lock);
        }
        throw new SealingException(SealingException.Failure.CHAIN_CONTENTION,
                "Chain head for tenant " + tenantId + " kept moving after " + maxChainAttempts + " attempts");
    }

    private String readChainHead(String tenantId) {
        try {
            Optional<SealedExportRow> latest = chainLedger.findLatest(tenantId);
            return latest.map(SealedExportRow::getManifestSha256).orElse(null);
        } catch (LedgerException e) {
            throw new SealingException(SealingException.Failure.LEDGER_FAILED,
                    "Could not read chain head for tenant " + tenantId, e);
        }
    }

    private void upload(SealedBundle bundle, String storageKey, SealRequest request) {
        Map<String, String> metadata = Map.of(
                "bundle_id", bundle.getBundleId(),
                "export_type", request.getExportType().getWireValue(),
                "tenant_id", request.getTenantId());
        byte[] archive = bundle.getArchiveBytes();

        long backoffMs = initialBackoffMs;
        for (int attempt = 1; ; attempt++) {
            try {
                bundleStorage.put(storageKey, archive, metadata);
                return;
            } catch (StorageException e) {
                if (attempt >= maxUploadAttempts) {
                    LOG.errorf(e, "Upload of bundle %s to %s failed after %d attempts",
                            bundle.getBundleId(), storageKey, attempt);
                    throw new SealingException(SealingException.Failure.STORAGE_FAILED,
                            "Upload failed after " + attempt + " attempts: " + e.getMessage(),
                            bundle.getBundleId(), null, e);
                }
                sealingMetrics.incrementUploadRetry();
                LOG.warnf("Upload of bundle %s failed (attempt %d/%d), retrying in %dms: %s",
                        bundle.getBundleId(), attempt, maxUploadAttempts, backoffMs, e.getMessage());
                try {
                    sleeper.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SealingException(SealingException.Failure.STORAGE_FAILED,
                            "Interrupted while retrying upload", bundle.getBundleId(), null, ie);
                }
                backoffMs *= 2;
            }
        }
    }

    private static List<ManifestFileEntry> hashFiles(List<BundleFile> files) {
        List<ManifestFileEntry> entries = new ArrayList<>(files.size());
        for (BundleFile file : files) {
            entries.add(new ManifestFileEntry(
                    file.getPath(),
                    ContentHasher.sha256Hex(file.getData()),
                    file.getLength(),
                    file.getContentType()));
        }
        return List.copyOf(entries);
    }

    static void validate(SealRequest request) {
        if (request == null) {
            throw invalid("request is required");
        }
        if (request.getTenantId() == null || request.getTenantId().isBlank()) {
            throw invalid("tenant_id is required");
        }
        if (request.getExportType() == null) {
            throw invalid("export_type is required");
        }
        if (request.getGeneratedBy() == null
                || request.getGeneratedBy().getUserId() == null
                || request.getGeneratedBy().getUserId().isBlank()) {
            throw invalid("generated_by.user_id is required");
        }
        if (request.getFiles().isEmpty()) {
            throw invalid("at least one file is required");
        }

        Set<String> seen = new HashSet<>();
        for (BundleFile file : request.getFiles()) {
            try {
                BundlePaths.requireSafe(file.getPath());
            } catch (IllegalArgumentException e) {
                throw invalid("invalid file path: " + e.getMessage());
            }
            if (BundlePaths.isReserved(file.getPath())) {
                throw invalid("file path is reserved: " + file.getPath());
            }
            if (!seen.add(file.getPath())) {
                throw invalid("duplicate file path: " + file.getPath());
            }
            if (file.getContentType() == null || file.getContentType().isBlank()) {
                throw invalid("content_type is required for " + file.getPath());
            }
        }
    }

    private static SealingException invalid(String message) {
        return new SealingException(SealingException.Failure.INVALID_INPUT, message);
    }

    private TenantLock acquireTenantLock(String tenantId) {
        TenantLock tenantLock = tenantLocks.compute(tenantId, (id, existing) -> {
            TenantLock held = existing != null ? existing : new TenantLock();
            held.users++;
            return held;
        });
        tenantLock.lock.lock();
        return tenantLock;
    }

    private void releaseTenantLock(String tenantId, TenantLock tenantLock) {
        tenantLock.lock.unlock();
        tenantLocks.computeIfPresent(tenantId, (id, held) -> --held.users == 0 ? null : held);
    }

    int tenantLockCount() {
        return tenantLocks.size();
    }
}
