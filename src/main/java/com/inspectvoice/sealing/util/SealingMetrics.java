package com.inspectvoice.sealing.util;

import com.inspectvoice.sealing.seal.SealingException;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lightweight in-process counters for sealing and verification.
 * <p>
 * Exposed via {@code /v1/manage/metrics}.
 */
@ApplicationScoped
public class SealingMetrics {

    private final AtomicLong sealSuccessTotal = new AtomicLong();
    private final Map<SealingException.Failure, AtomicLong> sealFailureTotals = new EnumMap<>(SealingException.Failure.class);
    private final AtomicLong uploadRetryTotal = new AtomicLong();
    private final AtomicLong chainConflictTotal = new AtomicLong();
    private final AtomicLong orphanedArchiveTotal = new AtomicLong();
    private final AtomicLong sealDurationMsLast = new AtomicLong();
    private final AtomicLong sealBytesTotal = new AtomicLong();

    private final Map<String, AtomicLong> verificationTotals = new ConcurrentHashMap<>();
    private final AtomicLong verifyRateLimitedTotal = new AtomicLong();

    public SealingMetrics() {
        for (SealingException.Failure failure : SealingException.Failure.values()) {
            sealFailureTotals.put(failure, new AtomicLong());
        }
    }

    public void recordSealSuccess(long durationMs, long archiveBytes) {
        sealSuccessTotal.incrementAndGet();
        sealDurationMsLast.set(durationMs);
        sealBytesTotal.addAndGet(archiveBytes);
    }

    public void incrementSealFailure(SealingException.Failure failure) {
        sealFailureTotals.get(failure).incrementAndGet();
    }

    public void incrementUploadRetry() {
        uploadRetryTotal.incrementAndGet();
    }

    public void incrementChainConflict() {
        chainConflictTotal.incrementAndGet();
    }

    public void incrementOrphanedArchive() {
        orphanedArchiveTotal.incrementAndGet();
    }

    public void recordVerification(String reasonCode) {
        verificationTotals.computeIfAbsent(reasonCode, k -> new AtomicLong()).incrementAndGet();
    }

    public void incrementVerifyRateLimited() {
        verifyRateLimitedTotal.incrementAndGet();
    }

    public long getSealSuccessTotal() {
        return sealSuccessTotal.get();
    }

    public long getSealFailureTotal(SealingException.Failure failure) {
        return sealFailureTotals.get(failure).get();
    }

    public long getChainConflictTotal() {
        return chainConflictTotal.get();
    }

    public long getUploadRetryTotal() {
        return uploadRetryTotal.get();
    }

    public long getOrphanedArchiveTotal() {
        return orphanedArchiveTotal.get();
    }

    public long getVerificationTotal(String reasonCode) {
        AtomicLong counter = verificationTotals.get(reasonCode);
        return counter == null ? 0L : counter.get();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("seal_success_total", sealSuccessTotal.get());
        for (Map.Entry<SealingException.Failure, AtomicLong> entry : sealFailureTotals.entrySet()) {
            m.put("seal_failure_" + entry.getKey().name().toLowerCase() + "_total", entry.getValue().get());
        }
        m.put("upload_retry_total", uploadRetryTotal.get());
        m.put("chain_conflict_total", chainConflictTotal.get());
        m.put("orphaned_archive_total", orphanedArchiveTotal.get());
        m.put("seal_duration_ms_last", sealDurationMsLast.get());
        m.put("seal_bytes_total", sealBytesTotal.get());

        Map<String, AtomicLong> byReason = new TreeMap<>(verificationTotals);
        for (Map.Entry<String, AtomicLong> entry : byReason.entrySet()) {
            m.put("verification_" + entry.getKey() + "_total", entry.getValue().get());
        }
        m.put("verify_rate_limited_total", verifyRateLimitedTotal.get());
        return m;
    }
}
