package com.inspectvoice.sealing.util;

import com.inspectvoice.sealing.seal.SealingException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SealingMetricsTest {

    @Test
    void snapshotExposesEveryCounter() {
        SealingMetrics metrics = new SealingMetrics();
        metrics.recordSealSuccess(42, 1000);
        metrics.recordSealSuccess(7, 500);
        metrics.incrementSealFailure(SealingException.Failure.STORAGE_FAILED);
        metrics.incrementUploadRetry();
        metrics.incrementChainConflict();
        metrics.incrementOrphanedArchive();
        metrics.recordVerification("valid");
        metrics.recordVerification("valid");
        metrics.recordVerification("file_hash_mismatch");

        Map<String, Long> snapshot = metrics.snapshot();

        assertThat(snapshot)
                .containsEntry("seal_success_total", 2L)
                .containsEntry("seal_failure_storage_failed_total", 1L)
                .containsEntry("seal_failure_invalid_input_total", 0L)
                .containsEntry("upload_retry_total", 1L)
                .containsEntry("chain_conflict_total", 1L)
                .containsEntry("orphaned_archive_total", 1L)
                .containsEntry("seal_duration_ms_last", 7L)
                .containsEntry("seal_bytes_total", 1500L)
                .containsEntry("verification_valid_total", 2L)
                .containsEntry("verification_file_hash_mismatch_total", 1L)
                .containsEntry("verify_rate_limited_total", 0L);
        assertThat(metrics.getVerificationTotal("unknown_key")).isZero();
    }
}
