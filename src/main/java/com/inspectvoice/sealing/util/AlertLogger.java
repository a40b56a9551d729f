package com.inspectvoice.sealing.util;

import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Utility for sending structured alerts to monitoring systems.
 * <p>
 * Every line starts with {@code ALERT:} so log aggregators can match on it. Key
 * material never appears in an alert.
 */
public final class AlertLogger {

    private AlertLogger() {}

    private static final Logger LOG = Logger.getLogger(AlertLogger.class);

    /**
     * An archive reached storage but has no ledger row. It still verifies on its own
     * and is never part of the tenant chain.
     */
    public static void orphanedArchive(String bundleId, String tenantId, String storageKey, String error) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "ORPHANED_ARCHIVE");
        alertData.put("severity", "CRITICAL");
        alertData.put("bundle_id", bundleId);
        alertData.put("tenant_id", tenantId);
        alertData.put("storage_key", storageKey);
        alertData.put("error", error);

        LOG.errorf("ALERT: Orphaned sealed archive bundle=%s tenant=%s key=%s. Error: %s",
                bundleId, tenantId, storageKey, error);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void chainConflict(String tenantId, String bundleId, int attempt, int maxAttempts) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "CHAIN_CONFLICT");
        alertData.put("severity", "WARNING");
        alertData.put("tenant_id", tenantId);
        alertData.put("bundle_id", bundleId);
        alertData.put("attempt", attempt);
        alertData.put("max_attempts", maxAttempts);

        LOG.warnf("ALERT: Chain head moved for tenant %s while sealing %s (attempt %d/%d)",
                tenantId, bundleId, attempt, maxAttempts);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void tamperDetected(String bundleId, String reason, String detail) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "TAMPER_DETECTED");
        alertData.put("severity", "CRITICAL");
        alertData.put("bundle_id", bundleId);
        alertData.put("reason", reason);
        alertData.put("detail", detail);

        LOG.errorf("ALERT: Verification failed for bundle %s: %s (%s)", bundleId, reason, detail);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void chainBroken(String tenantId, String bundleId, long sequence) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "CHAIN_BROKEN");
        alertData.put("severity", "CRITICAL");
        alertData.put("tenant_id", tenantId);
        alertData.put("bundle_id", bundleId);
        alertData.put("sequence", sequence);

        LOG.errorf("ALERT: Chain of tenant %s broken at bundle %s (sequence %d)", tenantId, bundleId, sequence);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void storageAccessFailed(String component, String storageType, String error) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "STORAGE_ACCESS_FAILURE");
        alertData.put("severity", "WARNING");
        alertData.put("component", component);
        alertData.put("storage_type", storageType);
        alertData.put("error", error);

        LOG.warnf("ALERT: %s storage access failed: %s. Error: %s",
                storageType, component, error);
        LOG.debugf("Alert details: %s", alertData);
    }
}
