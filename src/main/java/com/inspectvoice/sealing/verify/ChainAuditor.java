package com.inspectvoice.sealing.verify;

import com.inspectvoice.sealing.domain.SealedExportRow;
import com.inspectvoice.sealing.ledger.ChainLedgerFacade;
import com.inspectvoice.sealing.util.AlertLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Walks a tenant's ledger rows in append order and checks every
 * {@code prev_bundle_hash} against the previous row's {@code manifest_sha256}.
 * Works from the ledger alone; archives are not downloaded.
 */
@ApplicationScoped
public class ChainAuditor {

    private static final Logger LOG = Logger.getLogger(ChainAuditor.class);

    @Inject
    ChainLedgerFacade chainLedger;

    Clock clock = Clock.systemUTC();

    public ChainAuditReport audit(String tenantId) {
        List<SealedExportRow> chain = chainLedger.chainOf(tenantId);
        if (chain.isEmpty()) {
            return new ChainAuditReport(tenantId, ChainAuditReport.Status.EMPTY, 0, 0, null, clock.instant(), null);
        }

        String expectedPrev = null;
        for (int i = 0; i < chain.size(); i++) {
            SealedExportRow row = chain.get(i);
            if (!Objects.equals(expectedPrev, row.getPrevBundleHash()) || row.getSequence() != i + 1) {
                AlertLogger.chainBroken(tenantId, row.getBundleId(), row.getSequence());
                ChainAuditReport.BrokenLink link = new ChainAuditReport.BrokenLink(
                        row.getBundleId(), row.getSequence(), expectedPrev, row.getPrevBundleHash());
                return new ChainAuditReport(tenantId, ChainAuditReport.Status.BROKEN, chain.size(), i,
                        chain.get(chain.size() - 1).getManifestSha256(), clock.instant(), link);
            }
            expectedPrev = row.getManifestSha256();
        }

        LOG.infof("Chain audit of tenant %s: %d entries intact", tenantId, chain.size());
        return new ChainAuditReport(tenantId, ChainAuditReport.Status.VALID, chain.size(), chain.size(),
                expectedPrev, clock.instant(), null);
    }
}
