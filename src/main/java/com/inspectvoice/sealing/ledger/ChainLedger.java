package com.inspectvoice.sealing.ledger;

import com.inspectvoice.sealing.domain.SealedExportRow;

import java.util.List;
import java.util.Optional;

/**
 * Append-only chain-of-custody store. Exposes no update or delete.
 */
public interface ChainLedger {

    /**
     * Latest row of the tenant's chain, the predecessor of the next seal.
     */
    Optional<SealedExportRow> findLatest(String tenantId);

    Optional<SealedExportRow> findByBundleId(String bundleId);

    /**
     * Newest first.
     */
    List<SealedExportRow> listByTenant(String tenantId, int limit, int offset);

    /**
     * The whole tenant chain in append order.
     */
    List<SealedExportRow> chainOf(String tenantId);

    /**
     * The row recorded immediately before {@code row} in its tenant chain.
     */
    Optional<SealedExportRow> findPredecessor(SealedExportRow row);

    /**
     * Appends {@code row} only if the tenant head still equals {@code row.prevBundleHash}
     * ({@code null} meaning an empty chain).
     *
     * @return the stored row with its assigned sequence
     * @throws ChainConflictException if another append claimed that predecessor first
     * @throws LedgerException        if the store fails or the bundle id already exists
     */
    SealedExportRow append(SealedExportRow row);

    boolean isAvailable();
}
