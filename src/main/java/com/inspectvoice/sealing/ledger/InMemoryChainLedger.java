package com.inspectvoice.sealing.ledger;

import com.inspectvoice.sealing.domain.SealedExportRow;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Test-friendly, in-memory ledger. Check-then-append runs under the instance monitor.
 */
@ApplicationScoped
@Named("in-memory-ledger")
public class InMemoryChainLedger implements ChainLedger {

    private final Map<String, List<SealedExportRow>> chains = new HashMap<>();
    private final Map<String, SealedExportRow> byBundleId = new HashMap<>();

    @Override
    public synchronized Optional<SealedExportRow> findLatest(String tenantId) {
        List<SealedExportRow> chain = chains.get(tenantId);
        if (chain == null || chain.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(chain.get(chain.size() - 1));
    }

    @Override
    public synchronized Optional<SealedExportRow> findByBundleId(String bundleId) {
        return Optional.ofNullable(byBundleId.get(bundleId));
    }

    @Override
    public synchronized List<SealedExportRow> listByTenant(String tenantId, int limit, int offset) {
        List<SealedExportRow> chain = chains.getOrDefault(tenantId, List.of());
        List<SealedExportRow> page = new ArrayList<>();
        for (int i = chain.size() - 1 - offset; i >= 0 && page.size() < limit; i--) {
            page.add(chain.get(i));
        }
        return page;
    }

    @Override
    public synchronized List<SealedExportRow> chainOf(String tenantId) {
        return List.copyOf(chains.getOrDefault(tenantId, List.of()));
    }

    @Override
    public synchronized Optional<SealedExportRow> findPredecessor(SealedExportRow row) {
        List<SealedExportRow> chain = chains.get(row.getTenantId());
        int index = (int) row.getSequence() - 2;
        if (chain == null || index < 0 || index >= chain.size()) {
            return Optional.empty();
        }
        return Optional.of(chain.get(index));
    }

    @Override
    public synchronized SealedExportRow append(SealedExportRow row) {
        if (byBundleId.containsKey(row.getBundleId())) {
            throw new LedgerException("Bundle already recorded: " + row.getBundleId());
        }
        List<SealedExportRow> chain = chains.computeIfAbsent(row.getTenantId(), k -> new ArrayList<>());
        String head = chain.isEmpty() ? null : chain.get(chain.size() - 1).getManifestSha256();
        if (!Objects.equals(head, row.getPrevBundleHash())) {
            throw new ChainConflictException(row.getTenantId(), row.getPrevBundleHash(), head);
        }
        SealedExportRow stored = row.withSequence(chain.size() + 1L);
        chain.add(stored);
        byBundleId.put(stored.getBundleId(), stored);
        return stored;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    public synchronized int size() {
        return byBundleId.size();
    }
}
