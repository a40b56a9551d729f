package com.inspectvoice.sealing.ledger;

import com.inspectvoice.sealing.domain.SealedExportRow;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.List;
import java.util.Optional;

/**
 * Facade that selects the active ChainLedger implementation based on configuration.
 */
@ApplicationScoped
public class ChainLedgerFacade implements ChainLedger {

    @ConfigProperty(name = "app.ledger.mode", defaultValue = "redis")
    String mode;

    @Inject
    @Named("redis-ledger")
    RedisChainLedger redisLedger;

    @Inject
    @Named("in-memory-ledger")
    InMemoryChainLedger inMemoryLedger;

    private ChainLedger delegate() {
        if ("in-memory".equalsIgnoreCase(mode)) {
            return inMemoryLedger;
        }
        return redisLedger;
    }

    @Override
    public Optional<SealedExportRow> findLatest(String tenantId) {
        return delegate().findLatest(tenantId);
    }

    @Override
    public Optional<SealedExportRow> findByBundleId(String bundleId) {
        return delegate().findByBundleId(bundleId);
    }

    @Override
    public List<SealedExportRow> listByTenant(String tenantId, int limit, int offset) {
        return delegate().listByTenant(tenantId, limit, offset);
    }

    @Override
    public List<SealedExportRow> chainOf(String tenantId) {
        return delegate().chainOf(tenantId);
    }

    @Override
    public Optional<SealedExportRow> findPredecessor(SealedExportRow row) {
        return delegate().findPredecessor(row);
    }

    @Override
    public SealedExportRow append(SealedExportRow row) {
        return delegate().append(row);
    }

    @Override
    public boolean isAvailable() {
        return delegate().isAvailable();
    }
}
