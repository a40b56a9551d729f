package com.inspectvoice.sealing.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.inspectvoice.sealing.domain.SealedExportRow;
import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.mutiny.redis.client.Response;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Redis-backed chain-of-custody ledger.
 * <p>
 * Layout per tenant: {@code {prefix}tenant:{id}:head} holds the latest manifest hash,
 * {@code {prefix}tenant:{id}:chain} lists bundle ids in append order, and
 * {@code {prefix}bundle:{bundleId}} is a hash with the row {@code payload} and its
 * {@code sequence}. Appends go through {@code lua/ledger_append.lua}, which compares
 * the head and writes all three keys atomically.
 * <p>
 * On Redis Cluster those three keys must hash to one slot, so the prefix has to carry a
 * hash tag such as {@code {sealed}:}. That places the whole ledger in a single slot.
 */
@ApplicationScoped
@Named("redis-ledger")
public class RedisChainLedger implements ChainLedger {

    private static final Logger LOG = Logger.getLogger(RedisChainLedger.class);
    private static final String APPEND_SCRIPT_PATH = "/lua/ledger_append.lua";
    private static final String NUM_KEYS = "3";

    @ConfigProperty(name = "app.ledger.mode", defaultValue = "redis")
    String mode;

    @ConfigProperty(name = "app.ledger.key-prefix", defaultValue = "sealed:")
    String keyPrefix;

    @ConfigProperty(name = "app.ledger.redis-timeout-seconds", defaultValue = "5")
    int redisTimeoutSeconds;

    @Inject
    RedisAPI redisAPI;

    @Inject
    ObjectMapper objectMapper;

    private ObjectWriter rowWriter;
    private ObjectReader rowReader;
    private String appendScript;
    private volatile String appendScriptSha;

    @PostConstruct
    void init() {
        rowWriter = objectMapper.writerFor(SealedExportRow.class);
        rowReader = objectMapper.readerFor(SealedExportRow.class);
        appendScript = loadScript(APPEND_SCRIPT_PATH);
        if (!isActive()) {
            return;
        }
        if (!hasHashTag(keyPrefix)) {
            LOG.infof("Ledger key prefix '%s' has no hash tag; appends require standalone Redis, "
                    + "use a prefix like '{sealed}:' on Redis Cluster", keyPrefix);
        }
        try {
            loadAppendScript();
        } catch (Exception e) {
            // Redis may come up after us; append() loads the script on first use
            LOG.warnf(e, "Failed to load ledger append script at startup");
        }
    }

    private boolean isActive() {
        return !"in-memory".equalsIgnoreCase(mode);
    }

    private String loadScript(String classpathPath) {
        try (InputStream is = getClass().getResourceAsStream(classpathPath)) {
            if (is == null) {
                throw new IllegalStateException("Lua script not found at: " + classpathPath);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read Lua script from: " + classpathPath, e);
        }
    }

    private String loadAppendScript() {
        Response response = redisAPI.script(List.of("LOAD", appendScript)).await().atMost(timeout());
        if (response == null) {
            throw new LedgerException("SCRIPT LOAD returned no SHA");
        }
        appendScriptSha = response.toString();
        LOG.infof("Ledger append Lua script loaded with SHA: %s", appendScriptSha);
        return appendScriptSha;
    }

    private Duration timeout() {
        return Duration.ofSeconds(redisTimeoutSeconds);
    }

    String headKey(String tenantId) {
        return keyPrefix + "tenant:" + tenantId + ":head";
    }

    String chainKey(String tenantId) {
        return keyPrefix + "tenant:" + tenantId + ":chain";
    }

    String bundleKey(String bundleId) {
        return keyPrefix + "bundle:" + bundleId;
    }

    /** Redis Cluster hashes only the text between the first '{' and the next '}' when it is non-empty. */
    static boolean hasHashTag(String prefix) {
        int open = prefix.indexOf('{');
        if (open < 0) {
            return false;
        }
        int close = prefix.indexOf('}', open + 1);
        return close > open + 1;
    }

    @Override
    public SealedExportRow append(SealedExportRow row) {
        String payload;
        try {
            payload = rowWriter.writeValueAsString(row);
        } catch (IOException e) {
            throw new LedgerException("Failed to serialise ledger row " + row.getBundleId(), e);
        }

        String expectedHead = row.getPrevBundleHash() == null ? "" : row.getPrevBundleHash();
        Response response;
        try {
            response = evalAppend(row, expectedHead, payload);
        } catch (Exception e) {
            if (e.getMessage() != null && e.getMessage().contains("NOSCRIPT")) {
                LOG.info("Ledger append script not found in Redis, reloading...");
                try {
                    loadAppendScript();
                    response = evalAppend(row, expectedHead, payload);
                } catch (Exception retryEx) {
                    throw new LedgerException("Ledger append failed after script reload for " + row.getBundleId(), retryEx);
                }
            } else {
                throw new LedgerException("Ledger append failed for " + row.getBundleId(), e);
            }
        }

        if (response == null || response.size() < 2) {
            throw new LedgerException("Unexpected ledger append response for " + row.getBundleId());
        }
        int status = response.get(0).toInteger();
        String detail = response.get(1) != null ? response.get(1).toString() : "";
        switch (status) {
            case 1:
                return row.withSequence(Long.parseLong(detail));
            case 0:
                throw new ChainConflictException(row.getTenantId(), row.getPrevBundleHash(),
                        detail.isEmpty() ? null : detail);
            default:
                throw new LedgerException("Bundle already recorded: " + row.getBundleId());
        }
    }

    private Response evalAppend(SealedExportRow row, String expectedHead, String payload) {
        String sha = appendScriptSha != null ? appendScriptSha : loadAppendScript();
        List<String> args = new ArrayList<>(9);
        args.add(sha);
        args.add(NUM_KEYS);
        args.add(headKey(row.getTenantId()));      // KEYS[1]
        args.add(chainKey(row.getTenantId()));     // KEYS[2]
        args.add(bundleKey(row.getBundleId()));    // KEYS[3]
        args.add(expectedHead);                    // ARGV[1]
        args.add(row.getManifestSha256());         // ARGV[2]
        args.add(row.getBundleId());               // ARGV[3]
        args.add(payload);                         // ARGV[4]
        return redisAPI.evalsha(args).await().atMost(timeout());
    }

    @Override
    public Optional<SealedExportRow> findByBundleId(String bundleId) {
        try {
            Response response = redisAPI.hmget(List.of(bundleKey(bundleId), "payload", "sequence"))
                    .await().atMost(timeout());
            if (response == null || response.size() < 2 || response.get(0) == null) {
                return Optional.empty();
            }
            SealedExportRow row = rowReader.readValue(response.get(0).toString());
            long sequence = response.get(1) != null ? response.get(1).toLong() : 0L;
            return Optional.of(row.withSequence(sequence));
        } catch (IOException e) {
            throw new LedgerException("Corrupt ledger row for bundle " + bundleId, e);
        } catch (Exception e) {
            throw new LedgerException("Failed to read ledger row for bundle " + bundleId, e);
        }
    }

    @Override
    public Optional<SealedExportRow> findLatest(String tenantId) {
        return bundleIdAt(tenantId, -1).flatMap(this::findByBundleId);
    }

    @Override
    public Optional<SealedExportRow> findPredecessor(SealedExportRow row) {
        if (row.getSequence() <= 1) {
            return Optional.empty();
        }
        return bundleIdAt(row.getTenantId(), row.getSequence() - 2).flatMap(this::findByBundleId);
    }

    private Optional<String> bundleIdAt(String tenantId, long index) {
        try {
            Response response = redisAPI.lindex(chainKey(tenantId), Long.toString(index))
                    .await().atMost(timeout());
            return response == null ? Optional.empty() : Optional.of(response.toString());
        } catch (Exception e) {
            throw new LedgerException("Failed to read chain of tenant " + tenantId, e);
        }
    }

    @Override
    public List<SealedExportRow> listByTenant(String tenantId, int limit, int offset) {
        if (limit <= 0) {
            return List.of();
        }
        // newest first: the page is a window counted back from the tail
        long start = -((long) offset + limit);
        long stop = -((long) offset + 1);
        List<SealedExportRow> rows = loadRange(tenantId, start, stop);
        Collections.reverse(rows);
        return rows;
    }

    @Override
    public List<SealedExportRow> chainOf(String tenantId) {
        return loadRange(tenantId, 0, -1);
    }

    private List<SealedExportRow> loadRange(String tenantId, long start, long stop) {
        Response ids;
        try {
            ids = redisAPI.lrange(chainKey(tenantId), Long.toString(start), Long.toString(stop))
                    .await().atMost(timeout());
        } catch (Exception e) {
            throw new LedgerException("Failed to read chain of tenant " + tenantId, e);
        }
        List<SealedExportRow> rows = new ArrayList<>();
        if (ids == null) {
            return rows;
        }
        for (int i = 0; i < ids.size(); i++) {
            String bundleId = ids.get(i).toString();
            SealedExportRow row = findByBundleId(bundleId)
                    .orElseThrow(() -> new LedgerException("Chain of tenant " + tenantId
                            + " references missing bundle row " + bundleId));
            rows.add(row);
        }
        return rows;
    }

    @Override
    public boolean isAvailable() {
        try {
            redisAPI.ping(List.of()).await().atMost(timeout());
            return true;
        } catch (Exception e) {
            LOG.warnf("Ledger Redis unavailable: %s", e.getMessage());
            return false;
        }
    }
}
