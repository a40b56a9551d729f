package com.inspectvoice.sealing.testing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.inspectvoice.sealing.crypto.SigningKeyResolver;
import com.inspectvoice.sealing.domain.BundleFile;
import com.inspectvoice.sealing.domain.ExportType;
import com.inspectvoice.sealing.domain.GeneratedBy;
import com.inspectvoice.sealing.domain.SealedExportRow;
import com.inspectvoice.sealing.ledger.ChainLedgerFacade;
import com.inspectvoice.sealing.ledger.InMemoryChainLedger;
import com.inspectvoice.sealing.manifest.ManifestBuilder;
import com.inspectvoice.sealing.seal.BundleSealer;
import com.inspectvoice.sealing.seal.SealRequest;
import com.inspectvoice.sealing.seal.SealingService;
import com.inspectvoice.sealing.storage.BundleStorageFacade;
import com.inspectvoice.sealing.storage.InMemoryBundleStorage;
import com.inspectvoice.sealing.util.SealingMetrics;
import com.inspectvoice.sealing.verify.BundleVerifier;
import com.inspectvoice.sealing.verify.ChainAuditor;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Wires the sealing pipeline by hand over in-memory storage and ledger,
 * the way CDI would in {@code in-memory} mode.
 */
public final class SealingFixture {

    public static final String ACTIVE_KEY_ID = "test-key-2";
    public static final String ACTIVE_KEY_HEX = "2b7e151628aed2a6abf7158809cf4f3c2b7e151628aed2a6abf7158809cf4f3c";
    public static final String LEGACY_KEY_ID = "test-key-1";
    public static final String LEGACY_KEY_HEX = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";
    public static final String LEGACY_KEYS_JSON = "{\"" + LEGACY_KEY_ID + "\":\"" + LEGACY_KEY_HEX + "\"}";
    public static final String VERIFY_BASE_URL = "https://verify.test";
    public static final Instant NOW = Instant.parse("2024-03-01T10:15:30.123Z");

    public final ObjectMapper objectMapper = objectMapper();
    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    public final SealingMetrics metrics = new SealingMetrics();
    public final InMemoryBundleStorage inMemoryStorage = new InMemoryBundleStorage();
    public final InMemoryChainLedger inMemoryLedger = new InMemoryChainLedger();
    public final BundleStorageFacade storage = new BundleStorageFacade();
    public final ChainLedgerFacade ledger = new ChainLedgerFacade();
    public final ManifestBuilder manifestBuilder = new ManifestBuilder();
    public final BundleSealer bundleSealer = new BundleSealer();
    public final SigningKeyResolver keyResolver;
    public final SealingService sealingService = new SealingService();
    public final BundleVerifier verifier = new BundleVerifier();
    public final ChainAuditor auditor = new ChainAuditor();

    public SealingFixture() {
        this(ACTIVE_KEY_ID, ACTIVE_KEY_HEX, LEGACY_KEYS_JSON);
    }

    public SealingFixture(String activeKeyId, String activeKeyHex, String legacyKeysJson) {
        keyResolver = keyResolver(objectMapper, activeKeyId, activeKeyHex, legacyKeysJson);

        setField(storage, "mode", "in-memory");
        setField(storage, "keyPrefix", "sealed-exports/");
        setField(storage, "inMemoryStorage", inMemoryStorage);

        setField(ledger, "mode", "in-memory");
        setField(ledger, "inMemoryLedger", inMemoryLedger);

        setField(manifestBuilder, "verifyBaseUrl", VERIFY_BASE_URL);
        setField(manifestBuilder, "clock", clock);
        setField(bundleSealer, "manifestBuilder", manifestBuilder);

        setField(sealingService, "maxChainAttempts", 3);
        setField(sealingService, "maxUploadAttempts", 3);
        setField(sealingService, "initialBackoffMs", 1L);
        setField(sealingService, "signingKeyResolver", keyResolver);
        setField(sealingService, "bundleSealer", bundleSealer);
        setField(sealingService, "bundleStorage", storage);
        setField(sealingService, "chainLedger", ledger);
        setField(sealingService, "sealingMetrics", metrics);
        setField(sealingService, "clock", clock);

        setField(verifier, "signingKeyResolver", keyResolver);
        setField(verifier, "chainLedger", ledger);
        setField(verifier, "bundleStorage", storage);
        setField(verifier, "objectMapper", objectMapper);
        setField(verifier, "sealingMetrics", metrics);

        setField(auditor, "chainLedger", ledger);
        setField(auditor, "clock", clock);
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Builds a resolver and runs its startup parsing; {@code null} id or hex means unset.
     */
    public static SigningKeyResolver keyResolver(ObjectMapper objectMapper,
                                                 String activeKeyId,
                                                 String activeKeyHex,
                                                 String legacyKeysJson) {
        SigningKeyResolver resolver = new SigningKeyResolver();
        setField(resolver, "activeKeyId", Optional.ofNullable(activeKeyId));
        setField(resolver, "activeKeyHex", Optional.ofNullable(activeKeyHex));
        setField(resolver, "legacyKeysJson", legacyKeysJson);
        setField(resolver, "objectMapper", objectMapper);
        invoke(resolver, "init");
        return resolver;
    }

    public static SealRequest request(String tenantId, BundleFile... files) {
        return new SealRequest(tenantId, ExportType.PDF_REPORT, "inspection-42",
                new GeneratedBy("user-7", "Alex Inspector"), List.of(files));
    }

    public static SealRequest reportRequest(String tenantId) {
        return request(tenantId, pdf("report.pdf", "%PDF-1.4 abc"));
    }

    public static BundleFile pdf(String path, String content) {
        return new BundleFile(path, content.getBytes(StandardCharsets.UTF_8), "application/pdf");
    }

    public static BundleFile csv(String path, String content) {
        return new BundleFile(path, content.getBytes(StandardCharsets.UTF_8), "text/csv");
    }

    /**
     * A ledger row as it looks before append (sequence 0).
     */
    public static SealedExportRow row(String bundleId, String tenantId, String manifestSha256, String prevBundleHash) {
        return new SealedExportRow(bundleId, tenantId, ExportType.PDF_REPORT, null, 1, 100L,
                "sealed-exports/" + tenantId + "/" + bundleId + ".zip", manifestSha256, "c2ln", ACTIVE_KEY_ID,
                prevBundleHash, "user-7", "2024-03-01T10:15:30.123Z", NOW, 0L);
    }

    public static void setField(Object target, String name, Object value) {
        try {
            Field field = findField(target.getClass(), name);
            field.setAccessible(true);
            field.set(target, value);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    public static void invoke(Object target, String methodName) {
        try {
            Method method = target.getClass().getDeclaredMethod(methodName);
            method.setAccessible(true);
            method.invoke(target);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    private static Field findField(Class<?> type, String name) throws NoSuchFieldException {
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            try {
                return c.getDeclaredField(name);
            } catch (NoSuchFieldException ignored) {
                // keep walking up
            }
        }
        throw new NoSuchFieldException(name);
    }
}
