package com.inspectvoice.sealing.crypto;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inspectvoice.sealing.seal.SealingException;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves {@code signing_key_id} values to key material.
 * <p>
 * The active key signs new bundles. Retired keys stay in the legacy table so bundles
 * signed before a rotation remain verifiable. Lookup checks the active key first,
 * then the legacy table; an unknown id resolves to {@link Optional#empty()}.
 * <p>
 * Configuration problems (missing active key, malformed hex, legacy table that is not
 * a JSON object) are recorded at startup and reported by {@link #configurationError()}
 * so the startup validator can fail fast. They never surface as an empty lookup.
 */
@ApplicationScoped
public class SigningKeyResolver {

    private static final Logger LOG = Logger.getLogger(SigningKeyResolver.class);

    @ConfigProperty(name = "app.signing.active-key-id")
    Optional<String> activeKeyId;

    @ConfigProperty(name = "app.signing.active-key")
    Optional<String> activeKeyHex;

    @ConfigProperty(name = "app.signing.legacy-keys", defaultValue = "{}")
    String legacyKeysJson;

    @Inject
    ObjectMapper objectMapper;

    private volatile SigningKey activeKey;
    private volatile Map<String, SigningKey> legacyKeys = Collections.emptyMap();
    private volatile String configurationError;

    @PostConstruct
    void init() {
        StringBuilder errors = new StringBuilder();

        String keyId = activeKeyId.map(String::trim).orElse("");
        String keyHex = activeKeyHex.map(String::trim).orElse("");
        if (keyId.isEmpty() || keyHex.isEmpty()) {
            errors.append("active signing key id and material must both be configured; ");
        } else {
            try {
                activeKey = SigningKey.fromHex(keyId, keyHex);
            } catch (IllegalArgumentException e) {
                errors.append(e.getMessage()).append("; ");
            }
        }

        Map<String, SigningKey> parsed = new LinkedHashMap<>();
        try {
            Map<String, String> raw = objectMapper.readValue(
                    legacyKeysJson == null || legacyKeysJson.isBlank() ? "{}" : legacyKeysJson,
                    new TypeReference<Map<String, String>>() { });
            for (Map.Entry<String, String> entry : raw.entrySet()) {
                try {
                    parsed.put(entry.getKey(), SigningKey.fromHex(entry.getKey(), entry.getValue()));
                } catch (IllegalArgumentException e) {
                    errors.append(e.getMessage()).append("; ");
                }
            }
        } catch (Exception e) {
            errors.append("legacy signing keys are not a JSON object of keyId to hex: ")
                    .append(e.getMessage()).append("; ");
        }
        legacyKeys = Collections.unmodifiableMap(parsed);

        if (errors.length() > 0) {
            configurationError = errors.toString().trim();
            LOG.errorf("Signing key configuration invalid: %s", configurationError);
        } else {
            configurationError = null;
            LOG.infof("Signing keys loaded: active=%s, legacy=%s", activeKey.getKeyId(), legacyKeys.keySet());
        }
    }

    /**
     * Resolves a key id, active key first then the legacy table.
     */
    public Optional<SigningKey> resolve(String keyId) {
        if (keyId == null || keyId.isBlank()) {
            return Optional.empty();
        }
        SigningKey active = activeKey;
        if (active != null && active.getKeyId().equals(keyId)) {
            return Optional.of(active);
        }
        return Optional.ofNullable(legacyKeys.get(keyId));
    }

    /**
     * Returns the key new bundles are signed with.
     *
     * @throws SealingException with {@link SealingException.Failure#SIGNING_KEY_UNAVAILABLE} if none is configured
     */
    public SigningKey activeKey() {
        SigningKey active = activeKey;
        if (active == null) {
            throw new SealingException(SealingException.Failure.SIGNING_KEY_UNAVAILABLE,
                    "No active signing key configured" + (configurationError != null ? ": " + configurationError : ""));
        }
        return active;
    }

    public boolean isActiveKeyConfigured() {
        return activeKey != null;
    }

    public Optional<String> configurationError() {
        return Optional.ofNullable(configurationError);
    }

    public int getLegacyKeyCount() {
        return legacyKeys.size();
    }
}
