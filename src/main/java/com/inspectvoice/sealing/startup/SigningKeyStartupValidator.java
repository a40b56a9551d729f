package com.inspectvoice.sealing.startup;

import com.inspectvoice.sealing.crypto.SigningKeyResolver;
import com.inspectvoice.sealing.storage.BundleStorageFacade;
import com.inspectvoice.sealing.util.AlertLogger;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Validates signing configuration at startup.
 *
 * <p><b>Startup Behavior:</b>
 * <ul>
 *   <li>active key id or material missing or malformed: fail startup</li>
 *   <li>legacy key table not a JSON object of hex keys: fail startup</li>
 *   <li>bundle storage unreachable: alert only, sealing reports STORAGE_FAILED until it recovers</li>
 * </ul>
 */
@ApplicationScoped
public class SigningKeyStartupValidator {

    private static final Logger LOG = Logger.getLogger(SigningKeyStartupValidator.class);

    @ConfigProperty(name = "app.startup.validation.enabled", defaultValue = "true")
    boolean validationEnabled;

    @Inject
    SigningKeyResolver signingKeyResolver;

    @Inject
    BundleStorageFacade bundleStorage;

    void onStart(@Observes StartupEvent event) {
        validate();
    }

    public void validate() {
        if (!validationEnabled) {
            LOG.warn("Startup validation is DISABLED. Service may start without a usable signing key.");
            return;
        }

        LOG.info("Validating signing configuration at startup...");

        signingKeyResolver.configurationError().ifPresent(error -> {
            LOG.errorf("CRITICAL STARTUP FAILURE: signing keys are misconfigured.%n"
                    + "  Problem: %s%n"
                    + "  Required: app.signing.active-key-id and app.signing.active-key (hex)%n"
                    + "  Optional: app.signing.legacy-keys as a JSON object of keyId to hex", error);
            throw new IllegalStateException("Startup validation failed: " + error);
        });

        boolean storageAccessible = bundleStorage.isAccessible();
        if (!storageAccessible) {
            AlertLogger.storageAccessFailed("startup-validation", "bundle", "storage not accessible at startup");
        }

        LOG.infof("Startup validation complete: active key=%s, legacy keys=%d, storage=%s",
                signingKeyResolver.activeKey().getKeyId(),
                signingKeyResolver.getLegacyKeyCount(),
                storageAccessible ? "AVAILABLE" : "UNAVAILABLE");
    }
}
