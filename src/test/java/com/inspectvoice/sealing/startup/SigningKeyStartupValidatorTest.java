package com.inspectvoice.sealing.startup;

import com.inspectvoice.sealing.crypto.SigningKeyResolver;
import com.inspectvoice.sealing.storage.BundleStorageFacade;
import com.inspectvoice.sealing.testing.SealingFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.inspectvoice.sealing.testing.SealingFixture.ACTIVE_KEY_HEX;
import static com.inspectvoice.sealing.testing.SealingFixture.ACTIVE_KEY_ID;
import static com.inspectvoice.sealing.testing.SealingFixture.LEGACY_KEYS_JSON;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SigningKeyStartupValidatorTest {

    @Mock
    BundleStorageFacade bundleStorage;

    private SigningKeyStartupValidator validator(SigningKeyResolver resolver, boolean enabled) {
        SigningKeyStartupValidator validator = new SigningKeyStartupValidator();
        validator.validationEnabled = enabled;
        validator.signingKeyResolver = resolver;
        validator.bundleStorage = bundleStorage;
        return validator;
    }

    private static SigningKeyResolver resolver(String id, String hex, String legacy) {
        return SealingFixture.keyResolver(SealingFixture.objectMapper(), id, hex, legacy);
    }

    @Test
    void passesWithValidKeysAndStorage() {
        when(bundleStorage.isAccessible()).thenReturn(true);

        assertThatCode(() -> validator(resolver(ACTIVE_KEY_ID, ACTIVE_KEY_HEX, LEGACY_KEYS_JSON), true).validate())
                .doesNotThrowAnyException();
    }

    @Test
    void unreachableStorageOnlyAlerts() {
        when(bundleStorage.isAccessible()).thenReturn(false);

        assertThatCode(() -> validator(resolver(ACTIVE_KEY_ID, ACTIVE_KEY_HEX, "{}"), true).validate())
                .doesNotThrowAnyException();
        verify(bundleStorage).isAccessible();
    }

    @Test
    void missingActiveKeyFailsStartup() {
        assertThatThrownBy(() -> validator(resolver(null, null, "{}"), true).validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Startup validation failed");
        verifyNoInteractions(bundleStorage);
    }

    @Test
    void malformedLegacyKeyFailsStartup() {
        assertThatThrownBy(() -> validator(resolver(ACTIVE_KEY_ID, ACTIVE_KEY_HEX, "{\"old\":\"xyz\"}"), true).validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("old");
    }

    @Test
    void disabledValidationSkipsEverything() {
        assertThatCode(() -> validator(resolver(null, null, "{}"), false).validate())
                .doesNotThrowAnyException();
        verifyNoInteractions(bundleStorage);
    }
}
