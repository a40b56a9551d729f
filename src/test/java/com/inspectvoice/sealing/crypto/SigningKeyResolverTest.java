package com.inspectvoice.sealing.crypto;

import com.inspectvoice.sealing.seal.SealingException;
import com.inspectvoice.sealing.testing.SealingFixture;
import org.junit.jupiter.api.Test;

import static com.inspectvoice.sealing.testing.SealingFixture.ACTIVE_KEY_HEX;
import static com.inspectvoice.sealing.testing.SealingFixture.ACTIVE_KEY_ID;
import static com.inspectvoice.sealing.testing.SealingFixture.LEGACY_KEYS_JSON;
import static com.inspectvoice.sealing.testing.SealingFixture.LEGACY_KEY_HEX;
import static com.inspectvoice.sealing.testing.SealingFixture.LEGACY_KEY_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SigningKeyResolverTest {

    private static SigningKeyResolver resolver(String id, String hex, String legacy) {
        return SealingFixture.keyResolver(SealingFixture.objectMapper(), id, hex, legacy);
    }

    @Test
    void resolvesActiveAndLegacyKeys() {
        SigningKeyResolver resolver = resolver(ACTIVE_KEY_ID, ACTIVE_KEY_HEX, LEGACY_KEYS_JSON);

        assertThat(resolver.configurationError()).isEmpty();
        assertThat(resolver.isActiveKeyConfigured()).isTrue();
        assertThat(resolver.activeKey()).isEqualTo(SigningKey.fromHex(ACTIVE_KEY_ID, ACTIVE_KEY_HEX));
        assertThat(resolver.resolve(LEGACY_KEY_ID)).contains(SigningKey.fromHex(LEGACY_KEY_ID, LEGACY_KEY_HEX));
        assertThat(resolver.getLegacyKeyCount()).isEqualTo(1);
    }

    @Test
    void unknownOrBlankKeyIdResolvesToEmpty() {
        SigningKeyResolver resolver = resolver(ACTIVE_KEY_ID, ACTIVE_KEY_HEX, "{}");

        assertThat(resolver.resolve("retired-and-forgotten")).isEmpty();
        assertThat(resolver.resolve("")).isEmpty();
        assertThat(resolver.resolve(null)).isEmpty();
    }

    @Test
    void missingActiveKeyIsAConfigurationErrorAndBlocksSealing() {
        SigningKeyResolver resolver = resolver(null, null, "{}");

        assertThat(resolver.isActiveKeyConfigured()).isFalse();
        assertThat(resolver.configurationError()).isPresent();
        assertThatThrownBy(resolver::activeKey)
                .isInstanceOf(SealingException.class)
                .extracting(e -> ((SealingException) e).getFailure())
                .isEqualTo(SealingException.Failure.SIGNING_KEY_UNAVAILABLE);
    }

    @Test
    void malformedActiveHexIsAConfigurationError() {
        SigningKeyResolver resolver = resolver(ACTIVE_KEY_ID, "zz-not-hex", "{}");

        assertThat(resolver.configurationError()).hasValueSatisfying(
                error -> assertThat(error).contains("not valid hex"));
        assertThat(resolver.isActiveKeyConfigured()).isFalse();
    }

    @Test
    void legacyTableThatIsNotAnObjectIsAConfigurationError() {
        SigningKeyResolver resolver = resolver(ACTIVE_KEY_ID, ACTIVE_KEY_HEX, "[\"k1\"]");

        assertThat(resolver.configurationError()).hasValueSatisfying(
                error -> assertThat(error).contains("legacy signing keys"));
        assertThat(resolver.isActiveKeyConfigured()).isTrue();
        assertThat(resolver.getLegacyKeyCount()).isZero();
    }

    @Test
    void keyToStringNeverPrintsMaterial() {
        SigningKey key = SigningKey.fromHex(ACTIVE_KEY_ID, ACTIVE_KEY_HEX);

        assertThat(key.toString()).contains(ACTIVE_KEY_ID).doesNotContain(ACTIVE_KEY_HEX.substring(0, 8));
    }
}
