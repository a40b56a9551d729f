package com.inspectvoice.sealing.crypto;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

class ManifestSignerTest {

    private static final SigningKey KEY =
            SigningKey.fromHex("k1", "2b7e151628aed2a6abf7158809cf4f3c2b7e151628aed2a6abf7158809cf4f3c");
    private static final SigningKey OTHER_KEY =
            SigningKey.fromHex("k0", "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f");

    private final byte[] manifest = "{\"bundle_id\":\"b1\",\"version\":1}".getBytes(StandardCharsets.UTF_8);

    @Test
    void signatureVerifiesWithSameKey() {
        String signature = ManifestSigner.sign(manifest, KEY);

        assertThat(Base64.getDecoder().decode(signature)).hasSize(32);
        assertThat(ManifestSigner.verify(manifest, signature, KEY)).isTrue();
    }

    @Test
    void signingIsDeterministic() {
        assertThat(ManifestSigner.sign(manifest, KEY)).isEqualTo(ManifestSigner.sign(manifest, KEY));
    }

    @Test
    void matchesRfc4231TestCase2() {
        SigningKey jefe = new SigningKey("jefe", "Jefe".getBytes(StandardCharsets.US_ASCII));
        byte[] data = "what do ya want for nothing?".getBytes(StandardCharsets.US_ASCII);

        byte[] mac = Base64.getDecoder().decode(ManifestSigner.sign(data, jefe));

        assertThat(ContentHasher.toHex(mac))
                .isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
    }

    @Test
    void anyChangedManifestByteFailsVerification() {
        String signature = ManifestSigner.sign(manifest, KEY);

        for (int i = 0; i < manifest.length; i++) {
            byte[] tampered = manifest.clone();
            tampered[i] ^= 0x01;
            assertThat(ManifestSigner.verify(tampered, signature, KEY)).as("byte %d", i).isFalse();
        }
    }

    @Test
    void changedSignatureByteFailsVerification() {
        byte[] mac = Base64.getDecoder().decode(ManifestSigner.sign(manifest, KEY));
        mac[5] ^= 0x40;

        assertThat(ManifestSigner.verify(manifest, Base64.getEncoder().encodeToString(mac), KEY)).isFalse();
    }

    @Test
    void otherKeyFailsVerification() {
        String signature = ManifestSigner.sign(manifest, KEY);

        assertThat(ManifestSigner.verify(manifest, signature, OTHER_KEY)).isFalse();
    }

    @Test
    void malformedOrMissingSignatureFailsWithoutThrowing() {
        assertThat(ManifestSigner.verify(manifest, "not base64 !!", KEY)).isFalse();
        assertThat(ManifestSigner.verify(manifest, "", KEY)).isFalse();
        assertThat(ManifestSigner.verify(manifest, null, KEY)).isFalse();
    }

    @Test
    void trailingWhitespaceInSignatureIsTolerated() {
        String signature = ManifestSigner.sign(manifest, KEY);

        assertThat(ManifestSigner.verify(manifest, signature + "\n", KEY)).isTrue();
    }
}
