package com.inspectvoice.sealing.crypto;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHasherTest {

    @Test
    void matchesKnownSha256Vectors() {
        assertThat(ContentHasher.sha256Hex("abc".getBytes(StandardCharsets.US_ASCII)))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(ContentHasher.sha256Hex(new byte[0]))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void rawDigestIs32Bytes() {
        assertThat(ContentHasher.sha256("abc".getBytes(StandardCharsets.US_ASCII))).hasSize(32);
    }

    @Test
    void toHexIsLowercaseAndZeroPadded() {
        assertThat(ContentHasher.toHex(new byte[]{0x00, 0x0f, (byte) 0xab})).isEqualTo("000fab");
    }

    @Test
    void recognisesSha256HexStrings() {
        assertThat(ContentHasher.isSha256Hex("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad")).isTrue();
        assertThat(ContentHasher.isSha256Hex("BA7816BF8F01CFEA414140DE5DAE2223B00361A396177A9CB410FF61F20015AD")).isFalse();
        assertThat(ContentHasher.isSha256Hex("abc")).isFalse();
        assertThat(ContentHasher.isSha256Hex(null)).isFalse();
    }
}
