package com.inspectvoice.sealing.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * HMAC-SHA256 signing of canonical manifest bytes.
 */
public final class ManifestSigner {

    public static final String SIGNATURE_ALGORITHM = "HMAC-SHA256";

    private static final String JCA_ALGORITHM = "HmacSHA256";

    private ManifestSigner() {
    }

    /**
     * @return base64 (standard alphabet, padded) HMAC-SHA256 of {@code data}
     */
    public static String sign(byte[] data, SigningKey key) {
        return Base64.getEncoder().encodeToString(mac(data, key));
    }

    /**
     * Verifies a base64 signature. Comparison is constant-time; a signature that
     * is not valid base64 simply fails.
     */
    public static boolean verify(byte[] data, String signature, SigningKey key) {
        if (signature == null) {
            return false;
        }
        byte[] provided;
        try {
            provided = Base64.getDecoder().decode(signature.trim().getBytes(StandardCharsets.US_ASCII));
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(mac(data, key), provided);
    }

    private static byte[] mac(byte[] data, SigningKey key) {
        try {
            Mac mac = Mac.getInstance(JCA_ALGORITHM);
            mac.init(new SecretKeySpec(key.material(), JCA_ALGORITHM));
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable for key " + key.getKeyId(), e);
        }
    }
}
