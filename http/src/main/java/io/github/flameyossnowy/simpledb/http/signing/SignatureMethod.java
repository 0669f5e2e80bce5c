package io.github.flameyossnowy.simpledb.http.signing;

import javax.crypto.Mac;
import java.security.NoSuchAlgorithmException;

/**
 * HMAC algorithms accepted for version 2 signatures. The name is both the
 * {@code SignatureMethod} parameter value and the JCE algorithm.
 */
public enum SignatureMethod {
    HMAC_SHA256("HmacSHA256"),
    HMAC_SHA1("HmacSHA1");

    private final String algorithm;

    SignatureMethod(String algorithm) {
        this.algorithm = algorithm;
    }

    public String algorithm() {
        return algorithm;
    }

    public boolean isAvailable() {
        try {
            Mac.getInstance(algorithm);
            return true;
        } catch (NoSuchAlgorithmException e) {
            return false;
        }
    }

    /**
     * SHA-256 when the runtime provides it, SHA-1 otherwise.
     */
    public static SignatureMethod preferred() {
        return HMAC_SHA256.isAvailable() ? HMAC_SHA256 : HMAC_SHA1;
    }
}
