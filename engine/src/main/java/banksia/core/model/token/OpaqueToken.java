package banksia.core.model.token;

import java.util.Arrays;
import java.util.Base64;

/**
 * A random key and its HMAC-SHA256 signature.
 *
 * <p>The external form is {@code base64url(key) + "." + base64url(signature)}
 * without padding. Only the signature part is used as the server-side lookup
 * key; the raw key is never persisted.
 */
public final class OpaqueToken {

    static final char SEPARATOR = '.';

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final byte[] key;
    private final byte[] signature;

    public OpaqueToken(byte[] key, byte[] signature) {
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("key cannot be null or empty");
        }
        if (signature == null || signature.length == 0) {
            throw new IllegalArgumentException("signature cannot be null or empty");
        }
        this.key = key.clone();
        this.signature = signature.clone();
    }

    public byte[] key() {
        return key.clone();
    }

    public byte[] signature() {
        return signature.clone();
    }

    /**
     * Canonical lookup key for this token, stable across re-encoding.
     *
     * @return the URL-safe encoded signature
     */
    public String signatureString() {
        return ENCODER.encodeToString(signature);
    }

    /**
     * The string handed to clients.
     *
     * @return URL-safe token string without whitespace
     */
    public String encode() {
        return ENCODER.encodeToString(key) + SEPARATOR + ENCODER.encodeToString(signature);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OpaqueToken other)) {
            return false;
        }
        return Arrays.equals(key, other.key) && Arrays.equals(signature, other.signature);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(key) + Arrays.hashCode(signature);
    }

    @Override
    public String toString() {
        // raw token material stays out of logs
        return "OpaqueToken[signature=" + signatureString() + "]";
    }
}
