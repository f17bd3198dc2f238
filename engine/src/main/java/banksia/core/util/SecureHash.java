package banksia.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Log-safe fingerprints of token signatures.
 *
 * <p>A signature is the store's lookup key, so it never appears in logs
 * directly; a truncated SHA-256 of it is enough to correlate log lines.
 */
public final class SecureHash {

    static final int FINGERPRINT_LENGTH = 12;

    private SecureHash() {}

    /**
     * @param signature the token signature, may be null
     * @return a 12 character hex fingerprint, or {@code "-"} for null
     */
    public static String fingerprint(String signature) {
        if (signature == null) {
            return "-";
        }
        return HexFormat.of().formatHex(sha256(signature)).substring(0, FINGERPRINT_LENGTH);
    }

    private static byte[] sha256(String input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is a required JDK algorithm", e);
        }
    }
}
