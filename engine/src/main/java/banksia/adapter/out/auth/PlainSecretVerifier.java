package banksia.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import banksia.core.port.out.SecretVerifier;

/**
 * Compares secrets stored in clear text, in constant time.
 */
public class PlainSecretVerifier implements SecretVerifier {

    @Override
    public boolean verify(String storedSecret, String presented) {
        if (storedSecret == null || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                storedSecret.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }
}
