package banksia.core.service.token;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import banksia.core.config.OAuth2Config;
import banksia.core.model.token.MalformedTokenException;
import banksia.core.model.token.OpaqueToken;

/**
 * Generates and verifies HMAC-SHA256 signed opaque tokens.
 *
 * <p>Every access token, refresh token and authorization code is a fresh random
 * key plus its signature under the server secret. Parsing only accepts the
 * exact canonical encoding, so any altered character fails verification.
 */
@ApplicationScoped
public class TokenCodec {

    /** Minimum server secret length in bytes. */
    public static final int MIN_SECRET_BYTES = 16;

    private static final String ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecretKeySpec signingKey;
    private final int keyLength;
    private final SecureRandom random = new SecureRandom();

    @Inject
    public TokenCodec(OAuth2Config config) {
        this(config.secret().getBytes(StandardCharsets.UTF_8), config.keyLength());
    }

    public TokenCodec(byte[] secret, int keyLength) {
        if (secret == null || secret.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "banksia.oauth2.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (keyLength < 1) {
            throw new IllegalStateException("banksia.oauth2.key-length must be positive, got " + keyLength);
        }
        this.signingKey = new SecretKeySpec(secret.clone(), ALGORITHM);
        this.keyLength = keyLength;
    }

    /**
     * Create a new token with a random key.
     *
     * @return the token
     */
    public OpaqueToken generate() {
        final var key = new byte[keyLength];
        random.nextBytes(key);
        return new OpaqueToken(key, sign(key));
    }

    /**
     * Parse and verify a token string.
     *
     * @param encoded the string presented by a client
     * @return the verified token
     * @throws MalformedTokenException if the string is not a canonical token signed with this secret
     */
    public OpaqueToken parse(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            throw new MalformedTokenException("Token is empty");
        }
        final var separator = encoded.indexOf('.');
        if (separator <= 0 || separator != encoded.lastIndexOf('.') || separator == encoded.length() - 1) {
            throw new MalformedTokenException("Token must have exactly two segments");
        }

        final var keyPart = encoded.substring(0, separator);
        final var signaturePart = encoded.substring(separator + 1);
        final var key = decodeCanonical(keyPart);
        final var signature = decodeCanonical(signaturePart);

        if (!MessageDigest.isEqual(sign(key), signature)) {
            throw new MalformedTokenException("Token signature does not match");
        }
        return new OpaqueToken(key, signature);
    }

    /**
     * Lookup key for a token string.
     *
     * @throws MalformedTokenException if the string does not verify
     */
    public String signatureOf(String encoded) {
        return parse(encoded).signatureString();
    }

    private byte[] sign(byte[] key) {
        try {
            final var mac = Mac.getInstance(ALGORITHM);
            mac.init(signingKey);
            return mac.doFinal(key);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }

    private static byte[] decodeCanonical(String segment) {
        final byte[] bytes;
        try {
            bytes = DECODER.decode(segment);
        } catch (IllegalArgumentException e) {
            throw new MalformedTokenException("Token segment is not base64url", e);
        }
        // the decoder ignores trailing bits, so re-encode to reject aliases
        if (bytes.length == 0 || !ENCODER.encodeToString(bytes).equals(segment)) {
            throw new MalformedTokenException("Token segment is not canonically encoded");
        }
        return bytes;
    }
}
