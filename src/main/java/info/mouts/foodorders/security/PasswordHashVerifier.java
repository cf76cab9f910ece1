package info.mouts.foodorders.security;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Checks passwords against werkzeug-style PBKDF2 hashes of the form
 * {@code pbkdf2:<digest>[:<iterations>]$<salt>$<hex>}, where the salt is used
 * as its UTF-8 bytes and the derived key has the digest's length.
 */
@Component
@Slf4j
public class PasswordHashVerifier {
    static final int DEFAULT_ITERATIONS = 600_000;

    private static final String SALT_CHARS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int SALT_LENGTH = 16;

    private final SecureRandom random = new SecureRandom();

    /**
     * @param password the clear-text password
     * @param stored   the stored hash
     * @return true if the password matches; false on mismatch or an
     *         unsupported hash format
     */
    public boolean matches(String password, String stored) {
        if (password == null || stored == null) {
            return false;
        }

        String[] parts = stored.split("\\$", 3);
        if (parts.length != 3) {
            log.warn("Unsupported password hash format");
            return false;
        }

        String[] method = parts[0].split(":");
        if (method.length < 2 || method.length > 3 || !"pbkdf2".equals(method[0])) {
            log.warn("Unsupported password hash method {}", method[0]);
            return false;
        }

        try {
            int iterations = method.length == 3 ? Integer.parseInt(method[2]) : DEFAULT_ITERATIONS;
            byte[] expected = HexFormat.of().parseHex(parts[2]);
            byte[] actual = derive(method[1], password, parts[1], iterations);
            return MessageDigest.isEqual(expected, actual);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed password hash: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Hashes a password in the format {@link #matches(String, String)} reads,
     * with a random salt.
     *
     * @param password   the clear-text password
     * @param iterations PBKDF2 iteration count
     * @return the encoded hash, e.g. {@code pbkdf2:sha256:600000$salt$hex}
     */
    public String hash(String password, int iterations) {
        StringBuilder salt = new StringBuilder(SALT_LENGTH);
        for (int i = 0; i < SALT_LENGTH; i++) {
            salt.append(SALT_CHARS.charAt(random.nextInt(SALT_CHARS.length())));
        }
        byte[] key = derive("sha256", password, salt.toString(), iterations);
        return "pbkdf2:sha256:" + iterations + "$" + salt + "$" + HexFormat.of().formatHex(key);
    }

    private byte[] derive(String digest, String password, String salt, int iterations) {
        int keyBits = switch (digest.toLowerCase(Locale.ROOT)) {
            case "sha1" -> 160;
            case "sha256" -> 256;
            case "sha512" -> 512;
            default -> throw new IllegalArgumentException("unsupported digest " + digest);
        };
        String algorithm = "PBKDF2WithHmac" + digest.toUpperCase(Locale.ROOT);

        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt.getBytes(StandardCharsets.UTF_8), iterations,
                keyBits);
        try {
            return SecretKeyFactory.getInstance(algorithm).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2 is not available for " + digest, e);
        } finally {
            spec.clearPassword();
        }
    }
}
