package app.mediarouter.gateway.vault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM vault keyed by the SHA-256 digest of the configured master key.
 * Tokens are {@code base64url(nonce || ciphertext)}.
 */
@Service
public class LocalSecretVault implements SecretVault {

    private static final Logger log = LoggerFactory.getLogger(LocalSecretVault.class);
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;

    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    public LocalSecretVault(VaultProps props) {
        String appEnv = System.getenv("APP_ENV");
        boolean isProd = appEnv != null
                && (appEnv.equalsIgnoreCase("prod") || appEnv.equalsIgnoreCase("production"));
        String masterKey = props == null ? null : props.masterKey();
        if (masterKey == null || masterKey.isBlank()) {
            if (isProd) {
                throw new IllegalStateException("Gateway vault master key is required in prod");
            }
            byte[] generated = new byte[32];
            random.nextBytes(generated);
            this.key = new SecretKeySpec(generated, "AES");
            log.warn("Gateway vault master key is not configured; using ephemeral key");
        } else {
            this.key = new SecretKeySpec(deriveKey(masterKey), "AES");
        }
    }

    @Override
    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext is required");
        }
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        byte[] ciphertext = runCipher(Cipher.ENCRYPT_MODE, nonce, plaintext.getBytes(StandardCharsets.UTF_8));
        byte[] packed = new byte[nonce.length + ciphertext.length];
        System.arraycopy(nonce, 0, packed, 0, nonce.length);
        System.arraycopy(ciphertext, 0, packed, nonce.length, ciphertext.length);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(packed);
    }

    @Override
    public String decrypt(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token is required");
        }
        byte[] packed;
        try {
            packed = Base64.getUrlDecoder().decode(token);
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid secret token encoding", ex);
        }
        if (packed.length <= NONCE_LENGTH) {
            throw new IllegalStateException("Invalid secret token format");
        }
        byte[] nonce = Arrays.copyOfRange(packed, 0, NONCE_LENGTH);
        byte[] ciphertext = Arrays.copyOfRange(packed, NONCE_LENGTH, packed.length);
        return new String(runCipher(Cipher.DECRYPT_MODE, nonce, ciphertext), StandardCharsets.UTF_8);
    }

    private byte[] runCipher(int mode, byte[] nonce, byte[] input) {
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(mode, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            return cipher.doFinal(input);
        } catch (Exception ex) {
            String action = mode == Cipher.ENCRYPT_MODE ? "encrypt" : "decrypt";
            throw new IllegalStateException("Failed to " + action + " secret", ex);
        }
    }

    private static byte[] deriveKey(String masterKey) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(masterKey.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
