package app.mediarouter.gateway.vault;

import java.util.UUID;

/**
 * Decrypted secret held only for the lifetime of one generation task.
 */
public record ResolvedCredential(
        UUID credentialId,
        String provider,
        String secret
) {
    @Override
    public String toString() {
        return "ResolvedCredential[credentialId=" + credentialId + ", provider=" + provider + "]";
    }
}
