package app.mediarouter.gateway.vault;

public interface SecretVault {
    String encrypt(String plaintext);

    String decrypt(String token);
}
