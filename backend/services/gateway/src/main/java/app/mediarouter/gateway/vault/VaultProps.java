package app.mediarouter.gateway.vault;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.gateway.vault")
public record VaultProps(
        String masterKey
) {
}
