package app.mediarouter.gateway.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.gateway.storage")
public record StorageProps(
        String path,
        String publicBaseUrl
) {
}
