package app.mediarouter.gateway.provider.runway;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.gateway.runway")
public record RunwayProps(
        String baseUrl
) {
}
