package app.mediarouter.gateway.provider.kling;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.gateway.kling")
public record KlingProps(
        String baseUrl
) {
}
