package app.mediarouter.gateway.provider.openai;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.gateway.openai")
public record OpenAiProps(
        String baseUrl,
        String defaultModel
) {
}
