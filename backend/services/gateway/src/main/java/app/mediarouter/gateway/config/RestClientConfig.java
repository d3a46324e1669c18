package app.mediarouter.gateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Timeouts for every {@code RestClient} built from the shared builder: provider adapters and artifact downloads.
 * The read timeout bounds the wait for a response.
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestClientCustomizer timeoutRestClientCustomizer(
            @Value("${app.gateway.http.connect-timeout-seconds:10}") long connectTimeoutSeconds,
            @Value("${app.gateway.http.read-timeout-seconds:60}") long readTimeoutSeconds
    ) {
        ClientHttpRequestFactory requestFactory = requestFactory(
                Duration.ofSeconds(Math.max(connectTimeoutSeconds, 1)),
                Duration.ofSeconds(Math.max(readTimeoutSeconds, 1))
        );
        return builder -> builder.requestFactory(requestFactory);
    }

    public static ClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(readTimeout);
        return requestFactory;
    }
}
