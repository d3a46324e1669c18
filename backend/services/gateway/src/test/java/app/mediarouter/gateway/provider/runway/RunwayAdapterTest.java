package app.mediarouter.gateway.provider.runway;

import app.mediarouter.gateway.provider.GenerationOutcome;
import app.mediarouter.gateway.provider.GenerationRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RunwayAdapterTest {

    private static final String BASE_URL = "https://runway.test/v1";

    private MockRestServiceServer server;
    private RunwayAdapter adapter;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        adapter = new RunwayAdapter(builder, new RunwayProps(BASE_URL), new ObjectMapper());
    }

    @Test
    void submitsRemoteModelAndDimensions() {
        server.expect(requestTo(BASE_URL + "/generations"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("gen4"))
                .andExpect(jsonPath("$.width").value(1440))
                .andExpect(jsonPath("$.height").value(1080))
                .andExpect(jsonPath("$.seed").value(42))
                .andRespond(withSuccess("{\"id\":\"rw-1\",\"status\":\"pending\"}", MediaType.APPLICATION_JSON));

        GenerationOutcome outcome = adapter.generateVideo("key",
                new GenerationRequest("runway-gen4", "city at night", 5, "4:3", 42L, null, null));

        assertThat(outcome.remoteJobId()).isEqualTo("rw-1");
        assertThat(outcome.isFailed()).isFalse();
        server.verify();
    }

    @Test
    void readsOutputUrlFromObjectOrArray() {
        server.expect(requestTo(BASE_URL + "/generations/rw-1"))
                .andRespond(withSuccess("{\"status\":\"succeeded\",\"output\":{\"url\":\"https://cdn.test/a.mp4\"}}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/generations/rw-2"))
                .andRespond(withSuccess("{\"status\":\"succeeded\",\"output\":[\"https://cdn.test/b.mp4\"]}",
                        MediaType.APPLICATION_JSON));

        assertThat(adapter.checkStatus("key", "rw-1").videoUrl()).isEqualTo("https://cdn.test/a.mp4");
        assertThat(adapter.checkStatus("key", "rw-2").videoUrl()).isEqualTo("https://cdn.test/b.mp4");
    }

    @Test
    void failedStatusPrefersFailureField() {
        server.expect(requestTo(BASE_URL + "/generations/rw-3"))
                .andRespond(withSuccess("{\"status\":\"failed\",\"failure\":\"content policy\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/generations/rw-4"))
                .andRespond(withSuccess("{\"status\":\"failed\"}", MediaType.APPLICATION_JSON));

        assertThat(adapter.checkStatus("key", "rw-3").error()).isEqualTo("content policy");
        assertThat(adapter.checkStatus("key", "rw-4").error()).isEqualTo("Runway generation failed");
    }

    @Test
    void rateLimitKeepsStatusCode() {
        server.expect(requestTo(BASE_URL + "/generations/rw-5"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"Rate limit exceeded\"}"));

        GenerationOutcome outcome = adapter.checkStatus("key", "rw-5");

        assertThat(outcome.httpStatus()).isEqualTo(429);
        assertThat(outcome.remoteJobId()).isEqualTo("rw-5");
        assertThat(outcome.error()).isEqualTo("HTTP 429: Rate limit exceeded");
    }

    @Test
    void explicitResolutionOverridesAspectRatio() {
        server.expect(requestTo(BASE_URL + "/generations"))
                .andExpect(jsonPath("$.width").value(1280))
                .andExpect(jsonPath("$.height").value(768))
                .andRespond(withSuccess("{\"id\":\"rw-9\"}", MediaType.APPLICATION_JSON));

        adapter.generateVideo("key", new GenerationRequest("runway-gen3", "dunes", 5, "16:9", null, null, "1280x768"));

        server.verify();
        assertThat(RunwayAdapter.parseResolution("wide")).isNull();
    }
}
