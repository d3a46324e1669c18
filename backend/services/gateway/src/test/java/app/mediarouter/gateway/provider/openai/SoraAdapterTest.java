package app.mediarouter.gateway.provider.openai;

import app.mediarouter.gateway.provider.GenerationOutcome;
import app.mediarouter.gateway.provider.GenerationRequest;
import app.mediarouter.gateway.provider.NormalizedStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SoraAdapterTest {

    private static final String BASE_URL = "https://openai.test/v1";

    private MockRestServiceServer server;
    private SoraAdapter adapter;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        adapter = new SoraAdapter(builder, new OpenAiProps(BASE_URL + "/", null), new ObjectMapper());
    }

    @Test
    void submitsVideoWithMappedSize() {
        server.expect(requestTo(BASE_URL + "/videos"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("sora-2"))
                .andExpect(jsonPath("$.seconds").value("8"))
                .andExpect(jsonPath("$.size").value("720x1280"))
                .andRespond(withSuccess("{\"id\":\"video_123\",\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

        GenerationOutcome outcome = adapter.generateVideo("sk-test",
                new GenerationRequest("sora-2", "a fox in snow", 8, "9:16", null, null, null));

        assertThat(outcome.status()).isEqualTo(NormalizedStatus.processing);
        assertThat(outcome.remoteJobId()).isEqualTo("video_123");
        server.verify();
    }

    @Test
    void completedStatusPointsAtContentEndpoint() {
        server.expect(requestTo(BASE_URL + "/videos/video_123"))
                .andRespond(withSuccess("{\"id\":\"video_123\",\"status\":\"completed\",\"size\":\"1280x720\",\"seconds\":\"8\"}",
                        MediaType.APPLICATION_JSON));

        GenerationOutcome outcome = adapter.checkStatus("sk-test", "video_123");

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.videoUrl()).isEqualTo(BASE_URL + "/videos/video_123/content");
        assertThat(outcome.metadata().path("size").asText()).isEqualTo("1280x720");
        assertThat(adapter.artifactHeaders("sk-test")).containsEntry(HttpHeaders.AUTHORIZATION, "Bearer sk-test");
    }

    @Test
    void failedStatusCarriesProviderReason() {
        server.expect(requestTo(BASE_URL + "/videos/video_9"))
                .andRespond(withSuccess("{\"status\":\"failed\",\"error\":{\"message\":\"moderation blocked\"}}",
                        MediaType.APPLICATION_JSON));

        GenerationOutcome outcome = adapter.checkStatus("sk-test", "video_9");

        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.error()).isEqualTo("moderation blocked");
    }

    @Test
    void unknownStatusKeepsPolling() {
        server.expect(requestTo(BASE_URL + "/videos/video_1"))
                .andRespond(withSuccess("{\"status\":\"warming_up\"}", MediaType.APPLICATION_JSON));

        assertThat(adapter.checkStatus("sk-test", "video_1").status()).isEqualTo(NormalizedStatus.processing);
    }

    @Test
    void httpErrorBecomesFailedOutcome() {
        server.expect(requestTo(BASE_URL + "/videos"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"message\":\"Incorrect API key provided\"}}"));

        GenerationOutcome outcome = adapter.generateVideo("sk-bad",
                new GenerationRequest("sora-2", "prompt", 5, "16:9", null, null, null));

        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.httpStatus()).isEqualTo(401);
        assertThat(outcome.error()).isEqualTo("HTTP 401: Incorrect API key provided");
    }

    @Test
    void missingIdIsReportedAsFailure() {
        server.expect(requestTo(BASE_URL + "/videos"))
                .andRespond(withSuccess("{\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

        GenerationOutcome outcome = adapter.generateVideo("sk-test",
                new GenerationRequest("sora-2", "prompt", 5, "16:9", null, null, null));

        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.error()).isEqualTo("OpenAI video id is missing");
    }

    @Test
    void validateKeyReflectsModelsEndpoint() {
        server.expect(requestTo(BASE_URL + "/models")).andRespond(withSuccess());
        assertThat(adapter.validateKey("sk-good")).isTrue();

        server.reset();
        server.expect(requestTo(BASE_URL + "/models")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));
        assertThat(adapter.validateKey("sk-bad")).isFalse();
    }
}
