package app.mediarouter.gateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationMetadataReaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsExplicitDimensions() throws Exception {
        GenerationMetadataReader.VideoDimensions dimensions = GenerationMetadataReader.read(
                objectMapper.readTree("{\"width\":1080,\"height\":1920,\"duration\":6.5}"), 5);

        assertThat(dimensions.resolution()).isEqualTo("1080x1920");
        assertThat(dimensions.durationSeconds()).isEqualTo(6.5);
    }

    @Test
    void readsSizeStringAndSecondsField() throws Exception {
        GenerationMetadataReader.VideoDimensions dimensions = GenerationMetadataReader.read(
                objectMapper.readTree("{\"size\":\"1280x720\",\"seconds\":\"8\"}"), 5);

        assertThat(dimensions.width()).isEqualTo(1280);
        assertThat(dimensions.height()).isEqualTo(720);
        assertThat(dimensions.durationSeconds()).isEqualTo(8.0);
    }

    @Test
    void fallsBackWhenMetadataMissing() {
        GenerationMetadataReader.VideoDimensions dimensions = GenerationMetadataReader.read(null, 5);

        assertThat(dimensions.resolution()).isEqualTo("1920x1080");
        assertThat(dimensions.durationSeconds()).isEqualTo(5.0);
    }

    @Test
    void ignoresNonPositiveValues() throws Exception {
        GenerationMetadataReader.VideoDimensions dimensions = GenerationMetadataReader.read(
                objectMapper.readTree("{\"width\":0,\"height\":720,\"resolution\":\"0x0\",\"duration\":-1}"), 4);

        assertThat(dimensions.resolution()).isEqualTo("1920x1080");
        assertThat(dimensions.durationSeconds()).isEqualTo(4.0);
    }
}
