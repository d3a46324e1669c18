package app.mediarouter.gateway.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class LocalVideoStorage implements ArtifactDownloader {

    private static final Logger log = LoggerFactory.getLogger(LocalVideoStorage.class);

    public static final String LOCATION_PREFIX = "/videos/";
    private static final String DEFAULT_PATH = "./storage/videos";

    private final RestClient restClient;
    private final Path storagePath;
    private final String publicBaseUrl;

    public LocalVideoStorage(RestClient.Builder restClientBuilder, StorageProps props) {
        String path = props == null || props.path() == null || props.path().isBlank() ? DEFAULT_PATH : props.path();
        this.storagePath = Paths.get(path).toAbsolutePath().normalize();
        this.publicBaseUrl = props == null || props.publicBaseUrl() == null ? "" : trimTrailingSlash(props.publicBaseUrl());
        this.restClient = restClientBuilder.build();
        try {
            Files.createDirectories(storagePath);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to create video storage directory " + storagePath, ex);
        }
    }

    @Override
    public String download(String url, String fileName, Map<String, String> headers) {
        String name = fileName == null || fileName.isBlank() ? UUID.randomUUID() + ".mp4" : fileName;
        Path target = resolve(name);
        Path partial = target.resolveSibling(name + ".part");
        Map<String, String> requestHeaders = headers == null ? Map.of() : headers;

        try {
            restClient.get()
                    .uri(URI.create(url))
                    .headers(httpHeaders -> requestHeaders.forEach(httpHeaders::set))
                    .exchange((request, response) -> {
                        if (response.getStatusCode().isError()) {
                            throw new IllegalStateException("Video download failed with HTTP " + response.getStatusCode().value());
                        }
                        try (InputStream body = response.getBody()) {
                            Files.copy(body, partial, StandardCopyOption.REPLACE_EXISTING);
                        }
                        return null;
                    });
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            discardPartial(partial);
            throw new UncheckedIOException("Failed to store video " + name, ex);
        } catch (RuntimeException ex) {
            discardPartial(partial);
            throw ex;
        }
        log.info("Video stored file={} bytes={}", name, sizeOf(target));
        return LOCATION_PREFIX + name;
    }

    @Override
    public String publicUrl(String storedLocation) {
        return publicBaseUrl + storedLocation;
    }

    public Optional<Path> find(String fileName) {
        Path path = resolve(fileName);
        return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }

    @Override
    public boolean delete(String fileName) {
        try {
            return Files.deleteIfExists(resolve(fileName));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to delete video " + fileName, ex);
        }
    }

    /**
     * File name part of a stored location such as {@code /videos/gen_abc.mp4}.
     */
    public static String fileNameOf(String storedLocation) {
        if (storedLocation == null) {
            return null;
        }
        int slash = storedLocation.lastIndexOf('/');
        return slash < 0 ? storedLocation : storedLocation.substring(slash + 1);
    }

    private Path resolve(String fileName) {
        Path resolved = storagePath.resolve(fileName).normalize();
        if (!storagePath.equals(resolved.getParent())) {
            throw new IllegalArgumentException("Invalid video file name: " + fileName);
        }
        return resolved;
    }

    private void discardPartial(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException ex) {
            log.warn("Failed to remove partial download file={} error={}", partial.getFileName(), ex.getMessage());
        }
    }

    private long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException ex) {
            return -1L;
        }
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
