package app.mediarouter.gateway.storage;

import java.util.Map;

public interface ArtifactDownloader {
    /**
     * Streams the artifact at {@code url} to durable storage.
     *
     * @return the stored location, e.g. {@code /videos/gen_abc.mp4}
     */
    String download(String url, String fileName, Map<String, String> headers);

    String publicUrl(String storedLocation);

    boolean delete(String fileName);
}
