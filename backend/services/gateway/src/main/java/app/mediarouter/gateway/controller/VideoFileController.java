package app.mediarouter.gateway.controller;

import app.mediarouter.gateway.storage.LocalVideoStorage;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;

@RestController
public class VideoFileController {

    private static final MediaType VIDEO_MP4 = MediaType.parseMediaType("video/mp4");

    private final LocalVideoStorage videoStorage;

    public VideoFileController(LocalVideoStorage videoStorage) {
        this.videoStorage = videoStorage;
    }

    @GetMapping("/videos/{fileName:.+}")
    public ResponseEntity<Resource> video(@PathVariable String fileName) {
        Path path;
        try {
            path = videoStorage.find(fileName)
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Video not found"));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
        }
        return ResponseEntity.ok()
                .contentType(VIDEO_MP4)
                .body(new FileSystemResource(path));
    }
}
