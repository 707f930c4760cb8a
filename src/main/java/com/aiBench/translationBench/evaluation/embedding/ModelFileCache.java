package com.aiBench.translationBench.evaluation.embedding;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Local copy of remotely published model files (ONNX weights, tokenizer).
 *
 * A file is downloaded once into the cache directory and reused on later starts.
 * Downloads land in a ".part" file first, so an interrupted download is never mistaken
 * for a complete one.
 */
@Slf4j
public class ModelFileCache {

    private final RestClient restClient;
    private final Path cacheDir;

    public ModelFileCache(RestClient restClient, Path cacheDir) {
        this.restClient = restClient;
        this.cacheDir = cacheDir;
    }

    /**
     * Returns the local path of the file published at the given URL, downloading it if needed.
     *
     * @param url HTTP(S) location of the file
     * @return path of the cached file
     * @throws UncheckedIOException if the file cannot be written
     * @throws IllegalStateException if the server does not deliver the file
     */
    public Path resolve(String url) {
        Path target = cacheDir.resolve(fileName(url));
        try {
            if (Files.isRegularFile(target) && Files.size(target) > 0) {
                log.debug("Model file cached - path: {}", target);
                return target;
            }
            Files.createDirectories(cacheDir);
            Path partial = target.resolveSibling(target.getFileName() + ".part");

            long startTime = System.currentTimeMillis();
            log.info("Downloading model file - url: {}, target: {}", url, target);
            restClient.get()
                    .uri(URI.create(url))
                    .exchange((request, response) -> {
                        if (!response.getStatusCode().is2xxSuccessful()) {
                            throw new IllegalStateException("Model file download failed - status: "
                                    + response.getStatusCode().value() + ", url: " + url);
                        }
                        try (InputStream body = response.getBody()) {
                            Files.copy(body, partial, StandardCopyOption.REPLACE_EXISTING);
                        }
                        return partial;
                    });
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Model file downloaded - path: {}, bytes: {}, latency: {}ms",
                    target, Files.size(target), System.currentTimeMillis() - startTime);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to cache model file from " + url, e);
        }
    }

    static String fileName(String url) {
        String path = URI.create(url).getPath();
        String name = path == null ? "" : path.substring(path.lastIndexOf('/') + 1);
        if (name.isBlank()) {
            throw new IllegalArgumentException("Model file URL has no file name: " + url);
        }
        return name;
    }
}
