package com.framescan.framescan.service.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import com.framescan.framescan.config.ScanProperties;
import com.framescan.framescan.service.session.SessionResourceManager;

import jakarta.annotation.PostConstruct;

/**
 * Where uploaded videos live on disk between upload and session teardown.
 */
@Service
public class VideoStorageService {

    private static final Logger logger = LoggerFactory.getLogger(VideoStorageService.class);

    static final Map<String, String> SUPPORTED_FORMATS = Map.of(
            "video/mp4", ".mp4",
            "video/avi", ".avi",
            "video/mov", ".mov",
            "video/quicktime", ".mov",
            "video/x-msvideo", ".avi",
            "video/webm", ".webm");

    private final SessionResourceManager resourceManager;
    private final ScanProperties.Storage config;
    private final Path uploadDir;
    private final Path tempDir;

    public VideoStorageService(SessionResourceManager resourceManager, ScanProperties properties) {
        this.resourceManager = resourceManager;
        this.config = properties.getStorage();
        this.uploadDir = Paths.get(config.getUploadDir());
        this.tempDir = Paths.get(config.getTempDir());
    }

    /**
     * Create the storage directories and, unless disabled, remove files left
     * over from a previous run (crash or hard stop).
     */
    @PostConstruct
    public void init() throws IOException {
        Files.createDirectories(uploadDir);
        Files.createDirectories(tempDir);
        if (config.isPurgeOnStartup()) {
            List<String> leftovers = cleanupAll();
            if (!leftovers.isEmpty()) {
                logger.info("Removed {} leftover video files from a previous run", leftovers.size());
            }
        }
    }

    /**
     * Check type and size before anything is allocated for an upload.
     *
     * @throws IllegalArgumentException if the upload is not acceptable
     */
    public void validate(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("No video file provided");
        }
        if (!SUPPORTED_FORMATS.containsKey(file.getContentType())) {
            throw new IllegalArgumentException("Unsupported file type. Supported formats: "
                    + SUPPORTED_FORMATS.keySet().stream().sorted().toList());
        }
        if (file.getSize() > config.getMaxUploadBytes()) {
            throw new IllegalArgumentException("File too large. Maximum size is "
                    + (config.getMaxUploadBytes() / (1024 * 1024)) + "MB.");
        }
    }

    /**
     * Save an upload as {@code <sessionId><ext>} in the upload directory.
     */
    public Path store(String sessionId, MultipartFile file) {
        String extension = SUPPORTED_FORMATS.getOrDefault(file.getContentType(), ".mp4");
        Path target = uploadDir.resolve(sessionId + extension);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            resourceManager.deleteVideoFile(target);
            throw new UncheckedIOException("Failed to save uploaded file", e);
        }
        logger.info("Saved upload {} for session {} ({} bytes)", file.getOriginalFilename(), sessionId, file.getSize());
        return target;
    }

    /**
     * Remove every file in the upload and temp directories, whatever session
     * they belong to.
     *
     * @return names of the deleted files
     */
    public List<String> cleanupAll() {
        List<String> removed = new ArrayList<>();
        for (Path dir : List.of(tempDir, uploadDir)) {
            try {
                removed.addAll(resourceManager.purgeDirectory(dir));
            } catch (IOException e) {
                throw new UncheckedIOException("Cleanup failed for " + dir, e);
            }
        }
        logger.info("Cleaned up {} temporary files", removed.size());
        return removed;
    }
}
