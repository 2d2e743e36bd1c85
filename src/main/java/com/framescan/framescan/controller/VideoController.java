package com.framescan.framescan.controller;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.framescan.framescan.exception.SessionError;
import com.framescan.framescan.exception.SessionException;
import com.framescan.framescan.service.session.ScanSession;
import com.framescan.framescan.service.session.SessionRegistry;
import com.framescan.framescan.service.storage.VideoStorageService;

/**
 * Video provisioning and playback.
 *
 * Endpoints:
 * - POST /upload-video/ - store a video and open a session for it
 * - GET /get-video/{sessionId} - stream the stored video back for playback
 * - DELETE /cleanup - remove all stored video files and the sessions that never connected
 * - DELETE /cleanup/{sessionId} - tear down one session and its file
 */
@RestController
public class VideoController {

    private final SessionRegistry registry;
    private final VideoStorageService storageService;

    public VideoController(SessionRegistry registry, VideoStorageService storageService) {
        this.registry = registry;
        this.storageService = storageService;
    }

    @PostMapping("/upload-video/")
    public ResponseEntity<Map<String, Object>> uploadVideo(@RequestParam("file") MultipartFile file) {
        storageService.validate(file);

        String sessionId = registry.create();
        try {
            Path stored = storageService.store(sessionId, file);
            registry.assignVideo(sessionId, stored);
        } catch (RuntimeException e) {
            registry.remove(sessionId);
            throw e;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", sessionId);
        body.put("filename", file.getOriginalFilename());
        body.put("size", file.getSize());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/get-video/{sessionId}")
    public ResponseEntity<Resource> getVideo(@PathVariable String sessionId) {
        ScanSession session = registry.require(sessionId);
        Path videoPath = session.getVideoPath();
        if (videoPath == null || !Files.isRegularFile(videoPath)) {
            throw new SessionException(SessionError.VIDEO_NOT_FOUND, "Video file not found");
        }

        Resource resource = new FileSystemResource(videoPath);
        MediaType mediaType = MediaTypeFactory.getMediaType(resource).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok()
                .contentType(mediaType)
                .body(resource);
    }

    @DeleteMapping("/cleanup")
    public ResponseEntity<Map<String, Object>> cleanup() {
        List<String> removed = storageService.cleanupAll();
        List<String> sessions = registry.removeUnclaimed(Instant.now());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Cleaned up " + removed.size() + " files");
        body.put("files", removed);
        body.put("sessions", sessions);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/cleanup/{sessionId}")
    public ResponseEntity<Map<String, Object>> cleanupSession(@PathVariable String sessionId) {
        registry.require(sessionId);
        boolean removed = registry.remove(sessionId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", sessionId);
        body.put("removed", removed);
        return ResponseEntity.ok(body);
    }
}
