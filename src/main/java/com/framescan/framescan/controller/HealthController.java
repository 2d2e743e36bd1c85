package com.framescan.framescan.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.framescan.framescan.service.classifier.ClassifierBootstrap;
import com.framescan.framescan.service.session.SessionRegistry;

@RestController
public class HealthController {

    private final ClassifierBootstrap classifierBootstrap;
    private final SessionRegistry registry;

    public HealthController(ClassifierBootstrap classifierBootstrap, SessionRegistry registry) {
        this.classifierBootstrap = classifierBootstrap;
        this.registry = registry;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of(
                "message", "Frame Scan API",
                "version", "1.0.0",
                "status", "running");
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("classifier", classifierBootstrap.isAvailable() ? "loaded" : "unavailable");
        body.put("activeSessions", registry.size());
        return ResponseEntity.ok(body);
    }
}
