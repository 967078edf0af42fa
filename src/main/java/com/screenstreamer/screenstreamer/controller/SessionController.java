package com.screenstreamer.screenstreamer.controller;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import com.screenstreamer.screenstreamer.model.dto.SessionStatus;
import com.screenstreamer.screenstreamer.model.dto.StartSessionRequest;
import com.screenstreamer.screenstreamer.service.capture.CaptureSessionService;
import com.screenstreamer.screenstreamer.service.producer.LaunchException;

import lombok.RequiredArgsConstructor;

/**
 * Capture session control
 *
 * Endpoints:
 * - POST /session/start - launch the screen capture producer
 * - POST /session/stop - stop it and disconnect all viewers
 * - GET /session/status - state and counters of the current session
 */
@RestController
@RequestMapping("/session")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class SessionController {

    private final CaptureSessionService sessionService;

    /**
     * POST /session/start
     * {
     *   "frameRate": 15,
     *   "quality": 5,
     *   "scaleWidth": 1280,
     *   "previewWidth": 800
     * }
     * Body is optional; missing fields fall back to application.properties.
     */
    @PostMapping("/start")
    public ResponseEntity<?> start(@RequestBody(required = false) StartSessionRequest request) {
        if (request != null) {
            if (request.getFrameRate() != null && request.getFrameRate() <= 0) {
                return ResponseEntity.badRequest().body(Map.of("error", "frameRate must be positive"));
            }
            if (request.getQuality() != null && (request.getQuality() < 2 || request.getQuality() > 31)) {
                return ResponseEntity.badRequest().body(Map.of("error", "quality must be between 2 and 31"));
            }
            if (request.getScaleWidth() != null && request.getScaleWidth() < 0) {
                return ResponseEntity.badRequest().body(Map.of("error", "scaleWidth cannot be negative"));
            }
            if (request.getPreviewWidth() != null && request.getPreviewWidth() <= 0) {
                return ResponseEntity.badRequest().body(Map.of("error", "previewWidth must be positive"));
            }
        }

        try {
            return ResponseEntity.ok(sessionService.startSession(request));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (LaunchException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/stop")
    public ResponseEntity<SessionStatus> stop() {
        return ResponseEntity.ok(sessionService.stopSession());
    }

    @GetMapping("/status")
    public ResponseEntity<SessionStatus> status() {
        return ResponseEntity.ok(sessionService.status());
    }
}
