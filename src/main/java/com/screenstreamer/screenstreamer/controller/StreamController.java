package com.screenstreamer.screenstreamer.controller;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import com.screenstreamer.screenstreamer.config.ScreenStreamerProperties;
import com.screenstreamer.screenstreamer.service.capture.CaptureSession;
import com.screenstreamer.screenstreamer.service.capture.CaptureSessionService;
import com.screenstreamer.screenstreamer.service.stream.StreamBroadcastService;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

/**
 * GET /stream - live multipart/x-mixed-replace JPEG feed of the current capture session.
 */
@RestController
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class StreamController {

    private final CaptureSessionService sessionService;
    private final StreamBroadcastService broadcastService;
    private final ScreenStreamerProperties properties;

    @GetMapping("/stream")
    public ResponseEntity<StreamingResponseBody> stream(HttpServletRequest request) {
        CaptureSession session = sessionService.getActiveSession();
        if (session == null) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "No capture session is running");
        }
        if (broadcastService.isFull()) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE,
                    "Viewer limit of " + properties.getStream().getMaxConnections() + " reached");
        }

        String remoteAddress = request.getRemoteAddr();
        StreamingResponseBody body = out -> broadcastService.serve(session, out, remoteAddress);

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE,
                        "multipart/x-mixed-replace; boundary=" + properties.getStream().getBoundary())
                .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
                .header(HttpHeaders.PRAGMA, "no-cache")
                .header(HttpHeaders.EXPIRES, "0")
                .body(body);
    }
}
