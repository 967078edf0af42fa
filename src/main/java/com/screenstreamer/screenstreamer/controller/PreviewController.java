package com.screenstreamer.screenstreamer.controller;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.screenstreamer.screenstreamer.service.preview.LatestPreviewHolder;

import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class PreviewController {

    private static final Logger logger = LoggerFactory.getLogger(PreviewController.class);

    private final LatestPreviewHolder previewHolder;

    /**
     * Latest downscaled preview as a single JPEG, 404 until one has been decoded.
     */
    @GetMapping("/preview")
    public ResponseEntity<byte[]> preview() {
        try {
            byte[] jpeg = previewHolder.encodeLatestAsJpeg();
            if (jpeg == null) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok()
                    .contentType(MediaType.IMAGE_JPEG)
                    .cacheControl(CacheControl.noStore())
                    .body(jpeg);
        } catch (IOException e) {
            logger.error("Encoding preview failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }
}
