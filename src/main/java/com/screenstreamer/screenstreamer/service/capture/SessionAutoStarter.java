package com.screenstreamer.screenstreamer.service.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.screenstreamer.screenstreamer.config.ScreenStreamerProperties;
import com.screenstreamer.screenstreamer.service.producer.LaunchException;

import lombok.RequiredArgsConstructor;

/**
 * Starts capturing at boot when {@code screenstreamer.auto-start=true}.
 */
@Component
@RequiredArgsConstructor
public class SessionAutoStarter {

    private static final Logger logger = LoggerFactory.getLogger(SessionAutoStarter.class);

    private final ScreenStreamerProperties properties;
    private final CaptureSessionService sessionService;

    @EventListener(ApplicationReadyEvent.class)
    public void startOnBoot() {
        if (!properties.isAutoStart()) {
            return;
        }
        try {
            sessionService.startSession(null);
        } catch (LaunchException e) {
            logger.error("Auto-start failed, use POST /session/start to retry: {}", e.getMessage());
        } catch (IllegalStateException e) {
            logger.info("Auto-start skipped: {}", e.getMessage());
        }
    }
}
