package com.screenstreamer.screenstreamer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.screenstreamer.screenstreamer.config.ScreenStreamerProperties;
import com.screenstreamer.screenstreamer.model.SessionState;
import com.screenstreamer.screenstreamer.service.capture.CaptureSessionService;

@SpringBootTest
class ScreenStreamerApplicationTests {

    @Autowired
    private CaptureSessionService sessionService;

    @Autowired
    private ScreenStreamerProperties properties;

    @Test
    void contextLoadsIdle() {
        assertFalse(properties.isAutoStart());
        assertEquals(SessionState.IDLE, sessionService.status().getState());
        assertNull(sessionService.getActiveSession());
    }

    @Test
    void defaultsComeFromApplicationProperties() {
        assertEquals(15, properties.getProducer().getFrameRate());
        assertEquals("frame", properties.getStream().getBoundary());
        assertEquals(10L * 1024 * 1024, properties.getScanner().getMaxBufferSize().toBytes());
    }
}
