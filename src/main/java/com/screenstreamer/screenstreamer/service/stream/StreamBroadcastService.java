package com.screenstreamer.screenstreamer.service.stream;

import java.io.OutputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.screenstreamer.screenstreamer.config.ScreenStreamerProperties;
import com.screenstreamer.screenstreamer.service.capture.CaptureSession;

/**
 * Tracks the viewers of the MJPEG stream. Each viewer runs its own
 * {@link StreamSubscriber} loop on the thread serving its response.
 */
@Service
public class StreamBroadcastService {

    private static final Logger logger = LoggerFactory.getLogger(StreamBroadcastService.class);

    private final ScreenStreamerProperties.Stream settings;
    private final Map<String, StreamSubscriber> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong subscriberIds = new AtomicLong();

    public StreamBroadcastService(ScreenStreamerProperties properties) {
        this.settings = properties.getStream();
    }

    /**
     * Streams {@code session}'s frames to {@code out} until the viewer leaves
     * or the session ends. Blocks the calling thread.
     */
    public void serve(CaptureSession session, OutputStream out, String remoteAddress) {
        String id = "viewer-" + subscriberIds.incrementAndGet();
        StreamSubscriber subscriber = new StreamSubscriber(id, session.getId(), session.getFrameStore(),
                session::isActive, out, settings.getBoundary(), settings.getMinInterval(), settings.getPollInterval());

        subscribers.put(id, subscriber);
        logger.info("{} connected from {} to session {} ({} active)", id, remoteAddress, session.getId(),
                subscribers.size());
        try {
            subscriber.run();
        } finally {
            subscribers.remove(id);
            logger.info("{} left after {} frames ({} active)", id, subscriber.getFramesSent(), subscribers.size());
        }
    }

    /**
     * Tells every viewer of {@code sessionId} to stop at its next tick.
     *
     * @return number of viewers signalled
     */
    public int closeSubscribers(String sessionId) {
        int count = 0;
        for (StreamSubscriber subscriber : subscribers.values()) {
            if (sessionId.equals(subscriber.getSessionId())) {
                subscriber.close();
                count++;
            }
        }
        if (count > 0) {
            logger.info("Closing {} viewer(s) of session {}", count, sessionId);
        }
        return count;
    }

    /**
     * True once as many viewers are connected as the streaming executor has threads.
     */
    public boolean isFull() {
        return subscribers.size() >= settings.getMaxConnections();
    }

    public int getActiveCount() {
        return subscribers.size();
    }
}
