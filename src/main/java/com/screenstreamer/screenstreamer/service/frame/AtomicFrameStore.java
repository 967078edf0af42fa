package com.screenstreamer.screenstreamer.service.frame;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

public class AtomicFrameStore implements FrameStore {

    private final AtomicReference<Frame> slot = new AtomicReference<>();
    private final AtomicLong publishCount = new AtomicLong();

    @Override
    public void publish(Frame frame) {
        if (frame == null) {
            throw new IllegalArgumentException("frame must not be null");
        }
        slot.set(frame);
        publishCount.incrementAndGet();
    }

    @Override
    public Optional<Frame> snapshot() {
        return Optional.ofNullable(slot.get());
    }

    @Override
    public void clear() {
        slot.set(null);
    }

    public long getPublishCount() {
        return publishCount.get();
    }
}
