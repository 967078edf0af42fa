package com.screenstreamer.screenstreamer.service.frame;

import java.util.Optional;

/**
 * Single slot holding the most recent frame. One writer, any number of readers.
 * Publishing replaces the slot; frames nobody read in between are dropped.
 * Implementations must never block and never expose a partially published frame.
 */
public interface FrameStore {

    void publish(Frame frame);

    Optional<Frame> snapshot();

    void clear();
}
