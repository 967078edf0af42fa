package com.screenstreamer.screenstreamer.service.frame;

public interface FrameScanListener {

    void onFrame(Frame frame);

    default void onDesync(StreamDesyncException e) {
    }
}
