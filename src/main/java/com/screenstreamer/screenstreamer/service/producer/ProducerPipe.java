package com.screenstreamer.screenstreamer.service.producer;

import java.io.IOException;
import java.time.Duration;

/**
 * Byte source of a running capture producer plus its shutdown handle.
 */
public interface ProducerPipe extends AutoCloseable {

    /**
     * Blocks until bytes are available and copies them into {@code buffer}.
     *
     * @return number of bytes read, or -1 once the producer closed its output
     */
    int readChunk(byte[] buffer) throws IOException;

    /**
     * Asks the producer to quit, waits up to {@code timeout}, then kills it.
     * Safe to call more than once and from any thread.
     */
    void requestStop(Duration timeout);

    PipeState getState();

    /**
     * OS process id, or -1 when the producer is not a process.
     */
    long pid();

    @Override
    void close();
}
