package com.screenstreamer.screenstreamer.service.producer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * External capture process with stdout exposed as a byte source.
 *
 * stderr is drained on a daemon thread into the {@code ...SubprocessPipe.stderr}
 * logger so the process never stalls on a full diagnostic pipe.
 */
public class SubprocessPipe implements ProducerPipe {

    private static final Logger logger = LoggerFactory.getLogger(SubprocessPipe.class);
    private static final Logger stderrLogger = LoggerFactory.getLogger(SubprocessPipe.class.getName() + ".stderr");

    private static final long FORCE_KILL_WAIT_MS = 5000;

    private final Process process;
    private final String name;
    private final String quitSignal;
    private final InputStream stdout;
    private final Thread stderrDrain;

    private volatile PipeState state = PipeState.RUNNING;

    private SubprocessPipe(Process process, String name, String quitSignal) {
        this.process = process;
        this.name = name;
        this.quitSignal = quitSignal;
        this.stdout = process.getInputStream();
        this.stderrDrain = new Thread(this::drainStderr, "producer-stderr-" + process.pid());
        this.stderrDrain.setDaemon(true);
    }

    /**
     * Launches {@code command} with all three standard streams piped.
     *
     * @param quitSignal text written to stdin to ask for a graceful exit
     * @throws LaunchException if the executable is missing or cannot be started
     */
    public static SubprocessPipe start(List<String> command, String quitSignal) throws LaunchException {
        if (command == null || command.isEmpty()) {
            throw new LaunchException("Producer command is empty");
        }
        String name = command.get(0);
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException | SecurityException e) {
            throw new LaunchException("Failed to start producer '" + name + "': " + e.getMessage(), e);
        }

        SubprocessPipe pipe = new SubprocessPipe(process, name, quitSignal);
        pipe.stderrDrain.start();
        logger.info("Started producer {} (pid {})", name, process.pid());
        return pipe;
    }

    @Override
    public int readChunk(byte[] buffer) throws IOException {
        try {
            int n = stdout.read(buffer);
            if (n < 0) {
                markExitedIfDone();
            }
            return n;
        } catch (IOException e) {
            // stdout is torn down under us when the process is stopped
            if (state != PipeState.RUNNING || !process.isAlive()) {
                logger.debug("Producer {} output closed: {}", name, e.getMessage());
                markExitedIfDone();
                return -1;
            }
            throw e;
        }
    }

    @Override
    public synchronized void requestStop(Duration timeout) {
        if (state != PipeState.RUNNING) {
            return;
        }
        if (!process.isAlive()) {
            state = PipeState.EXITED;
            closeStdin();
            return;
        }

        state = PipeState.STOP_REQUESTED;
        sendQuitSignal();

        boolean exited = false;
        try {
            exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for producer {} to quit", name);
        }

        if (exited) {
            state = PipeState.EXITED;
            logger.info("Producer {} exited with code {}", name, process.exitValue());
        } else {
            logger.warn("Producer {} did not exit within {} ms, killing it", name, timeout.toMillis());
            process.destroyForcibly();
            awaitForcedExit();
            state = PipeState.FORCE_KILLED;
        }
        closeStdin();
    }

    private void sendQuitSignal() {
        try {
            OutputStream stdin = process.getOutputStream();
            stdin.write(quitSignal.getBytes(StandardCharsets.US_ASCII));
            stdin.flush();
        } catch (IOException e) {
            logger.debug("Could not send quit signal to producer {}: {}", name, e.getMessage());
        }
    }

    private void awaitForcedExit() {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    if (!process.waitFor(FORCE_KILL_WAIT_MS, TimeUnit.MILLISECONDS)) {
                        logger.error("Producer {} still alive {} ms after kill", name, FORCE_KILL_WAIT_MS);
                    }
                    return;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void markExitedIfDone() {
        synchronized (this) {
            if (state == PipeState.RUNNING && !process.isAlive()) {
                state = PipeState.EXITED;
            }
        }
    }

    private void closeStdin() {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            logger.debug("Error closing producer stdin: {}", e.getMessage());
        }
    }

    private void drainStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                stderrLogger.debug("{}: {}", name, line);
            }
        } catch (IOException e) {
            logger.debug("Producer {} stderr closed: {}", name, e.getMessage());
        }
    }

    @Override
    public PipeState getState() {
        return state;
    }

    @Override
    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Stops the producer if still running and releases its output stream.
     */
    @Override
    public void close() {
        requestStop(Duration.ofSeconds(2));
        try {
            stdout.close();
        } catch (IOException e) {
            logger.debug("Error closing producer stdout: {}", e.getMessage());
        }
    }
}
