package com.screenstreamer.screenstreamer.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Stand-in for the capture encoder, run as a child JVM.
 *
 * Usage: FakeEncoderMain mode frameCount frameSize
 * - graceful: write frames, then exit on 'q' from stdin
 * - stubborn: write frames, then ignore stdin and never exit
 * - exit: write frames and exit at once
 */
public class FakeEncoderMain {

    public static void main(String[] args) throws IOException, InterruptedException {
        String mode = args.length > 0 ? args[0] : "graceful";
        int frameCount = args.length > 1 ? Integer.parseInt(args[1]) : 3;
        int frameSize = args.length > 2 ? Integer.parseInt(args[2]) : 100;

        OutputStream out = System.out;
        for (int i = 0; i < frameCount; i++) {
            out.write(JpegFixtures.syntheticFrame(frameSize, i));
        }
        out.flush();
        System.err.println("fake encoder wrote " + frameCount + " frames");
        System.err.flush();

        switch (mode) {
            case "exit":
                return;
            case "stubborn":
                while (true) {
                    Thread.sleep(60_000);
                }
            default:
                InputStream in = System.in;
                int b;
                while ((b = in.read()) >= 0) {
                    if (b == 'q') {
                        System.err.println("fake encoder quitting");
                        return;
                    }
                }
        }
    }
}
