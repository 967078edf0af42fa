package com.screenstreamer.screenstreamer.service.producer;

public interface ProducerLauncher {

    ProducerPipe launch(ProducerConfig config) throws LaunchException;
}
