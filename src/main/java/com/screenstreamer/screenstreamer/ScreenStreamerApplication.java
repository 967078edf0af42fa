package com.screenstreamer.screenstreamer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ScreenStreamerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ScreenStreamerApplication.class, args);
	}

}
