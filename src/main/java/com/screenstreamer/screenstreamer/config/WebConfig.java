package com.screenstreamer.screenstreamer.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ThreadPoolTaskExecutor mjpegStreamExecutor;
    private final RequestLoggingInterceptor requestLoggingInterceptor;

    public WebConfig(@Qualifier("mjpegStreamExecutor") ThreadPoolTaskExecutor mjpegStreamExecutor,
                     RequestLoggingInterceptor requestLoggingInterceptor) {
        this.mjpegStreamExecutor = mjpegStreamExecutor;
        this.requestLoggingInterceptor = requestLoggingInterceptor;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins("*")
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*");
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(requestLoggingInterceptor);
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        // a viewer stays connected until it leaves or the session stops
        configurer.setDefaultTimeout(-1);
        configurer.setTaskExecutor(mjpegStreamExecutor);
    }
}
