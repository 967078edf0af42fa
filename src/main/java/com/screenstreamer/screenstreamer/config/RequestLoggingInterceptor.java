package com.screenstreamer.screenstreamer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import com.screenstreamer.screenstreamer.service.stream.StreamBroadcastService;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Logs control and viewer requests when {@code logging.request.enabled=true}.
 * Viewer connects carry the current viewer count; control calls are logged
 * again on completion with status and duration.
 */
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingInterceptor.class);

    private static final String START_ATTRIBUTE = RequestLoggingInterceptor.class.getName() + ".start";

    private final StreamBroadcastService broadcastService;

    @Value("${logging.request.enabled:false}")
    private boolean enabled;

    @Value("${logging.request.zone:}")
    private String zone;

    public RequestLoggingInterceptor(StreamBroadcastService broadcastService) {
        this.broadcastService = broadcastService;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!enabled || !(handler instanceof HandlerMethod)) {
            return true;
        }

        String handlerName = ((HandlerMethod) handler).getMethod().getName();
        if (isViewer(request)) {
            logger.info("Viewer request at {} from {} ({} already watching), agent={}",
                    timestamp(), request.getRemoteAddr(), broadcastService.getActiveCount(),
                    request.getHeader("User-Agent"));
        } else {
            request.setAttribute(START_ATTRIBUTE, System.nanoTime());
            logger.info("{} {} -> {} at {} from {}", request.getMethod(), request.getRequestURI(), handlerName,
                    timestamp(), request.getRemoteAddr());
        }
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
                                Exception ex) {
        Object start = request.getAttribute(START_ATTRIBUTE);
        if (!enabled || !(start instanceof Long)) {
            return;
        }
        long tookMillis = (System.nanoTime() - (Long) start) / 1_000_000;
        logger.info("{} {} answered {} in {} ms", request.getMethod(), request.getRequestURI(),
                response.getStatus(), tookMillis);
    }

    private static boolean isViewer(HttpServletRequest request) {
        return "/stream".equals(request.getRequestURI());
    }

    private String timestamp() {
        ZoneId zoneId = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        return ZonedDateTime.ofInstant(Instant.now(), zoneId).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
