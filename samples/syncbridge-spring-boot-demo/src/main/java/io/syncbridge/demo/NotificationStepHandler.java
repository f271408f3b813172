package io.syncbridge.demo;

import io.syncbridge.spi.StepHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class NotificationStepHandler implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(NotificationStepHandler.class);

    @Override
    public Map<String, Object> handle(String action, Map<String, Object> payload) {
        log.info("[Step] notifications/{} to={} booking={}", action, payload.get("to"), payload.get("bookingId"));
        return Map.of("sent", true);
    }
}
