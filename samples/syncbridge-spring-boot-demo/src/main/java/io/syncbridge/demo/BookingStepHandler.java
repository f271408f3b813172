package io.syncbridge.demo;

import io.syncbridge.spi.StepHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Step handler behind the {@code bookings} target function.
 */
@Component
public class BookingStepHandler implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(BookingStepHandler.class);

    @Override
    public Map<String, Object> handle(String action, Map<String, Object> payload) {
        if (!"create".equals(action)) {
            throw new IllegalArgumentException("Unsupported bookings action: " + action);
        }
        log.info("[Step] bookings/{} payload={}", action, payload);
        return Map.of("id", "bk-" + payload.get("listingId"), "guest", payload.get("guest"));
    }
}
