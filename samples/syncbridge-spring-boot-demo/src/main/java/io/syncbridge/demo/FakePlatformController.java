package io.syncbridge.demo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * Stands in for the external platform's workflow API so the demo runs offline.
 */
@RestController
@RequestMapping("/fake-platform/api/1.1")
public class FakePlatformController {

    private static final Logger log = LoggerFactory.getLogger(FakePlatformController.class);

    @PostMapping("/wf/{workflow}")
    public Map<String, Object> workflow(@PathVariable String workflow, @RequestBody Map<String, Object> body) {
        log.info("[Platform] wf/{} <- {}", workflow, body);
        return Map.of("status", "success", "response", Map.of("id", UUID.randomUUID().toString()));
    }
}
