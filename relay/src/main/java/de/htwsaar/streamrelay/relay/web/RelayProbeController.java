package de.htwsaar.streamrelay.relay.web;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health- und Readiness-Probes des Relays.
 */
@RestController
@Profile("relay")
public class RelayProbeController {

    private final Clock clock;

    public RelayProbeController(Clock clock) {
        this.clock = clock;
    }

    /** @return HTTP 200 mit Status und Zeitstempel */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", Instant.now(clock).toString());
        return ResponseEntity.ok(body);
    }

    /** @return HTTP 200 "ready" */
    @GetMapping("/ready")
    public ResponseEntity<String> ready() {
        return ResponseEntity.ok("ready");
    }
}
