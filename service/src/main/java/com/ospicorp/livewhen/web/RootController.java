package com.ospicorp.livewhen.web;

import io.swagger.v3.oas.annotations.Hidden;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness endpoints. The root also reports the zone used to interpret weeks and hours. */
@RestController
@Hidden
public class RootController {
  private final Clock clock;

  public RootController(Clock clock) {
    this.clock = clock;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", "livewhen");
    body.put("status", "ok");
    body.put("zone", clock.getZone().getId());
    body.put("now", ZonedDateTime.now(clock).toOffsetDateTime().toString());
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
