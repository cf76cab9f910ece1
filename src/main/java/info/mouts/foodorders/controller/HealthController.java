package info.mouts.foodorders.controller;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@Tag(name = "Health API", description = "Service description and liveness")
public class HealthController {
    private final String applicationName;
    private final String version;
    private final Clock clock;

    public HealthController(@Value("${spring.application.name:food-order-service}") String applicationName,
            @Value("${app.version:1.0.0}") String version, Clock clock) {
        this.applicationName = applicationName;
        this.version = version;
        this.clock = clock;
    }

    @GetMapping("/")
    @Operation(summary = "Welcome", description = "Names the service and its main endpoints.")
    public ResponseEntity<Map<String, Object>> home() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "/api/health");
        endpoints.put("orders", "/api/orders");
        endpoints.put("order_submit", "/api/order/submit");
        endpoints.put("products", "/api/products");
        endpoints.put("users", "/api/users");
        endpoints.put("analytics", "/api/analytics/orders");
        endpoints.put("admin", "/api/admin/*");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", applicationName);
        body.put("version", version);
        body.put("status", "running");
        body.put("endpoints", endpoints);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/api/health")
    @Operation(summary = "Health Check")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of("status", "healthy", "timestamp", clock.instant().toString()));
    }
}
