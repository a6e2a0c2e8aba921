package com.hfm.apigateway.controller;

import com.hfm.apigateway.config.ServiceEndpoints;
import com.hfm.apigateway.routing.GatewayRoute;
import com.hfm.apigateway.routing.GatewayRouteTable;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Endpoints the gateway answers itself, without contacting a backend.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final GatewayRouteTable routeTable;
    private final ServiceEndpoints serviceEndpoints;

    @GetMapping("/health")
    public Mono<Map<String, String>> health() {
        return Mono.just(Map.of("status", "healthy"));
    }

    @GetMapping("/routes")
    public Mono<ResponseEntity<Map<String, Object>>> routes() {
        List<Map<String, String>> routes = routeTable.getRoutes().stream()
                .map(this::describe)
                .collect(Collectors.toList());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("routes", routes);
        body.put("totalRoutes", routes.size());
        return Mono.just(ResponseEntity.ok(body));
    }

    private Map<String, String> describe(GatewayRoute route) {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("id", route.getId());
        info.put("path", route.getPathPattern());
        info.put("service", route.getService().getServiceName());
        info.put("target", serviceEndpoints.uriFor(route.getService()).toString());
        return info;
    }
}
