package com.hfm.budget.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class ServiceInfoController {

    static final String SERVICE_NAME = "HFM Budget Analysis Service";

    @GetMapping("/")
    public Map<String, String> root() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("service", SERVICE_NAME);
        body.put("status", "running");
        return body;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }
}
