package com.voxell.auth.controller;

import com.voxell.auth.exception.AuthException;
import com.voxell.auth.store.UserStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * StatusController - Liveness and database diagnostics for operators.
 *
 * Endpoints:
 * - GET /     - Static readiness message
 * - GET /test - Backend and user store status; always 200, the body tells
 *               whether the store answered
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class StatusController {

    static final String READY_MESSAGE = "Voxell DLC API ready";

    private final UserStore userStore;

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", READY_MESSAGE);
    }

    @GetMapping("/test")
    public Map<String, Object> test() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("backend", "Running");
        try {
            long players = userStore.count();
            response.put("database", "Connected & Working");
            response.put("connection_status", "Connected");
            response.put("registered_players", players);
        } catch (AuthException e) {
            log.warn("Diagnostics could not reach the user store: {}", e.getMessage());
            response.put("database", "Not Available");
            response.put("connection_status", "Not Connected");
            response.put("registered_players", null);
        }
        return response;
    }
}
