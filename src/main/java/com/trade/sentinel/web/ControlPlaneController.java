package com.trade.sentinel.web;

import com.trade.sentinel.common.exception.Http;
import com.trade.sentinel.service.ControlPlaneService;
import com.trade.sentinel.service.decision.TradingMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/control")
@RequiredArgsConstructor
@Slf4j
public class ControlPlaneController {

    private final ControlPlaneService controlPlane;

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        return Http.from(controlPlane.getStatus());
    }

    @GetMapping("/breakers")
    public ResponseEntity<?> breakers() {
        return Http.from(controlPlane.getBreakers());
    }

    @PostMapping("/breakers/reset")
    public ResponseEntity<?> resetBreakers(@RequestParam(name = "name", required = false) String name) {
        log.info("Breaker reset requested ({})", name == null ? "all" : name);
        return Http.from(controlPlane.resetBreakers(name));
    }

    @PostMapping("/health/reset")
    public ResponseEntity<?> resetHealth() {
        log.info("Health reset requested");
        return Http.from(controlPlane.resetHealth());
    }

    @PostMapping("/pause")
    public ResponseEntity<?> pause() {
        log.info("Decision pause requested");
        return Http.from(controlPlane.pause());
    }

    @PostMapping("/resume")
    public ResponseEntity<?> resume() {
        log.info("Decision resume requested");
        return Http.from(controlPlane.resume());
    }

    @PutMapping("/mode/{mode}")
    public ResponseEntity<?> mode(@PathVariable("mode") TradingMode mode) {
        log.info("Trading mode change requested: {}", mode);
        return Http.from(controlPlane.setMode(mode));
    }
}
