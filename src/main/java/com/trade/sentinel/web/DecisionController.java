package com.trade.sentinel.web;

import com.trade.sentinel.common.exception.Http;
import com.trade.sentinel.service.ControlPlaneService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/decision")
@RequiredArgsConstructor
public class DecisionController {

    private final ControlPlaneService controlPlane;

    @GetMapping("/history")
    public ResponseEntity<?> history(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        return Http.from(controlPlane.history(limit));
    }

    @GetMapping("/vetoes")
    public ResponseEntity<?> vetoes(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        return Http.from(controlPlane.vetoes(limit));
    }
}
