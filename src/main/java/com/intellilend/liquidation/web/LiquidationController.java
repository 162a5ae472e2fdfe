package com.intellilend.liquidation.web;

import com.intellilend.liquidation.common.exception.Http;
import com.intellilend.liquidation.service.monitor.LiquidationMonitorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/liquidation")
@RequiredArgsConstructor
@Slf4j
public class LiquidationController {

    private final LiquidationMonitorService monitor;

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        return Http.from(monitor.getStatus());
    }

    @GetMapping("/borrowers/{address}")
    public ResponseEntity<?> borrower(@PathVariable("address") String address) {
        return Http.from(monitor.getBorrowerDetail(address));
    }

    @PostMapping("/start")
    public ResponseEntity<?> start() {
        log.info("Monitor start requested");
        return Http.from(monitor.start());
    }

    @PostMapping("/stop")
    public ResponseEntity<?> stop() {
        log.info("Monitor stop requested");
        return Http.from(monitor.stop());
    }

    @PostMapping("/sweep")
    public ResponseEntity<?> sweep() {
        log.info("Manual sweep requested");
        return Http.from(monitor.sweep());
    }
}
