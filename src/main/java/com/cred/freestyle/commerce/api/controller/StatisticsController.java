package com.cred.freestyle.commerce.api.controller;

import com.cred.freestyle.commerce.service.StatisticsService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Back-office dashboard counters.
 *
 * @author Commerce Platform Team
 */
@RestController
@RequestMapping("/api/v1/admin/statistics")
@PreAuthorize("hasRole('ADMIN')")
public class StatisticsController {

    private final StatisticsService statisticsService;

    public StatisticsController(StatisticsService statisticsService) {
        this.statisticsService = statisticsService;
    }

    @GetMapping("/products")
    public ResponseEntity<Map<String, Long>> productStatistics() {
        return ResponseEntity.ok(statisticsService.productStatistics());
    }

    @GetMapping("/users")
    public ResponseEntity<Map<String, Long>> userStatistics() {
        return ResponseEntity.ok(statisticsService.userStatistics());
    }

    @GetMapping("/orders")
    public ResponseEntity<Map<String, Long>> orderStatistics() {
        return ResponseEntity.ok(statisticsService.orderStatistics());
    }
}
