package com.webapp.backend_telemetry.controller;

import com.webapp.backend_telemetry.dtos.ModelInfoDto;
import com.webapp.backend_telemetry.dtos.OverviewDto;
import com.webapp.backend_telemetry.dtos.RunsReport;
import com.webapp.backend_telemetry.dtos.StatisticsDto;
import com.webapp.backend_telemetry.service.AnalyticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/telemetry")
@RequiredArgsConstructor
public class DashboardController {
    private final AnalyticsService analyticsService;

    @GetMapping("/stats")
    public ResponseEntity<StatisticsDto> stats() {
        return ResponseEntity.ok(analyticsService.getStatistics());
    }

    @GetMapping("/runs")
    public ResponseEntity<RunsReport> runs() {
        return ResponseEntity.ok(analyticsService.getRuns());
    }

    @GetMapping("/model")
    public ResponseEntity<ModelInfoDto> model() {
        return ResponseEntity.ok(analyticsService.getModelInfo());
    }

    @GetMapping("/overview")
    public ResponseEntity<OverviewDto> overview() {
        return ResponseEntity.ok(analyticsService.getOverview());
    }

    @PostMapping("/cache/refresh")
    public ResponseEntity<StatisticsDto> refresh() {
        return ResponseEntity.ok(analyticsService.refresh());
    }
}
