package com.xendex.backend.controllers;

import com.xendex.backend.dto.analytics.FunnelDto;
import com.xendex.backend.dto.analytics.OverviewDto;
import com.xendex.backend.dto.analytics.SequenceMetricsDto;
import com.xendex.backend.services.AnalyticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    @GetMapping("/overview")
    public ResponseEntity<OverviewDto> getOverview() {
        return ResponseEntity.ok(analyticsService.getOverview());
    }

    @GetMapping("/sequences/{sequenceId}")
    public ResponseEntity<SequenceMetricsDto> getSequenceMetrics(@PathVariable Long sequenceId) {
        return ResponseEntity.ok(analyticsService.getSequenceMetrics(sequenceId));
    }

    @GetMapping("/funnel")
    public ResponseEntity<FunnelDto> getFunnel() {
        return ResponseEntity.ok(analyticsService.getFunnel());
    }
}
