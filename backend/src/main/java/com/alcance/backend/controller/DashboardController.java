package com.alcance.backend.controller;

import com.alcance.backend.dto.OutreachDashboardStats;
import com.alcance.backend.service.OutreachDashboardService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/outreach/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final OutreachDashboardService dashboardService;

    @GetMapping
    public OutreachDashboardStats getStats() {
        return dashboardService.getStats();
    }
}
