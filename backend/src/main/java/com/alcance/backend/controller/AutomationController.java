package com.alcance.backend.controller;

import com.alcance.backend.dto.AutomationStatus;
import com.alcance.backend.service.OutreachAutomationDriver;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/outreach/automation")
@RequiredArgsConstructor
public class AutomationController {

    private final OutreachAutomationDriver automationDriver;

    @PostMapping("/start")
    public AutomationStatus start() {
        automationDriver.start();
        return automationDriver.status();
    }

    @PostMapping("/stop")
    public AutomationStatus stop() {
        automationDriver.stop();
        return automationDriver.status();
    }

    @GetMapping("/status")
    public AutomationStatus status() {
        return automationDriver.status();
    }
}
