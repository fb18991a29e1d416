package com.alcance.backend.controller;

import com.alcance.backend.domain.Campaign;
import com.alcance.backend.dto.BatchSendResult;
import com.alcance.backend.dto.CampaignDetail;
import com.alcance.backend.dto.CampaignRequest;
import com.alcance.backend.service.CampaignDispatchService;
import com.alcance.backend.service.CampaignService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/outreach/campaigns")
@RequiredArgsConstructor
public class CampaignController {

    private final CampaignService campaignService;
    private final CampaignDispatchService dispatchService;

    @GetMapping
    public List<Campaign> list() {
        return campaignService.list();
    }

    @GetMapping("/{id}")
    public CampaignDetail detail(@PathVariable UUID id) {
        return campaignService.detail(id);
    }

    @PostMapping
    public ResponseEntity<Campaign> create(@RequestBody CampaignRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(campaignService.create(request));
    }

    @PatchMapping("/{id}")
    public Campaign update(@PathVariable UUID id, @RequestBody CampaignRequest request) {
        return campaignService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        campaignService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // --- CICLO DE VIDA ---

    @PostMapping("/{id}/start")
    public Campaign start(@PathVariable UUID id) {
        return campaignService.start(id);
    }

    @PostMapping("/{id}/pause")
    public Campaign pause(@PathVariable UUID id) {
        return campaignService.pause(id);
    }

    @PostMapping("/{id}/resume")
    public Campaign resume(@PathVariable UUID id) {
        return campaignService.resume(id);
    }

    @PostMapping("/{id}/complete")
    public Campaign complete(@PathVariable UUID id) {
        return campaignService.complete(id);
    }

    @PostMapping("/{id}/send-batch")
    public BatchSendResult sendBatch(@PathVariable UUID id, @RequestParam(defaultValue = "10") int batchSize) {
        return dispatchService.sendBatch(id, batchSize);
    }
}
