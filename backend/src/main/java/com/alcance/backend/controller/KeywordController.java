package com.alcance.backend.controller;

import com.alcance.backend.domain.SearchKeyword;
import com.alcance.backend.dto.CollectRequest;
import com.alcance.backend.dto.CollectionResult;
import com.alcance.backend.dto.KeywordRequest;
import com.alcance.backend.service.LeadCollectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/outreach/keywords")
@RequiredArgsConstructor
public class KeywordController {

    private final LeadCollectionService collectionService;

    @GetMapping
    public List<SearchKeyword> list() {
        return collectionService.listKeywords();
    }

    @PostMapping
    public ResponseEntity<SearchKeyword> create(@RequestBody KeywordRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(collectionService.createKeyword(request));
    }

    @PatchMapping("/{id}")
    public SearchKeyword update(@PathVariable UUID id, @RequestBody KeywordRequest request) {
        return collectionService.updateKeyword(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        collectionService.deleteKeyword(id);
        return ResponseEntity.noContent().build();
    }

    // Coleta manual de uma palavra-chave
    @PostMapping("/collect")
    public CollectionResult collect(@RequestBody CollectRequest request) {
        int max = request.maxResults() != null ? request.maxResults() : 20;
        return collectionService.collect(request.keyword(), request.category(), max);
    }
}
