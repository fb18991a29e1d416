package com.alcance.backend.integration;

import com.alcance.backend.domain.enums.LeadCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cliente do serviço externo de coleta de leads.
 */
@Component
@Slf4j
public class LeadSearchClient {

    @Value("${alcance.collector.url:}")
    private String apiUrl;

    @Value("${alcance.collector.api-key:}")
    private String apiKey;

    private final RestClient restClient;

    public LeadSearchClient(RestClient.Builder builder) {
        this.restClient = builder.build();
    }

    public List<LeadRecord> search(String keyword, LeadCategory category, int maxResults) {
        if (apiUrl == null || apiUrl.isBlank()) {
            log.warn("Coletor não configurado (alcance.collector.url); busca por '{}' ignorada.", keyword);
            return List.of();
        }

        Map<String, Object> body = new HashMap<>();
        body.put("keyword", keyword);
        body.put("category", category != null ? category.name() : null);
        body.put("maxResults", maxResults);

        try {
            List<LeadRecord> records = restClient.post()
                .uri(apiUrl + "/search")
                .header("access_token", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(new ParameterizedTypeReference<List<LeadRecord>>() {});
            return records != null ? records : List.of();
        } catch (RestClientException e) {
            throw new IllegalStateException("Erro ao consultar o coletor: " + e.getMessage(), e);
        }
    }
}
