package com.alcance.backend.integration;

import com.alcance.backend.domain.Lead;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * Cliente do serviço externo que procura contatos a partir do perfil do lead.
 */
@Component
@Slf4j
public class ContactExtractorClient {

    @Value("${alcance.extractor.url:}")
    private String apiUrl;

    @Value("${alcance.collector.api-key:}")
    private String apiKey;

    private final RestClient restClient;

    public ContactExtractorClient(RestClient.Builder builder) {
        this.restClient = builder.build();
    }

    public List<ExtractedContact> extract(Lead lead) {
        if (apiUrl == null || apiUrl.isBlank()) {
            log.warn("Extrator não configurado (alcance.extractor.url); lead {} ignorado.", lead.getId());
            return List.of();
        }

        Map<String, Object> body = Map.of(
            "handle", lead.getHandle(),
            "profileUrl", lead.getProfileUrl() != null ? lead.getProfileUrl() : ""
        );

        try {
            List<ExtractedContact> contacts = restClient.post()
                .uri(apiUrl + "/extract")
                .header("access_token", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(new ParameterizedTypeReference<List<ExtractedContact>>() {});
            return contacts != null ? contacts : List.of();
        } catch (RestClientException e) {
            throw new IllegalStateException("Erro ao extrair contatos: " + e.getMessage(), e);
        }
    }
}
