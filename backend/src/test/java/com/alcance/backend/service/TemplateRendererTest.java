package com.alcance.backend.service;

import com.alcance.backend.domain.EmailTemplate;
import com.alcance.backend.domain.Lead;
import com.alcance.backend.dto.RenderedMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TemplateRenderer")
class TemplateRendererTest {

    private TemplateRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new TemplateRenderer();
        ReflectionTestUtils.setField(renderer, "senderName", "Marina");
        ReflectionTestUtils.setField(renderer, "organizationName", "Alcance");
        ReflectionTestUtils.setField(renderer, "serviceName", "Alcance Pro");
        ReflectionTestUtils.setField(renderer, "unsubscribeText", "Não quer mais receber?");
        ReflectionTestUtils.setField(renderer, "trackingBaseUrl", "https://api.alcance.app");
        ReflectionTestUtils.setField(renderer, "trackOpens", true);
        ReflectionTestUtils.setField(renderer, "trackClicks", true);
    }

    @Test
    @DisplayName("Substitui variáveis do lead e do remetente")
    void rendersLeadAndSenderVariables() {
        Lead lead = new Lead();
        lead.setHandle("cozinha-da-ana");
        lead.setDisplayName("Ana");
        EmailTemplate template = new EmailTemplate();
        template.setSubject("{{lead_name}}, conheça o {{service_name}}");
        template.setBody("Olá {{ lead_name }}! Aqui é {{sender_name}} da {{organization_name}} ({{lead_handle}}).");

        RenderedMessage message = renderer.render(template, lead, "ana@blog.com", null);

        assertThat(message.recipient()).isEqualTo("ana@blog.com");
        assertThat(message.subject()).isEqualTo("Ana, conheça o Alcance Pro");
        assertThat(message.body()).isEqualTo("Olá Ana! Aqui é Marina da Alcance (cozinha-da-ana).");
    }

    @Test
    @DisplayName("Placeholder sem valor vira string vazia")
    void unresolvedPlaceholderIsEmpty() {
        assertThat(renderer.render("Oi {{desconhecido}}!", Map.of())).isEqualTo("Oi !");
    }

    @Test
    @DisplayName("Variáveis da chamada têm prioridade e aceitam caracteres especiais")
    void customVariables() {
        Lead lead = new Lead();
        lead.setHandle("h");
        Map<String, String> vars = renderer.variablesFor(lead, Map.of("lead_name", "R$ 10\\dia"));

        assertThat(renderer.render("{{lead_name}}", vars)).isEqualTo("R$ 10\\dia");
    }

    @Test
    @DisplayName("Sem nome de exibição usa o handle")
    void fallsBackToHandle() {
        Lead lead = new Lead();
        lead.setHandle("viagens-do-bruno");

        assertThat(renderer.variablesFor(lead, null)).containsEntry("lead_name", "viagens-do-bruno");
    }

    @Test
    @DisplayName("HTML rastreado tem pixel, links embrulhados e rodapé de descadastro")
    void trackedHtml() {
        String html = renderer.toTrackedHtml(
                "<p>Veja <a href=\"https://alcance.app/parceria\">a proposta</a> ou <a href=\"mailto:oi@alcance.app\">escreva</a></p>",
                "trk-1");

        assertThat(html).contains("https://api.alcance.app/api/outreach/track/open/trk-1");
        assertThat(html).contains("https://api.alcance.app/api/outreach/track/click/trk-1?url=https%3A%2F%2Falcance.app%2Fparceria");
        assertThat(html).contains("href=\"mailto:oi@alcance.app\"");
        assertThat(html).contains("href=\"https://api.alcance.app/api/outreach/unsubscribe/trk-1\"");
        assertThat(html).contains("Não quer mais receber?");
        assertThat(html.indexOf("track/open")).isLessThan(html.indexOf("</body>"));
    }

    @Test
    @DisplayName("Rastreamento desligado mantém só o rodapé")
    void trackingDisabled() {
        ReflectionTestUtils.setField(renderer, "trackOpens", false);
        ReflectionTestUtils.setField(renderer, "trackClicks", false);

        String html = renderer.toTrackedHtml("<a href=\"https://alcance.app\">site</a>", "trk-2");

        assertThat(html).doesNotContain("track/open").doesNotContain("track/click");
        assertThat(html).contains("href=\"https://alcance.app\"").contains("/unsubscribe/trk-2");
    }
}
