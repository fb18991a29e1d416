package com.alcance.backend.service;

import com.alcance.backend.domain.EmailTemplate;
import com.alcance.backend.domain.Lead;
import com.alcance.backend.dto.RenderedMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renderiza templates com placeholders {{variavel}}.
 * Placeholder sem valor vira string vazia.
 */
@Service
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-zA-Z0-9_]+)\\s*}}");
    private static final Pattern HREF = Pattern.compile("href=[\"']([^\"']+)[\"']");

    @Value("${alcance.sender.name:}")
    private String senderName;

    @Value("${alcance.sender.organization:}")
    private String organizationName;

    @Value("${alcance.sender.service-name:}")
    private String serviceName;

    @Value("${alcance.sender.unsubscribe-text:Se não quiser mais receber estes e-mails, clique em descadastrar.}")
    private String unsubscribeText;

    @Value("${alcance.tracking.base-url:http://localhost:8080}")
    private String trackingBaseUrl;

    @Value("${alcance.tracking.opens:true}")
    private boolean trackOpens;

    @Value("${alcance.tracking.clicks:true}")
    private boolean trackClicks;

    public String render(String text, Map<String, String> variables) {
        if (text == null) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = variables.getOrDefault(matcher.group(1), "");
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public Map<String, String> variablesFor(Lead lead, Map<String, String> custom) {
        Map<String, String> variables = new HashMap<>();
        String name = lead.getDisplayName() != null ? lead.getDisplayName() : lead.getHandle();
        variables.put("lead_name", name);
        variables.put("lead_handle", lead.getHandle());
        variables.put("lead_url", lead.getProfileUrl());
        variables.put("sender_name", senderName);
        variables.put("organization_name", organizationName);
        variables.put("service_name", serviceName);
        if (custom != null) {
            variables.putAll(custom);
        }
        return variables;
    }

    public RenderedMessage render(EmailTemplate template, Lead lead, String recipient, Map<String, String> custom) {
        Map<String, String> variables = variablesFor(lead, custom);
        return new RenderedMessage(recipient, render(template.getSubject(), variables), render(template.getBody(), variables));
    }

    /**
     * Corpo HTML final com rodapé de descadastro, pixel de abertura e links rastreados.
     */
    public String toTrackedHtml(String body, String trackingId) {
        String unsubscribeUrl = trackingBaseUrl + "/api/outreach/unsubscribe/" + trackingId;
        String html = "<!DOCTYPE html><html><head><meta charset=\"utf-8\"></head>"
                + "<body style=\"font-family: Arial, sans-serif; line-height: 1.6; color: #333;\">"
                + body
                + "<hr style=\"border: none; border-top: 1px solid #eee; margin: 20px 0;\">"
                + "<p style=\"font-size: 12px; color: #999;\">" + unsubscribeText
                + " <a href=\"" + unsubscribeUrl + "\">Descadastrar</a></p>"
                + "</body></html>";

        if (trackClicks) {
            html = wrapLinks(html, trackingId, unsubscribeUrl);
        }
        if (trackOpens) {
            String pixel = "<img src=\"" + trackingBaseUrl + "/api/outreach/track/open/" + trackingId
                    + "\" width=\"1\" height=\"1\" style=\"display:none;\" />";
            html = html.replace("</body>", pixel + "</body>");
        }
        return html;
    }

    private String wrapLinks(String html, String trackingId, String unsubscribeUrl) {
        Matcher matcher = HREF.matcher(html);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String url = matcher.group(1);
            String replacement = matcher.group(0);
            boolean skip = url.startsWith("mailto:") || url.startsWith("tel:")
                    || url.contains("/track/click/") || url.equals(unsubscribeUrl);
            if (!skip) {
                replacement = "href=\"" + trackingBaseUrl + "/api/outreach/track/click/" + trackingId
                        + "?url=" + URLEncoder.encode(url, StandardCharsets.UTF_8) + "\"";
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
