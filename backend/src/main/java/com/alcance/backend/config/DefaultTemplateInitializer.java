package com.alcance.backend.config;

import com.alcance.backend.domain.EmailTemplate;
import com.alcance.backend.domain.enums.TemplateType;
import com.alcance.backend.repository.EmailTemplateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class DefaultTemplateInitializer {

    @Bean
    CommandLineRunner initTemplates(EmailTemplateRepository templateRepository) {
        return args -> {
            // 1. APRESENTAÇÃO
            createIfNotExist(templateRepository, "Apresentação padrão", TemplateType.INTRODUCTION,
                "{{lead_name}}, uma proposta de parceria da {{organization_name}}",
                "<p>Olá, {{lead_name}}!</p>"
                    + "<p>Sou {{sender_name}}, da {{organization_name}}. Acompanhamos o seu conteúdo em "
                    + "<a href=\"{{lead_url}}\">{{lead_url}}</a> e acreditamos que o {{service_name}} "
                    + "combina com o seu público.</p>"
                    + "<p>Podemos conversar sobre uma parceria?</p>"
                    + "<p>Abraços,<br>{{sender_name}}</p>");

            // 2. FOLLOW-UP
            createIfNotExist(templateRepository, "Follow-up padrão", TemplateType.FOLLOW_UP,
                "Re: {{lead_name}}, uma proposta de parceria da {{organization_name}}",
                "<p>Olá de novo, {{lead_name}}!</p>"
                    + "<p>Escrevi há alguns dias sobre o {{service_name}}. Se fizer sentido para você, "
                    + "é só responder este e-mail.</p>"
                    + "<p>Obrigado,<br>{{sender_name}}</p>");
        };
    }

    private void createIfNotExist(EmailTemplateRepository repo, String name, TemplateType type,
                                  String subject, String body) {
        if (repo.findByNameIgnoreCase(name).isPresent()) {
            return;
        }
        EmailTemplate template = new EmailTemplate();
        template.setName(name);
        template.setDescription("Template criado automaticamente");
        template.setType(type);
        template.setSubject(subject);
        template.setBody(body);
        template.setDefaultTemplate(true);
        repo.save(template);
        log.info("Template padrão criado: {}", name);
    }
}
