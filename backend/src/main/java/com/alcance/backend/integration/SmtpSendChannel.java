package com.alcance.backend.integration;

import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;

@Component
@RequiredArgsConstructor
@Slf4j
public class SmtpSendChannel implements SendChannel {

    private final JavaMailSender mailSender;

    @Value("${alcance.sender.email:nao-responda@alcance.app}")
    private String senderEmail;

    @Value("${alcance.sender.name:}")
    private String senderName;

    @Override
    public SendResult send(String recipient, String subject, String body) {
        MimeMessage message = mailSender.createMimeMessage();
        try {
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            helper.setTo(recipient);
            helper.setSubject(subject);
            helper.setText(body.replaceAll("<[^>]+>", ""), body);
            if (senderName != null && !senderName.isBlank()) {
                helper.setFrom(senderEmail, senderName);
            } else {
                helper.setFrom(senderEmail);
            }
        } catch (MessagingException | UnsupportedEncodingException e) {
            // Endereço malformado não melhora com nova tentativa
            return SendResult.rejected("Mensagem inválida: " + e.getMessage(), 501);
        }

        try {
            mailSender.send(message);
            return SendResult.ok();
        } catch (MailParseException | MailPreparationException e) {
            return SendResult.rejected("Mensagem inválida: " + e.getMessage(), 501);
        } catch (MailSendException e) {
            if (hasInvalidAddress(e)) {
                return SendResult.rejected("Destinatário recusado: " + recipient, 550);
            }
            throw e;
        }
    }

    private static boolean hasInvalidAddress(MailSendException e) {
        for (Exception failure : e.getFailedMessages().values()) {
            if (failure instanceof SendFailedException sendFailed
                    && sendFailed.getInvalidAddresses() != null
                    && sendFailed.getInvalidAddresses().length > 0) {
                return true;
            }
        }
        return false;
    }
}
