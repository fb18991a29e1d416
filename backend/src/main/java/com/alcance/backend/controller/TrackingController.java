package com.alcance.backend.controller;

import com.alcance.backend.domain.EmailLog;
import com.alcance.backend.exception.ValidationException;
import com.alcance.backend.service.EmailTrackingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.Base64;
import java.util.UUID;

/**
 * Eventos de engajamento. Pixel, clique e descadastro são públicos (vêm do e-mail);
 * os endpoints /logs/{id}/... recebem callbacks do provedor ou do operador.
 */
@RestController
@RequestMapping("/api/outreach")
@RequiredArgsConstructor
public class TrackingController {

    // GIF transparente 1x1
    private static final byte[] PIXEL = Base64.getDecoder()
            .decode("R0lGODlhAQABAIAAAAAAAP///yH5BAEAAAAALAAAAAABAAEAAAIBRAA7");

    private final EmailTrackingService trackingService;

    @GetMapping("/track/open/{trackingId}")
    public ResponseEntity<byte[]> trackOpen(@PathVariable String trackingId) {
        trackingService.trackOpen(trackingId);
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_GIF)
                .cacheControl(CacheControl.noStore())
                .body(PIXEL);
    }

    @GetMapping("/track/click/{trackingId}")
    public ResponseEntity<Void> trackClick(@PathVariable String trackingId, @RequestParam String url) {
        URI target;
        try {
            target = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("URL de destino inválida.");
        }
        if (target.getScheme() == null
                || !(target.getScheme().equalsIgnoreCase("http") || target.getScheme().equalsIgnoreCase("https"))) {
            throw new ValidationException("URL de destino inválida.");
        }
        trackingService.trackClick(trackingId);
        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, target.toString())
                .build();
    }

    @RequestMapping(value = "/unsubscribe/{trackingId}", method = {RequestMethod.GET, RequestMethod.POST},
            produces = MediaType.TEXT_HTML_VALUE)
    public ResponseEntity<String> unsubscribe(@PathVariable String trackingId,
                                              @RequestParam(required = false) String reason) {
        boolean found = trackingService.unsubscribe(trackingId, reason).isPresent();
        String message = found
                ? "Pronto! Você não receberá mais nossos e-mails."
                : "Link de descadastro inválido ou expirado.";
        String html = "<!DOCTYPE html><html><head><meta charset=\"utf-8\"><title>Descadastro</title></head>"
                + "<body style=\"font-family: Arial, sans-serif; text-align: center; padding: 40px;\">"
                + "<h2>" + message + "</h2></body></html>";
        return ResponseEntity.status(found ? HttpStatus.OK : HttpStatus.NOT_FOUND).body(html);
    }

    // --- Callbacks por id do log ---

    @PostMapping("/logs/{id}/opened")
    public EmailLog markOpened(@PathVariable UUID id) {
        return trackingService.markOpened(id);
    }

    @PostMapping("/logs/{id}/clicked")
    public EmailLog markClicked(@PathVariable UUID id) {
        return trackingService.markClicked(id);
    }

    @PostMapping("/logs/{id}/replied")
    public EmailLog markReplied(@PathVariable UUID id) {
        return trackingService.markReplied(id);
    }
}
