package com.alcance.backend.service;

import com.alcance.backend.domain.Contact;
import com.alcance.backend.domain.Lead;
import com.alcance.backend.domain.enums.ContactSource;
import com.alcance.backend.domain.enums.ContactType;
import com.alcance.backend.domain.enums.LeadStatus;
import com.alcance.backend.dto.ContactRequest;
import com.alcance.backend.exception.ValidationException;
import com.alcance.backend.repository.EmailLogRepository;
import com.alcance.backend.repository.LeadRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LeadService")
class LeadServiceTest {

    @Mock private LeadRepository leadRepository;
    @Mock private EmailLogRepository emailLogRepository;

    private LeadService leadService;
    private Lead lead;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-14T13:30:00Z"), ZoneId.of("America/Sao_Paulo"));
        leadService = new LeadService(leadRepository, emailLogRepository, clock);

        lead = new Lead();
        lead.setId(UUID.randomUUID());
        lead.setHandle("cozinha-da-ana");
        lenient().when(leadRepository.findById(lead.getId())).thenReturn(Optional.of(lead));
        lenient().when(leadRepository.save(any(Lead.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    @DisplayName("Status")
    class Status {

        @Test
        @DisplayName("changeStatus fora da tabela é erro de validação")
        void illegalChange() {
            lead.setStatus(LeadStatus.NEW);

            assertThatThrownBy(() -> leadService.changeStatus(lead.getId(), LeadStatus.RESPONDED, null))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("NEW -> RESPONDED");
            verify(leadRepository, never()).save(any());
        }

        @Test
        @DisplayName("changeStatus válido grava e anota")
        void legalChangeWithNote() {
            lead.setStatus(LeadStatus.CONTACTED);

            Lead result = leadService.changeStatus(lead.getId(), LeadStatus.CONVERTED, "Fechou parceria");

            assertThat(result.getStatus()).isEqualTo(LeadStatus.CONVERTED);
            assertThat(result.getNotes()).startsWith("[2026-10-14T10:30]").endsWith("Fechou parceria");
        }

        @Test
        @DisplayName("Estado terminal não sai mais")
        void terminalIsFinal() {
            lead.setStatus(LeadStatus.INVALID);

            assertThat(leadService.advance(lead.getId(), LeadStatus.CONTACTED)).isFalse();
            verify(leadRepository, never()).compareAndSetStatus(any(), any(), any(), any());
        }

        @Test
        @DisplayName("advance aplica via compare-and-set")
        void advanceUsesCompareAndSet() {
            lead.setStatus(LeadStatus.CONTACT_FOUND);
            when(leadRepository.compareAndSetStatus(eq(lead.getId()), eq(LeadStatus.CONTACT_FOUND),
                    eq(LeadStatus.CONTACTED), any())).thenReturn(1);

            assertThat(leadService.advance(lead.getId(), LeadStatus.CONTACTED)).isTrue();
        }

        @Test
        @DisplayName("advance relê uma vez quando perde a corrida")
        void advanceRetriesOnce() {
            lead.setStatus(LeadStatus.CONTACT_FOUND);
            when(leadRepository.compareAndSetStatus(any(), any(), any(), any())).thenReturn(0);

            assertThat(leadService.advance(lead.getId(), LeadStatus.CONTACTED)).isFalse();
            verify(leadRepository, times(2)).compareAndSetStatus(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Mesmo status não é transição")
        void sameStatus() {
            lead.setStatus(LeadStatus.CONTACTED);

            assertThat(leadService.advance(lead.getId(), LeadStatus.CONTACTED)).isFalse();
        }
    }

    @Nested
    @DisplayName("Contatos")
    class Contacts {

        @Test
        @DisplayName("Primeiro contato leva NEW a CONTACT_FOUND")
        void firstContact() {
            Lead result = leadService.addContact(lead.getId(),
                    new ContactRequest(ContactType.EMAIL, " ana@cozinha.com ", null, true));

            assertThat(result.getStatus()).isEqualTo(LeadStatus.CONTACT_FOUND);
            assertThat(result.isHasContact()).isTrue();
            assertThat(result.getContacts()).singleElement().satisfies(c -> {
                assertThat(c.getValue()).isEqualTo("ana@cozinha.com");
                assertThat(c.getSource()).isEqualTo(ContactSource.MANUAL);
            });
        }

        @Test
        @DisplayName("Contato novo não mexe em lead já contatado ou inválido")
        void contactKeepsLaterStatus() {
            lead.setStatus(LeadStatus.CONTACTED);
            leadService.addContact(lead.getId(), new ContactRequest(ContactType.EMAIL, "ana@cozinha.com", null, false));
            assertThat(lead.getStatus()).isEqualTo(LeadStatus.CONTACTED);

            lead.setStatus(LeadStatus.INVALID);
            leadService.addContact(lead.getId(), new ContactRequest(ContactType.EMAIL, "outro@cozinha.com", null, false));
            assertThat(lead.getStatus()).isEqualTo(LeadStatus.INVALID);
        }

        @Test
        @DisplayName("Novo primário desmarca o anterior")
        void singlePrimary() {
            Contact old = Contact.of(ContactType.EMAIL, "antigo@cozinha.com");
            old.setPrimary(true);
            lead.addContact(old);

            leadService.addContact(lead.getId(), new ContactRequest(ContactType.EMAIL, "novo@cozinha.com", null, true));

            assertThat(old.isPrimary()).isFalse();
            assertThat(LeadService.primaryEmail(lead)).contains("novo@cozinha.com");
        }

        @Test
        @DisplayName("E-mail malformado é rejeitado")
        void invalidEmail() {
            assertThatThrownBy(() -> leadService.addContact(lead.getId(),
                    new ContactRequest(ContactType.EMAIL, "sem-arroba", null, false)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Sem primário, usa o primeiro e-mail; sem e-mail, vazio")
        void primaryEmailFallback() {
            lead.addContact(Contact.of(ContactType.PHONE, "+55 11 98888-0000"));
            assertThat(LeadService.primaryEmail(lead)).isEmpty();

            lead.addContact(Contact.of(ContactType.EMAIL, "contato@cozinha.com"));
            assertThat(LeadService.primaryEmail(lead)).contains("contato@cozinha.com");
        }
    }
}
