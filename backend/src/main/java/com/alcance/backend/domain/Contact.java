package com.alcance.backend.domain;

import com.alcance.backend.domain.enums.ContactSource;
import com.alcance.backend.domain.enums.ContactType;
import com.fasterxml.jackson.annotation.JsonBackReference;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Entity
@Table(name = "lead_contacts")
@EqualsAndHashCode(of = "id")
@ToString(exclude = "lead")
public class Contact {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "lead_id", nullable = false)
    @JsonBackReference
    private Lead lead;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ContactType type;

    @Column(name = "contact_value", nullable = false)
    private String value;

    @Enumerated(EnumType.STRING)
    private ContactSource source = ContactSource.PROFILE;

    @Column(name = "is_primary")
    private boolean primary;

    private boolean verified;

    @Column(name = "extracted_at")
    private LocalDateTime extractedAt;

    public static Contact of(ContactType type, String value) {
        Contact contact = new Contact();
        contact.setType(type);
        contact.setValue(value);
        return contact;
    }

    @PrePersist
    protected void onCreate() {
        if (extractedAt == null) extractedAt = LocalDateTime.now();
    }
}
