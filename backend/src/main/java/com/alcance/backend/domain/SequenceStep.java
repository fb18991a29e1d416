package com.alcance.backend.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Embeddable
@NoArgsConstructor
@AllArgsConstructor
public class SequenceStep {

    @Column(name = "template_id", nullable = false)
    private UUID templateId;

    // Dias de espera após o passo anterior (ignorado no primeiro passo)
    @Column(name = "delay_days")
    private int delayDays;
}
