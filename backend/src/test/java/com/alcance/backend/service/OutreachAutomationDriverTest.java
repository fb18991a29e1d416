package com.alcance.backend.service;

import com.alcance.backend.core.runtime.MutableClock;
import com.alcance.backend.domain.Campaign;
import com.alcance.backend.domain.enums.CampaignStatus;
import com.alcance.backend.dto.AutomationStatus;
import com.alcance.backend.dto.BatchSendResult;
import com.alcance.backend.dto.BatchSendResult.StopReason;
import com.alcance.backend.dto.CollectionResult;
import com.alcance.backend.dto.ExtractionResult;
import com.alcance.backend.repository.CampaignRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutreachAutomationDriver")
class OutreachAutomationDriverTest {

    @Mock private LeadCollectionService collectionService;
    @Mock private LeadScoringService scoringService;
    @Mock private CampaignDispatchService dispatchService;
    @Mock private CampaignRepository campaignRepository;
    @Mock private TaskScheduler scheduler;
    @Mock private ScheduledFuture<Object> future;

    private MutableClock clock;
    private OutreachAutomationDriver driver;

    @BeforeEach
    void setUp() {
        // Quarta-feira, 10:30 local
        clock = new MutableClock(Instant.parse("2026-10-14T13:30:00Z"), ZoneId.of("America/Sao_Paulo"));
        driver = new OutreachAutomationDriver(collectionService, scoringService, dispatchService,
                campaignRepository, scheduler, clock);
        ReflectionTestUtils.setField(driver, "stopTimeoutMs", 1_000L);
        lenient().doReturn(future).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
    }

    private static Campaign campaign() {
        Campaign campaign = new Campaign();
        campaign.setId(UUID.randomUUID());
        campaign.setStatus(CampaignStatus.ACTIVE);
        return campaign;
    }

    private static BatchSendResult sent(UUID campaignId, int sent) {
        return new BatchSendResult(campaignId, 10, sent, sent, 0, 0, StopReason.NO_PENDING_LEADS, false, List.of());
    }

    private void onlyDispatch() {
        ReflectionTestUtils.setField(driver, "autoCollect", false);
        ReflectionTestUtils.setField(driver, "autoExtract", false);
        ReflectionTestUtils.setField(driver, "autoScore", false);
    }

    @Test
    @DisplayName("start e stop são idempotentes")
    void idempotentLifecycle() {
        driver.start();
        driver.start();

        assertThat(driver.isRunning()).isTrue();
        verify(scheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofMillis(300_000)));

        driver.stop();
        driver.stop();

        assertThat(driver.isRunning()).isFalse();
        verify(future, times(1)).cancel(false);
    }

    @Test
    @DisplayName("Não inicia sozinho por padrão")
    void noAutoStartByDefault() {
        assertThat(driver.isAutoStartup()).isFalse();
    }

    @Test
    @DisplayName("Tick sem start não faz nada")
    void tickWhileStopped() {
        driver.tick();

        verifyNoInteractions(collectionService, scoringService, dispatchService, campaignRepository);
    }

    @Test
    @DisplayName("Fora do horário de trabalho o tick não coleta nem envia")
    void outsideWorkingHours() {
        clock.advance(Duration.ofHours(10)); // 20:30
        driver.start();

        driver.tick();

        verifyNoInteractions(collectionService, scoringService, dispatchService, campaignRepository);
        assertThat(driver.status().withinWorkingHours()).isFalse();
    }

    @Test
    @DisplayName("Tick completo: coleta, extração, scoring e um lote por campanha ativa")
    void fullTick() {
        Campaign first = campaign();
        Campaign second = campaign();
        when(collectionService.collectionSweep(3, 20)).thenReturn(new CollectionResult(1, 12, 4, 8, 0));
        when(collectionService.extractionSweep(20)).thenReturn(new ExtractionResult(10, 3, 5, 0));
        when(campaignRepository.findByStatusOrderByCreatedAtAsc(CampaignStatus.ACTIVE)).thenReturn(List.of(first, second));
        when(dispatchService.sendBatch(eq(first.getId()), eq(10), any())).thenReturn(sent(first.getId(), 2));
        when(dispatchService.sendBatch(eq(second.getId()), eq(10), any())).thenReturn(sent(second.getId(), 3));
        driver.start();

        driver.tick();

        verify(scoringService).scoreBatch(true, 100);
        AutomationStatus status = driver.status();
        assertThat(status.collectedToday()).isEqualTo(4);
        assertThat(status.extractedToday()).isEqualTo(5);
        assertThat(status.sentToday()).isEqualTo(5);
        assertThat(status.lastCollectionAt()).isEqualTo(LocalDateTime.of(2026, 10, 14, 10, 30));
    }

    @Test
    @DisplayName("Falha na coleta não impede os envios")
    void collectionFailureIsContained() {
        Campaign only = campaign();
        when(collectionService.collectionSweep(anyInt(), anyInt())).thenThrow(new IllegalStateException("API fora do ar"));
        when(collectionService.extractionSweep(anyInt())).thenReturn(new ExtractionResult(0, 0, 0, 0));
        when(campaignRepository.findByStatusOrderByCreatedAtAsc(CampaignStatus.ACTIVE)).thenReturn(List.of(only));
        when(dispatchService.sendBatch(eq(only.getId()), anyInt(), any())).thenReturn(sent(only.getId(), 1));
        driver.start();

        driver.tick();

        assertThat(driver.status().sentToday()).isEqualTo(1);
    }

    @Test
    @DisplayName("stop no meio do tick deixa o lote em curso terminar e não começa a próxima campanha")
    void stopMidTick() {
        onlyDispatch();
        Campaign first = campaign();
        Campaign second = campaign();
        when(campaignRepository.findByStatusOrderByCreatedAtAsc(CampaignStatus.ACTIVE)).thenReturn(List.of(first, second));
        ArgumentCaptor<BooleanSupplier> keepRunning = ArgumentCaptor.forClass(BooleanSupplier.class);
        when(dispatchService.sendBatch(eq(first.getId()), eq(10), keepRunning.capture())).thenAnswer(inv -> {
            driver.stop();
            return sent(first.getId(), 1);
        });
        driver.start();

        driver.tick();

        assertThat(keepRunning.getValue().getAsBoolean()).isFalse();
        verify(dispatchService, never()).sendBatch(eq(second.getId()), anyInt(), any());
        assertThat(driver.status().sentToday()).isEqualTo(1);
    }

    @Test
    @DisplayName("Contadores do dia zeram na virada")
    void countersResetAtMidnight() {
        onlyDispatch();
        Campaign only = campaign();
        when(campaignRepository.findByStatusOrderByCreatedAtAsc(CampaignStatus.ACTIVE)).thenReturn(List.of(only));
        when(dispatchService.sendBatch(eq(only.getId()), anyInt(), any())).thenReturn(sent(only.getId(), 4));
        driver.start();
        driver.tick();
        assertThat(driver.status().sentToday()).isEqualTo(4);

        clock.advance(Duration.ofDays(1));

        assertThat(driver.status().sentToday()).isZero();
    }

    @Test
    @DisplayName("Horário de trabalho [início, fim)")
    void workingHoursBoundaries() {
        assertThat(driver.isWithinWorkingHours(LocalDateTime.of(2026, 10, 14, 9, 0))).isTrue();
        assertThat(driver.isWithinWorkingHours(LocalDateTime.of(2026, 10, 14, 17, 59))).isTrue();
        assertThat(driver.isWithinWorkingHours(LocalDateTime.of(2026, 10, 14, 18, 0))).isFalse();
        assertThat(driver.isWithinWorkingHours(LocalDateTime.of(2026, 10, 14, 8, 59))).isFalse();
    }
}
