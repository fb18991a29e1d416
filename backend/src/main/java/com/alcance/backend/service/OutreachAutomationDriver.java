package com.alcance.backend.service;

import com.alcance.backend.core.runtime.SendCounterRegistry;
import com.alcance.backend.domain.Campaign;
import com.alcance.backend.domain.enums.CampaignStatus;
import com.alcance.backend.dto.AutomationStatus;
import com.alcance.backend.dto.BatchSendResult;
import com.alcance.backend.dto.CollectionResult;
import com.alcance.backend.dto.ExtractionResult;
import com.alcance.backend.repository.CampaignRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Loop de automação: coleta, extração, scoring e um lote por campanha ativa, em intervalo fixo
 * e só dentro do horário de trabalho. Campanhas são processadas em sequência dentro do tick.
 * <p>
 * start()/stop() são idempotentes. stop() no meio de um tick deixa o envio em curso terminar
 * e impede os próximos.
 */
@Service
@Slf4j
public class OutreachAutomationDriver implements SmartLifecycle {

    private final LeadCollectionService collectionService;
    private final LeadScoringService scoringService;
    private final CampaignDispatchService dispatchService;
    private final CampaignRepository campaignRepository;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final ReentrantLock tickLock = new ReentrantLock();
    private final Object lifecycleMonitor = new Object();

    @Value("${alcance.automation.auto-start:false}")
    private boolean autoStart;

    @Value("${alcance.automation.tick-interval-ms:300000}")
    private long tickIntervalMs = 300_000;

    @Value("${alcance.automation.working-hours-start:9}")
    private int workingHoursStart = 9;

    @Value("${alcance.automation.working-hours-end:18}")
    private int workingHoursEnd = 18;

    @Value("${alcance.automation.batch-size:10}")
    private int batchSize = 10;

    @Value("${alcance.automation.auto-collect:true}")
    private boolean autoCollect = true;

    @Value("${alcance.automation.auto-extract:true}")
    private boolean autoExtract = true;

    @Value("${alcance.automation.auto-score:true}")
    private boolean autoScore = true;

    @Value("${alcance.automation.keywords-per-sweep:3}")
    private int keywordsPerSweep = 3;

    @Value("${alcance.automation.results-per-keyword:20}")
    private int resultsPerKeyword = 20;

    @Value("${alcance.automation.extraction-batch-size:20}")
    private int extractionBatchSize = 20;

    @Value("${alcance.automation.scoring-batch-size:100}")
    private int scoringBatchSize = 100;

    @Value("${alcance.automation.stop-timeout-ms:60000}")
    private long stopTimeoutMs = 60_000;

    private volatile boolean running;
    private volatile LocalDateTime startedAt;
    private volatile LocalDateTime lastTickAt;
    private volatile LocalDateTime lastCollectionAt;
    private ScheduledFuture<?> scheduledTick;

    // Contadores do dia, independentes dos contadores por campanha
    private LocalDate today;
    private int collectedToday;
    private int extractedToday;
    private int sentToday;

    public OutreachAutomationDriver(LeadCollectionService collectionService,
                                    LeadScoringService scoringService,
                                    CampaignDispatchService dispatchService,
                                    CampaignRepository campaignRepository,
                                    @Qualifier("automationScheduler") TaskScheduler scheduler,
                                    Clock clock) {
        this.collectionService = collectionService;
        this.scoringService = scoringService;
        this.dispatchService = dispatchService;
        this.campaignRepository = campaignRepository;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (running) {
                log.info("Automação já está em execução.");
                return;
            }
            running = true;
            startedAt = LocalDateTime.now(clock);
            scheduledTick = scheduler.scheduleAtFixedRate(this::tick, Duration.ofMillis(tickIntervalMs));
            log.info("Automação iniciada (intervalo {}ms, horário {}h-{}h).", tickIntervalMs, workingHoursStart, workingHoursEnd);
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (!running) {
                return;
            }
            running = false;
            if (scheduledTick != null) {
                // Sem interrupção: o envio em curso termina normalmente
                scheduledTick.cancel(false);
                scheduledTick = null;
            }
        }
        awaitCurrentTick();
        log.info("Automação parada.");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }

    // Para antes dos contadores de envio
    @Override
    public int getPhase() {
        return SendCounterRegistry.PHASE + 1;
    }

    void tick() {
        if (!running || !tickLock.tryLock()) {
            return;
        }
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            lastTickAt = now;
            rollToday(now.toLocalDate());

            if (!isWithinWorkingHours(now)) {
                log.debug("Fora do horário de trabalho ({}h); tick ignorado.", now.getHour());
                return;
            }

            if (autoCollect && running) {
                try {
                    CollectionResult result = collectionService.collectionSweep(keywordsPerSweep, resultsPerKeyword);
                    lastCollectionAt = LocalDateTime.now(clock);
                    addToday(result.created(), 0, 0);
                } catch (RuntimeException e) {
                    log.error("Erro na coleta automática: {}", e.getMessage(), e);
                }
            }

            if (autoExtract && running) {
                try {
                    ExtractionResult result = collectionService.extractionSweep(extractionBatchSize);
                    addToday(0, result.contactsFound(), 0);
                } catch (RuntimeException e) {
                    log.error("Erro na extração automática: {}", e.getMessage(), e);
                }
            }

            if (autoScore && running) {
                try {
                    scoringService.scoreBatch(true, scoringBatchSize);
                } catch (RuntimeException e) {
                    log.error("Erro no scoring automático: {}", e.getMessage(), e);
                }
            }

            List<Campaign> campaigns = campaignRepository.findByStatusOrderByCreatedAtAsc(CampaignStatus.ACTIVE);
            for (Campaign campaign : campaigns) {
                if (!running) {
                    break;
                }
                try {
                    BatchSendResult result = dispatchService.sendBatch(campaign.getId(), batchSize, this::isRunning);
                    addToday(0, 0, result.sent());
                } catch (RuntimeException e) {
                    log.error("Erro no lote da campanha {}: {}", campaign.getId(), e.getMessage(), e);
                }
            }
        } finally {
            tickLock.unlock();
        }
    }

    public AutomationStatus status() {
        LocalDateTime now = LocalDateTime.now(clock);
        synchronized (this) {
            rollToday(now.toLocalDate());
            return new AutomationStatus(
                running,
                startedAt,
                lastTickAt,
                lastCollectionAt,
                isWithinWorkingHours(now),
                workingHoursStart,
                workingHoursEnd,
                tickIntervalMs,
                today,
                collectedToday,
                extractedToday,
                sentToday
            );
        }
    }

    boolean isWithinWorkingHours(LocalDateTime now) {
        int hour = now.getHour();
        if (workingHoursStart == workingHoursEnd) {
            return true;
        }
        if (workingHoursStart < workingHoursEnd) {
            return hour >= workingHoursStart && hour < workingHoursEnd;
        }
        return hour >= workingHoursStart || hour < workingHoursEnd;
    }

    private synchronized void rollToday(LocalDate date) {
        if (!date.equals(today)) {
            today = date;
            collectedToday = 0;
            extractedToday = 0;
            sentToday = 0;
        }
    }

    private synchronized void addToday(int collected, int extracted, int sent) {
        collectedToday += collected;
        extractedToday += extracted;
        sentToday += sent;
    }

    private void awaitCurrentTick() {
        try {
            if (tickLock.tryLock(stopTimeoutMs, TimeUnit.MILLISECONDS)) {
                tickLock.unlock();
            } else {
                log.warn("Tick em andamento não terminou em {}ms.", stopTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Espera pelo fim do tick interrompida.");
        }
    }
}
