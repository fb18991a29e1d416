package com.alcance.backend.core.runtime;

import com.alcance.backend.domain.SchedulerCounter;
import com.alcance.backend.domain.enums.CounterScope;
import com.alcance.backend.repository.SchedulerCounterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.UUID;

/**
 * Contadores de envio por (campanha, dia) e (campanha, hora).
 * <p>
 * Vive enquanto o processo vive: carregado do banco no start() e descartado no stop().
 * Toda verificação de cota é um check-and-increment sob o lock da campanha; o valor
 * "enviado" só sobe depois do envio confirmado, e as reservas em andamento entram na conta
 * para que chamadas concorrentes nunca ultrapassem o limite.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SendCounterRegistry implements SmartLifecycle {

    public static final int PHASE = Integer.MAX_VALUE - 1000;

    private static final DateTimeFormatter HOUR_KEY = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH");

    private final SchedulerCounterRepository counterRepository;
    private final Clock clock;

    private final ConcurrentMap<UUID, CampaignWindow> windows = new ConcurrentHashMap<>();
    private volatile boolean running;

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        windows.clear();
        String dayKey = dayKey(now());
        String hourKey = hourKey(now());

        for (SchedulerCounter counter : counterRepository.findByScopeAndWindowKey(CounterScope.DAY, dayKey)) {
            window(counter.getCampaignId()).daySent = counter.getSentCount();
        }
        for (SchedulerCounter counter : counterRepository.findByScopeAndWindowKey(CounterScope.HOUR, hourKey)) {
            window(counter.getCampaignId()).hourSent = counter.getSentCount();
        }
        running = true;
        log.info("Contadores de envio carregados ({} campanhas com envios hoje).", windows.size());
    }

    @Override
    public synchronized void stop() {
        running = false;
        windows.clear();
        log.info("Contadores de envio descarregados.");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // Sobe antes e desce depois do driver de automação
    @Override
    public int getPhase() {
        return PHASE;
    }

    public Reservation tryReserve(UUID campaignId, SendLimits limits) {
        ensureRunning();
        LocalDateTime now = now();
        CampaignWindow window = window(campaignId);

        synchronized (window) {
            window.roll(dayKey(now), hourKey(now));

            if (window.daySent + window.inFlight >= limits.dailyLimit()) {
                return Reservation.denied(campaignId, Reservation.Denial.DAILY_LIMIT);
            }
            if (window.hourSent + window.inFlight >= limits.hourlyLimit()) {
                return Reservation.denied(campaignId, Reservation.Denial.HOURLY_LIMIT);
            }
            if (limits.minIntervalSeconds() > 0 && window.lastAttemptAt != null
                    && now.isBefore(window.lastAttemptAt.plusSeconds(limits.minIntervalSeconds()))) {
                return Reservation.denied(campaignId, Reservation.Denial.MIN_INTERVAL);
            }

            window.inFlight++;
            window.lastAttemptAt = now;
            return Reservation.granted(campaignId, window.dayKey, window.hourKey);
        }
    }

    /**
     * Envio confirmado: a reserva vira envio contabilizado.
     */
    public void commit(Reservation reservation) {
        requireGranted(reservation);
        LocalDateTime now = now();
        CampaignWindow window = window(reservation.campaignId());

        synchronized (window) {
            window.roll(dayKey(now), hourKey(now));
            if (reservation.dayKey().equals(window.dayKey) && window.inFlight > 0) {
                window.inFlight--;
            }
            window.daySent++;
            window.hourSent++;
            // Memória vale para a cota; o próximo commit regrava o valor atual se esta gravação falhar
            try {
                persist(reservation.campaignId(), CounterScope.DAY, window.dayKey, window.daySent, now);
                persist(reservation.campaignId(), CounterScope.HOUR, window.hourKey, window.hourSent, now);
            } catch (RuntimeException e) {
                log.error("Falha ao gravar contadores da campanha {}: {}", reservation.campaignId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Envio falhou: devolve a vaga sem contar nada.
     */
    public void release(Reservation reservation) {
        requireGranted(reservation);
        LocalDateTime now = now();
        CampaignWindow window = window(reservation.campaignId());

        synchronized (window) {
            window.roll(dayKey(now), hourKey(now));
            if (reservation.dayKey().equals(window.dayKey) && window.inFlight > 0) {
                window.inFlight--;
            }
        }
    }

    public CounterSnapshot snapshot(UUID campaignId) {
        ensureRunning();
        LocalDateTime now = now();
        CampaignWindow window = window(campaignId);
        synchronized (window) {
            window.roll(dayKey(now), hourKey(now));
            return new CounterSnapshot(window.dayKey, window.daySent, window.hourKey, window.hourSent, window.inFlight);
        }
    }

    private void persist(UUID campaignId, CounterScope scope, String windowKey, int value, LocalDateTime now) {
        SchedulerCounter counter = counterRepository
                .findByCampaignIdAndScopeAndWindowKey(campaignId, scope, windowKey)
                .orElseGet(() -> {
                    SchedulerCounter created = new SchedulerCounter();
                    created.setCampaignId(campaignId);
                    created.setScope(scope);
                    created.setWindowKey(windowKey);
                    return created;
                });
        counter.setSentCount(value);
        counter.setUpdatedAt(now);
        counterRepository.save(counter);
    }

    private CampaignWindow window(UUID campaignId) {
        return windows.computeIfAbsent(campaignId, id -> {
            CampaignWindow window = new CampaignWindow();
            window.dayKey = dayKey(now());
            window.hourKey = hourKey(now());
            return window;
        });
    }

    private void ensureRunning() {
        if (!running) {
            throw new IllegalStateException("SendCounterRegistry não foi inicializado.");
        }
    }

    private static void requireGranted(Reservation reservation) {
        if (reservation == null || !reservation.isGranted()) {
            throw new IllegalArgumentException("Reserva não concedida.");
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    static String dayKey(LocalDateTime time) {
        return time.toLocalDate().toString();
    }

    static String hourKey(LocalDateTime time) {
        return time.truncatedTo(ChronoUnit.HOURS).format(HOUR_KEY);
    }

    // Estado mutável protegido pelo monitor da própria instância
    private static final class CampaignWindow {
        String dayKey;
        String hourKey;
        int daySent;
        int hourSent;
        int inFlight;
        LocalDateTime lastAttemptAt;

        void roll(String currentDay, String currentHour) {
            if (!currentDay.equals(dayKey)) {
                dayKey = currentDay;
                daySent = 0;
                inFlight = 0;
            }
            if (!currentHour.equals(hourKey)) {
                hourKey = currentHour;
                hourSent = 0;
            }
        }
    }
}
