package com.alcance.backend.config;

import com.alcance.backend.integration.DispatchRetryPolicy;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Beans de tempo, threads e política de reenvio usados pelo envio e pela automação.
 */
@Configuration
@Slf4j
public class RuntimeConfig {

    @Bean
    public Clock clock(@Value("${alcance.zone:America/Sao_Paulo}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }

    @Bean
    public DispatchRetryPolicy dispatchRetryPolicy() {
        return new DispatchRetryPolicy();
    }

    @Bean
    public RetryConfig dispatchRetryConfig(
            DispatchRetryPolicy policy,
            @Value("${alcance.dispatch.max-attempts:3}") int maxAttempts,
            @Value("${alcance.dispatch.backoff-initial-ms:2000}") long initialBackoffMs,
            @Value("${alcance.dispatch.backoff-multiplier:2.0}") double multiplier,
            @Value("${alcance.dispatch.backoff-max-ms:30000}") long maxBackoffMs) {
        return policy.retryConfig(maxAttempts, initialBackoffMs, multiplier, maxBackoffMs);
    }

    @Bean
    public Retry dispatchRetry(RetryConfig dispatchRetryConfig) {
        Retry retry = Retry.of("email-dispatch", dispatchRetryConfig);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Falha temporária no envio (tentativa {}): {}. Nova tentativa em {}ms",
                        event.getNumberOfRetryAttempts(), describe(event.getLastThrowable()),
                        event.getWaitInterval().toMillis()));
        return retry;
    }

    private static String describe(Throwable error) {
        return error != null ? error.getMessage() : "rejeição temporária do provedor";
    }

    // Chamadas ao canal de envio, cada uma com timeout imposto pelo DispatchWorker
    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor(@Value("${alcance.dispatch.pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    // Uma thread só: ticks da automação nunca rodam em paralelo
    @Bean(name = "automationScheduler")
    public ThreadPoolTaskScheduler automationScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("automacao-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(60);
        scheduler.initialize();
        return scheduler;
    }
}
