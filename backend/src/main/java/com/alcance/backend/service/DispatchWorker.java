package com.alcance.backend.service;

import com.alcance.backend.dto.DispatchOutcome;
import com.alcance.backend.dto.RenderedMessage;
import com.alcance.backend.integration.DispatchRetryPolicy;
import com.alcance.backend.integration.FailureKind;
import com.alcance.backend.integration.SendChannel;
import com.alcance.backend.integration.SendResult;
import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chama o canal externo com timeout por tentativa; o reenvio fica a cargo do {@link Retry} de envio.
 * Nunca lança exceção: o resultado sempre volta como {@link DispatchOutcome}.
 */
@Service
@Slf4j
public class DispatchWorker {

    private final SendChannel sendChannel;
    private final DispatchRetryPolicy retryPolicy;
    private final Retry dispatchRetry;
    private final AsyncTaskExecutor dispatchExecutor;

    @Value("${alcance.dispatch.timeout-ms:15000}")
    private long timeoutMs = 15000;

    public DispatchWorker(SendChannel sendChannel,
                          DispatchRetryPolicy retryPolicy,
                          Retry dispatchRetry,
                          @Qualifier("dispatchExecutor") AsyncTaskExecutor dispatchExecutor) {
        this.sendChannel = sendChannel;
        this.retryPolicy = retryPolicy;
        this.dispatchRetry = dispatchRetry;
        this.dispatchExecutor = dispatchExecutor;
    }

    public DispatchOutcome dispatch(UUID leadId, RenderedMessage message) {
        AtomicInteger attempts = new AtomicInteger();
        CheckedSupplier<SendResult> send = Retry.decorateCheckedSupplier(dispatchRetry, () -> {
            attempts.incrementAndGet();
            return sendWithTimeout(message);
        });

        FailureKind kind;
        String reason;
        try {
            SendResult result = send.get();
            if (result.accepted()) {
                return DispatchOutcome.accepted(attempts.get());
            }
            kind = retryPolicy.classify(result);
            reason = result.reason();
        } catch (TimeoutException e) {
            kind = FailureKind.TRANSIENT;
            reason = "Timeout após " + timeoutMs + "ms";
        } catch (RejectedExecutionException e) {
            kind = FailureKind.TRANSIENT;
            reason = "Fila de envio cheia";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DispatchOutcome.failed(FailureKind.TRANSIENT, attempts.get(), "Envio interrompido");
        } catch (Error e) {
            throw e;
        } catch (Throwable e) {
            kind = retryPolicy.classify(e);
            reason = e.getMessage();
        }

        log.error("Envio para lead {} falhou ({}) após {} tentativa(s): {}", leadId, kind, attempts.get(), reason);
        return DispatchOutcome.failed(kind, attempts.get(), reason);
    }

    // Exceção do canal sai desembrulhada para a classificação do Retry
    private SendResult sendWithTimeout(RenderedMessage message) throws Throwable {
        Future<SendResult> future = dispatchExecutor.submit(
                () -> sendChannel.send(message.recipient(), message.subject(), message.body()));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw e.getCause() != null ? e.getCause() : e;
        }
    }
}
