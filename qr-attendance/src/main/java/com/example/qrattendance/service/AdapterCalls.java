package com.example.qrattendance.service;

import com.example.qrattendance.exception.AdapterTimeoutException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 외부 어댑터 호출을 제한 시간 안에서 실행한다. 재시도는 하지 않는다.
 */
@Slf4j
@Component
public class AdapterCalls {

    private final AsyncTaskExecutor executor;

    @Getter
    private final Duration timeout;

    public AdapterCalls(@Qualifier("adapterExecutor") AsyncTaskExecutor executor,
                        @Value("${attendance.qr.adapter-timeout:PT3S}") Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    public <T> T call(String operation, Supplier<T> work) {
        Callable<T> task = work::get;
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            // pool and queue are full
            log.warn("Adapter call {} rejected, executor saturated", operation);
            throw new AdapterTimeoutException(operation, timeout, e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Adapter call {} timed out after {} ms", operation, timeout.toMillis());
            throw new AdapterTimeoutException(operation, timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IllegalStateException("Interrupted while waiting for " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(operation + " failed", cause);
        }
    }

    /**
     * Fire-and-forget; failures are logged and dropped.
     */
    public void fireAndForget(String operation, Runnable work) {
        try {
            executor.execute(() -> {
                try {
                    work.run();
                } catch (Exception e) {
                    log.warn("Background call {} failed: {}", operation, e.getMessage(), e);
                }
            });
        } catch (RuntimeException e) {
            log.warn("Background call {} could not be scheduled: {}", operation, e.getMessage());
        }
    }
}
