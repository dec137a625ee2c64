package com.example.dispatch_service.storage;

import com.example.dispatch_service.config.DispatchProperties;
import com.example.dispatch_service.exception.DispatchException;
import com.example.dispatch_service.exception.StorageUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.client.circuitbreaker.CircuitBreaker;
import org.springframework.cloud.client.circuitbreaker.CircuitBreakerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 저장소 호출을 서킷 브레이커 + 트랜잭션으로 감싼다.
 * 일시 장애는 재시도 가능한 {@link StorageUnavailableException}으로 바꾸고, 재시도는 하지 않는다.
 * 제한 시간({@code dispatch.storage.timeout})은 트랜잭션 자체에 걸려 있어서,
 * 시간 초과로 보고된 호출은 항상 롤백된 상태다.
 */
@Component
@Slf4j
public class StorageCallExecutor {

    public static final String CIRCUIT_BREAKER_NAME = "dispatch-storage";

    private final CircuitBreaker circuitBreaker;
    private final TransactionTemplate transactionTemplate;
    private final Duration timeout;

    public StorageCallExecutor(CircuitBreakerFactory<?, ?> cbFactory,
                               PlatformTransactionManager transactionManager,
                               DispatchProperties properties) {
        this.circuitBreaker = cbFactory.create(CIRCUIT_BREAKER_NAME);
        this.timeout = properties.getStorage().getTimeout();
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        // 쿼리 타임아웃은 초 단위로만 지정 가능 (올림)
        this.transactionTemplate.setTimeout((int) Math.max(1, (timeout.toMillis() + 999) / 1000));
    }

    public <T> T inTransaction(String operation, TransactionCallback<T> callback) {
        return circuitBreaker.run(
                () -> transactionTemplate.execute(status -> {
                    long deadline = System.nanoTime() + timeout.toNanos();
                    T result = callback.doInTransaction(status);
                    // 제한 시간을 넘긴 작업은 커밋하지 않음
                    if (System.nanoTime() - deadline > 0) {
                        throw new TransactionTimedOutException(
                                "저장소 작업 제한 시간 초과: " + operation + " (" + timeout.toMillis() + "ms)");
                    }
                    return result;
                }),
                throwable -> {
                    throw translate(operation, throwable);
                });
    }

    private RuntimeException translate(String operation, Throwable failure) {
        Throwable throwable = unwrap(failure);
        if (throwable instanceof DispatchException dispatchException) {
            return dispatchException;
        }
        if (isTransient(throwable)) {
            log.error("저장소 일시 장애. operation: {}, error: {}", operation, throwable.toString());
            return new StorageUnavailableException("저장소를 일시적으로 사용할 수 없습니다. 잠시 후 다시 시도해 주세요.", throwable);
        }
        if (throwable instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new IllegalStateException("저장소 호출 실패: " + operation, throwable);
    }

    // 타임리미터/벌크헤드가 별도 스레드에서 실행하면 원인 예외가 감싸져서 올라옴
    private Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private boolean isTransient(Throwable throwable) {
        return throwable instanceof TimeoutException
                || throwable instanceof TransactionTimedOutException
                || throwable instanceof CallNotPermittedException
                || throwable instanceof TransientDataAccessException
                || throwable instanceof DataAccessResourceFailureException
                || throwable instanceof CannotCreateTransactionException;
    }
}
