package com.ryuqq.stageflow.application.resilience;

import com.ryuqq.stageflow.core.error.TransientInfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 저장소 연산 재시도 래퍼.
 *
 * <p>일시 장애로 분류된 예외만 백오프 후 재시도하며, 그 외 예외는 즉시 전파합니다.
 * 재시도를 모두 소진하면 {@link TransientInfrastructureException}으로 감싸서 던지므로
 * 호출자는 인프라 장애를 비즈니스 실패와 구분할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Optional<Map<String, Object>> value =
 *     retrier.execute("kv.get", () -> holder.current().get(key));
 * }</pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class StoreOperationRetrier {

    private static final Logger log = LoggerFactory.getLogger(StoreOperationRetrier.class);

    private final RetryPolicy policy;
    private final BackoffCalculator backoff;
    private final TransientErrorClassifier classifier;

    /**
     * 기본 정책으로 생성.
     */
    public StoreOperationRetrier() {
        this(new RetryPolicy(), new TransientErrorClassifier());
    }

    /**
     * 생성자.
     *
     * @param policy 재시도 정책
     * @param classifier 일시 장애 판별기
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public StoreOperationRetrier(RetryPolicy policy, TransientErrorClassifier classifier) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        this.policy = policy;
        this.backoff = policy.toBackoff();
        this.classifier = classifier;
    }

    /**
     * 연산 실행 (일시 장애 시 재시도).
     *
     * @param operationName 로그용 연산 이름
     * @param operation 실행할 연산
     * @param <T> 결과 타입
     * @return 연산 결과
     * @throws TransientInfrastructureException 재시도를 모두 소진한 경우
     * @throws RuntimeException 일시 장애가 아닌 예외는 그대로 전파
     */
    public <T> T execute(String operationName, Supplier<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        int attempt = 1;
        while (true) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (!classifier.isTransient(e)) {
                    throw e;
                }
                if (attempt >= policy.maxAttempts()) {
                    log.error("Store operation {} failed after {} attempts", operationName, attempt, e);
                    throw new TransientInfrastructureException(
                        "Store operation " + operationName + " failed after " + attempt + " attempts", e);
                }
                long delayMs = backoff.calculate(attempt);
                log.warn("Transient failure on {} (attempt {}/{}), retrying in {}ms: {}",
                    operationName, attempt, policy.maxAttempts(), delayMs, e.getMessage());
                sleep(delayMs);
                attempt++;
            }
        }
    }

    /**
     * 결과 없는 연산 실행.
     *
     * @param operationName 로그용 연산 이름
     * @param operation 실행할 연산
     */
    public void run(String operationName, Runnable operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        execute(operationName, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * 일시 장애 여부 판단 (판별기 위임).
     *
     * @param error 예외
     * @return 일시 장애이면 true
     */
    public boolean isTransient(Throwable error) {
        return classifier.isTransient(error);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientInfrastructureException("Interrupted while waiting to retry store operation", e);
        }
    }
}
