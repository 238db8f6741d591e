package com.ryuqq.stageflow.application.resilience;

import com.ryuqq.stageflow.core.error.TransientInfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 프로세스 단위 저장소 클라이언트 보관소.
 *
 * <p>클라이언트는 최초 사용 시 한 번 생성되어 공유됩니다. 호출자는 핸들을 캐싱하지 않고
 * 매 연산마다 {@link #current()}로 조회해야 하며, 전송 계층이 죽은 것이 확인되면
 * {@link #invalidate(Object)}로 폐기하여 다음 호출에서 재연결되게 합니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * current() ─► (없으면) connector.get() ─► 공유
 *     │
 *     └─ 일시 장애 ─► invalidate(dead) ─► closer.accept(dead) ─► 다음 current()에서 재연결
 * </pre>
 *
 * @param <T> 클라이언트 타입
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class StoreClientHolder<T> implements Supplier<T> {

    private static final Logger log = LoggerFactory.getLogger(StoreClientHolder.class);

    private final String name;
    private final Supplier<? extends T> connector;
    private final Consumer<? super T> closer;
    private final AtomicReference<T> current = new AtomicReference<>();
    private final AtomicLong generation = new AtomicLong();
    private final Object connectLock = new Object();

    /**
     * 생성자.
     *
     * @param name 로그용 저장소 이름
     * @param connector 새 클라이언트 생성 함수
     * @param closer 폐기된 클라이언트 정리 함수 (null이면 정리 없음)
     * @throws IllegalArgumentException name 또는 connector가 null인 경우
     */
    public StoreClientHolder(String name, Supplier<? extends T> connector, Consumer<? super T> closer) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (connector == null) {
            throw new IllegalArgumentException("connector cannot be null");
        }
        this.name = name;
        this.connector = connector;
        this.closer = closer == null ? client -> { } : closer;
    }

    /**
     * 현재 살아있는 클라이언트 조회 (없으면 연결).
     *
     * @return 클라이언트
     * @throws RuntimeException 연결 실패 시 connector의 예외 전파
     */
    public T current() {
        T client = current.get();
        if (client != null) {
            return client;
        }
        synchronized (connectLock) {
            client = current.get();
            if (client == null) {
                client = connector.get();
                if (client == null) {
                    throw new TransientInfrastructureException("Connector for " + name + " returned no client");
                }
                current.set(client);
                log.info("Connected {} store client (generation {})", name, generation.incrementAndGet());
            }
            return client;
        }
    }

    @Override
    public T get() {
        return current();
    }

    /**
     * 죽은 클라이언트 폐기.
     *
     * <p>이미 다른 스레드가 교체한 경우 아무것도 하지 않습니다.</p>
     *
     * @param dead 장애가 확인된 클라이언트
     * @return 폐기했으면 true
     */
    public boolean invalidate(T dead) {
        if (dead == null || !current.compareAndSet(dead, null)) {
            return false;
        }
        log.warn("Invalidated {} store client (generation {})", name, generation.get());
        try {
            closer.accept(dead);
        } catch (RuntimeException e) {
            log.warn("Failed to close invalidated {} store client", name, e);
        }
        return true;
    }

    /**
     * 클라이언트가 준비될 때까지 대기 (콜드 스타트 워밍업).
     *
     * @param timeout 최대 대기 시간
     * @param pollInterval 확인 간격
     * @param readinessCheck 준비 확인 연산 (예: ping), 실패 시 예외
     * @return 준비된 클라이언트
     * @throws TransientInfrastructureException 시간 내 준비되지 않은 경우
     */
    public T awaitReady(Duration timeout, Duration pollInterval, Consumer<? super T> readinessCheck) {
        if (timeout == null || pollInterval == null || readinessCheck == null) {
            throw new IllegalArgumentException("timeout, pollInterval and readinessCheck cannot be null");
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        RuntimeException lastError = null;
        while (true) {
            T client = null;
            try {
                client = current();
                readinessCheck.accept(client);
                return client;
            } catch (RuntimeException e) {
                lastError = e;
                invalidate(client);
                log.debug("{} store not ready yet: {}", name, e.getMessage());
            }
            if (System.nanoTime() >= deadline) {
                throw new TransientInfrastructureException(
                    name + " store not ready within " + timeout.toMillis() + "ms", lastError);
            }
            sleep(pollInterval.toMillis());
        }
    }

    /**
     * 지금까지 연결된 클라이언트 세대 수.
     *
     * @return 세대 번호 (연결 전 0)
     */
    public long generation() {
        return generation.get();
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientInfrastructureException("Interrupted while waiting for " + name + " store", e);
        }
    }
}
