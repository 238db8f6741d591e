package com.ryuqq.stageflow.application.resilience;

import com.ryuqq.stageflow.core.error.StageflowException;
import com.ryuqq.stageflow.core.error.TransientInfrastructureException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 일시적 인프라 장애 판별기.
 *
 * <p>예외와 원인 체인(cause chain)을 따라가며 다음 중 하나에 해당하면 일시 장애로 판단합니다.</p>
 * <ul>
 *   <li>{@link TransientInfrastructureException}</li>
 *   <li>{@link SocketTimeoutException}, {@link ConnectException}</li>
 *   <li>메시지에 알려진 연결 장애 시그니처 포함 (대소문자 무시)</li>
 * </ul>
 *
 * <p>그 외 {@link StageflowException}(자연 키 충돌, 유효성 위반 등)은 인프라 장애가 아니므로
 * 메시지와 무관하게 false입니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class TransientErrorClassifier {

    /**
     * 기본 연결 장애 시그니처.
     */
    public static final List<String> DEFAULT_SIGNATURES = List.of(
        "not yet connected",
        "not ready",
        "response from the engine was empty",
        "empty response",
        "connection reset",
        "connection refused",
        "econnrefused",
        "can't reach database server",
        "connection pool timeout",
        "timed out fetching a new connection",
        "timed out"
    );

    private static final int MAX_CAUSE_DEPTH = 16;

    private final List<String> signatures;

    /**
     * 기본 시그니처로 생성.
     */
    public TransientErrorClassifier() {
        this(DEFAULT_SIGNATURES);
    }

    /**
     * 커스텀 시그니처로 생성.
     *
     * @param signatures 일시 장애로 판단할 메시지 조각 (소문자 비교)
     * @throws IllegalArgumentException signatures가 null인 경우
     */
    public TransientErrorClassifier(List<String> signatures) {
        if (signatures == null) {
            throw new IllegalArgumentException("signatures cannot be null");
        }
        List<String> normalized = new ArrayList<>();
        for (String signature : signatures) {
            if (signature != null && !signature.isBlank()) {
                normalized.add(signature.toLowerCase(Locale.ROOT));
            }
        }
        this.signatures = Collections.unmodifiableList(normalized);
    }

    /**
     * 일시 장애 여부 판단.
     *
     * @param error 판단할 예외 (null이면 false)
     * @return 일시 장애이면 true
     */
    public boolean isTransient(Throwable error) {
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < MAX_CAUSE_DEPTH && visited.add(current)) {
            if (current instanceof TransientInfrastructureException) {
                return true;
            }
            if (current instanceof StageflowException) {
                return false;
            }
            if (current instanceof SocketTimeoutException || current instanceof ConnectException) {
                return true;
            }
            if (matchesSignature(current.getMessage())) {
                return true;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    private boolean matchesSignature(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String signature : signatures) {
            if (lower.contains(signature)) {
                return true;
            }
        }
        return false;
    }
}
