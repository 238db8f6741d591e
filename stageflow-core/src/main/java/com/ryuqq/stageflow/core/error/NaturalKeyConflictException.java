package com.ryuqq.stageflow.core.error;

/**
 * 자연 키 유일성 제약 위반.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class NaturalKeyConflictException extends StageflowException {

    private final String ownerId;
    private final String naturalKey;

    public NaturalKeyConflictException(String ownerId, String naturalKey) {
        super(ErrorType.NATURAL_KEY_CONFLICT,
            "Natural key already in use (owner: " + ownerId + ", key: " + naturalKey + ")");
        this.ownerId = ownerId;
        this.naturalKey = naturalKey;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getNaturalKey() {
        return naturalKey;
    }
}
