package com.ryuqq.stageflow.testkit.support;

import com.ryuqq.stageflow.core.stage.Stage;

/**
 * A three-stage catalog for pipeline tests.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public enum TestStage implements Stage {
    S1,
    S2,
    S3
}
