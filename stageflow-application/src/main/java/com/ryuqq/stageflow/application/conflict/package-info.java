/**
 * Natural-key conflict resolution.
 *
 * <p>UPDATE keeps the value the entity already owns; CREATE disambiguates with a numeric suffix.
 * A conflict never results in the natural key being cleared.</p>
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.application.conflict;
