/**
 * Read-only workflow queries (pending list, stuck sweep input, single lookup).
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.application.query;
