/**
 * In-memory status event sink.
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.adapter.inmemory.event;
