/**
 * In-memory job queue adapter.
 *
 * <p>Per-stage delay queues with leases and a dead letter list. Suitable for tests and
 * single-process demos; state is lost on restart.</p>
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.adapter.inmemory.queue;
