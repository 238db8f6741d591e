/**
 * In-memory key-value store adapter with passive TTL and atomic conditional writes.
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.adapter.inmemory.kv;
