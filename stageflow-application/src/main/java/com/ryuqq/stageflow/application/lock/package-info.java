/**
 * Per-entity exclusive locking.
 *
 * <p>Reentrant for the holding workflow, refreshed at every stage start, reclaimable once stale.
 * All transitions go through compare-and-set on the key-value store.</p>
 *
 * <pre>
 * unheld ──acquire──► held(W1) ──acquire(W1)──► held(W1, refreshed)
 *                        │
 *                        ├─release(W1)──► unheld
 *                        └─stale + acquire(W2)──► held(W2)   (W1 now gets LockLostException)
 * </pre>
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.application.lock;
