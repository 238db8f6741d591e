/**
 * Runner Adapter Layer - Workflow 실행 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stageflow.adapter.runner.StagePipelineOrchestrator} - 고정 Stage 파이프라인 오케스트레이터</li>
 *   <li>{@link com.ryuqq.stageflow.adapter.runner.QueueWorkerRunner} - Stage별 큐 폴링 워커 (동시 실행 한도, lease ceiling)</li>
 *   <li>{@link com.ryuqq.stageflow.adapter.runner.InlineFastPathRunner} - 시간 예산 안의 호출 스레드 실행, 남은 Stage는 큐로 인계</li>
 *   <li>{@link com.ryuqq.stageflow.adapter.runner.Reaper} - stuck Workflow 회수</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (StagePipelineOrchestrator, QueueWorkerRunner, InlineFastPathRunner, Reaper)
 *   ↓ implements
 * application (WorkflowOrchestrator, Runtime)
 *   ↓ uses
 * application services (StageResultStore, EntityLockManager, ConflictResolver, resilience)
 *   ↓ depends on
 * core (StagePipeline, WorkflowExecution, Outcome, SPI)
 * </pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
package com.ryuqq.stageflow.adapter.runner;
