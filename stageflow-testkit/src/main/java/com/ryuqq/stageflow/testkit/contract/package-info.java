/**
 * SPI Contract Tests.
 *
 * <p>Abstract JUnit 5 suites that every adapter of a core SPI must pass. An adapter module
 * subclasses a suite in its own test sources and supplies the instance under test:</p>
 *
 * <pre>
 * class InMemoryWorkflowStoreContractTest extends AbstractWorkflowStoreContractTest {
 *     {@literal @}Override
 *     protected WorkflowStore createStore() {
 *         return new InMemoryWorkflowStore();
 *     }
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.testkit.contract;
