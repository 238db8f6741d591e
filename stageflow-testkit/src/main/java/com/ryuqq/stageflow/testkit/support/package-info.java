/**
 * Test doubles shared by the module test suites: a controllable clock, a scripted stage handler
 * and a small stage catalog.
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.testkit.support;
