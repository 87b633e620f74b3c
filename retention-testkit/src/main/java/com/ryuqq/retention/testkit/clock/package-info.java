/**
 * Deterministic clock for time-dependent tests.
 */
package com.ryuqq.retention.testkit.clock;
