/**
 * Reusable contract tests for the store and work queue SPIs.
 *
 * <p>Adapter modules extend these abstract classes to verify their implementations.</p>
 */
package com.ryuqq.retention.testkit.contract;
