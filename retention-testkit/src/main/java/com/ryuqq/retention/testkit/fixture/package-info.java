/**
 * Resource fixtures shared by tests across modules.
 */
package com.ryuqq.retention.testkit.fixture;
