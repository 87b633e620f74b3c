/**
 * Controller wiring: event classifiers per watched kind, one work queue and one reconciler.
 *
 * <p>{@link com.ryuqq.retention.application.controller.RetentionControllers} assembles
 * the TTL cleanup and limit cleanup controllers.</p>
 */
package com.ryuqq.retention.application.controller;
