/**
 * Reconcilers and the translation of their verdicts into scheduling directives.
 */
package com.ryuqq.retention.application.reconciler;
