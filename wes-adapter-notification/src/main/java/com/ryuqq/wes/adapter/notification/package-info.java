/**
 * Notification channel.
 *
 * <p>A single {@code {"run_id": "..."}} message, delivered at-least-once. The server side
 * ({@link com.ryuqq.wes.adapter.notification.NotificationServer}) feeds the reconcile queue;
 * the client side ({@link com.ryuqq.wes.adapter.notification.HttpRunNotifier}) is a
 * best-effort {@link com.ryuqq.wes.application.trigger.RunNotifier}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.adapter.notification;
