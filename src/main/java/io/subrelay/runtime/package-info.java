/**
 * Synchronous orchestration.
 *
 * <p>{@link io.subrelay.runtime.Dispatcher} checks a request, resolves its agents and hands it to
 * {@link io.subrelay.runtime.FanOutRunner}, {@link io.subrelay.runtime.ChainRunner} or a single
 * {@link io.subrelay.worker.StepRunner} call, or to the async job path.
 */
package io.subrelay.runtime;
