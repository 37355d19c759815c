/**
 * SubRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.subrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.subrelay.runtime.Dispatcher} validates requests and routes them to the runners.</li>
 *   <li>{@code io.subrelay.worker.StepExecutor} supervises one streaming worker process.</li>
 *   <li>{@code io.subrelay.runner.DetachedRunnerMain} is the process started for background jobs.</li>
 *   <li>{@code io.subrelay.completion.CompletionCorrelator} turns result files into notifications.</li>
 * </ul>
 */
package io.subrelay;
