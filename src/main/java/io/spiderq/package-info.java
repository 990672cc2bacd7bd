/**
 * spiderq source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.spiderq.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.spiderq.cli.SpiderqCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.spiderq.scheduler.QueueScheduler} runs queued jobs one at a time.</li>
 *   <li>{@code io.spiderq.worker.WorkerBridge} spawns and supervises the worker process.</li>
 *   <li>{@code io.spiderq.storage.TaskStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.spiderq;
