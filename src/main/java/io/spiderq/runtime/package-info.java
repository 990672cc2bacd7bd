/**
 * Runtime wiring package.
 *
 * <p>{@link io.spiderq.runtime.SpiderqRuntime} builds the store, worker bridge, queue scheduler and audit trail
 * from one data root, runs startup recovery and exposes the operations used by the CLI.
 */
package io.spiderq.runtime;
