/**
 * Scheduling package.
 *
 * <p>{@link io.opgraph.scheduler.Scheduler} owns admission: dependency wiring, condition
 * evaluation, exclusivity and dispatch onto a {@link io.opgraph.scheduler.WorkerPool}.
 * {@link io.opgraph.scheduler.ExclusivityController} may be shared between schedulers.
 */
package io.opgraph.scheduler;
