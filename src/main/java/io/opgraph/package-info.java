/**
 * OpGraph source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.opgraph.task.Task} defines the task lifecycle and the finish contract.</li>
 *   <li>{@code io.opgraph.scheduler.Scheduler} admits tasks once dependencies, conditions and exclusivity allow.</li>
 *   <li>{@code io.opgraph.group.GroupTask} nests a private scheduler inside a task.</li>
 *   <li>{@code io.opgraph.Main} bootstraps the demonstration CLI.</li>
 * </ul>
 */
package io.opgraph;
