package com.contact.resolution.task;

/**
 * Counters for background tasks since startup.
 *
 * @param submitted tasks accepted by the executor
 * @param completed tasks that ran to completion
 * @param failed    tasks that threw
 * @param rejected  tasks refused because the queue was full or the supervisor was shut down
 * @param active    tasks running or queued right now
 */
public record TaskStats(long submitted, long completed, long failed, long rejected, long active) {
}
