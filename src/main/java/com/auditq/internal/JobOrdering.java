package com.auditq.internal;

import com.auditq.Job;

import java.util.Comparator;

/**
 * Dequeue order: higher priority first, then the job that became due earliest. The id breaks exact
 * ties so two workers looking at the same candidates agree on the order.
 */
public final class JobOrdering {

    public static final Comparator<Job> DEQUEUE_ORDER = Comparator
            .comparingInt(Job::getPriority).reversed()
            .thenComparing(Job::getScheduledAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Job::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private JobOrdering() {
    }
}
