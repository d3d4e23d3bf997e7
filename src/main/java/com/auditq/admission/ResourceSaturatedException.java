package com.auditq.admission;

/**
 * The resource already has the maximum number of queued, running or retrying jobs.
 */
public class ResourceSaturatedException extends AdmissionException {

    private final String resourceId;
    private final long activeJobs;
    private final int limit;

    public ResourceSaturatedException(String resourceId, long activeJobs, int limit) {
        super("Too many active jobs for resource " + resourceId + " (" + activeJobs + "/" + limit
                + "). Please wait for existing jobs to complete.");
        this.resourceId = resourceId;
        this.activeJobs = activeJobs;
        this.limit = limit;
    }

    public String getResourceId() {
        return resourceId;
    }

    public long getActiveJobs() {
        return activeJobs;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public String errorCode() {
        return "ResourceSaturated";
    }
}
