package com.auditq.admission;

public class ResourceAccessDeniedException extends AdmissionException {

    private final String resourceId;

    public ResourceAccessDeniedException(String resourceId) {
        super("Access to resource " + resourceId + " denied");
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }

    @Override
    public String errorCode() {
        return "AccessDenied";
    }
}
