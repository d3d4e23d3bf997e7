package com.auditq.broadcast;

import java.util.UUID;

public final class Topics {

    private Topics() {
    }

    public static String resource(String resourceId) {
        return "resource:" + resourceId;
    }

    public static String monitoring(UUID configId) {
        return "monitoring:" + configId;
    }
}
