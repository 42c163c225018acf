package com.chronofill.backend.exception;

public class TenantNotActiveException extends BackfillValidationException {
    public TenantNotActiveException(String tenantId, Enum<?> status) {
        super("TENANT_NOT_ACTIVE", "Tenant " + tenantId + " is not active (status: " + status + ")");
    }
}
