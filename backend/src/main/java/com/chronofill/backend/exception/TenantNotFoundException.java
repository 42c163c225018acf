package com.chronofill.backend.exception;

public class TenantNotFoundException extends BackfillValidationException {
    public TenantNotFoundException(String tenantId) {
        super("TENANT_NOT_FOUND", "Tenant " + tenantId + " not found");
    }
}
