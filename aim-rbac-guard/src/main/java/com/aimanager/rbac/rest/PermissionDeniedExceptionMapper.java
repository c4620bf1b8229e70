package com.aimanager.rbac.rest;

import com.aimanager.rbac.exceptions.PermissionDeniedException;
import com.aimanager.rbac.model.policy.AccessDecision;
import com.aimanager.rbac.util.ExceptionLoggingUtils;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class PermissionDeniedExceptionMapper implements ExceptionMapper<PermissionDeniedException> {

    @Override
    public Response toResponse(PermissionDeniedException exception) {
        // a denial is an expected outcome, the audit trail already has it
        ExceptionLoggingUtils.logDebug(exception, "Permission denied");
        return Response.status(Response.Status.FORBIDDEN).entity(toRestError(exception)).build();
    }

    static RestError toRestError(PermissionDeniedException exception) {
        AccessDecision decision = exception.getDecision();
        RestError error = RestError.builder()
            .status(Response.Status.FORBIDDEN.getStatusCode())
            .statusMessage("Forbidden")
            .reasonMessage(exception.getMessage())
            .debugMessage(ExceptionLoggingUtils.describe(exception))
            .build();
        if (decision != null) {
            error.setPolicyId(decision.getPolicyId());
            error.setResource(decision.getResource() == null ? null : decision.getResource().getValue());
        }
        return error;
    }
}
