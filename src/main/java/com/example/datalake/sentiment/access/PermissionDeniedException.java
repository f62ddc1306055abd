package com.example.datalake.sentiment.access;

/** The caller lacks the role an operation requires. */
public class PermissionDeniedException extends RuntimeException {

    private final String caller;
    private final String requiredRole;

    public PermissionDeniedException(String caller, String requiredRole) {
        super(String.format("Caller '%s' does not hold the %s role.", caller, requiredRole));
        this.caller = caller;
        this.requiredRole = requiredRole;
    }

    public String getCaller() {
        return caller;
    }

    public String getRequiredRole() {
        return requiredRole;
    }
}
