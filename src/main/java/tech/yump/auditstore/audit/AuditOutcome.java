package tech.yump.auditstore.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditOutcome {
    SUCCESS("success"),
    FAILURE("failure");

    private final String value;

    AuditOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AuditOutcome fromValue(String value) {
        if ("success".equals(value)) {
            return SUCCESS;
        }
        if ("failure".equals(value)) {
            return FAILURE;
        }
        throw new AuditEventValidationException("Invalid outcome: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
