package tech.yump.auditstore.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The fixed vocabulary of recorded security actions.
 */
public enum AuditActionType {

    // Passkey registration
    REGISTRATION_START("registration_start"),
    REGISTRATION_SUCCESS("registration_success"),
    REGISTRATION_FAILURE("registration_failure"),

    // Passkey authentication
    AUTHENTICATION_START("authentication_start"),
    AUTHENTICATION_SUCCESS("authentication_success"),
    AUTHENTICATION_FAILURE("authentication_failure"),

    // Credential management
    CREDENTIAL_DELETED("credential_deleted"),
    CREDENTIAL_UPDATED("credential_updated"),

    // AAL2 step-up
    AAL2_TIMESTAMP_SET("aal2_timestamp_set"),
    AAL2_ACCESS_GRANTED("aal2_access_granted"),
    AAL2_ACCESS_DENIED("aal2_access_denied"),
    AAL2_POLICY_SET("aal2_policy_set"),

    // Role management
    AAL2_ROLE_ASSIGNED("aal2_role_assigned"),
    AAL2_ROLE_REVOKED("aal2_role_revoked");

    private final String value;

    AuditActionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @param value wire value such as {@code "authentication_success"}
     * @throws AuditEventValidationException if the value is not part of the vocabulary
     */
    @JsonCreator
    public static AuditActionType fromValue(String value) {
        for (AuditActionType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new AuditEventValidationException("Invalid action_type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
