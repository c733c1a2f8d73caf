package tech.yump.auditstore.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import tech.yump.auditstore.storage.StorageException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for producers of audit events (registration, authentication and
 * policy code). Recording never fails the operation being observed: validation
 * and storage problems are logged and reported as an empty result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditRecorder {

    private final AuditBackend auditBackend;
    private final Clock clock;

    /**
     * Validates, stores and mirrors one audit event.
     *
     * @param handle     audit log of the scope the event belongs to
     * @param userId     acting user, null for anonymous
     * @param actionType one of the 14 action type values
     * @param outcome    {@code "success"} or {@code "failure"}
     * @param metadata   optional action-specific data
     * @return the event id, or empty if the event could not be recorded
     */
    public Optional<String> logAuditEvent(
            AuditLogHandle handle,
            @Nullable String userId,
            String actionType,
            String outcome,
            @Nullable String ipAddress,
            @Nullable String userAgent,
            @Nullable Map<String, ?> metadata) {
        AuditEvent event;
        try {
            event = AuditEvent.create(clock, userId, actionType, outcome, ipAddress, userAgent, metadata);
        } catch (AuditEventValidationException e) {
            log.error("Invalid audit event rejected: Action={}, Outcome={}, User={}, Error={}",
                    actionType, outcome, userId, e.getMessage());
            return Optional.empty();
        }

        String eventId;
        try {
            eventId = handle.addEvent(event);
        } catch (StorageException e) {
            log.error("Failed to store audit event in scope '{}': Action={}, Outcome={}, Error={}",
                    handle.scope(), actionType, outcome, e.getMessage(), e);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Unexpected error storing audit event in scope '{}': Action={}, Outcome={}, Error={}",
                    handle.scope(), actionType, outcome, e.getMessage(), e);
            return Optional.empty();
        }

        try {
            auditBackend.logEvent(handle.scope(), event);
        } catch (Exception e) {
            // The event is committed; a failing mirror must not hide that
            log.error("Failed to mirror audit event {} to backend: {}", eventId, e.getMessage(), e);
        }
        return Optional.of(eventId);
    }

    // --- Passkey ceremony events ---

    public Optional<String> logRegistrationStart(AuditLogHandle handle, String userId, AuditRequestContext request) {
        return log(handle, AuditActionType.REGISTRATION_START, AuditOutcome.SUCCESS, userId, request, null, null);
    }

    public Optional<String> logRegistrationSuccess(AuditLogHandle handle, String userId, String credentialId,
                                                   AuditRequestContext request) {
        return log(handle, AuditActionType.REGISTRATION_SUCCESS, AuditOutcome.SUCCESS, userId, request, credentialId, null);
    }

    public Optional<String> logRegistrationFailure(AuditLogHandle handle, String userId, String errorMessage,
                                                   AuditRequestContext request) {
        return log(handle, AuditActionType.REGISTRATION_FAILURE, AuditOutcome.FAILURE, userId, request, null, errorMessage);
    }

    public Optional<String> logAuthenticationStart(AuditLogHandle handle, String username, AuditRequestContext request) {
        return log(handle, AuditActionType.AUTHENTICATION_START, AuditOutcome.SUCCESS, username, request, null, null);
    }

    public Optional<String> logAuthenticationSuccess(AuditLogHandle handle, String userId, String credentialId,
                                                     AuditRequestContext request) {
        return log(handle, AuditActionType.AUTHENTICATION_SUCCESS, AuditOutcome.SUCCESS, userId, request, credentialId, null);
    }

    /**
     * @param credentialId the credential presented, null if none was identified
     */
    public Optional<String> logAuthenticationFailure(AuditLogHandle handle, String username, String errorMessage,
                                                     @Nullable String credentialId, AuditRequestContext request) {
        return log(handle, AuditActionType.AUTHENTICATION_FAILURE, AuditOutcome.FAILURE, username, request, credentialId, errorMessage);
    }

    public Optional<String> logCredentialDeleted(AuditLogHandle handle, String userId, String credentialId,
                                                 AuditRequestContext request) {
        return log(handle, AuditActionType.CREDENTIAL_DELETED, AuditOutcome.SUCCESS, userId, request, credentialId, null);
    }

    private Optional<String> log(AuditLogHandle handle, AuditActionType actionType, AuditOutcome outcome, String userId,
                                 @Nullable AuditRequestContext request, @Nullable String credentialId,
                                 @Nullable String errorMessage) {
        AuditRequestContext context = request != null ? request : AuditRequestContext.UNKNOWN;
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (credentialId != null) {
            metadata.put("credential_id", credentialId);
        }
        if (errorMessage != null) {
            metadata.put("error_message", errorMessage);
        }
        return logAuditEvent(handle, userId, actionType.value(), outcome.value(),
                context.ipAddress(), context.userAgent(), metadata.isEmpty() ? null : metadata);
    }
}
