package com.certchaperone.backend.modules.audit.application;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.certchaperone.backend.modules.audit.domain.AuditLog;
import com.certchaperone.backend.modules.audit.domain.VehicleHistoryEvent;
import com.certchaperone.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.certchaperone.backend.modules.audit.infrastructure.persistence.VehicleHistoryRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends moderation events. Actions on a vehicle, claim or listing land in that vehicle's
 * {@code vehicle_history}; everything else lands in {@code audit_log}.
 *
 * <p>Both methods join the caller's transaction and flush immediately, so a failed append
 * surfaces inside the mutation that triggered it and rolls it back.
 */
@Service
public class ModerationAuditTrail {

    private final AuditLogRepository auditLogRepository;
    private final VehicleHistoryRepository vehicleHistoryRepository;

    public ModerationAuditTrail(AuditLogRepository auditLogRepository,
                                VehicleHistoryRepository vehicleHistoryRepository) {
        this.auditLogRepository = auditLogRepository;
        this.vehicleHistoryRepository = vehicleHistoryRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordAdminAction(AdminActionCommand command) {
        AuditLog auditLog = AuditLog.of(
                command.actionType(),
                command.resourceType(),
                command.resourceKey(),
                command.actorUserId(),
                command.correlationId(),
                command.detail());
        auditLogRepository.saveAndFlush(auditLog);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordVehicleEvent(VehicleEventCommand command) {
        Objects.requireNonNull(command.vehicleId(), "vehicleId is required");
        Objects.requireNonNull(command.subjectUserId(), "subjectUserId is required");
        Objects.requireNonNull(command.eventType(), "eventType is required");

        VehicleHistoryEvent event = new VehicleHistoryEvent();
        event.setVehicleId(command.vehicleId());
        event.setUserId(command.subjectUserId());
        event.setEventType(command.eventType());
        event.setEventDescription(command.description());
        if (command.metadata() != null && !command.metadata().isEmpty()) {
            event.setMetadata(new HashMap<>(command.metadata()));
        }
        vehicleHistoryRepository.saveAndFlush(event);
    }

    public record AdminActionCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            UUID correlationId,
            Map<String, Object> detail
    ) {
    }

    /**
     * @param subjectUserId the user whose timeline shows the event (vehicle owner, claim owner or seller)
     */
    public record VehicleEventCommand(
            UUID vehicleId,
            UUID subjectUserId,
            String eventType,
            String description,
            Map<String, Object> metadata
    ) {
    }
}
