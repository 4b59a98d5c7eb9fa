package com.example.salesmart.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Audit row: imported products and finished discovery runs.
 */
@Entity
@Table(name = "state_transitions")
@Getter
@Setter
@NoArgsConstructor
public class StateTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "log_id")
    private Long logId;

    @Column(name = "entity_type", nullable = false, length = 30)
    private String entityType; // 'DISCOVERED_PRODUCT','DISCOVERY_RUN'

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Column(name = "from_state")
    private String fromState;

    @Column(name = "to_state", nullable = false)
    private String toState;

    @Column(name = "reason_code")
    private String reasonCode;

    @Column(name = "reason_detail", length = 2000)
    private String reasonDetail;

    @Column(name = "actor", nullable = false, length = 50)
    private String actor;

    @Column(name = "correlation_id", length = 64)
    private String correlationId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null)
            createdAt = LocalDateTime.now();
        if (actor == null || actor.isBlank())
            actor = "SYSTEM";
    }
}
