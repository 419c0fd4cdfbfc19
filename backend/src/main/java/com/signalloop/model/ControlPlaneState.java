package com.signalloop.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Versioned policy parameters. Rows are insert-only apart from setting
 * {@code expiresAt}; the single row with a null {@code expiresAt} is active.
 */
@Getter
@Setter
@Entity
@Table(name = "control_plane_state")
public class ControlPlaneState {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "effective_at", nullable = false, updatable = false)
    private OffsetDateTime effectiveAt;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    @Column(name = "acceptance_threshold", nullable = false, updatable = false)
    private Double acceptanceThreshold;

    @Column(name = "exploration_rate", nullable = false, updatable = false)
    private Double explorationRate;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "template_weights", nullable = false, updatable = false, columnDefinition = "jsonb")
    private Map<String, Double> templateWeights = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "prompt_version_weights", nullable = false, updatable = false, columnDefinition = "jsonb")
    private Map<String, Map<String, Double>> promptVersionWeights = new LinkedHashMap<>();

    @Column(name = "updated_by", nullable = false, updatable = false, length = 64)
    private String updatedBy;

    @Column(name = "update_reason", updatable = false, length = 512)
    private String updateReason;

    public boolean isActive() {
        return expiresAt == null;
    }
}
