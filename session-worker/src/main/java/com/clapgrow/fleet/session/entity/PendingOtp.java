package com.clapgrow.fleet.session.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A one-time code awaiting verification, with the configuration delta it will apply.
 * At most one per tenant; a new request replaces the previous one.
 * The code is discarded once too many wrong guesses were made against it.
 */
@Entity
@Table(name = "pending_otps")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PendingOtp extends BaseAuditableEntity {

    @Id
    @Column(name = "tenant_id", length = 32)
    private String tenantId;

    @Column(name = "code", nullable = false, length = 6)
    private String code;

    @Column(name = "config_delta_json", nullable = false, columnDefinition = "TEXT")
    private String configDeltaJson;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "failed_attempts", nullable = false, columnDefinition = "INTEGER NOT NULL DEFAULT 0")
    private int failedAttempts;
}
