package com.clapgrow.fleet.session.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Durable authentication state of one tenant's session, as the protocol library serialises it.
 */
@Entity
@Table(name = "tenant_credentials")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TenantCredential extends BaseAuditableEntity {

    @Id
    @Column(name = "tenant_id", length = 32)
    private String tenantId;

    @Column(name = "creds_json", nullable = false, columnDefinition = "TEXT")
    private String credsJson;
}
