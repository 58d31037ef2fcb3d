package com.clapgrow.fleet.session.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Roster entry: a tenant that has successfully opened a session at least once.
 */
@Entity
@Table(name = "known_tenants")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class KnownTenant extends BaseAuditableEntity {

    @Id
    @Column(name = "tenant_id", length = 32)
    private String tenantId;
}
