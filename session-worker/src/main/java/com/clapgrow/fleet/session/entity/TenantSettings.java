package com.clapgrow.fleet.session.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "tenant_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TenantSettings extends BaseAuditableEntity {

    @Id
    @Column(name = "tenant_id", length = 32)
    private String tenantId;

    /**
     * Overrides only; defaults are merged in at read time.
     */
    @Column(name = "config_json", nullable = false, columnDefinition = "TEXT")
    private String configJson;
}
