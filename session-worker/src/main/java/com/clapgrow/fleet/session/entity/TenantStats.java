package com.clapgrow.fleet.session.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "tenant_stats")
@Getter
@Setter
@NoArgsConstructor
public class TenantStats extends BaseAuditableEntity {

    @Id
    @Column(name = "tenant_id", length = 32)
    private String tenantId;

    @Column(name = "commands_used", nullable = false)
    private long commandsUsed;

    @Column(name = "messages_received", nullable = false)
    private long messagesReceived;

    @Column(name = "groups_interacted", nullable = false)
    private long groupsInteracted;

    @Column(name = "last_active_at")
    private Instant lastActiveAt;

    public TenantStats(String tenantId) {
        this.tenantId = tenantId;
    }
}
