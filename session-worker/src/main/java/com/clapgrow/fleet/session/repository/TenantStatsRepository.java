package com.clapgrow.fleet.session.repository;

import com.clapgrow.fleet.session.entity.TenantStats;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface TenantStatsRepository extends JpaRepository<TenantStats, String> {

    @Modifying
    @Query("UPDATE TenantStats s SET s.commandsUsed = s.commandsUsed + 1, s.lastActiveAt = :now WHERE s.tenantId = :tenantId")
    int incrementCommandsUsed(@Param("tenantId") String tenantId, @Param("now") Instant now);

    @Modifying
    @Query("UPDATE TenantStats s SET s.messagesReceived = s.messagesReceived + 1, s.lastActiveAt = :now WHERE s.tenantId = :tenantId")
    int incrementMessagesReceived(@Param("tenantId") String tenantId, @Param("now") Instant now);

    @Modifying
    @Query("UPDATE TenantStats s SET s.groupsInteracted = s.groupsInteracted + 1, s.lastActiveAt = :now WHERE s.tenantId = :tenantId")
    int incrementGroupsInteracted(@Param("tenantId") String tenantId, @Param("now") Instant now);
}
