package com.clapgrow.fleet.session.repository;

import com.clapgrow.fleet.session.entity.PendingOtp;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PendingOtpRepository extends JpaRepository<PendingOtp, String> {

    /**
     * Row-locks the pending code so two concurrent verifications cannot both consume it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PendingOtp p WHERE p.tenantId = :tenantId")
    Optional<PendingOtp> findForUpdate(@Param("tenantId") String tenantId);
}
