package com.clapgrow.fleet.session.repository;

import com.clapgrow.fleet.session.entity.KnownTenant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface KnownTenantRepository extends JpaRepository<KnownTenant, String> {
    List<KnownTenant> findAllByOrderByCreatedAtAsc();
}
