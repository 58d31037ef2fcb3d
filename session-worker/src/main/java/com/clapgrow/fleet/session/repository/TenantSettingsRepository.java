package com.clapgrow.fleet.session.repository;

import com.clapgrow.fleet.session.entity.TenantSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TenantSettingsRepository extends JpaRepository<TenantSettings, String> {
}
