package com.clapgrow.fleet.session.repository;

import com.clapgrow.fleet.session.entity.TenantCredential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TenantCredentialRepository extends JpaRepository<TenantCredential, String> {
}
