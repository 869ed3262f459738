package com.flamingo.ai.memoryvault.domain.repository;

import com.flamingo.ai.memoryvault.domain.entity.VaultMeta;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for the vault's key/value metadata. */
@Repository
public interface VaultMetaRepository extends JpaRepository<VaultMeta, String> {}
