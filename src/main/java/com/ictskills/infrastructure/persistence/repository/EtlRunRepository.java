package com.ictskills.infrastructure.persistence.repository;

import com.ictskills.infrastructure.persistence.entity.EtlRunEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EtlRunRepository extends JpaRepository<EtlRunEntity, UUID> {

    List<EtlRunEntity> findTop10ByStatusOrderByCreatedAtAsc(EtlRunEntity.RunStatus status);
}
