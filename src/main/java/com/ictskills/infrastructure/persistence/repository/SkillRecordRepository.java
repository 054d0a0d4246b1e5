package com.ictskills.infrastructure.persistence.repository;

import com.ictskills.infrastructure.persistence.entity.SkillRecordEntity;
import com.ictskills.infrastructure.persistence.entity.SkillRecordId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SkillRecordRepository extends JpaRepository<SkillRecordEntity, SkillRecordId> {

    List<SkillRecordEntity> findAllByOrderByCountryIsoCodeAscYearAsc();
}
