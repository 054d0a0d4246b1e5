package com.ictskills.infrastructure.persistence;

import com.ictskills.domain.model.SkillRecord;
import com.ictskills.domain.service.SkillMetrics;
import com.ictskills.infrastructure.persistence.entity.SkillRecordEntity;
import com.ictskills.infrastructure.persistence.repository.SkillRecordRepository;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Access to the normalized skills table.
 *
 * Writes are upserts keyed on (country_iso_code, year): an existing row is
 * overwritten in full, a new one is inserted. This is also the single place
 * where a missing percentage becomes 0.
 *
 * Reads go through the "skillsStore" circuit breaker so a failing database
 * is not hammered by every dashboard request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SkillRecordStore {

    private final SkillRecordRepository repository;

    @CircuitBreaker(name = "skillsStore")
    @Transactional(readOnly = true, timeoutString = "${app.query.timeout-seconds:10}")
    public List<SkillRecord> readAll() {
        List<SkillRecord> records = repository.findAllByOrderByCountryIsoCodeAscYearAsc().stream()
                .map(SkillRecordStore::toRecord)
                .collect(Collectors.toList());

        log.debug("Loaded {} skill records", records.size());
        return records;
    }

    @Transactional
    public int upsertAll(List<SkillRecord> records) {
        List<SkillRecordEntity> entities = records.stream()
                .map(SkillRecordStore::toEntity)
                .collect(Collectors.toList());

        List<SkillRecordEntity> saved = repository.saveAll(entities);

        log.info("Upserted {} skill records", saved.size());
        return saved.size();
    }

    static SkillRecordEntity toEntity(SkillRecord record) {
        return SkillRecordEntity.builder()
                .countryIsoCode(record.getEntityCode())
                .year(record.getYear())
                .countryName(record.getEntityLabel() != null ? record.getEntityLabel() : record.getEntityCode())
                .pctBasic(SkillMetrics.coerce(record.getPctBasic()))
                .pctAboveBasic(SkillMetrics.coerce(record.getPctAboveBasic()))
                .build();
    }

    static SkillRecord toRecord(SkillRecordEntity entity) {
        return SkillRecord.builder()
                .entityCode(entity.getCountryIsoCode())
                .entityLabel(entity.getCountryName())
                .year(entity.getYear())
                .pctBasic(entity.getPctBasic())
                .pctAboveBasic(entity.getPctAboveBasic())
                .build();
    }
}
