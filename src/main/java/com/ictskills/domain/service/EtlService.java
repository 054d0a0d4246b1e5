package com.ictskills.domain.service;

import com.ictskills.domain.model.EtlSummary;
import com.ictskills.domain.model.RawObservation;
import com.ictskills.domain.model.SkillRecord;
import com.ictskills.infrastructure.persistence.SkillRecordStore;
import com.ictskills.infrastructure.source.SkillsCsvReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.util.List;

/**
 * Extract → reshape → upsert, in one transaction.
 *
 * Any failure rolls the whole run back; the table is never left half loaded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EtlService {

    private final SkillsCsvReader csvReader;
    private final SkillsReshaper reshaper;
    private final SkillRecordStore skillRecordStore;

    @Transactional
    public EtlSummary run(Path source) {
        List<RawObservation> observations = csvReader.read(source);
        List<SkillRecord> records = reshaper.reshape(observations);

        int upserted = records.isEmpty() ? 0 : skillRecordStore.upsertAll(records);

        log.info("ETL finished for {}: {} rows read, {} records reshaped, {} upserted",
                source, observations.size(), records.size(), upserted);

        return EtlSummary.builder()
                .rowsRead(observations.size())
                .recordsReshaped(records.size())
                .recordsUpserted(upserted)
                .build();
    }
}
