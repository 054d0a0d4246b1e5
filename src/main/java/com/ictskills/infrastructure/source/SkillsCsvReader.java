package com.ictskills.infrastructure.source;

import com.ictskills.domain.exception.DataSourceException;
import com.ictskills.domain.model.RawObservation;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the ITU digital-skills survey export (long format, one observation per line).
 *
 * Only the five columns below are used; any other column is ignored.
 * The whole file is read before anything is returned, so a broken file never
 * yields a partial observation list.
 */
@Slf4j
@Component
public class SkillsCsvReader {

    public static final String COL_ENTITY_CODE = "REF_AREA";
    public static final String COL_ENTITY_LABEL = "REF_AREA_LABEL";
    public static final String COL_PERIOD = "TIME_PERIOD";
    public static final String COL_SKILL_CATEGORY = "COMP_BREAKDOWN_1";
    public static final String COL_OBSERVED_VALUE = "OBS_VALUE";

    private static final List<String> REQUIRED_COLUMNS = List.of(
            COL_ENTITY_CODE, COL_ENTITY_LABEL, COL_PERIOD, COL_SKILL_CATEGORY, COL_OBSERVED_VALUE);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    public List<RawObservation> read(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new DataSourceException("Survey file not found: " + file);
        }

        log.info("Extracting observations from {}", file);

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {

            List<String> headers = parser.getHeaderNames();
            for (String column : REQUIRED_COLUMNS) {
                if (!headers.contains(column)) {
                    throw new DataSourceException("Survey file " + file + " is missing column " + column);
                }
            }

            List<RawObservation> observations = new ArrayList<>();
            for (CSVRecord record : parser) {
                observations.add(RawObservation.builder()
                        .entityCode(value(record, COL_ENTITY_CODE))
                        .entityLabel(value(record, COL_ENTITY_LABEL))
                        .period(value(record, COL_PERIOD))
                        .skillCategory(value(record, COL_SKILL_CATEGORY))
                        .observedValue(value(record, COL_OBSERVED_VALUE))
                        .build());
            }

            log.info("Extracted {} observations", observations.size());
            return observations;

        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw new DataSourceException("Unable to read survey file " + file + ": " + e.getMessage(), e);
        }
    }

    private static String value(CSVRecord record, String column) {
        return record.isSet(column) ? record.get(column) : null;
    }
}
