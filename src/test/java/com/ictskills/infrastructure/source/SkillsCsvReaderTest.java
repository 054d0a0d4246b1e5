package com.ictskills.infrastructure.source;

import com.ictskills.domain.exception.DataSourceException;
import com.ictskills.domain.model.RawObservation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SkillsCsvReaderTest {

    private static final String HEADER =
            "DATAFLOW,REF_AREA,REF_AREA_LABEL,INDICATOR,COMP_BREAKDOWN_1,TIME_PERIOD,OBS_VALUE,UNIT_MEASURE\n";

    private final SkillsCsvReader reader = new SkillsCsvReader();

    @TempDir
    Path tempDir;

    @Test
    void testRead_MapsRequiredColumnsAndIgnoresOthers() throws IOException {
        // Given
        Path file = write("survey.csv", HEADER
                + "ITU:DH,AUT,Austria,SKLS_DIG_CONT,BASIC,2023,22.9956,PT\n"
                + "ITU:DH,AUT,Austria,SKLS_DIG_CONT,ABOVE_BASIC,2023,53.2072,PT\n"
                + "ITU:DH,KOR,\"Korea, Rep.\",SKLS_DIG_CONT,BASIC,2022,_Z,PT\n");

        // When
        List<RawObservation> observations = reader.read(file);

        // Then
        assertEquals(3, observations.size());
        RawObservation first = observations.get(0);
        assertEquals("AUT", first.getEntityCode());
        assertEquals("Austria", first.getEntityLabel());
        assertEquals("2023", first.getPeriod());
        assertEquals("BASIC", first.getSkillCategory());
        assertEquals("22.9956", first.getObservedValue());

        RawObservation korea = observations.get(2);
        assertEquals("Korea, Rep.", korea.getEntityLabel());
        assertEquals("_Z", korea.getObservedValue());
    }

    @Test
    void testRead_HeaderOnlyGivesNoObservations() throws IOException {
        Path file = write("empty.csv", HEADER);

        assertTrue(reader.read(file).isEmpty());
    }

    @Test
    void testRead_MissingFileFails() {
        assertThrows(DataSourceException.class, () -> reader.read(tempDir.resolve("absent.csv")));
    }

    @Test
    void testRead_MissingRequiredColumnFails() throws IOException {
        Path file = write("partial.csv", "REF_AREA,REF_AREA_LABEL,TIME_PERIOD,OBS_VALUE\nAUT,Austria,2023,22.9\n");

        DataSourceException e = assertThrows(DataSourceException.class, () -> reader.read(file));
        assertTrue(e.getMessage().contains("COMP_BREAKDOWN_1"));
    }

    @Test
    void testRead_EmptyFileFails() throws IOException {
        Path file = write("blank.csv", "");

        assertThrows(DataSourceException.class, () -> reader.read(file));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
