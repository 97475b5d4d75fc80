package com.telemetry.pumlflow.util;

import com.telemetry.pumlflow.exception.PumlFlowException;
import com.telemetry.pumlflow.model.PvEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PvEventFileReader / PumlFileWriter 单元测试
 */
public class PvEventFileReaderTest {

    private static Path sampleFile() throws URISyntaxException {
        return Paths.get(PvEventFileReaderTest.class.getResource("/jobs/sample_jobs.json").toURI());
    }

    @Test
    void testReadFile_SingleOrListPreviousIds() throws URISyntaxException {
        List<PvEvent> events = PvEventFileReader.read(sampleFile());

        assertEquals(8, events.size());
        PvEvent reserve = events.get(1);
        assertEquals("ReserveStock", reserve.getEventType());
        assertEquals(Collections.singletonList("o-1-1"), reserve.getPreviousEventIds(), "单个字符串按数组接收");
        assertEquals(Arrays.asList("o-1-2", "o-1-3"), events.get(3).getPreviousEventIds());
        assertEquals("shop", events.get(3).getApplicationName());
        assertTrue(events.get(0).getPreviousEventIds().isEmpty());
    }

    @Test
    void testReadDirectory_OnlyJsonFiles(@TempDir Path dir) throws IOException, URISyntaxException {
        Files.copy(sampleFile(), dir.resolve("a.json"));
        Files.copy(sampleFile(), dir.resolve("b.json"));
        Files.write(dir.resolve("notes.txt"), "ignored".getBytes(StandardCharsets.UTF_8));

        assertEquals(16, PvEventFileReader.read(dir).size());
    }

    @Test
    void testRead_MissingOrBrokenInput(@TempDir Path dir) throws IOException {
        assertThrows(PumlFlowException.class, () -> PvEventFileReader.read(dir.resolve("absent.json")));

        Path broken = dir.resolve("broken.json");
        Files.write(broken, "{not json".getBytes(StandardCharsets.UTF_8));
        assertThrows(PumlFlowException.class, () -> PvEventFileReader.read(broken));
    }

    @Test
    void testWritePuml_FileNamedAfterJob(@TempDir Path dir) throws IOException {
        Path file = PumlFileWriter.write(dir.resolve("out"), "billing/job:1", "@startuml\n@enduml\n");

        assertEquals("billing_job_1.puml", file.getFileName().toString());
        assertEquals("@startuml\n@enduml\n", new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }
}
