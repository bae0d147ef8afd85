package org.Aayush.scenario.scenario;

import org.Aayush.scenario.core.ScenarioSerializationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Scenario Bundle Tests")
class ScenarioBundleTest {

    private static ScenarioBundle bundle() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put(ScenarioFiles.NODES, "<nodes/>\n");
        files.put(ScenarioFiles.EDGES, "<edges/>\n");
        files.put(ScenarioFiles.ROUTES, "<routes/>\n");
        files.put(ScenarioFiles.RUN_CONFIG, "<configuration/>\n");
        files.put(ScenarioFiles.METADATA, "{ \"name\": \"Zürich\" }\n");
        return new ScenarioBundle(files);
    }

    @Test
    @DisplayName("Bundle exposes files in insertion order and rejects unknown names")
    void testAccessors() {
        ScenarioBundle bundle = bundle();

        assertEquals(ScenarioFiles.ALL, bundle.fileNames());
        assertEquals("<edges/>\n", bundle.content(ScenarioFiles.EDGES));
        assertThrows(IllegalArgumentException.class, () -> bundle.content("missing.xml"));
        assertThrows(UnsupportedOperationException.class, () -> bundle.files().put("x", "y"));
    }

    @Test
    @DisplayName("writeTo creates the directory and writes every file as UTF-8")
    void testWriteTo(@TempDir Path tempDir) throws IOException {
        Path target = tempDir.resolve("out").resolve("scenario");

        bundle().writeTo(target);

        for (String name : ScenarioFiles.ALL) {
            assertTrue(Files.isRegularFile(target.resolve(name)), name);
        }
        assertEquals("{ \"name\": \"Zürich\" }\n", Files.readString(target.resolve(ScenarioFiles.METADATA), StandardCharsets.UTF_8));
        try (Stream<Path> siblings = Files.list(target.getParent())) {
            assertEquals(List.of(target), siblings.toList(), "staging directory must be removed");
        }
    }

    @Test
    @DisplayName("writeTo replaces files left by an earlier run")
    void testOverwrite(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve(ScenarioFiles.ROUTES), "stale");

        bundle().writeTo(tempDir);

        assertEquals("<routes/>\n", Files.readString(tempDir.resolve(ScenarioFiles.ROUTES)));
    }

    @Test
    @DisplayName("writeTo onto a regular file fails with a reason-coded error")
    void testWriteFailure(@TempDir Path tempDir) throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file");

        ScenarioSerializationException ex = assertThrows(ScenarioSerializationException.class,
                () -> bundle().writeTo(blocker.resolve("scenario")));

        assertEquals(ScenarioBundle.REASON_WRITE_FAILED, ex.getReasonCode());
    }

    @Test
    @DisplayName("Archive holds one entry per file in bundle order")
    void testArchive() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        new BundleArchiver().archive(bundle(), bytes);

        List<String> names = new ArrayList<>();
        Map<String, String> contents = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes.toByteArray()), StandardCharsets.UTF_8)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                names.add(entry.getName());
                contents.put(entry.getName(), new String(zip.readAllBytes(), StandardCharsets.UTF_8));
            }
        }

        assertEquals(ScenarioFiles.ALL, names);
        assertEquals(bundle().files(), contents);
    }

    @Test
    @DisplayName("Archive to a path creates parent directories")
    void testArchiveToPath(@TempDir Path tempDir) {
        Path zipFile = tempDir.resolve("exports").resolve("scenario.zip");

        Path written = new BundleArchiver().archive(bundle(), zipFile);

        assertEquals(zipFile, written);
        assertTrue(Files.isRegularFile(zipFile));
    }
}
