package org.Aayush.scenario.scenario;

import org.Aayush.scenario.core.ScenarioSerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packs a {@link ScenarioBundle} into a deflated ZIP archive, one entry per file in bundle order.
 */
public final class BundleArchiver {
    private static final Logger LOG = LoggerFactory.getLogger(BundleArchiver.class);

    public static final String REASON_ARCHIVE_FAILED = "BUNDLE_ARCHIVE_FAILED";

    public void archive(ScenarioBundle bundle, OutputStream output) throws IOException {
        Objects.requireNonNull(bundle, "bundle");
        Objects.requireNonNull(output, "output");
        ZipOutputStream zip = new ZipOutputStream(output, StandardCharsets.UTF_8);
        zip.setMethod(ZipOutputStream.DEFLATED);
        for (Map.Entry<String, String> file : bundle.files().entrySet()) {
            zip.putNextEntry(new ZipEntry(file.getKey()));
            zip.write(file.getValue().getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }
        zip.finish();
    }

    /**
     * Writes the archive to {@code zipFile}, replacing any existing file.
     *
     * @throws ScenarioSerializationException when the archive cannot be written.
     */
    public Path archive(ScenarioBundle bundle, Path zipFile) {
        Objects.requireNonNull(zipFile, "zipFile");
        try {
            Path parent = zipFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream output = Files.newOutputStream(zipFile)) {
                archive(bundle, output);
            }
        } catch (IOException ex) {
            throw new ScenarioSerializationException(
                    REASON_ARCHIVE_FAILED,
                    "Error creating archive " + zipFile + ": " + ex.getMessage(),
                    ex
            );
        }
        LOG.info("Created scenario archive {}", zipFile);
        return zipFile;
    }
}
