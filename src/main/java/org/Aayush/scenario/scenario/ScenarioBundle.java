package org.Aayush.scenario.scenario;

import org.Aayush.scenario.core.ScenarioSerializationException;
import org.Aayush.scenario.core.io.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, ordered set of rendered scenario documents keyed by file name.
 * <p>
 * A bundle only exists once every document rendered; {@link ScenarioSerializer} never
 * hands out a partial one. {@link #writeTo(Path)} keeps that guarantee on disk by
 * staging all files first and moving them into place afterwards.
 */
public final class ScenarioBundle {
    private static final Logger LOG = LoggerFactory.getLogger(ScenarioBundle.class);

    public static final String REASON_WRITE_FAILED = "BUNDLE_WRITE_FAILED";

    private final Map<String, String> files;

    public ScenarioBundle(Map<String, String> files) {
        Objects.requireNonNull(files, "files");
        LinkedHashMap<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : files.entrySet()) {
            copy.put(
                    Objects.requireNonNull(entry.getKey(), "file name"),
                    Objects.requireNonNull(entry.getValue(), "content of " + entry.getKey())
            );
        }
        this.files = Collections.unmodifiableMap(copy);
    }

    public Map<String, String> files() {
        return files;
    }

    public List<String> fileNames() {
        return List.copyOf(files.keySet());
    }

    public String content(String fileName) {
        String content = files.get(fileName);
        if (content == null) {
            throw new IllegalArgumentException("Bundle has no file " + fileName);
        }
        return content;
    }

    /**
     * Writes every file into {@code directory}, creating it when absent.
     * <p>
     * Files are first written to a staging directory next to the target; the target only
     * receives files after all writes succeeded.
     *
     * @throws ScenarioSerializationException on any I/O failure.
     */
    public void writeTo(Path directory) {
        Objects.requireNonNull(directory, "directory");
        Path target = directory.toAbsolutePath();
        Path staging = null;
        try {
            Files.createDirectories(target);
            staging = Files.createTempDirectory(target.getParent() == null ? target : target.getParent(), ".bundle-");
            for (Map.Entry<String, String> file : files.entrySet()) {
                Files.writeString(staging.resolve(file.getKey()), file.getValue(), StandardCharsets.UTF_8);
            }
            for (String name : files.keySet()) {
                Files.move(staging.resolve(name), target.resolve(name), StandardCopyOption.REPLACE_EXISTING);
            }
            FileTrees.deleteRecursively(staging);
            LOG.debug("Wrote {} scenario files to {}", files.size(), target);
        } catch (IOException ex) {
            ScenarioSerializationException failure = new ScenarioSerializationException(
                    REASON_WRITE_FAILED,
                    "Error writing scenario files to " + target + ": " + ex.getMessage(),
                    ex
            );
            try {
                FileTrees.deleteRecursively(staging);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ScenarioBundle)) {
            return false;
        }
        return files.equals(((ScenarioBundle) other).files);
    }

    @Override
    public int hashCode() {
        return files.hashCode();
    }

    @Override
    public String toString() {
        return "ScenarioBundle" + files.keySet();
    }
}
