package com.powersentinel.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Collects the artifacts of one run in a hidden staging directory and moves
 * them into the output directory only on {@link #commit()}.
 *
 * <p>
 * {@link #close()} deletes whatever is still staged, so a run that fails
 * before committing leaves the output directory untouched.
 * </p>
 *
 * @since 1.0.0
 */
final class ArtifactStager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactStager.class);

    static final String STAGING_PREFIX = ".staging-";

    private final Path outputDir;
    private final Path stagingDir;
    private final List<String> staged = new ArrayList<>();
    private boolean committed;

    ArtifactStager(Path outputDir) throws IOException {
        this.outputDir = outputDir;
        Files.createDirectories(outputDir);
        this.stagingDir = Files.createTempDirectory(outputDir, STAGING_PREFIX);
    }

    /**
     * Reserve {@code fileName} in the staging directory.
     *
     * @return the staging path to write to
     */
    Path stage(String fileName) {
        if (committed) {
            throw new IllegalStateException("Artifacts already committed");
        }
        staged.add(fileName);
        return stagingDir.resolve(fileName);
    }

    /**
     * Move every staged file into the output directory, replacing earlier
     * versions.
     *
     * @return final artifact paths in staging order
     */
    List<Path> commit() throws IOException {
        List<Path> published = new ArrayList<>(staged.size());
        for (String fileName : staged) {
            Path target = outputDir.resolve(fileName);
            move(stagingDir.resolve(fileName), target);
            published.add(target);
        }
        committed = true;
        LOG.info("Published {} artifact(s) to {}", published.size(), outputDir);
        return Collections.unmodifiableList(published);
    }

    Path getStagingDir() {
        return stagingDir;
    }

    @Override
    public void close() {
        if (!Files.exists(stagingDir)) {
            return;
        }
        if (!committed) {
            LOG.warn("Discarding {} staged artifact(s) in {}", staged.size(), stagingDir);
        }
        try (Stream<Path> paths = Files.walk(stagingDir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete staging directory " + stagingDir, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}; falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
