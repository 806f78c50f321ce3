package com.powersentinel.job;

import com.powersentinel.core.model.TimeSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SeriesCache}.
 */
class SeriesCacheTest {

    @TempDir
    Path dir;

    private final AtomicInteger loads = new AtomicInteger();
    private final SeriesCache cache = new SeriesCache();
    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        source = Files.writeString(dir.resolve("raw.txt"), "first version");
    }

    @Test
    @DisplayName("Should load once and then serve the cached series")
    void shouldServeCachedSeries() {
        TimeSeries first = cache.get(source, countingLoader());
        TimeSeries second = cache.get(source, countingLoader());

        assertThat(second).isSameAs(first);
        assertThat(loads.get()).isEqualTo(1);
        assertThat(cache.getMissCount()).isEqualTo(1);
        assertThat(cache.getHitCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should treat relative and absolute paths to the same file as one entry")
    void shouldNormalizeKeys() {
        cache.get(source, countingLoader());
        cache.get(dir.resolve("sub").resolve("..").resolve("raw.txt"), countingLoader());

        assertThat(loads.get()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reload after the file changes")
    void shouldReloadModifiedFile() throws IOException {
        cache.get(source, countingLoader());

        Files.writeString(source, "second, longer version");
        Files.setLastModifiedTime(source, FileTime.fromMillis(Files.getLastModifiedTime(source).toMillis() + 10_000));
        cache.get(source, countingLoader());

        assertThat(loads.get()).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reload after invalidate and clear")
    void shouldReloadAfterInvalidation() {
        cache.get(source, countingLoader());
        cache.invalidate(source);
        cache.get(source, countingLoader());
        cache.clear();

        assertThat(cache.size()).isZero();
        cache.get(source, countingLoader());
        assertThat(loads.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should not cache a failed load")
    void shouldNotCacheFailures() {
        assertThatThrownBy(() -> cache.get(source, path -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("Should fail for a missing file")
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> cache.get(dir.resolve("absent.txt"), countingLoader()))
                .isInstanceOf(UncheckedIOException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Function<Path, TimeSeries> countingLoader() {
        return path -> {
            loads.incrementAndGet();
            return TimeSeries.of("kw", LocalDateTime.of(2007, 1, 1, 0, 0), Duration.ofHours(1), 1.0, 2.0);
        };
    }
}
