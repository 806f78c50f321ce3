package com.powersentinel.job;

import com.powersentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Memoizes loaded series per source file.
 *
 * <p>
 * An entry is keyed by the file's absolute path together with its
 * last-modified time and size, so a rewritten file misses the cache and
 * replaces the stale entry. Entries live until {@link #invalidate(Path)} or
 * {@link #clear()}; nothing is evicted implicitly.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesCache {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesCache.class);

    private final Map<Path, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicInteger misses = new AtomicInteger();

    /**
     * Return the cached series for {@code source}, loading it when absent or
     * when the file changed since it was cached.
     *
     * @throws UncheckedIOException if the file attributes cannot be read
     */
    public TimeSeries get(Path source, Function<Path, TimeSeries> loader) {
        Objects.requireNonNull(source, "Source path must not be null");
        Objects.requireNonNull(loader, "Loader must not be null");
        Path key = source.toAbsolutePath().normalize();
        Fingerprint fingerprint = Fingerprint.of(key);

        Entry cached = entries.get(key);
        if (cached != null && cached.fingerprint.equals(fingerprint)) {
            hits.incrementAndGet();
            LOG.debug("Series cache hit for {}", key);
            return cached.series;
        }

        misses.incrementAndGet();
        LOG.debug("Series cache {} for {}", cached == null ? "miss" : "stale entry", key);
        TimeSeries series = loader.apply(key);
        entries.put(key, new Entry(fingerprint, series));
        return series;
    }

    public void invalidate(Path source) {
        if (entries.remove(source.toAbsolutePath().normalize()) != null) {
            LOG.debug("Invalidated series cache entry for {}", source);
        }
    }

    public void clear() {
        entries.clear();
        LOG.debug("Series cache cleared");
    }

    public int size() {
        return entries.size();
    }

    public int getHitCount() {
        return hits.get();
    }

    public int getMissCount() {
        return misses.get();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static final class Entry {
        final Fingerprint fingerprint;
        final TimeSeries series;

        Entry(Fingerprint fingerprint, TimeSeries series) {
            this.fingerprint = fingerprint;
            this.series = series;
        }
    }

    private static final class Fingerprint {
        final long lastModifiedMillis;
        final long size;

        private Fingerprint(long lastModifiedMillis, long size) {
            this.lastModifiedMillis = lastModifiedMillis;
            this.size = size;
        }

        static Fingerprint of(Path path) {
            try {
                return new Fingerprint(Files.getLastModifiedTime(path).toMillis(), Files.size(path));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read attributes of " + path, e);
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Fingerprint other)) {
                return false;
            }
            return lastModifiedMillis == other.lastModifiedMillis && size == other.size;
        }

        @Override
        public int hashCode() {
            return Objects.hash(lastModifiedMillis, size);
        }
    }
}
