package com.eyelevel.labmigrator.service.cache;

import com.eyelevel.labmigrator.exception.CacheUnavailableException;
import com.eyelevel.labmigrator.model.Entry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Shared file handling of the cache formats: gzip when the file name ends in {@code .gz}, temp file plus
 * atomic move on save, and translation of I/O and parse errors into {@link CacheUnavailableException}.
 */
@Slf4j
public abstract class AbstractEntryCacheStore implements EntryCacheStore {

    protected abstract void write(Writer writer, List<Entry> entries) throws IOException;

    protected abstract List<Entry> read(Reader reader) throws IOException;

    @Override
    public void save(Path path, List<Entry> entries) {
        Path target = path.toAbsolutePath();
        Path tempFile = null;
        try {
            Files.createDirectories(target.getParent());
            tempFile = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try (Writer writer = openWriter(tempFile, isGzip(target))) {
                write(writer, entries);
            }
            moveIntoPlace(tempFile, target);
            log.info("Cached {} entries to {}.", entries.size(), target);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(tempFile);
            throw new CacheUnavailableException("Could not write entry cache " + target + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<Entry> load(Path path) {
        Path source = path.toAbsolutePath();
        if (!Files.isRegularFile(source)) {
            throw new CacheUnavailableException("Entry cache " + source + " does not exist");
        }
        try (Reader reader = openReader(source, isGzip(source))) {
            List<Entry> entries = read(reader);
            log.info("Loaded {} entries from cache {}.", entries.size(), source);
            return entries;
        } catch (NoSuchFileException e) {
            throw new CacheUnavailableException("Entry cache " + source + " does not exist", e);
        } catch (IOException | RuntimeException e) {
            throw new CacheUnavailableException("Could not read entry cache " + source + ": " + e.getMessage(), e);
        }
    }

    public static boolean isGzip(Path path) {
        return "gz".equalsIgnoreCase(FilenameUtils.getExtension(path.getFileName().toString()));
    }

    private static Writer openWriter(Path file, boolean gzip) throws IOException {
        OutputStream out = Files.newOutputStream(file);
        if (gzip) {
            out = new GZIPOutputStream(out);
        }
        return new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    private static Reader openReader(Path file, boolean gzip) throws IOException {
        InputStream in = Files.newInputStream(file);
        if (gzip) {
            in = new GZIPInputStream(in);
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    private static void moveIntoPlace(Path tempFile, Path target) throws IOException {
        try {
            Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place.", target);
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove temporary cache file {}: {}", file, e.getMessage());
        }
    }
}
