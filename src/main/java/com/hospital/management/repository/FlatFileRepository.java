package com.hospital.management.repository;

import com.hospital.management.codec.RecordCodec;
import com.hospital.management.exception.DataFileException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Whole-file persistence for one collection: every load reads the full file, every save
 * rewrites it. There is no locking; the last writer wins.
 */
public abstract class FlatFileRepository<V> {

    private static final Logger log = LoggerFactory.getLogger(FlatFileRepository.class);

    private final RecordCodec<V> codec;
    private final Path file;
    private final String kind;

    protected FlatFileRepository(RecordCodec<V> codec, Path file, String kind) {
        this.codec = codec;
        this.file = file;
        this.kind = kind;
    }

    /**
     * A missing file is a first run, not an error: it loads as an empty collection.
     */
    protected Map<Integer, V> load() {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.warn("{} file {} not found, starting empty", kind, file);
            return new LinkedHashMap<>();
        } catch (IOException e) {
            throw new DataFileException("read", file, e);
        }
        Map<Integer, V> records = codec.decode(normalizeLineEndings(text));
        log.info("Loaded {} {} records from {}", records.size(), kind, file);
        return records;
    }

    /**
     * Files written on Windows end lines with "\r\n"; the codecs only know '\n'.
     */
    static String normalizeLineEndings(String text) {
        return StringUtils.replace(StringUtils.replace(text, "\r\n", "\n"), "\r", "\n");
    }

    protected void save(Map<Integer, V> records) {
        String text = codec.encode(records);
        Path dir = file.toAbsolutePath().getParent();
        try {
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try {
                Files.writeString(tmp, text, StandardCharsets.UTF_8);
                moveIntoPlace(tmp);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new DataFileException("write", file, e);
        }
        log.info("Saved {} {} records to {}", records.size(), kind, file);
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
