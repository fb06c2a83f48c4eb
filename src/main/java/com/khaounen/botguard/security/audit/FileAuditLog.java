package com.khaounen.botguard.security.audit;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Audit log kept in one JSON document mapping Beam IDs to their entries.
 * Writers of the same file share one lock, also across instances.
 */
public class FileAuditLog implements AuditLog {

    private static final Map<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();
    private static final TypeReference<LinkedHashMap<String, List<AuditLogEntry>>> DOCUMENT =
            new TypeReference<>() {
            };

    private final Path file;
    private final ObjectMapper objectMapper;

    public FileAuditLog(Path file, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean append(String fingerprint, AuditLogEntry entry) {
        ReentrantLock lock = LOCKS.computeIfAbsent(file, path -> new ReentrantLock());
        lock.lock();
        try {
            Map<String, List<AuditLogEntry>> document = read();
            List<AuditLogEntry> list = document.computeIfAbsent(fingerprint, key -> new ArrayList<>());
            if (list.contains(entry)) {
                return false;
            }
            list.add(entry);
            write(document);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<AuditLogEntry> entries(String fingerprint) {
        ReentrantLock lock = LOCKS.computeIfAbsent(file, path -> new ReentrantLock());
        lock.lock();
        try {
            return List.copyOf(read().getOrDefault(fingerprint, List.of()));
        } finally {
            lock.unlock();
        }
    }

    private Map<String, List<AuditLogEntry>> read() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            if (Files.size(file) == 0) {
                return new LinkedHashMap<>();
            }
            return objectMapper.readValue(file.toFile(), DOCUMENT);
        } catch (IOException ex) {
            throw new UncheckedIOException("cannot read audit log " + file, ex);
        }
    }

    private void write(Map<String, List<AuditLogEntry>> document) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), document);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new UncheckedIOException("cannot write audit log " + file, ex);
        }
    }
}
