package com.menuvo.menuImport.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * {@link FileStorage} on the local file system.
 * Keys are relative paths below the configured root; keys resolving outside the root are rejected.
 */
@Slf4j
@Component
public class LocalFileStorage implements FileStorage {

    private final Path root;

    public LocalFileStorage(@Value("${menu-import.storage.directory:${java.io.tmpdir}/menu-imports}") String directory) {
        this.root = Path.of(directory).toAbsolutePath().normalize();
    }

    @Override
    public void putFile(String key, byte[] content) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new FileStorageException("Failed to store file: " + key, e);
        }
        log.debug("File stored - key: {}, size: {}", key, content.length);
    }

    @Override
    public byte[] getFile(String key) {
        Path source = resolve(key);
        try {
            return Files.readAllBytes(source);
        } catch (NoSuchFileException e) {
            throw new FileStorageException("File not found: " + key, e);
        } catch (IOException e) {
            throw new FileStorageException("Failed to read file: " + key, e);
        }
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new FileStorageException("File key must not be blank");
        }
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new FileStorageException("File key escapes storage root: " + key);
        }
        return resolved;
    }
}
