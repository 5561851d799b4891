package com.libragraph.keyfile.core.storage;

import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Local filesystem transport for key files.
 *
 * <p>Relative locators resolve against {@code keyfile.storage.filesystem.root};
 * {@code file://} URLs are accepted. Other remote locators are rejected.
 * Writes go to a temp file in the target directory and are moved into place.
 */
@ApplicationScoped
public class FilesystemKeyFileStorage implements KeyFileStorage {

    private static final Logger log = Logger.getLogger(FilesystemKeyFileStorage.class);

    @ConfigProperty(name = "keyfile.storage.filesystem.root", defaultValue = ".")
    String root;

    Path resolvePath(KeySource source) {
        if (source.isRemote()) {
            throw new StorageException("Unsupported key file location: " + source);
        }
        String locator = source.locator();
        Path path = locator.regionMatches(true, 0, "file://", 0, 7)
                ? Path.of(URI.create(locator))
                : Path.of(locator);
        return path.isAbsolute() ? path : Path.of(root).resolve(path);
    }

    @Override
    public Uni<byte[]> read(KeySource source) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(source);
            try {
                return Files.readAllBytes(path);
            } catch (NoSuchFileException e) {
                throw new KeyFileNotFoundException(source);
            } catch (IOException e) {
                throw new StorageException("Failed to read key file: " + source, e);
            }
        });
    }

    @Override
    public Uni<Void> write(KeySource target, byte[] data) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(target).toAbsolutePath();
            Path dir = path.getParent();
            Path tmp = null;
            try {
                Files.createDirectories(dir);
                tmp = Files.createTempFile(dir, ".keyfile", ".tmp");
                Files.write(tmp, data);
                try {
                    Files.move(tmp, path,
                            StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.debugf("Atomic move unsupported in %s, replacing non-atomically", dir);
                    Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
                }
                log.debugf("Wrote %d-byte key file %s", data.length, path);
            } catch (IOException e) {
                throw new StorageException("Failed to write key file: " + target, e);
            } finally {
                deleteQuietly(tmp);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(KeySource source) {
        return Uni.createFrom().item(() -> Files.isRegularFile(resolvePath(source)));
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warnf(e, "Could not remove temp file %s", tmp);
        }
    }
}
