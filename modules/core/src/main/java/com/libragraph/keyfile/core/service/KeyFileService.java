package com.libragraph.keyfile.core.service;

import com.libragraph.keyfile.core.create.KeyCreator;
import com.libragraph.keyfile.core.resolve.KeyResolver;
import com.libragraph.keyfile.core.resolve.ResolvedKey;
import com.libragraph.keyfile.core.storage.KeyFileStorage;
import com.libragraph.keyfile.core.storage.KeySource;
import com.libragraph.keyfile.util.SensitiveBytes;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Entry point for loading and creating key files through {@link KeyFileStorage}.
 *
 * <p>Transport errors are propagated unchanged. Raw file contents and
 * intermediate keys are zeroed once the result has been built.
 */
@ApplicationScoped
public class KeyFileService {

    private static final Logger log = Logger.getLogger(KeyFileService.class);

    @Inject
    KeyFileStorage storage;

    @Inject
    KeyResolver resolver;

    @Inject
    KeyCreator creator;

    @ConfigProperty(name = "keyfile.resolve.refuse-database-files", defaultValue = "true")
    boolean refuseDatabaseFiles;

    /**
     * Loads a key file using the configured database-file guard.
     */
    public Uni<KeyFileKey> loadKey(KeySource source) {
        return loadKey(source, refuseDatabaseFiles);
    }

    /**
     * Loads and resolves a key file.
     *
     * @param refuseIfContainerFile fail with
     *        {@link com.libragraph.keyfile.core.resolve.AmbiguousContainerFileException}
     *        if the file is a database
     */
    public Uni<KeyFileKey> loadKey(KeySource source, boolean refuseIfContainerFile) {
        return storage.read(source).map(raw -> {
            try (SensitiveBytes fileData = SensitiveBytes.wrap(raw);
                 ResolvedKey key = resolver.resolve(fileData.bytes(), refuseIfContainerFile)) {
                log.infof("Loaded key file %s (format=%s)", source.displayName(), key.format().label());
                return new KeyFileKey(source, key.format(), key.bytes());
            }
        });
    }

    /**
     * Creates a new random key file at {@code target}, overwriting any existing file.
     *
     * @param additionalEntropy optional caller entropy; may be null
     */
    public Uni<Void> createKeyFile(KeySource target, byte[] additionalEntropy) {
        return Uni.createFrom().item(() -> creator.create(additionalEntropy))
                .chain(document -> storage.write(target, document)
                        .eventually(() -> SensitiveBytes.zero(document)))
                .invoke(() -> log.infof("Created key file %s", target.displayName()));
    }
}
