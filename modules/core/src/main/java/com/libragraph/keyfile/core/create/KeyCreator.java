package com.libragraph.keyfile.core.create;

import com.libragraph.keyfile.formats.xml.XmlKeyFileWriter;
import com.libragraph.keyfile.util.KeyDigest;
import com.libragraph.keyfile.util.SensitiveBytes;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Generates new random keys and renders them as XML key files.
 *
 * <p>With additional entropy the key is {@code SHA-256(entropy || random)};
 * without it, the 32 random bytes are the key. Entropy is never persisted.
 */
@ApplicationScoped
public class KeyCreator {

    private static final Logger log = Logger.getLogger(KeyCreator.class);

    public static final int KEY_LENGTH = 32;

    @Inject
    RandomSource randomSource;

    @Inject
    XmlKeyFileWriter writer;

    /**
     * Creates a new key and returns the XML key file bytes to persist.
     * All intermediate key buffers are zeroed before returning.
     *
     * @param additionalEntropy optional caller entropy; null or empty to use only the random source
     * @throws RandomSourceException if no random bytes could be obtained
     */
    public byte[] create(byte[] additionalEntropy) {
        try (SensitiveBytes key = generateKey(additionalEntropy)) {
            return writer.write(key.bytes());
        }
    }

    /**
     * Derives a fresh 32-byte key without serializing it.
     * The returned buffer must be closed by the caller.
     */
    public SensitiveBytes generateKey(byte[] additionalEntropy) {
        try (SensitiveBytes random = SensitiveBytes.wrap(nextRandomKey())) {
            if (additionalEntropy == null || additionalEntropy.length == 0) {
                return SensitiveBytes.copyOf(random.bytes());
            }
            log.debugf("Mixing %d bytes of additional entropy into new key", additionalEntropy.length);
            return SensitiveBytes.wrap(KeyDigest.sha256(additionalEntropy, random.bytes()));
        }
    }

    private byte[] nextRandomKey() {
        byte[] bytes;
        try {
            bytes = randomSource.nextBytes(KEY_LENGTH);
        } catch (RandomSourceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RandomSourceException("Random source failed", e);
        }
        if (bytes == null || bytes.length != KEY_LENGTH) {
            SensitiveBytes.zero(bytes);
            throw new RandomSourceException("Random source did not return " + KEY_LENGTH + " bytes");
        }
        return bytes;
    }
}
