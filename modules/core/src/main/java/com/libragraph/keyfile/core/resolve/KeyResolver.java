package com.libragraph.keyfile.core.resolve;

import com.libragraph.keyfile.core.KeyFileException;
import com.libragraph.keyfile.formats.api.KeyFormatParser;
import com.libragraph.keyfile.formats.api.ParseResult;
import com.libragraph.keyfile.formats.registry.KeyFormatRegistry;
import com.libragraph.keyfile.formats.signature.ContainerSignature;
import com.libragraph.keyfile.formats.signature.ContainerSignatureChecker;
import com.libragraph.keyfile.types.KeyFileFormat;
import com.libragraph.keyfile.util.KeyDigest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Turns the raw bytes of a key file into a key.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>empty input fails</li>
 *   <li>if guarded, a database container signature fails</li>
 *   <li>parsers from {@link KeyFormatRegistry}, highest priority first;
 *       the first match wins</li>
 *   <li>otherwise SHA-256 of the whole file</li>
 * </ol>
 * A 64-byte file that is not valid hex therefore ends up hashed.
 *
 * <p>Stateless and reentrant.
 */
@ApplicationScoped
public class KeyResolver {

    private static final Logger log = Logger.getLogger(KeyResolver.class);

    @Inject
    ContainerSignatureChecker signatureChecker;

    @Inject
    KeyFormatRegistry registry;

    /**
     * Resolves {@code rawBytes} to a key. The input is only read, never retained.
     *
     * @param rawBytes              complete key file contents
     * @param refuseIfContainerFile fail if the file looks like a database
     * @throws EmptyKeyFileException            if there are no bytes
     * @throws AmbiguousContainerFileException if guarded and a database signature matches
     * @throws KeyFileException                 if a parser reports a hard failure
     */
    public ResolvedKey resolve(byte[] rawBytes, boolean refuseIfContainerFile) {
        if (rawBytes == null || rawBytes.length == 0) {
            throw new EmptyKeyFileException();
        }

        if (refuseIfContainerFile) {
            Optional<ContainerSignature> signature = signatureChecker.detect(rawBytes);
            if (signature.isPresent()) {
                log.warnf("Refusing %s database file selected as key file", signature.get().label());
                throw new AmbiguousContainerFileException(signature.get());
            }
        }

        for (KeyFormatParser parser : registry.orderedParsers()) {
            ParseResult result = parser.parse(rawBytes);
            switch (result.status()) {
                case MATCHED -> {
                    log.debugf("Resolved %d-byte key file as %s", rawBytes.length, result.format().label());
                    return new ResolvedKey(result.key(), result.format());
                }
                case FAILED -> throw new KeyFileException(
                        "Key file parser " + parser.format().label() + " failed", result.error());
                case NOT_THIS_FORMAT -> log.tracef("Not %s: %s", parser.format().label(), result.reason());
            }
        }

        log.debugf("No structured format matched %d-byte key file, hashing contents", rawBytes.length);
        return new ResolvedKey(KeyDigest.sha256(rawBytes), KeyFileFormat.HASHED);
    }
}
