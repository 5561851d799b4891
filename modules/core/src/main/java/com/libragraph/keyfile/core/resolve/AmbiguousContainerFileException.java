package com.libragraph.keyfile.core.resolve;

import com.libragraph.keyfile.core.KeyFileException;
import com.libragraph.keyfile.formats.signature.ContainerSignature;

/**
 * Thrown when the selected key file is recognizably a database container.
 */
public class AmbiguousContainerFileException extends KeyFileException {

    private final ContainerSignature signature;

    public AmbiguousContainerFileException(ContainerSignature signature) {
        super("The selected file is a database, not a key file (signature: " + signature.label() + ")");
        this.signature = signature;
    }

    public ContainerSignature signature() {
        return signature;
    }
}
