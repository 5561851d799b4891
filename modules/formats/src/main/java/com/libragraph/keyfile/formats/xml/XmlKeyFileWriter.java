package com.libragraph.keyfile.formats.xml;

import jakarta.enterprise.context.ApplicationScoped;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

import static com.libragraph.keyfile.formats.xml.XmlKeyFileSchema.*;

/**
 * Serializes a key into the canonical XML key file layout:
 * UTF-8, CRLF line breaks, tab indentation.
 *
 * <p>The base64 text of the key only ever lives in arrays that are zeroed
 * once the document has been written.
 */
@ApplicationScoped
public class XmlKeyFileWriter {

    private static final String ENCODING = "utf-8";
    private static final String NEWLINE = "\r\n";
    private static final String INDENT = "\t";

    /**
     * Renders {@code keyData} as a complete key file document.
     *
     * @return UTF-8 bytes ready to be written to disk; the caller owns and should zero them
     */
    public byte[] write(byte[] keyData) {
        Objects.requireNonNull(keyData, "keyData cannot be null");

        WipeableOutputStream out = new WipeableOutputStream();
        byte[] encoded = Base64.getEncoder().encode(keyData);
        char[] text = new char[encoded.length];
        try {
            for (int i = 0; i < encoded.length; i++) {
                text[i] = (char) encoded[i];
            }
            XMLStreamWriter xml = XMLOutputFactory.newDefaultFactory().createXMLStreamWriter(out, ENCODING);
            try {
                xml.writeStartDocument(ENCODING, "1.0");
                xml.writeCharacters(NEWLINE);
                xml.writeStartElement(ROOT);
                xml.writeCharacters(NEWLINE + INDENT);

                xml.writeStartElement(META);
                xml.writeCharacters(NEWLINE + INDENT + INDENT);
                xml.writeStartElement(VERSION);
                xml.writeCharacters(CURRENT_VERSION);
                xml.writeEndElement(); // Version
                xml.writeCharacters(NEWLINE + INDENT);
                xml.writeEndElement(); // Meta
                xml.writeCharacters(NEWLINE + INDENT);

                xml.writeStartElement(KEY);
                xml.writeCharacters(NEWLINE + INDENT + INDENT);
                xml.writeStartElement(DATA);
                xml.writeCharacters(text, 0, text.length);
                xml.writeEndElement(); // Data
                xml.writeCharacters(NEWLINE + INDENT);
                xml.writeEndElement(); // Key
                xml.writeCharacters(NEWLINE);

                xml.writeEndElement(); // KeyFile
                xml.writeCharacters(NEWLINE);
                xml.writeEndDocument();
                xml.flush();
            } finally {
                xml.close();
            }
            return out.toByteArray();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to serialize XML key file", e);
        } finally {
            Arrays.fill(encoded, (byte) 0);
            Arrays.fill(text, '\0');
            out.wipe();
        }
    }

    /**
     * Output buffer whose backing array can be cleared after copying out.
     */
    static class WipeableOutputStream extends ByteArrayOutputStream {

        WipeableOutputStream() {
            super(256);
        }

        void wipe() {
            Arrays.fill(buf, (byte) 0);
            count = 0;
        }
    }
}
