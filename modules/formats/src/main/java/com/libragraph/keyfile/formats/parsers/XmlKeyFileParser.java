package com.libragraph.keyfile.formats.parsers;

import com.libragraph.keyfile.formats.api.KeyFormatParser;
import com.libragraph.keyfile.formats.api.ParseResult;
import com.libragraph.keyfile.types.KeyFileFormat;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static com.libragraph.keyfile.formats.xml.XmlKeyFileSchema.*;

/**
 * Parser for XML key files. Priority 300: tried first, at any file length.
 *
 * <p>Meta (and its version) is ignored. Only the first Data element under a
 * Key element is honored. The decoded length is not checked.
 * Malformed markup or base64 (including missing padding) is a soft miss.
 */
@ApplicationScoped
public class XmlKeyFileParser implements KeyFormatParser {

    private static final Logger log = Logger.getLogger(XmlKeyFileParser.class);

    private static final ErrorHandler STRICT_ERRORS = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            log.tracef("XML key file warning: %s", e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    @Override
    public KeyFileFormat format() {
        return KeyFileFormat.XML;
    }

    @Override
    public int priority() {
        return 300;
    }

    @Override
    public ParseResult parse(byte[] data) {
        if (data == null || data.length == 0) {
            return ParseResult.notThisFormat("empty input");
        }

        Document doc;
        try {
            DocumentBuilder builder = newBuilder();
            doc = builder.parse(new ByteArrayInputStream(data));
        } catch (SAXException | IOException e) {
            return ParseResult.notThisFormat("not well-formed XML: " + e.getMessage());
        }

        Element root = doc.getDocumentElement();
        if (root == null || !ROOT.equals(root.getNodeName())) {
            return ParseResult.notThisFormat("root element is not " + ROOT);
        }
        List<Element> children = childElements(root);
        if (children.size() < MIN_ROOT_CHILDREN) {
            return ParseResult.notThisFormat("root has fewer than " + MIN_ROOT_CHILDREN + " elements");
        }

        String encoded = null;
        for (Element child : children) {
            if (META.equals(child.getNodeName())) {
                continue;
            }
            if (!KEY.equals(child.getNodeName())) {
                continue;
            }
            for (Element keyChild : childElements(child)) {
                if (DATA.equals(keyChild.getNodeName()) && encoded == null) {
                    encoded = keyChild.getTextContent();
                }
            }
        }
        if (encoded == null) {
            return ParseResult.notThisFormat("no " + KEY + "/" + DATA + " element");
        }

        String base64 = stripWhitespace(encoded);
        // Padding is mandatory; unpadded text is not a valid key
        if (base64.length() % 4 != 0) {
            return ParseResult.notThisFormat("unpadded base64 in " + DATA);
        }
        try {
            byte[] key = Base64.getDecoder().decode(base64);
            return ParseResult.matched(key, KeyFileFormat.XML);
        } catch (IllegalArgumentException e) {
            return ParseResult.notThisFormat("invalid base64 in " + DATA + ": " + e.getMessage());
        }
    }

    private static DocumentBuilder newBuilder() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newDefaultInstance();
        try {
            // Key files never need DTDs; refuse them to rule out entity expansion
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setNamespaceAware(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(STRICT_ERRORS);
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure configuration", e);
        }
    }

    private static List<Element> childElements(Element parent) {
        List<Element> elements = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) n);
            }
        }
        return elements;
    }

    private static String stripWhitespace(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
