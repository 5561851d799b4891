package com.libragraph.keyfile.formats.parsers;

import com.libragraph.keyfile.formats.api.ParseResult;
import com.libragraph.keyfile.types.KeyFileFormat;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

class XmlKeyFileParserTest {

    private final XmlKeyFileParser parser = new XmlKeyFileParser();

    private static byte[] keyFile(String keyBody) {
        return ("<?xml version=\"1.0\" encoding=\"utf-8\"?>\n"
                + "<KeyFile>\n"
                + "  <Meta><Version>1.00</Version></Meta>\n"
                + "  <Key>" + keyBody + "</Key>\n"
                + "</KeyFile>\n").getBytes(StandardCharsets.UTF_8);
    }

    private static String b64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    @Test
    void shouldDecodeDataElement() {
        byte[] key = new byte[32];
        for (int i = 0; i < key.length; i++) key[i] = (byte) i;

        ParseResult result = parser.parse(keyFile("<Data>" + b64(key) + "</Data>"));

        assertThat(result.isMatched()).isTrue();
        assertThat(result.format()).isEqualTo(KeyFileFormat.XML);
        assertThat(result.key()).isEqualTo(key);
    }

    @Test
    void shouldHonorOnlyFirstDataElement() {
        byte[] first = {1, 1, 1, 1};
        byte[] second = {2, 2, 2, 2};

        ParseResult result = parser.parse(keyFile(
                "<Data>" + b64(first) + "</Data><Data>" + b64(second) + "</Data>"));

        assertThat(result.key()).containsExactly(1, 1, 1, 1);
    }

    @Test
    void shouldIgnoreMalformedSecondDataElement() {
        byte[] first = {7, 7, 7};

        ParseResult result = parser.parse(keyFile(
                "<Data>" + b64(first) + "</Data><Data>!!not base64!!</Data>"));

        assertThat(result.key()).containsExactly(7, 7, 7);
    }

    @Test
    void shouldAcceptAnyDecodedLength() {
        byte[] shortKey = {9, 8, 7, 6, 5};

        ParseResult result = parser.parse(keyFile("<Data>" + b64(shortKey) + "</Data>"));

        assertThat(result.isMatched()).isTrue();
        assertThat(result.key()).hasSize(5);
    }

    @Test
    void shouldTolerateWhitespaceInsideData() {
        byte[] key = new byte[32];
        key[0] = 0x7F;
        String encoded = b64(key);
        String wrapped = "\r\n\t\t" + encoded.substring(0, 20) + "\n  " + encoded.substring(20) + "\r\n\t";

        ParseResult result = parser.parse(keyFile("<Data>" + wrapped + "</Data>"));

        assertThat(result.key()).isEqualTo(key);
    }

    @Test
    void shouldIgnoreMetaVersion() {
        String xml = "<KeyFile><Meta><Version>9.99</Version></Meta>"
                + "<Key><Data>" + b64(new byte[]{1}) + "</Data></Key></KeyFile>";

        ParseResult result = parser.parse(xml.getBytes(StandardCharsets.UTF_8));

        assertThat(result.isMatched()).isTrue();
    }

    @Test
    void shouldMissOnInvalidBase64() {
        ParseResult result = parser.parse(keyFile("<Data>@@@@</Data>"));

        assertThat(result.status()).isEqualTo(ParseResult.Status.NOT_THIS_FORMAT);
    }

    @Test
    void shouldMissOnUnpaddedBase64() {
        ParseResult result = parser.parse(keyFile("<Data>AAAAAAA</Data>"));

        assertThat(result.status()).isEqualTo(ParseResult.Status.NOT_THIS_FORMAT);
        assertThat(result.reason()).contains("unpadded");
    }

    @Test
    void shouldMissOnWrongRoot() {
        String xml = "<Other><Meta/><Key><Data>AAAA</Data></Key></Other>";

        assertThat(parser.parse(xml.getBytes(StandardCharsets.UTF_8)).isMatched()).isFalse();
    }

    @Test
    void shouldMissWhenRootHasOneChild() {
        String xml = "<KeyFile><Key><Data>AAAA</Data></Key></KeyFile>";

        ParseResult result = parser.parse(xml.getBytes(StandardCharsets.UTF_8));

        assertThat(result.status()).isEqualTo(ParseResult.Status.NOT_THIS_FORMAT);
        assertThat(result.reason()).contains("fewer than 2");
    }

    @Test
    void shouldMissWhenNoDataElement() {
        String xml = "<KeyFile><Meta/><Key><Other>AAAA</Other></Key></KeyFile>";

        assertThat(parser.parse(xml.getBytes(StandardCharsets.UTF_8)).isMatched()).isFalse();
    }

    @Test
    void shouldMissOnMalformedMarkup() {
        assertThat(parser.parse("<KeyFile><Meta>".getBytes(StandardCharsets.UTF_8)).isMatched()).isFalse();
        assertThat(parser.parse(new byte[]{0x00, 0x01, (byte) 0xFF}).isMatched()).isFalse();
    }

    @Test
    void shouldRefuseDoctype() {
        String xml = "<?xml version=\"1.0\"?>"
                + "<!DOCTYPE KeyFile [<!ENTITY k \"AAAA\">]>"
                + "<KeyFile><Meta/><Key><Data>&k;</Data></Key></KeyFile>";

        ParseResult result = parser.parse(xml.getBytes(StandardCharsets.UTF_8));

        assertThat(result.status()).isEqualTo(ParseResult.Status.NOT_THIS_FORMAT);
    }

    @Test
    void shouldHavePriority300() {
        assertThat(parser.priority()).isEqualTo(300);
    }
}
