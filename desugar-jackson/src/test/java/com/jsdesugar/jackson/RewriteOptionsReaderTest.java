package com.jsdesugar.jackson;

import com.jsdesugar.json.AstJsonException;
import com.jsdesugar.json.RewriteOptionsReader;
import com.jsdesugar.rewrite.RewriteOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class RewriteOptionsReaderTest {

    private final RewriteOptionsReader reader = new JacksonAstJsonProvider().getOptionsReader();

    @Test
    void testReadsPrefix() {
        assertEquals("$", reader.read("{\"namePrefix\": \"$\"}").namePrefix());
    }

    @Test
    void testAcceptsLegacyKey() {
        assertEquals("_", reader.read("{\"customPrefix\": \"_\"}").namePrefix());
    }

    @Test
    void testMissingPrefixMeansDefault() {
        assertEquals(RewriteOptions.defaults(), reader.read("{}"));
        assertEquals(RewriteOptions.defaults(), reader.read("{\"namePrefix\": null, \"verbose\": true}"));
    }

    @Test
    void testEmptyPrefixIsAllowed() {
        assertEquals("", reader.read("{\"namePrefix\": \"\"}").namePrefix());
    }

    @Test
    void testInvalidPrefixIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> reader.read("{\"namePrefix\": \"9lives\"}"));
    }

    @Test
    void testMalformedDocument() {
        assertThrows(AstJsonException.class, () -> reader.read("{\"namePrefix\": "));
        assertThrows(AstJsonException.class, () -> reader.read("null"));
    }

    @Test
    void testReadsFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("desugar.json");
        Files.writeString(file, "{\"namePrefix\": \"impl_\"}");

        assertEquals("impl_", reader.read(file).namePrefix());
        assertThrows(AstJsonException.class, () -> reader.read(dir.resolve("missing.json")));
    }
}
