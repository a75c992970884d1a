package com.codefarm.shorturl.util;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ShortcodeGeneratorTest {

    private final ShortcodeGenerator generator = new ShortcodeGenerator();

    @Test
    void generatedCodesAreSixAlphanumericCharacters() {
        for (int i = 0; i < 500; i++) {
            String code = generator.generate();
            assertEquals(ShortcodeGenerator.GENERATED_LENGTH, code.length());
            assertTrue(code.matches("[a-zA-Z0-9]+"), "unexpected character in " + code);
            assertTrue(generator.isValidFormat(code));
        }
    }

    @Test
    void generatedCodesVary() {
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            codes.add(generator.generate());
        }
        // 62^6 possibilities, a repeat within 1000 draws is vanishingly unlikely
        assertEquals(1000, codes.size());
    }

    @Test
    void acceptsCodesBetweenThreeAndTwentyCharacters() {
        assertTrue(generator.isValidFormat("abc"));
        assertTrue(generator.isValidFormat("ABC123xyz"));
        assertTrue(generator.isValidFormat("a".repeat(20)));
    }

    @Test
    void rejectsMalformedCodes() {
        assertFalse(generator.isValidFormat(null));
        assertFalse(generator.isValidFormat(""));
        assertFalse(generator.isValidFormat("ab"));
        assertFalse(generator.isValidFormat("a".repeat(21)));
        assertFalse(generator.isValidFormat("has-dash"));
        assertFalse(generator.isValidFormat("under_score"));
        assertFalse(generator.isValidFormat("space d"));
        assertFalse(generator.isValidFormat("ümlaut"));
    }
}
