package com.provider.linkage.bulk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvSupportTest {

    @Test
    @DisplayName("Should split quoted fields with embedded commas and quotes")
    void testParseLine() {
        assertEquals(List.of("a", "b, c", "say \"hi\"", ""),
                CsvSupport.parseLine("a,\"b, c\",\"say \"\"hi\"\"\","));
        assertEquals(List.of(""), CsvSupport.parseLine(""));
    }

    @Test
    @DisplayName("Unterminated quotes should be refused")
    void testUnterminatedQuote() {
        assertThrows(IllegalArgumentException.class, () -> CsvSupport.parseLine("a,\"b"));
    }

    @Test
    @DisplayName("Escaped output should parse back to the same fields")
    void testJoinParsesBack() {
        List<String> fields = List.of("Sunrise, Inc.", "plain", "quote \" inside");

        assertEquals(fields, CsvSupport.parseLine(CsvSupport.join(fields)));
        assertEquals("", CsvSupport.escape(null));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "5000000.0, 5000000",
            "1.0E7, 10000000",
            "0.125, 0.125",
            "12.50, 12.5",
            "0.0, 0"
    })
    @DisplayName("Numbers should render without exponent or trailing zeros")
    void testNumber(double value, String expected) {
        assertEquals(expected, CsvSupport.number(value));
    }

    @Test
    @DisplayName("Null numbers should render empty")
    void testNullNumber() {
        assertEquals("", CsvSupport.number(null));
    }

    @Test
    @DisplayName("Header lookups should be case-insensitive and blank-aware")
    void testHeader() {
        CsvSupport.Header header = new CsvSupport.Header(Arrays.asList(" Legal_Name ", "STATE", "zip"));
        List<String> row = List.of(" Sunrise Clinic ", "TX", "  ");

        assertEquals("Sunrise Clinic", header.get(row, "legal_name"));
        assertEquals("TX", header.get(row, "state"));
        assertNull(header.get(row, "zip"));
        assertNull(header.get(row, "phone"));
        assertNull(header.get(List.of("only"), "state"));
        assertThrows(IllegalArgumentException.class, () -> header.require("legal_name", "phone"));
    }
}
