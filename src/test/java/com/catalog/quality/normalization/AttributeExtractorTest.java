package com.catalog.quality.normalization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AttributeExtractorTest {

    private final AttributeExtractor extractor = new AttributeExtractor();

    @Test
    @DisplayName("Should map Russian and English tags to attribute keys")
    void testAliases() {
        Map<String, String> attributes = extractor.extract(
                "<ИНН>7707083893</ИНН><kpp>773601001</kpp><ЕдиницаИзмерения> шт </ЕдиницаИзмерения>");

        assertEquals("7707083893", attributes.get(AttributeExtractor.INN));
        assertEquals("773601001", attributes.get(AttributeExtractor.KPP));
        assertEquals("шт", attributes.get(AttributeExtractor.UNIT));
    }

    @Test
    @DisplayName("Should ignore unknown and empty tags")
    void testUnknownTags() {
        Map<String, String> attributes = extractor.extract("<Цвет>красный</Цвет><Артикул></Артикул>");
        assertTrue(attributes.isEmpty());
    }

    @Test
    @DisplayName("Should keep the first occurrence of a key")
    void testFirstWins() {
        Map<String, String> attributes = extractor.extract("<inn>7707083893</inn><ИНН>500100732259</ИНН>");
        assertEquals("7707083893", attributes.get(AttributeExtractor.INN));
    }

    @Test
    @DisplayName("Should accept tags with attributes")
    void testTagAttributes() {
        Map<String, String> attributes = extractor.extract("<Артикул type=\"vendor\">A-100</Артикул>");
        assertEquals("A-100", attributes.get(AttributeExtractor.ARTICLE));
    }

    @Test
    @DisplayName("Should return empty map for blank payload")
    void testBlank() {
        assertTrue(extractor.extract(null).isEmpty());
        assertTrue(extractor.extract("").isEmpty());
    }

    @Test
    @DisplayName("Should use custom aliases")
    void testCustomAliases() {
        AttributeExtractor custom = new AttributeExtractor(Map.of("vat", "inn"));
        assertEquals(Map.of("inn", "7707083893"), custom.extract("<VAT>7707083893</VAT><INN>1</INN>"));
    }
}
