/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.autopilot.api.types.GeneratedListingType;
import villagecompute.autopilot.api.types.PricingAttributesType;
import villagecompute.autopilot.api.types.SkuResultType;
import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.ProductField;

/**
 * Unit tests for {@link FieldMergeEngine}.
 */
class FieldMergeEngineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    PricingPolicy pricingPolicy;

    @Mock
    IdentifierGenerator identifierGenerator;

    @Mock
    DefaultTagRules defaultTagRules;

    @InjectMocks
    FieldMergeEngine engine;

    private Product product;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(defaultTagRules.tagsFor(any(), any(), any(), any(), any())).thenReturn(List.of());
        when(identifierGenerator.generate(anyString(), any(), any(), any()))
                .thenReturn(SkuResultType.success("JKT-M-90-0001"));

        product = new Product();
        product.id = UUID.randomUUID();
    }

    private static GeneratedListingType payload(String json) throws Exception {
        return MAPPER.readValue(json, GeneratedListingType.class);
    }

    @Test
    void testMerge_conditionWithParentheticalSplitsFlaws() throws Exception {
        Map<ProductField, Object> updates = engine
                .merge(product, payload("{\"condition\": \"Very good (minor bobbling)\"}"));

        assertEquals("Very good", updates.get(ProductField.CONDITION));
        assertEquals("minor bobbling", updates.get(ProductField.FLAWS));
    }

    @Test
    void testMerge_keywordDepartmentNormalized() throws Exception {
        Map<ProductField, Object> updates = engine.merge(product, payload("{\"department\": \"mens jacket\"}"));

        assertEquals("Men", updates.get(ProductField.DEPARTMENT));
    }

    @Test
    void testMerge_unrecognizedEnumsLeaveFieldsUntouched() throws Exception {
        product.era = "90s";
        Map<ProductField, Object> updates = engine
                .merge(product, payload("{\"era\": \"victorian\", \"department\": \"pets\", \"condition\": \"meh\"}"));

        assertFalse(updates.containsKey(ProductField.ERA));
        assertFalse(updates.containsKey(ProductField.DEPARTMENT));
        assertFalse(updates.containsKey(ProductField.CONDITION));
    }

    @Test
    void testMerge_generatedTextReplacesStoredValues() throws Exception {
        product.brand = "Wrangler";
        product.description = "Written by hand";
        Map<ProductField, Object> updates = engine
                .merge(product, payload("{\"brand\": \"Levi's\", \"description\": \"Classic trucker jacket\"}"));

        assertEquals("Levi's", updates.get(ProductField.BRAND));
        assertEquals("Classic trucker jacket", updates.get(ProductField.DESCRIPTION));
    }

    @Test
    void testMerge_emptyAndNullLiteralDoNotOverwrite() throws Exception {
        product.brand = "Levi's";
        product.material = "Denim";
        Map<ProductField, Object> updates = engine
                .merge(product, payload("{\"brand\": \"\", \"material\": \"null\", \"fit\": \"  Relaxed \"}"));

        assertFalse(updates.containsKey(ProductField.BRAND));
        assertFalse(updates.containsKey(ProductField.MATERIAL));
        assertEquals("Relaxed", updates.get(ProductField.FIT));
    }

    @Test
    void testMerge_priceDerivedWhenMissing() throws Exception {
        product.price = BigDecimal.ZERO;
        when(pricingPolicy.suggestPrice(any(), any())).thenReturn(new BigDecimal("45.00"));

        Map<ProductField, Object> updates = engine.merge(product,
                payload("{\"garment_type\": \"Coat\", \"material\": \"Wool\", \"condition\": \"Good (small stain)\"}"));

        assertEquals(new BigDecimal("45.00"), updates.get(ProductField.PRICE));
        ArgumentCaptor<PricingAttributesType> attributes = ArgumentCaptor.forClass(PricingAttributesType.class);
        verify(pricingPolicy).suggestPrice(eq("Coat"), attributes.capture());
        assertEquals("Wool", attributes.getValue().material());
        assertEquals("Good", attributes.getValue().condition());
    }

    @Test
    void testMerge_existingPriceNeverOverwritten() throws Exception {
        product.price = new BigDecimal("30.00");

        Map<ProductField, Object> updates = engine.merge(product, payload("{\"material\": \"Wool\"}"));

        assertFalse(updates.containsKey(ProductField.PRICE));
        verify(pricingPolicy, never()).suggestPrice(any(), any());
    }

    @Test
    void testMerge_zeroSuggestionIgnored() throws Exception {
        when(pricingPolicy.suggestPrice(any(), any())).thenReturn(BigDecimal.ZERO);

        Map<ProductField, Object> updates = engine.merge(product, payload("{\"material\": \"Wool\"}"));

        assertFalse(updates.containsKey(ProductField.PRICE));
    }

    @Test
    void testMerge_shopifyTagsUnionDefaultsFirst() throws Exception {
        when(defaultTagRules.tagsFor(any(), any(), any(), any(), any())).thenReturn(List.of("Vintage", "Jackets"));

        Map<ProductField, Object> updates = engine
                .merge(product, payload("{\"shopify_tags\": \"vintage, denim ,Jackets, 90s\"}"));

        assertEquals("Vintage, Jackets, denim, 90s", updates.get(ProductField.SHOPIFY_TAGS));
    }

    @Test
    void testMerge_skuAssignedAndAnnotationStripped() throws Exception {
        product.notes = "Small hole on cuff [SKU_NEEDS_ATTENTION: missing size]";

        Map<ProductField, Object> updates = engine
                .merge(product, payload("{\"garment_type\": \"Jacket\", \"size_recommended\": \"M\"}"));

        assertEquals("JKT-M-90-0001", updates.get(ProductField.SKU));
        assertEquals("Small hole on cuff", updates.get(ProductField.NOTES));
        verify(identifierGenerator).generate("Jacket", "M", null, null);
    }

    @Test
    void testMerge_skuFailureAnnotatesNotesOnce() throws Exception {
        when(identifierGenerator.generate(anyString(), any(), any(), any()))
                .thenReturn(SkuResultType.failure("missing size"));
        product.notes = "Raw notes";

        Map<ProductField, Object> first = engine.merge(product, payload("{\"garment_type\": \"Jacket\"}"));
        assertEquals("Raw notes [SKU_NEEDS_ATTENTION: missing size]", first.get(ProductField.NOTES));
        assertFalse(first.containsKey(ProductField.SKU));

        product.notes = (String) first.get(ProductField.NOTES);
        Map<ProductField, Object> second = engine.merge(product, payload("{\"garment_type\": \"Jacket\"}"));
        assertFalse(second.containsKey(ProductField.NOTES));
    }

    @Test
    void testMerge_noGarmentTypeSkipsIdentifier() throws Exception {
        Map<ProductField, Object> updates = engine.merge(product, payload("{\"title\": \"Wool coat\"}"));

        assertFalse(updates.containsKey(ProductField.SKU));
        verify(identifierGenerator, never()).generate(any(), any(), any(), any());
    }

    @Test
    void testCleanTitle() {
        assertEquals("Vintage Levi's Denim Jacket Blue Size M",
                FieldMergeEngine.cleanTitle("Vintage Levi's - Denim Jacket: Blue, Size M"));
        assertEquals(80, FieldMergeEngine.cleanTitle("x".repeat(120)).length());
        assertNull(FieldMergeEngine.cleanTitle("   "));
    }

    @Test
    void testNormalizeEra() {
        assertEquals(Optional.of("90s"), engine.normalizeEra("90S"));
        assertEquals(Optional.of("Y2K"), engine.normalizeEra("early 2000s"));
        assertEquals(Optional.of("80s"), engine.normalizeEra("1980s"));
        assertEquals(Optional.of("Modern"), engine.normalizeEra("contemporary"));
        assertTrue(engine.normalizeEra("1950s").isEmpty());
    }

    @Test
    void testNormalizeDepartment() {
        assertEquals(Optional.of("Women"), engine.normalizeDepartment("womens blouse"));
        assertEquals(Optional.of("Unisex"), engine.normalizeDepartment("men and women"));
        assertEquals(Optional.of("Kids"), engine.normalizeDepartment("girls dress"));
        assertEquals(Optional.of("Unisex"), engine.normalizeDepartment("UNISEX"));
    }

    @Test
    void testSanitizeCondition_withoutParenthetical() {
        FieldMergeEngine.ParsedCondition parsed = engine.sanitizeCondition("very good overall").orElseThrow();

        assertEquals("Very good", parsed.condition());
        assertNull(parsed.flaws());
    }
}
