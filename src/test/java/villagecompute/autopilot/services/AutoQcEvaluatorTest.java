/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.autopilot.api.types.QcEvaluationType;
import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.QcStatus;

/**
 * Unit tests for {@link AutoQcEvaluator}.
 */
class AutoQcEvaluatorTest {

    private final AutoQcEvaluator evaluator = new AutoQcEvaluator();

    private Product product;

    @BeforeEach
    void setUp() {
        product = new Product();
        product.title = "Vintage Levi's Denim Jacket";
        product.descriptionStyleA = "Classic trucker jacket.";
        product.garmentType = "Jacket";
        product.condition = "Excellent";
        product.sizeLabel = "M";
        product.pitToPit = "22in";
        product.era = "90s";
        product.brand = "Levi's";
        product.price = new BigDecimal("65.00");
    }

    @Test
    void testEvaluate_completeProductIsReady() {
        QcEvaluationType result = evaluator.evaluate(product);

        assertEquals(100, result.confidence());
        assertEquals(QcStatus.READY, result.status());
        assertTrue(result.flags().isEmpty());
    }

    @Test
    void testEvaluate_anyFlagPreventsReady() {
        product.era = null;

        QcEvaluationType result = evaluator.evaluate(product);

        assertEquals(95, result.confidence());
        assertEquals(QcStatus.NEEDS_REVIEW, result.status());
        assertEquals(true, result.flags().get(AutoQcEvaluator.FLAG_ERA_UNCERTAIN));
    }

    @Test
    void testEvaluate_missingRequiredFieldBlocks() {
        product.descriptionStyleA = " ";

        QcEvaluationType result = evaluator.evaluate(product);

        assertEquals(85, result.confidence());
        assertEquals(QcStatus.BLOCKED, result.status());
        assertEquals(List.of("description_style_a"), result.flags().get(AutoQcEvaluator.FLAG_MISSING_REQUIRED));
    }

    @Test
    void testEvaluate_goodConditionWithoutFlaws() {
        product.condition = "Good";

        QcEvaluationType result = evaluator.evaluate(product);

        assertEquals(90, result.confidence());
        assertEquals(true, result.flags().get(AutoQcEvaluator.FLAG_DAMAGE_UNDESCRIBED));

        product.flaws = "small stain on hem";
        assertEquals(QcStatus.READY, evaluator.evaluate(product).status());
    }

    @Test
    void testEvaluate_priceBands() {
        product.price = null;
        QcEvaluationType missing = evaluator.evaluate(product);
        assertEquals(80, missing.confidence());
        assertEquals(true, missing.flags().get(AutoQcEvaluator.FLAG_MISSING_PRICE));

        product.price = new BigDecimal("1500");
        QcEvaluationType outOfBand = evaluator.evaluate(product);
        assertEquals(95, outOfBand.confidence());
        assertEquals(true, outOfBand.flags().get(AutoQcEvaluator.FLAG_PRICE_OUT_OF_BAND));
    }

    @Test
    void testEvaluate_lowScoreBlocks() {
        product.sizeLabel = null;
        product.pitToPit = null;
        product.brand = null;
        product.price = null;

        QcEvaluationType result = evaluator.evaluate(product);

        assertEquals(40, result.confidence());
        assertEquals(QcStatus.BLOCKED, result.status());
    }

    @Test
    void testEvaluate_confidenceNeverNegative() {
        Product empty = new Product();

        QcEvaluationType result = evaluator.evaluate(empty);

        assertEquals(0, result.confidence());
        assertEquals(QcStatus.BLOCKED, result.status());
    }
}
