/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.autopilot.api.types.QcEvaluationType;
import villagecompute.autopilot.data.models.Condition;
import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.QcStatus;

/**
 * Scores a generated product for the QC dashboard.
 *
 * <p>
 * Confidence starts at 100 and loses points per finding; each finding (except missing required fields, which are
 * listed) adds a boolean flag. A product missing any required field is always BLOCKED. Otherwise it is READY only
 * with a high score and no flags at all.
 */
@ApplicationScoped
public class AutoQcEvaluator {

    static final int READY_THRESHOLD = 85;
    static final int REVIEW_THRESHOLD = 60;

    static final BigDecimal MIN_PRICE = BigDecimal.valueOf(5);
    static final BigDecimal MAX_PRICE = BigDecimal.valueOf(1000);

    public static final String FLAG_MISSING_REQUIRED = "missing_required_fields";
    public static final String FLAG_MISSING_SIZE = "missing_size";
    public static final String FLAG_MISSING_MEASUREMENTS = "missing_measurements";
    public static final String FLAG_ERA_UNCERTAIN = "era_uncertain";
    public static final String FLAG_BRAND_UNCLEAR = "brand_unclear";
    public static final String FLAG_DAMAGE_UNDESCRIBED = "damage_present_not_described";
    public static final String FLAG_MISSING_PRICE = "missing_price";
    public static final String FLAG_PRICE_OUT_OF_BAND = "price_out_of_band";

    private static final Set<String> CONDITIONS_NEEDING_FLAWS = Set.of(Condition.GOOD.label(),
            Condition.FAIR.label());

    public QcEvaluationType evaluate(Product product) {
        Map<String, Object> flags = new LinkedHashMap<>();
        int confidence = 100;

        List<String> missingRequired = new ArrayList<>();
        checkRequired(missingRequired, "title", product.title);
        checkRequired(missingRequired, "description_style_a", product.descriptionStyleA);
        checkRequired(missingRequired, "garment_type", product.garmentType);
        checkRequired(missingRequired, "condition", product.condition);
        confidence -= 15 * missingRequired.size();

        if (!FieldMergeEngine.hasValue(product.sizeLabel) && !FieldMergeEngine.hasValue(product.sizeRecommended)) {
            flags.put(FLAG_MISSING_SIZE, true);
            confidence -= 20;
        }
        if (!FieldMergeEngine.hasValue(product.pitToPit)) {
            flags.put(FLAG_MISSING_MEASUREMENTS, true);
            confidence -= 10;
        }
        if (!FieldMergeEngine.hasValue(product.era)) {
            flags.put(FLAG_ERA_UNCERTAIN, true);
            confidence -= 5;
        }
        if (!FieldMergeEngine.hasValue(product.brand)) {
            flags.put(FLAG_BRAND_UNCLEAR, true);
            confidence -= 10;
        }
        if (product.condition != null && CONDITIONS_NEEDING_FLAWS.contains(product.condition)
                && !FieldMergeEngine.hasValue(product.flaws)) {
            flags.put(FLAG_DAMAGE_UNDESCRIBED, true);
            confidence -= 10;
        }

        BigDecimal price = product.price;
        if (price == null || price.signum() <= 0) {
            flags.put(FLAG_MISSING_PRICE, true);
            confidence -= 20;
        } else if (price.compareTo(MIN_PRICE) < 0 || price.compareTo(MAX_PRICE) > 0) {
            flags.put(FLAG_PRICE_OUT_OF_BAND, true);
            confidence -= 5;
        }

        confidence = Math.max(0, Math.min(100, confidence));

        QcStatus status;
        if (!missingRequired.isEmpty()) {
            status = QcStatus.BLOCKED;
            flags.put(FLAG_MISSING_REQUIRED, List.copyOf(missingRequired));
        } else if (confidence >= READY_THRESHOLD && flags.isEmpty()) {
            status = QcStatus.READY;
        } else if (confidence >= REVIEW_THRESHOLD) {
            status = QcStatus.NEEDS_REVIEW;
        } else {
            status = QcStatus.BLOCKED;
        }
        return new QcEvaluationType(confidence, status, flags);
    }

    private static void checkRequired(List<String> missing, String column, String value) {
        if (!FieldMergeEngine.hasValue(value)) {
            missing.add(column);
        }
    }
}
