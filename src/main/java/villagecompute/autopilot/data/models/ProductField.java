/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.data.models;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Catalog of {@link Product} columns that this service reads and writes through partial updates.
 *
 * <p>
 * Partial updates are expressed as {@code Map<ProductField, Object>} and applied with {@link #applyTo}. The
 * {@link #UNDO_FIELDS} subset is what an undo snapshot captures before a generation pass mutates a product.
 */
public enum ProductField {

    TITLE("title", p -> p.title, (p, v) -> p.title = (String) v),
    DESCRIPTION("description", p -> p.description, (p, v) -> p.description = (String) v),
    DESCRIPTION_STYLE_A("description_style_a", p -> p.descriptionStyleA, (p, v) -> p.descriptionStyleA = (String) v),
    DESCRIPTION_STYLE_B("description_style_b", p -> p.descriptionStyleB, (p, v) -> p.descriptionStyleB = (String) v),
    SHOPIFY_TAGS("shopify_tags", p -> p.shopifyTags, (p, v) -> p.shopifyTags = (String) v),
    ETSY_TAGS("etsy_tags", p -> p.etsyTags, (p, v) -> p.etsyTags = (String) v),
    COLLECTIONS_TAGS("collections_tags", p -> p.collectionsTags, (p, v) -> p.collectionsTags = (String) v),
    ERA("era", p -> p.era, (p, v) -> p.era = (String) v),
    DEPARTMENT("department", p -> p.department, (p, v) -> p.department = (String) v),
    GARMENT_TYPE("garment_type", p -> p.garmentType, (p, v) -> p.garmentType = (String) v),
    BRAND("brand", p -> p.brand, (p, v) -> p.brand = (String) v),
    COLOUR_MAIN("colour_main", p -> p.colourMain, (p, v) -> p.colourMain = (String) v),
    COLOUR_SECONDARY("colour_secondary", p -> p.colourSecondary, (p, v) -> p.colourSecondary = (String) v),
    PATTERN("pattern", p -> p.pattern, (p, v) -> p.pattern = (String) v),
    SIZE_LABEL("size_label", p -> p.sizeLabel, (p, v) -> p.sizeLabel = (String) v),
    SIZE_RECOMMENDED("size_recommended", p -> p.sizeRecommended, (p, v) -> p.sizeRecommended = (String) v),
    FIT("fit", p -> p.fit, (p, v) -> p.fit = (String) v),
    MATERIAL("material", p -> p.material, (p, v) -> p.material = (String) v),
    CONDITION("condition", p -> p.condition, (p, v) -> p.condition = (String) v),
    FLAWS("flaws", p -> p.flaws, (p, v) -> p.flaws = (String) v),
    MADE_IN("made_in", p -> p.madeIn, (p, v) -> p.madeIn = (String) v),
    NOTES("notes", p -> p.notes, (p, v) -> p.notes = (String) v),
    PRICE("price", p -> p.price, (p, v) -> p.price = (BigDecimal) v),
    SKU("sku", p -> p.sku, (p, v) -> p.sku = (String) v),
    STATUS("status", p -> p.status, (p, v) -> p.status = (ProductStatus) v),
    GENERATED_AT("generated_at", p -> p.generatedAt, (p, v) -> p.generatedAt = (Instant) v),
    RUN_ID("run_id", p -> p.runId, (p, v) -> p.runId = (UUID) v),
    QC_STATUS("qc_status", p -> p.qcStatus, (p, v) -> p.qcStatus = (QcStatus) v),
    CONFIDENCE("confidence", p -> p.confidence, (p, v) -> p.confidence = (Integer) v),
    FLAGS("flags", p -> p.flags, ProductField::setFlags),
    BATCH_NUMBER("batch_number", p -> p.batchNumber, (p, v) -> p.batchNumber = (Integer) v);

    /**
     * Fields a generation pass may overwrite. Captured by undo snapshots and restored verbatim on undo.
     */
    public static final Set<ProductField> UNDO_FIELDS = Collections.unmodifiableSet(
            EnumSet.range(TITLE, GENERATED_AT));

    private final String column;
    private final Function<Product, Object> getter;
    private final BiConsumer<Product, Object> setter;

    ProductField(String column, Function<Product, Object> getter, BiConsumer<Product, Object> setter) {
        this.column = column;
        this.getter = getter;
        this.setter = setter;
    }

    /**
     * Returns the database column name, also used as the key in generation payloads and log output.
     */
    public String column() {
        return column;
    }

    public Object read(Product product) {
        return getter.apply(product);
    }

    public void write(Product product, Object value) {
        setter.accept(product, value);
    }

    /**
     * Copies the current values of {@code fields} out of {@code product}. Null values are kept so that a restore puts
     * an empty field back to empty.
     *
     * @param product
     *            the product to read
     * @param fields
     *            fields to capture
     * @return ordered field to value map
     */
    public static Map<ProductField, Object> capture(Product product, Set<ProductField> fields) {
        Map<ProductField, Object> values = new EnumMap<>(ProductField.class);
        for (ProductField field : fields) {
            values.put(field, field.read(product));
        }
        return values;
    }

    /**
     * Applies a partial update to an in-memory product.
     */
    public static void applyTo(Product product, Map<ProductField, Object> updates) {
        updates.forEach((field, value) -> field.write(product, value));
    }

    @SuppressWarnings("unchecked")
    private static void setFlags(Product product, Object value) {
        product.flags = (Map<String, Object>) value;
    }
}
