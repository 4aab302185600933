/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.autopilot.api.types.GeneratedListingType;
import villagecompute.autopilot.api.types.PricingAttributesType;
import villagecompute.autopilot.api.types.SkuResultType;
import villagecompute.autopilot.data.models.Condition;
import villagecompute.autopilot.data.models.Department;
import villagecompute.autopilot.data.models.Era;
import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.ProductField;

/**
 * Turns an untrusted generated payload into validated field updates for one product.
 *
 * <p>
 * <b>Merge rules per field:</b>
 * <ul>
 * <li><b>Direct overwrite</b> - text and tag fields; any value that is not null, blank or the literal "null" replaces
 * the stored value (regeneration is a force operation)</li>
 * <li><b>Validated overwrite</b> - {@code era} and {@code department} are normalized against their allowed sets, with a
 * keyword fallback; unrecognized values leave the field untouched</li>
 * <li><b>Composite parse</b> - {@code condition} of the form "Good (small stain)" becomes condition + flaws</li>
 * <li><b>Derived</b> - {@code price} is only filled when missing or non-positive, from the pricing policy fed with the
 * merged attributes</li>
 * <li><b>Identifier</b> - once a garment type is known the SKU is generated; a failure annotates {@code notes}
 * instead of failing the product</li>
 * <li><b>Tag union</b> - default tags and AI Shopify tags are unioned, never overwritten</li>
 * </ul>
 *
 * <p>
 * The engine never writes to the store. It returns the updates and leaves persistence to the caller.
 */
@ApplicationScoped
public class FieldMergeEngine {

    private static final Logger LOG = Logger.getLogger(FieldMergeEngine.class);

    static final String SKU_ANNOTATION_PREFIX = "[SKU_NEEDS_ATTENTION";
    static final int MAX_TITLE_LENGTH = 80;

    private static final Pattern CONDITION_WITH_DETAIL = Pattern
            .compile("^\\s*(Excellent|Very good|Good|Fair)\\s*\\((.*)\\)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE_PUNCTUATION = Pattern.compile("[,\\-–—:;]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SKU_ANNOTATION = Pattern.compile("\\s*\\[SKU_NEEDS_ATTENTION[^\\]]*\\]");

    private static final Pattern WOMEN_WORDS = Pattern.compile("\\b(women'?s?|womens|ladies|lady|female)\\b");
    private static final Pattern MEN_WORDS = Pattern.compile("\\b(men'?s?|mens|male|gents?)\\b");
    private static final Pattern KIDS_WORDS = Pattern.compile("\\b(kids?|child(ren)?|boys?|girls?|toddler)\\b");

    private static final Map<String, Era> ERA_ALIASES = Map.of("1980s", Era.EIGHTIES, "80's", Era.EIGHTIES,
            "eighties", Era.EIGHTIES, "1990s", Era.NINETIES, "90's", Era.NINETIES, "nineties", Era.NINETIES, "2000s",
            Era.Y2K, "00s", Era.Y2K, "contemporary", Era.MODERN);

    @Inject
    PricingPolicy pricingPolicy;

    @Inject
    IdentifierGenerator identifierGenerator;

    @Inject
    DefaultTagRules defaultTagRules;

    /**
     * Computes the field updates for {@code existing} from {@code payload}.
     *
     * @param existing
     *            the product as currently stored
     * @param payload
     *            generated fields, untrusted
     * @return updates to apply; fields not present are left untouched
     */
    public Map<ProductField, Object> merge(Product existing, GeneratedListingType payload) {
        Map<ProductField, Object> updates = new EnumMap<>(ProductField.class);

        String title = cleanTitle(payload.title());
        if (hasValue(title)) {
            updates.put(ProductField.TITLE, title);
        }
        overwrite(updates, ProductField.DESCRIPTION, payload.description());
        overwrite(updates, ProductField.DESCRIPTION_STYLE_A, payload.descriptionStyleA());
        overwrite(updates, ProductField.DESCRIPTION_STYLE_B, payload.descriptionStyleB());
        overwrite(updates, ProductField.ETSY_TAGS, payload.etsyTags());
        overwrite(updates, ProductField.COLLECTIONS_TAGS, payload.collectionsTags());
        overwrite(updates, ProductField.GARMENT_TYPE, payload.garmentType());
        overwrite(updates, ProductField.BRAND, payload.brand());
        overwrite(updates, ProductField.COLOUR_MAIN, payload.colourMain());
        overwrite(updates, ProductField.COLOUR_SECONDARY, payload.colourSecondary());
        overwrite(updates, ProductField.PATTERN, payload.pattern());
        overwrite(updates, ProductField.SIZE_LABEL, payload.sizeLabel());
        overwrite(updates, ProductField.SIZE_RECOMMENDED, payload.sizeRecommended());
        overwrite(updates, ProductField.FIT, payload.fit());
        overwrite(updates, ProductField.MATERIAL, payload.material());
        overwrite(updates, ProductField.MADE_IN, payload.madeIn());

        normalizeEra(payload.era()).ifPresent(era -> updates.put(ProductField.ERA, era));
        normalizeDepartment(payload.department()).ifPresent(dept -> updates.put(ProductField.DEPARTMENT, dept));
        sanitizeCondition(payload.condition()).ifPresent(parsed -> {
            updates.put(ProductField.CONDITION, parsed.condition());
            if (parsed.flaws() != null) {
                updates.put(ProductField.FLAWS, parsed.flaws());
            }
        });

        mergeShopifyTags(existing, payload, updates);
        derivePrice(existing, updates);
        assignIdentifier(existing, updates);

        return updates;
    }

    /**
     * Returns true for values that should overwrite a stored field: not null, not blank, not the literal "null".
     */
    public static boolean hasValue(String value) {
        return value != null && !value.isBlank() && !"null".equalsIgnoreCase(value.trim());
    }

    /**
     * Normalizes an era to one of 80s, 90s, Y2K or Modern.
     *
     * @param raw
     *            generated era text
     * @return the allowed label, or empty when nothing matches
     */
    public Optional<String> normalizeEra(String raw) {
        if (!hasValue(raw)) {
            return Optional.empty();
        }
        String folded = raw.trim().toLowerCase(Locale.ROOT);
        Optional<Era> exact = Era.fromLabel(capitalize(folded));
        if (exact.isPresent()) {
            return exact.map(Era::label);
        }
        Era alias = ERA_ALIASES.get(folded);
        if (alias != null) {
            return Optional.of(alias.label());
        }
        if (folded.contains("y2k") || folded.contains("2000")) {
            return Optional.of(Era.Y2K.label());
        }
        if (folded.contains("80")) {
            return Optional.of(Era.EIGHTIES.label());
        }
        if (folded.contains("90")) {
            return Optional.of(Era.NINETIES.label());
        }
        if (folded.contains("modern") || folded.contains("contemporary")) {
            return Optional.of(Era.MODERN.label());
        }
        return Optional.empty();
    }

    /**
     * Normalizes a department to one of Women, Men, Unisex or Kids.
     *
     * <p>
     * Falls back to keyword matching when the value is not an exact label, e.g. "mens jacket" maps to Men and "womens
     * blouse" to Women. Text naming both men and women maps to Unisex.
     *
     * @param raw
     *            generated department text
     * @return the allowed label, or empty when nothing matches
     */
    public Optional<String> normalizeDepartment(String raw) {
        if (!hasValue(raw)) {
            return Optional.empty();
        }
        String folded = raw.trim().toLowerCase(Locale.ROOT);
        Optional<Department> exact = Department.fromLabel(capitalize(folded));
        if (exact.isPresent()) {
            return exact.map(Department::label);
        }
        boolean women = WOMEN_WORDS.matcher(folded).find();
        boolean men = MEN_WORDS.matcher(folded).find();
        if (women && men) {
            return Optional.of(Department.UNISEX.label());
        }
        if (women) {
            return Optional.of(Department.WOMEN.label());
        }
        if (men) {
            return Optional.of(Department.MEN.label());
        }
        if (KIDS_WORDS.matcher(folded).find()) {
            return Optional.of(Department.KIDS.label());
        }
        if (folded.contains("unisex")) {
            return Optional.of(Department.UNISEX.label());
        }
        return Optional.empty();
    }

    /**
     * Splits condition text into a normalized condition label and flaw detail.
     *
     * <p>
     * "Very good (minor bobbling)" yields condition "Very good" and flaws "minor bobbling". Without a parenthetical the
     * text is searched for a condition label, longest label first, and flaws are left unset.
     *
     * @param raw
     *            generated condition text
     * @return parsed condition, or empty when no label is recognized
     */
    public Optional<ParsedCondition> sanitizeCondition(String raw) {
        if (!hasValue(raw)) {
            return Optional.empty();
        }
        Matcher matcher = CONDITION_WITH_DETAIL.matcher(raw);
        if (matcher.matches()) {
            Optional<Condition> condition = Condition.fromLabel(matcher.group(1));
            if (condition.isPresent()) {
                String detail = matcher.group(2).trim();
                return Optional.of(new ParsedCondition(condition.get().label(), hasValue(detail) ? detail : null));
            }
        }
        String folded = raw.toLowerCase(Locale.ROOT);
        for (Condition condition : Condition.values()) {
            if (folded.contains(condition.label().toLowerCase(Locale.ROOT))) {
                return Optional.of(new ParsedCondition(condition.label(), null));
            }
        }
        return Optional.empty();
    }

    /**
     * Strips title punctuation, collapses whitespace and caps the length at 80 characters.
     */
    public static String cleanTitle(String raw) {
        if (!hasValue(raw)) {
            return null;
        }
        String cleaned = WHITESPACE.matcher(TITLE_PUNCTUATION.matcher(raw).replaceAll(" ")).replaceAll(" ").trim();
        if (cleaned.length() > MAX_TITLE_LENGTH) {
            cleaned = cleaned.substring(0, MAX_TITLE_LENGTH).trim();
        }
        return cleaned;
    }

    /**
     * Unions tag lists, dropping blanks and case-insensitive duplicates. The first spelling of a tag wins.
     *
     * @param defaults
     *            default and category tags, placed first
     * @param generated
     *            comma-separated generated tags
     * @return comma-joined union, empty when both inputs are empty
     */
    public static String unionTags(List<String> defaults, String generated) {
        Map<String, String> union = new LinkedHashMap<>();
        List<String> all = new ArrayList<>(defaults == null ? List.of() : defaults);
        if (hasValue(generated)) {
            all.addAll(List.of(generated.split(",")));
        }
        for (String tag : all) {
            if (tag == null) {
                continue;
            }
            String trimmed = tag.trim();
            if (hasValue(trimmed)) {
                union.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
            }
        }
        return String.join(", ", union.values());
    }

    private void mergeShopifyTags(Product existing, GeneratedListingType payload, Map<ProductField, Object> updates) {
        List<String> defaults = defaultTagRules.tagsFor(merged(existing, updates, ProductField.GARMENT_TYPE),
                merged(existing, updates, ProductField.DEPARTMENT), merged(existing, updates, ProductField.TITLE),
                merged(existing, updates, ProductField.DESCRIPTION_STYLE_A),
                merged(existing, updates, ProductField.NOTES));
        String union = unionTags(defaults, payload.shopifyTags());
        if (!union.isEmpty()) {
            updates.put(ProductField.SHOPIFY_TAGS, union);
        }
    }

    private void derivePrice(Product existing, Map<ProductField, Object> updates) {
        if (existing.price != null && existing.price.signum() > 0) {
            return;
        }
        PricingAttributesType attributes = new PricingAttributesType(merged(existing, updates, ProductField.BRAND),
                merged(existing, updates, ProductField.MATERIAL), merged(existing, updates, ProductField.CONDITION),
                merged(existing, updates, ProductField.COLLECTIONS_TAGS), merged(existing, updates, ProductField.TITLE),
                merged(existing, updates, ProductField.ERA));
        BigDecimal suggested = pricingPolicy.suggestPrice(merged(existing, updates, ProductField.GARMENT_TYPE),
                attributes);
        if (suggested != null && suggested.signum() > 0) {
            updates.put(ProductField.PRICE, suggested);
        } else {
            LOG.debugf("No price suggestion for product %s", existing.id);
        }
    }

    private void assignIdentifier(Product existing, Map<ProductField, Object> updates) {
        String garmentType = merged(existing, updates, ProductField.GARMENT_TYPE);
        if (!hasValue(garmentType)) {
            return;
        }
        SkuResultType result = identifierGenerator.generate(garmentType,
                merged(existing, updates, ProductField.SIZE_RECOMMENDED), merged(existing, updates, ProductField.ERA),
                merged(existing, updates, ProductField.SIZE_LABEL));
        String notes = merged(existing, updates, ProductField.NOTES);

        if (result != null && result.isSuccess()) {
            updates.put(ProductField.SKU, result.sku());
            if (notes != null && notes.contains(SKU_ANNOTATION_PREFIX)) {
                updates.put(ProductField.NOTES, SKU_ANNOTATION.matcher(notes).replaceAll("").trim());
            }
            return;
        }

        String reason = result == null || result.error() == null ? "identifier unavailable" : result.error();
        LOG.infof("SKU generation failed for product %s: %s", existing.id, reason);
        if (notes != null && notes.contains(SKU_ANNOTATION_PREFIX)) {
            return;
        }
        String annotation = SKU_ANNOTATION_PREFIX + ": " + reason + "]";
        updates.put(ProductField.NOTES, hasValue(notes) ? notes.trim() + " " + annotation : annotation);
    }

    private static void overwrite(Map<ProductField, Object> updates, ProductField field, String value) {
        if (hasValue(value)) {
            updates.put(field, value.trim());
        }
    }

    private static String merged(Product existing, Map<ProductField, Object> updates, ProductField field) {
        Object value = updates.containsKey(field) ? updates.get(field) : field.read(existing);
        return value == null ? null : value.toString();
    }

    private static String capitalize(String folded) {
        if (folded.isEmpty()) {
            return folded;
        }
        return Character.toUpperCase(folded.charAt(0)) + folded.substring(1);
    }

    /**
     * Condition label with optional flaw detail.
     *
     * @param condition
     *            one of Excellent, Very good, Good, Fair
     * @param flaws
     *            detail from the parenthetical, or null
     */
    public record ParsedCondition(String condition, String flaws) {
    }
}
