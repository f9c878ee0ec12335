package com.deepansh.salesagent.tool.impl;

import com.deepansh.salesagent.store.Product;
import com.deepansh.salesagent.store.ProductStore;
import com.deepansh.salesagent.tool.SalesTool;
import com.deepansh.salesagent.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based recommendations: category match, optional price band, optional
 * gender filter, cheapest first, at most 10.
 *
 * Category lookup tries an exact (case-insensitive) match first and falls back
 * to "contains" — that is how a generic "Fashion" request reaches both the
 * women's and men's categories before the gender filter narrows it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RecommendProductsTool implements SalesTool {

    static final int LIMIT = 10;

    private final ProductStore productStore;

    @Override
    public String getName() {
        return "recommend_products";
    }

    @Override
    public String getDescription() {
        return "Recommend products in a category; price_range like '500-1500' or 'any'; gender 'female' or 'male'.";
    }

    @Override
    public Set<String> getRequiredParams() {
        return Set.of("category");
    }

    @Override
    public Set<String> getAllowedParams() {
        return Set.of("category", "price_range", "gender");
    }

    @Override
    public Object execute(Map<String, Object> params) {
        String category = ToolArguments.requireString(params, "category");
        String gender = ToolArguments.string(params, "gender");
        PriceRange range = PriceRange.parse(ToolArguments.string(params, "price_range"));

        // Over-fetch when a gender filter will drop rows afterwards
        int fetch = gender == null ? LIMIT : LIMIT * 4;
        List<Product> products = productStore.findByCategory(category, true, range.min(), range.max(), fetch);
        if (products.isEmpty()) {
            products = productStore.findByCategory(category, false, range.min(), range.max(), fetch);
        }

        List<Map<String, Object>> result = products.stream()
                .filter(p -> matchesGender(p, gender))
                .limit(LIMIT)
                .map(Product::toMap)
                .toList();

        log.debug("Recommended {} products [category={}, gender={}, range={}]",
                result.size(), category, gender, range);
        return result;
    }

    static boolean matchesGender(Product p, String gender) {
        if (gender == null) return true;
        String text = (p.category() + " " + p.name()).toLowerCase(Locale.ROOT).replace("'", "");
        boolean female = text.matches(".*\\b(women|womens|female|ladies)\\b.*");
        boolean male = text.matches(".*\\b(men|mens|male)\\b.*");
        return switch (gender.toLowerCase(Locale.ROOT)) {
            case "female", "women", "woman" -> female;
            case "male", "men", "man" -> male && !female;
            default -> true;
        };
    }

    /** "min-max" band; "any", blank or malformed means unbounded. */
    record PriceRange(Double min, Double max) {

        static PriceRange parse(String raw) {
            if (raw == null || raw.equalsIgnoreCase("any") || !raw.contains("-")) {
                return new PriceRange(null, null);
            }
            String[] parts = raw.split("-", 2);
            try {
                return new PriceRange(Double.parseDouble(parts[0].strip()), Double.parseDouble(parts[1].strip()));
            } catch (NumberFormatException e) {
                return new PriceRange(null, null);
            }
        }
    }
}
