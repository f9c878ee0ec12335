package com.deepansh.salesagent.core;

import com.deepansh.salesagent.plan.StepResult;
import com.deepansh.salesagent.store.ProductStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Works out which product an inventory check is about when the planner did
 * not (or could not) name it by id.
 *
 * Sources, in order of trust: products recommended earlier in this plan,
 * then the catalog. Nothing is ever guessed: when neither yields an id the
 * step fails with {@link #UNRESOLVABLE}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProductReferenceResolver {

    static final String UNRESOLVABLE =
            "Cannot infer product identifier for check_inventory; re-run recommend_products first";

    private static final String RECOMMEND_ACTION = "recommend_products";

    private final ProductStore productStore;

    record RecommendedItem(String productId, String name) {
    }

    /**
     * @param params mutable, already placeholder-resolved parameters; product_id is set in place
     */
    StepResolution resolveInventoryTarget(Map<String, Object> params, List<StepResult> previousResults) {
        String productId = text(params.get("product_id"));
        String sku = text(params.get("sku"));
        String productName = text(params.get("product_name"));
        List<RecommendedItem> recommended = recommendedItems(previousResults);

        if (productId == null && sku == null) {
            Optional<String> inferred = productName != null
                    ? matchRecommendedByName(productName, recommended).or(() -> lookupByName(productName))
                    : recommended.stream().findFirst().map(RecommendedItem::productId);

            if (inferred.isEmpty()) {
                log.info("Could not infer product for check_inventory [name={}, recommended={}]",
                        productName, recommended.size());
                return StepResolution.failed(params, UNRESOLVABLE);
            }
            params.put("product_id", inferred.get());
            log.debug("Inferred product_id={} for check_inventory [name={}]", inferred.get(), productName);
            return StepResolution.resolved(params);
        }

        if (productId != null && !recommended.isEmpty()
                && recommended.stream().noneMatch(r -> r.productId().equals(productId))) {
            String reconciled = reconcileBySlug(productId, recommended)
                    .orElse(recommended.get(0).productId());
            log.debug("Reconciled product_id {} → {}", productId, reconciled);
            params.put("product_id", reconciled);
        }
        return StepResolution.resolved(params);
    }

    /** Most recent successful recommendation step first, its items in result order. */
    static List<RecommendedItem> recommendedItems(List<StepResult> previousResults) {
        List<RecommendedItem> items = new ArrayList<>();
        for (int i = previousResults.size() - 1; i >= 0; i--) {
            StepResult r = previousResults.get(i);
            if (!r.success() || !RECOMMEND_ACTION.equals(r.step()) || !(r.result() instanceof List<?> list)) {
                continue;
            }
            for (Object item : list) {
                if (item instanceof Map<?, ?> m && text(m.get("product_id")) != null) {
                    items.add(new RecommendedItem(text(m.get("product_id")), text(m.get("name"))));
                }
            }
        }
        return items;
    }

    private static Optional<String> matchRecommendedByName(String name, List<RecommendedItem> recommended) {
        String wanted = name.toLowerCase(Locale.ROOT);
        Optional<String> exact = recommended.stream()
                .filter(r -> r.name() != null && r.name().toLowerCase(Locale.ROOT).equals(wanted))
                .map(RecommendedItem::productId)
                .findFirst();
        if (exact.isPresent()) return exact;

        return recommended.stream()
                .filter(r -> r.name() != null)
                .filter(r -> {
                    String have = r.name().toLowerCase(Locale.ROOT);
                    return have.contains(wanted) || wanted.contains(have);
                })
                .map(RecommendedItem::productId)
                .findFirst();
    }

    private Optional<String> lookupByName(String name) {
        return safeLookup(() -> productStore.findIdByExactName(name))
                .or(() -> safeLookup(() -> productStore.findIdByNameLike(name)));
    }

    /** Catalog lookups are best effort: a failing store means "no match", never a failed plan. */
    private Optional<String> safeLookup(Supplier<Optional<String>> lookup) {
        try {
            return lookup.get();
        } catch (DataAccessException e) {
            log.debug("Product lookup failed, treating as no match: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<String> reconcileBySlug(String productId, List<RecommendedItem> recommended) {
        String wanted = Slugs.of(productId);
        return recommended.stream()
                .filter(r -> Slugs.related(wanted, Slugs.of(r.productId()))
                        || Slugs.related(wanted, Slugs.of(r.name())))
                .map(RecommendedItem::productId)
                .findFirst();
    }

    private static String text(Object value) {
        if (value == null) return null;
        String s = value.toString().strip();
        return s.isEmpty() ? null : s;
    }
}
