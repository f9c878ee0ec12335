package com.deepansh.salesagent.plan;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword predicates over the raw user message.
 *
 * Matching is token-based (lowercased, split on anything that is not a letter
 * or digit) so "women's" never trips the male check via "men". A handful of
 * multi-word phrases are matched against the normalised message instead.
 * Deliberately coarse — these only decide whether the plan is missing an obvious step.
 */
public final class IntentHeuristics {

    public static final String CATEGORY_WOMEN = "Women's Fashion";
    public static final String CATEGORY_MEN = "Men's Fashion";
    public static final String CATEGORY_GENERIC = "Fashion";

    private static final Set<String> PRODUCT_WORDS = Set.of(
            "find", "show", "want", "looking", "browse", "search",
            "clothing", "clothes", "fashion", "apparel", "wear", "outfit", "outfits",
            "shirt", "shirts", "top", "tops", "blouse", "dress", "dresses",
            "pants", "trousers", "jeans", "shorts", "skirt", "jacket",
            "recommend", "recommendation", "recommendations", "suggest", "suggestions",
            "shop", "shopping", "buy", "product", "products", "items");
    private static final Set<String> PRODUCT_PHRASES = Set.of("all of them", "all of their");

    private static final Set<String> SIZE_WORDS = Set.of(
            "size", "sizes", "sizing", "stock", "available", "availability", "inventory");
    private static final Set<String> SIZE_PHRASES = Set.of("in stock");

    private static final Set<String> SMALL_TALK_WORDS = Set.of(
            "hi", "hello", "hey", "hiya", "howdy", "thanks", "thank", "thx", "cheers");
    private static final Set<String> SMALL_TALK_PHRASES = Set.of(
            "how are you", "hows your day", "whats up", "good morning", "good afternoon", "good evening");

    private static final Pattern EXPLICIT_ID = Pattern.compile("\\b(?:prod-\\w+|sku-\\w+)\\b", Pattern.CASE_INSENSITIVE);

    private static final Set<String> FEMALE_WORDS = Set.of(
            "female", "females", "women", "woman", "womens", "ladies", "lady", "girl", "girls");
    private static final Set<String> MALE_WORDS = Set.of(
            "male", "males", "men", "man", "mens", "gents", "guy", "guys", "boy", "boys");

    public enum Gender {
        FEMALE("female"), MALE("male");

        private final String value;

        Gender(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    private IntentHeuristics() {
    }

    public static boolean mentionsProducts(String message) {
        return matches(message, PRODUCT_WORDS, PRODUCT_PHRASES);
    }

    public static boolean mentionsSizeOrStock(String message) {
        return matches(message, SIZE_WORDS, SIZE_PHRASES);
    }

    /**
     * Greeting or chit-chat with no shopping signal in it. "hi, show me shirts"
     * is not small talk: the product words win.
     */
    public static boolean isSmallTalk(String message) {
        return matches(message, SMALL_TALK_WORDS, SMALL_TALK_PHRASES)
                && !mentionsExplicitIds(message)
                && !mentionsProducts(message)
                && !mentionsSizeOrStock(message);
    }

    /** PROD-xxx / SKU-xxx style identifiers typed by the user. */
    public static boolean mentionsExplicitIds(String message) {
        return message != null && EXPLICIT_ID.matcher(message).find();
    }

    /** Female is checked first: "men and women" resolves to female. */
    public static Optional<Gender> detectGender(String message) {
        Set<String> tokens = tokens(message);
        if (tokens.stream().anyMatch(FEMALE_WORDS::contains)) return Optional.of(Gender.FEMALE);
        if (tokens.stream().anyMatch(MALE_WORDS::contains)) return Optional.of(Gender.MALE);
        return Optional.empty();
    }

    public static String categoryFor(Optional<Gender> gender) {
        return gender.map(g -> g == Gender.FEMALE ? CATEGORY_WOMEN : CATEGORY_MEN)
                .orElse(CATEGORY_GENERIC);
    }

    public static Set<String> tokens(String message) {
        if (message == null || message.isBlank()) return Set.of();
        return Arrays.stream(normalise(message).split("[^a-z0-9]+"))
                .filter(t -> !t.isBlank())
                .collect(Collectors.toSet());
    }

    private static boolean matches(String message, Set<String> words, Set<String> phrases) {
        if (message == null || message.isBlank()) return false;
        if (tokens(message).stream().anyMatch(words::contains)) return true;
        String flat = " " + String.join(" ", normalise(message).split("[^a-z0-9]+")) + " ";
        return phrases.stream().anyMatch(p -> flat.contains(" " + p + " "));
    }

    private static String normalise(String message) {
        return message.toLowerCase(Locale.ROOT).replace("'", "").replace("’", "");
    }
}
