package de.bsommerfeld.triage.engine;

import de.bsommerfeld.triage.core.config.CategoryConfig;
import de.bsommerfeld.triage.core.config.TriageConfig;
import de.bsommerfeld.triage.core.config.TriageConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The fixed, ordered category taxonomy of one engine instance.
 * Compilation validates the configuration and fails fast; a rule set that
 * exists is always usable.
 */
public final class CategoryRuleSet {

    private final Map<String, CategoryRule> rules;
    private final List<CategoryRule> ordered;
    private final CategoryRule fallback;

    private CategoryRuleSet(Map<String, CategoryRule> rules, CategoryRule fallback) {
        this.rules = Collections.unmodifiableMap(rules);
        this.ordered = List.copyOf(rules.values());
        this.fallback = fallback;
    }

    /**
     * @throws TriageConfigurationException if the category list is empty,
     *                                      names are blank or duplicated, the
     *                                      fallback is missing or boosted, a
     *                                      boost lies outside [0, 1], a
     *                                      keyword normalizes to nothing or a
     *                                      pattern does not compile
     */
    public static CategoryRuleSet compile(TriageConfig config) {
        List<CategoryConfig> categories = config.getCategories();
        if (categories == null || categories.isEmpty())
            throw new TriageConfigurationException("At least one category must be configured");

        Map<String, CategoryRule> compiled = new LinkedHashMap<>();
        for (CategoryConfig category : categories) {
            CategoryRule rule = compileRule(category);
            if (compiled.putIfAbsent(rule.name(), rule) != null)
                throw new TriageConfigurationException("Duplicate category: " + rule.name());
        }

        String fallbackName = config.getFallbackCategory();
        CategoryRule fallback = compiled.get(fallbackName);
        if (fallback == null)
            throw new TriageConfigurationException("Fallback category '" + fallbackName + "' is not configured");
        if (fallback.priorityBoost() != 0.0)
            throw new TriageConfigurationException("Fallback category '" + fallbackName + "' must have zero boost");

        return new CategoryRuleSet(compiled, fallback);
    }

    private static CategoryRule compileRule(CategoryConfig category) {
        String name = category.getName();
        if (name == null || name.isBlank())
            throw new TriageConfigurationException("Category name must not be blank");

        double boost = category.getPriorityBoost();
        if (boost < 0.0 || boost > 1.0)
            throw new TriageConfigurationException("Priority boost of '" + name + "' must lie in [0, 1]: " + boost);

        List<String> keywords = new ArrayList<>();
        for (String keyword : nullSafe(category.getKeywords())) {
            String normalized = TextNormalizer.normalize(keyword);
            if (normalized.isEmpty())
                throw new TriageConfigurationException(
                        "Keyword '" + keyword + "' of '" + name + "' is empty after normalization");
            keywords.add(normalized);
        }

        List<Pattern> patterns = new ArrayList<>();
        for (String pattern : nullSafe(category.getPatterns())) {
            try {
                patterns.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                throw new TriageConfigurationException("Invalid pattern in '" + name + "': " + pattern, e);
            }
        }

        return new CategoryRule(name, keywords, patterns, category.getColor(), boost);
    }

    private static List<String> nullSafe(List<String> list) {
        return list != null ? list : List.of();
    }

    /** Rules in configuration order. */
    public List<CategoryRule> rules() {
        return ordered;
    }

    public List<String> names() {
        return List.copyOf(rules.keySet());
    }

    public CategoryRule fallback() {
        return fallback;
    }

    public Optional<CategoryRule> find(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    /** Boost of the named category, 0 for unknown names. */
    public double boostOf(String name) {
        CategoryRule rule = rules.get(name);
        return rule != null ? rule.priorityBoost() : 0.0;
    }

    /** Color of the named category, the fallback's color for unknown names. */
    public String colorOf(String name) {
        CategoryRule rule = rules.get(name);
        return rule != null ? rule.color() : fallback.color();
    }
}
