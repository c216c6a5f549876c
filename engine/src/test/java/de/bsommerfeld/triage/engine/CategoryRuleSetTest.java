package de.bsommerfeld.triage.engine;

import de.bsommerfeld.triage.core.config.CategoryConfig;
import de.bsommerfeld.triage.core.config.TriageConfig;
import de.bsommerfeld.triage.core.config.TriageConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CategoryRuleSetTest {

    @Test
    void compile_shouldKeepConfiguredOrder() {
        CategoryRuleSet rules = CategoryRuleSet.compile(new TriageConfig());

        assertEquals(List.of("bug_report", "feature_request", "question", "urgent", "deployment",
                "access_request", "general"), rules.names());
        assertEquals("general", rules.fallback().name());
    }

    @Test
    void compile_shouldNormalizeKeywords() {
        CategoryRuleSet rules = CategoryRuleSet.compile(new TriageConfig());

        CategoryRule deployment = rules.find("deployment").orElseThrow();
        assertTrue(deployment.keywords().contains("ci cd"));
    }

    @Test
    void boostAndColor_shouldResolveUnknownNames() {
        CategoryRuleSet rules = CategoryRuleSet.compile(new TriageConfig());

        assertEquals(0.8, rules.boostOf("urgent"), 1e-9);
        assertEquals(0.0, rules.boostOf("does_not_exist"), 1e-9);
        assertEquals("#FF4757", rules.colorOf("urgent"));
        assertEquals("#66BB6A", rules.colorOf("does_not_exist"));
    }

    @Test
    void compile_shouldRejectEmptyCategoryList() {
        var config = new TriageConfig();
        config.setCategories(List.of());

        assertThrows(TriageConfigurationException.class, () -> CategoryRuleSet.compile(config));
    }

    @Test
    void compile_shouldRejectDuplicateNames() {
        var config = withExtra(category("general", 0.0));

        var e = assertThrows(TriageConfigurationException.class, () -> CategoryRuleSet.compile(config));
        assertTrue(e.getMessage().contains("Duplicate"));
    }

    @Test
    void compile_shouldRejectBoostOutsideUnitRange() {
        var config = withExtra(category("loud", 1.5));

        assertThrows(TriageConfigurationException.class, () -> CategoryRuleSet.compile(config));
    }

    @Test
    void compile_shouldRejectKeywordThatNormalizesToNothing() {
        var config = withExtra(new CategoryConfig("smiley", List.of(":)"), List.of(), "#000000", 0.1));

        assertThrows(TriageConfigurationException.class, () -> CategoryRuleSet.compile(config));
    }

    @Test
    void compile_shouldRejectInvalidPattern() {
        var config = withExtra(new CategoryConfig("broken", List.of("x"), List.of("(["), "#000000", 0.1));

        var e = assertThrows(TriageConfigurationException.class, () -> CategoryRuleSet.compile(config));
        assertNotNull(e.getCause());
    }

    @Test
    void compile_shouldRequireFallbackCategory() {
        var config = new TriageConfig();
        config.setCategories(List.of(category("only", 0.5)));

        assertThrows(TriageConfigurationException.class, () -> CategoryRuleSet.compile(config));
    }

    @Test
    void compile_shouldRejectBoostedFallback() {
        var config = new TriageConfig();
        config.setCategories(List.of(category("general", 0.1)));

        assertThrows(TriageConfigurationException.class, () -> CategoryRuleSet.compile(config));
    }

    private static TriageConfig withExtra(CategoryConfig extra) {
        var config = new TriageConfig();
        List<CategoryConfig> categories = new ArrayList<>(config.getCategories());
        categories.add(extra);
        config.setCategories(categories);
        return config;
    }

    private static CategoryConfig category(String name, double boost) {
        return new CategoryConfig(name, List.of(name), List.of(), "#123456", boost);
    }
}
