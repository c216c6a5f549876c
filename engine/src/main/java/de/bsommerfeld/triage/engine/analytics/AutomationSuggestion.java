package de.bsommerfeld.triage.engine.analytics;

/**
 * A proposal for automating a recurring kind of request.
 *
 * @param title       short headline
 * @param description what was observed and what to build
 * @param priority    {@code Critical}, {@code High} or {@code Medium}
 * @param impact      expected effect
 * @param effort      {@code Low}, {@code Medium} or {@code High}
 * @param category    category the suggestion addresses
 */
public record AutomationSuggestion(String title, String description, String priority, String impact,
        String effort, String category) {
}
