package de.bsommerfeld.triage.engine.analytics;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives automation suggestions from a {@link BatchSummary}. Each rule fires
 * independently once its category count reaches the trigger.
 */
public final class AutomationAdvisor {

    private AutomationAdvisor() {
    }

    public static List<AutomationSuggestion> suggest(BatchSummary summary) {
        List<AutomationSuggestion> suggestions = new ArrayList<>();
        if (summary.totalMessages() == 0)
            return suggestions;

        int access = summary.categoryCount("access_request");
        if (access >= 2) {
            suggestions.add(new AutomationSuggestion("Self-Service Access Portal",
                    "Found " + access + " access requests. Implement a self-service portal to reduce manual work.",
                    "High", "Reduces response time by 80%", "Medium", "access_request"));
        }

        int questions = summary.categoryCount("question");
        if (questions >= 3) {
            suggestions.add(new AutomationSuggestion("Automated FAQ Bot",
                    "Found " + questions + " questions. A chatbot could handle common queries automatically.",
                    "Medium", "Reduces support load by 60%", "High", "question"));
        }

        int bugs = summary.categoryCount("bug_report");
        if (bugs >= 2) {
            suggestions.add(new AutomationSuggestion("Automated Bug Triage",
                    "Found " + bugs + " bug reports. Implement automatic priority assignment and routing.",
                    "High", "Improves response time by 50%", "Medium", "bug_report"));
        }

        if (summary.categoryCount("deployment") >= 1) {
            suggestions.add(new AutomationSuggestion("Deployment Status Automation",
                    "Automate deployment notifications and status updates to reduce manual communication.",
                    "Medium", "Improves team awareness", "Low", "deployment"));
        }

        if (summary.criticalCount() > 0) {
            suggestions.add(new AutomationSuggestion("Urgent Issue Escalation",
                    "Found " + summary.criticalCount() + " urgent issues. Set up automatic escalation workflows.",
                    "Critical", "Prevents service downtime", "Low", "urgent"));
        }

        return suggestions;
    }
}
