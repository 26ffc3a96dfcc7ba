package com.tx.insights.scoring;

/**
 * Score by effort bucket of an opportunity.
 */
public enum OpportunityCategory {
    QUICK_WIN("quick-win",
        "High-impact opportunity with minimal effort required. Implement immediately for quick results.",
        "Prioritize immediately. Expected ROI within 2-4 weeks."),
    STRATEGIC("strategic",
        "Major opportunity requiring significant investment. Plan resources for maximum impact.",
        "Create detailed project plan. Allocate dedicated resources."),
    INCREMENTAL("incremental",
        "Moderate improvement opportunity. Good for continuous optimization.",
        "Include in next sprint. Low risk with steady returns."),
    LONG_TERM("long-term",
        "Moderate opportunity requiring substantial effort. Schedule for future quarters.",
        "Add to roadmap for next quarter. Requires planning phase."),
    MAINTAIN("maintain",
        "Currently performing well. Monitor and maintain current performance.",
        "No immediate action needed. Set up monitoring alerts.");

    private final String label;
    private final String description;
    private final String suggestedAction;

    OpportunityCategory(String label, String description, String suggestedAction) {
        this.label = label;
        this.description = description;
        this.suggestedAction = suggestedAction;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public String getSuggestedAction() {
        return suggestedAction;
    }

    @Override
    public String toString() {
        return label;
    }
}
