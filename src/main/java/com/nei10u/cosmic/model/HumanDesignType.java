package com.nei10u.cosmic.model;

public enum HumanDesignType {
    GENERATOR("Generator", "Wait to Respond",
            "You are the life force of the world. Your sacral response guides you to what truly lights you up. "
                    + "Follow it, and your energy becomes unstoppable."),
    MANIFESTING_GENERATOR("Manifesting Generator", "Wait to Respond, Then Inform",
            "You carry both the power to initiate and the sustained energy to build. You are meant to explore many paths, "
                    + "and your efficiency comes from following your response."),
    PROJECTOR("Projector", "Wait for the Invitation",
            "You see what others cannot. Your gift is guiding and directing energy, but only when recognized and invited. "
                    + "Your wisdom is your superpower."),
    MANIFESTOR("Manifestor", "Inform Before Acting",
            "You are here to initiate. Your energy creates impact and opens doors others cannot. The world moves when you do."),
    REFLECTOR("Reflector", "Wait a Lunar Cycle",
            "You are a mirror for the world. Your openness allows you to sample all of life's possibilities. "
                    + "The lunar cycle is your compass.");

    private final String displayName;
    private final String strategy;
    private final String description;

    HumanDesignType(String displayName, String strategy, String description) {
        this.displayName = displayName;
        this.strategy = strategy;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getStrategy() {
        return strategy;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
