package com.linguabot.model;

public enum PromptVariant {

    /** Show the target-language form, ask for its meaning. */
    MEANING,

    /** Show the meaning, ask for the target-language form. */
    REVERSE
}
