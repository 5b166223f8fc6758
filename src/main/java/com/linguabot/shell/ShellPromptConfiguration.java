package com.linguabot.shell;

import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.shell.jline.PromptProvider;

/**
 * Customizes the Spring Shell prompt.
 * <p>
 * The prompt is re-evaluated before every command, so it always shows the active learner and
 * language, e.g. {@code linguabot[guest|ko] > }.
 * </p>
 */
@Configuration(proxyBeanMethods = false)
public class ShellPromptConfiguration {

    private static final String PROMPT_NAME = "linguabot";

    @Bean
    public PromptProvider linguabotPrompt(LearnerSession session) {
        return () -> promptFor(session);
    }

    static AttributedString promptFor(LearnerSession session) {
        return new AttributedStringBuilder()
                .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.CYAN))
                .append(PROMPT_NAME)
                .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW))
                .append("[" + session.getUserId() + "|" + session.getLanguage().code() + "]")
                .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.CYAN))
                .append(" > ")
                .toAttributedString();
    }
}
