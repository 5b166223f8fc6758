package com.linguabot.shell;

import com.linguabot.model.Language;
import lombok.Getter;
import lombok.Setter;
import org.springframework.stereotype.Component;

/**
 * Who is typing in this shell: the active learner, the language they practise and their open test.
 */
@Getter
@Setter
@Component
public class LearnerSession {

    private static final String DEFAULT_USER = "guest";

    private String userId = DEFAULT_USER;
    private Language language = Language.KOREAN;

    /**
     * The test opened with {@code test}, used by {@code answer} and {@code finish}; {@code null} when none.
     */
    private String activeTestId;
}
