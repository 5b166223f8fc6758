package com.linguabot;

import com.linguabot.model.Language;
import com.linguabot.service.api.TutorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        // Keep learner state in memory and don't write a log file
        "app.storage.directory=",
        "logging.file.name=",

        // IMPORTANT: Disable interactive mode so tests don't wait for user input
        "spring.shell.interactive.enabled=false",
        "spring.shell.script.enabled=false"
})
class LinguabotApplicationTests {

    @Autowired
    private TutorService tutorService;

    @Test
    void contextLoads() {
        // The bundled corpus is loaded at startup
        assertThat(tutorService.statistics().entriesByLanguage())
                .containsKeys(Language.KOREAN, Language.JAPANESE);
        assertThat(tutorService.handleMessage("context-test", Language.KOREAN, "안녕하세요").matched()).isTrue();
    }
}
