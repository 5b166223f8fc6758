package com.linguabot.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Language-specific metadata attached to a {@link VocabularyEntry}.
 * <p>
 * The concrete type is selected by the {@code "type"} property in the corpus JSON
 * ({@code "korean"} or {@code "japanese"}) and must agree with the entry's {@link Language}.
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = KoreanDetails.class, name = "korean"),
        @JsonSubTypes.Type(value = JapaneseDetails.class, name = "japanese")
})
public interface LanguageDetails {

    /**
     * The language this metadata describes.
     */
    Language language();

    /**
     * Alternative spellings under which the entry should be found, e.g. romanization or kana reading.
     */
    List<String> variantForms();

    /**
     * A pronunciation aid shown to the learner, or {@code null} when none is known.
     */
    String pronunciation();
}
