package com.linguabot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Korean-specific entry metadata.
 *
 * @param romanization Revised Romanization of the surface form (e.g. "annyeong").
 * @param honorific    Whether the form belongs to the polite/honorific register.
 * @param hanja        The Sino-Korean characters for the word, if any.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KoreanDetails(String romanization, boolean honorific, String hanja) implements LanguageDetails {

    @Override
    @JsonIgnore
    public Language language() {
        return Language.KOREAN;
    }

    @Override
    @JsonIgnore
    public List<String> variantForms() {
        List<String> forms = new ArrayList<>();
        if (romanization != null && !romanization.isBlank()) {
            forms.add(romanization);
        }
        if (hanja != null && !hanja.isBlank()) {
            forms.add(hanja);
        }
        return forms;
    }

    @Override
    @JsonIgnore
    public String pronunciation() {
        return romanization;
    }
}
