package com.linguabot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Japanese-specific entry metadata.
 *
 * @param reading    Kana reading of the surface form (e.g. "たべる" for "食べる").
 * @param romaji     Hepburn romanization of the reading.
 * @param politeForm The masu/desu form, if the entry is a predicate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JapaneseDetails(String reading, String romaji, String politeForm) implements LanguageDetails {

    @Override
    @JsonIgnore
    public Language language() {
        return Language.JAPANESE;
    }

    @Override
    @JsonIgnore
    public List<String> variantForms() {
        List<String> forms = new ArrayList<>();
        if (reading != null && !reading.isBlank()) {
            forms.add(reading);
        }
        if (romaji != null && !romaji.isBlank()) {
            forms.add(romaji);
        }
        if (politeForm != null && !politeForm.isBlank()) {
            forms.add(politeForm);
        }
        return forms;
    }

    @Override
    @JsonIgnore
    public String pronunciation() {
        if (reading == null || reading.isBlank()) {
            return romaji;
        }
        return romaji == null || romaji.isBlank() ? reading : reading + " / " + romaji;
    }
}
