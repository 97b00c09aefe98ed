package com.phillippitts.affectsignal.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extra upstream label synonyms, folded into the built-in synonym table.
 *
 * <p>Keys are upstream labels (matched case-insensitively), values are the category they map to:
 * <pre>
 * affect.normalizer.synonyms.calm=Calmness
 * affect.normalizer.synonyms.determination=Confidence
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "affect.normalizer")
public class NormalizerProperties {

    private Map<String, String> synonyms = new LinkedHashMap<>();

    public Map<String, String> getSynonyms() {
        return synonyms;
    }

    public void setSynonyms(Map<String, String> synonyms) {
        this.synonyms = synonyms == null ? new LinkedHashMap<>() : synonyms;
    }
}
