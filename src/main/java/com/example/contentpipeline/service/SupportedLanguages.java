package com.example.contentpipeline.service;

import com.example.contentpipeline.config.PipelineProperties;
import com.example.contentpipeline.domain.model.TargetLanguage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The configured set of accepted target languages. {@link #require(String)} is the single
 * place where a language code from a work item is turned into a {@link TargetLanguage}.
 */
@Component
public class SupportedLanguages {

    private final Set<TargetLanguage> supported;

    @Autowired
    public SupportedLanguages(PipelineProperties properties) {
        this(properties.getSupportedLanguages());
    }

    public SupportedLanguages(List<String> codes) {
        EnumSet<TargetLanguage> languages = EnumSet.noneOf(TargetLanguage.class);
        for (String code : codes) {
            languages.add(TargetLanguage.fromCode(code)
                    .orElseThrow(() -> new IllegalArgumentException("Configured language '" + code
                            + "' has no translation support")));
        }
        this.supported = Collections.unmodifiableSet(languages);
    }

    public TargetLanguage require(String code) {
        return TargetLanguage.fromCode(code)
                .filter(supported::contains)
                .orElseThrow(() -> new UnsupportedLanguageException(code, codes()));
    }

    public List<String> codes() {
        return supported.stream().map(TargetLanguage::code).collect(Collectors.toList());
    }
}
