package com.example.contentpipeline.domain.model;

import java.util.Map;

/**
 * Headings of the translated summary sections, in display order: overview, key takeaways,
 * action items.
 */
public enum SectionHeading {
    OVERVIEW(Map.of(
            TargetLanguage.ES, "Resumen general",
            TargetLanguage.JA, "概要",
            TargetLanguage.PT, "Resumo geral")),
    KEY_TAKEAWAYS(Map.of(
            TargetLanguage.ES, "Puntos clave",
            TargetLanguage.JA, "主要なポイント",
            TargetLanguage.PT, "Principais aprendizados")),
    ACTION_ITEMS(Map.of(
            TargetLanguage.ES, "Acciones de seguimiento",
            TargetLanguage.JA, "フォローアップのアクション",
            TargetLanguage.PT, "Ações de acompanhamento"));

    private final Map<TargetLanguage, String> localized;

    SectionHeading(Map<TargetLanguage, String> localized) {
        this.localized = localized;
    }

    public String label(TargetLanguage language) {
        return localized.get(language);
    }
}
