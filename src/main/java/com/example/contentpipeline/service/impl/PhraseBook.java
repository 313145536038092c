package com.example.contentpipeline.service.impl;

import com.example.contentpipeline.domain.model.TargetLanguage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed English to target-language phrases used by the mock translator. A phrase may carry
 * one {@code {0}} placeholder, which is copied into the translation unchanged.
 */
final class PhraseBook {

    private static final String PLACEHOLDER = "{0}";

    private final List<Entry> entries = new ArrayList<>();

    PhraseBook add(String english, Map<TargetLanguage, String> translations) {
        entries.add(new Entry(compile(english), translations));
        return this;
    }

    /** Returns {@code null} when no phrase matches. */
    String lookup(String english, TargetLanguage language) {
        for (Entry entry : entries) {
            Matcher matcher = entry.pattern.matcher(english.trim());
            if (matcher.matches() && entry.translations.containsKey(language)) {
                String template = entry.translations.get(language);
                return matcher.groupCount() == 0 ? template : template.replace(PLACEHOLDER, matcher.group(1));
            }
        }
        return null;
    }

    private static Pattern compile(String english) {
        int index = english.indexOf(PLACEHOLDER);
        if (index < 0) {
            return Pattern.compile(Pattern.quote(english));
        }
        return Pattern.compile(Pattern.quote(english.substring(0, index)) + "(.+?)"
                + Pattern.quote(english.substring(index + PLACEHOLDER.length())));
    }

    private record Entry(Pattern pattern, Map<TargetLanguage, String> translations) {
    }

    static PhraseBook standard() {
        return new PhraseBook()
                .add("Video {0} presents product updates and next steps.", Map.of(
                        TargetLanguage.ES, "El video {0} presenta actualizaciones del producto y próximos pasos.",
                        TargetLanguage.JA, "ビデオ{0}では製品更新と次のステップが説明されています。",
                        TargetLanguage.PT, "O vídeo {0} apresenta atualizações do produto e próximos passos."))
                .add("Recent progress on the product was highlighted.", Map.of(
                        TargetLanguage.ES, "Se destacó el progreso reciente del producto.",
                        TargetLanguage.JA, "製品の最近の進捗が強調されました。",
                        TargetLanguage.PT, "Foi destacado o progresso recente do produto."))
                .add("The team is aligned on upcoming priorities.", Map.of(
                        TargetLanguage.ES, "El equipo está alineado con las próximas prioridades.",
                        TargetLanguage.JA, "チームは今後の優先事項について足並みがそろっています。",
                        TargetLanguage.PT, "A equipe está alinhada com as próximas prioridades."))
                .add("Next steps were agreed for the coming release.", Map.of(
                        TargetLanguage.ES, "Se acordaron los próximos pasos para la siguiente versión.",
                        TargetLanguage.JA, "次のリリースに向けた次のステップが合意されました。",
                        TargetLanguage.PT, "Os próximos passos foram acordados para a próxima versão."))
                .add("Schedule a review meeting.", Map.of(
                        TargetLanguage.ES, "Programar una reunión de revisión.",
                        TargetLanguage.JA, "レビュー会議を予定する。",
                        TargetLanguage.PT, "Agendar uma reunião de revisão."))
                .add("Share notes with the stakeholders.", Map.of(
                        TargetLanguage.ES, "Compartir notas con las partes interesadas.",
                        TargetLanguage.JA, "関係者にメモを共有する。",
                        TargetLanguage.PT, "Compartilhar notas com as partes interessadas."));
    }
}
