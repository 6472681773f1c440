package com.herzen.recall.scoring;

import com.herzen.recall.scoring.ScoringModels.Language;

import java.util.Set;

/**
 * Closed stopword sets. Entries are matched against tokens after case folding and accent
 * stripping, so accented entries such as "até" never match and the token survives.
 */
public final class StopwordSets {
    public static final Set<String> PORTUGUESE = Set.of(
            "a", "o", "as", "os", "um", "uma", "uns", "umas", "de", "do", "da", "dos", "das",
            "em", "no", "na", "nos", "nas", "por", "pelo", "pela", "pelos", "pelas",
            "para", "com", "sem", "sob", "sobre", "ante", "até",
            "e", "ou", "mas", "nem", "que", "se", "como",
            "eu", "tu", "ele", "ela", "nós", "vós", "eles", "elas",
            "me", "te", "vos", "lhe", "lhes",
            "meu", "teu", "seu", "nosso", "vosso",
            "ser", "estar", "ter", "haver", "fazer", "ir",
            "foi", "era", "é", "são", "está", "estão",
            "isso", "aquilo", "isto", "esse", "essa", "este", "esta",
            "muito", "pouco", "mais", "menos", "tão"
    );

    public static final Set<String> ENGLISH = Set.of(
            "a", "an", "the", "in", "on", "at", "to", "for", "of", "with", "by",
            "and", "or", "but", "is", "are", "was", "were", "be", "been",
            "i", "you", "he", "she", "it", "we", "they",
            "this", "that", "these", "those"
    );

    public static Set<String> forLanguage(Language language) {
        return language == Language.EN_US ? ENGLISH : PORTUGUESE;
    }

    private StopwordSets() {}
}
