package com.herzen.recall.scoring;

import com.herzen.recall.scoring.ScoringModels.Language;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns free text into the canonical token sequence used for keypoint matching.
 *
 * <p>Steps, in order: locale-insensitive lower-casing, NFD decomposition with the Latin combining
 * marks (U+0300..U+036F) removed, removal of everything that is not a letter, decimal digit or
 * whitespace (superscript and subscript digits go too), splitting on whitespace runs, stopword
 * removal for the language and removal of tokens of two characters or fewer. Duplicates are kept
 * in source order.</p>
 */
@Component
public class RecallTokenizer {
    private static final Pattern COMBINING_MARKS = Pattern.compile("[\\u0300-\\u036f]");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{Nd}\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final int MIN_TOKEN_LENGTH = 3;

    public List<String> tokenize(String text, Language language) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        String folded = Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        folded = COMBINING_MARKS.matcher(folded).replaceAll("");
        folded = NON_WORD.matcher(folded).replaceAll("");

        Set<String> stopwords = StopwordSets.forLanguage(language);
        return Arrays.stream(WHITESPACE.split(folded))
                .filter(t -> !t.isEmpty())
                .filter(t -> !stopwords.contains(t))
                .filter(t -> t.length() >= MIN_TOKEN_LENGTH)
                .toList();
    }
}
