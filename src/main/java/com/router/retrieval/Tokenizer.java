package com.router.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lower-cases text and splits it on every non-alphanumeric character.
 */
public final class Tokenizer {

    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "but", "by", "for", "from", "has", "have", "if", "in",
            "into", "is", "it", "its", "me", "my", "no", "not", "of", "on", "or", "our", "so", "such", "that",
            "the", "their", "then", "there", "these", "they", "this", "to", "was", "we", "were", "will", "with",
            "you", "your");

    private Tokenizer() {
    }

    /**
     * @return every token of the text, in order
     */
    public static List<String> words(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        for (String token : SEPARATORS.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * @return the tokens of the text that carry lexical weight, stopwords removed
     */
    public static List<String> terms(String text) {
        List<String> tokens = words(text);
        tokens.removeIf(STOPWORDS::contains);
        return tokens;
    }
}
