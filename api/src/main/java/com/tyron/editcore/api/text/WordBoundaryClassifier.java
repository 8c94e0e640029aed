package com.tyron.editcore.api.text;

import org.jetbrains.annotations.NotNull;

import java.util.BitSet;
import java.util.Objects;

/**
 * Decides which characters end a "word" for word-wise navigation, deletion and selection.
 *
 * Whitespace is always a boundary. Characters listed as word characters are never a boundary, even if they
 * also appear in the punctuation list. Characters in the punctuation list are boundaries. Everything else
 * (letters, digits, non-ASCII symbols) is part of a word.
 */
public final class WordBoundaryClassifier {

    /**
     * Every ASCII punctuation character except {@code _} and {@code -}.
     */
    public static final String DEFAULT_PUNCTUATION = ".,;:!?\"'()[]{}<>|\\/@#$%^&*+=~`";

    /**
     * Characters kept inside words, so {@code snake_case} and {@code kebab-case} are single words.
     */
    public static final String DEFAULT_WORD_CHARACTERS = "_-";

    public static final WordBoundaryClassifier DEFAULT =
            new WordBoundaryClassifier(DEFAULT_PUNCTUATION, DEFAULT_WORD_CHARACTERS);

    private final String punctuation;
    private final String wordCharacters;
    private final BitSet punctuationSet = new BitSet(128);
    private final BitSet wordSet = new BitSet(128);

    public WordBoundaryClassifier(@NotNull String punctuation, @NotNull String wordCharacters) {
        this.punctuation = Objects.requireNonNull(punctuation, "punctuation");
        this.wordCharacters = Objects.requireNonNull(wordCharacters, "wordCharacters");
        punctuation.codePoints().forEach(punctuationSet::set);
        wordCharacters.codePoints().forEach(wordSet::set);
    }

    public boolean isBoundary(int codePoint) {
        // isSpaceChar adds the no-break spaces isWhitespace leaves out
        if (Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint)) {
            return true;
        }
        if (wordSet.get(codePoint)) {
            return false;
        }
        return punctuationSet.get(codePoint);
    }

    public boolean isWordPart(int codePoint) {
        return !isBoundary(codePoint);
    }

    public String getPunctuation() {
        return punctuation;
    }

    public String getWordCharacters() {
        return wordCharacters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WordBoundaryClassifier that)) return false;
        return punctuationSet.equals(that.punctuationSet) && wordSet.equals(that.wordSet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(punctuationSet, wordSet);
    }
}
