package com.librenovel.decompiler.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the optional words of a one-line statement and joins them with
 * single spaces. Null and empty words are skipped.
 * <p>
 * Older compilers kept a trailing space on some simple expressions. Such a
 * space is dropped from every word but the last one, so joining never
 * produces double spaces in the middle of a line.
 */
public final class WordConcatenator {

    private final List<String> words = new ArrayList<>();
    private boolean needsSpace;

    /**
     * @param needsSpace whether the joined text should start with a space
     */
    public WordConcatenator(boolean needsSpace) {
        this.needsSpace = needsSpace;
    }

    public WordConcatenator append(String... fragments) {
        for (String fragment : fragments) {
            if (fragment != null && !fragment.isEmpty()) {
                words.add(fragment);
            }
        }
        return this;
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    public String join() {
        if (words.isEmpty()) return "";

        StringBuilder sb = new StringBuilder();
        if (needsSpace) {
            sb.append(' ');
        }
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            boolean last = i == words.size() - 1;
            if (!last && word.endsWith(" ")) {
                word = word.substring(0, word.length() - 1);
            }
            if (i > 0) sb.append(' ');
            sb.append(word);
        }

        String joined = sb.toString();
        needsSpace = !joined.endsWith(" ");
        return joined;
    }
}
