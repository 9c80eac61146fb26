package org.netpreserve.scriptorium;

/**
 * Summary of the text extracted from the leading pages of a document.
 *
 * @param chars        non-whitespace characters
 * @param words        whitespace separated tokens containing a letter or digit
 * @param pagesSampled pages the text was taken from
 */
public record TextStats(int chars, int words, int pagesSampled) {
    public static TextStats of(String text, int pagesSampled) {
        int chars = 0;
        int words = 0;
        boolean inWord = false;
        boolean wordHasAlnum = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                if (inWord && wordHasAlnum) words++;
                inWord = false;
                wordHasAlnum = false;
            } else {
                chars++;
                inWord = true;
                if (Character.isLetterOrDigit(c)) wordHasAlnum = true;
            }
        }
        if (inWord && wordHasAlnum) words++;
        return new TextStats(chars, words, pagesSampled);
    }
}
