package org.calista.kb.presentation;

/**
 * Thrown at the boundary when a word contains a letter outside the configured alphabet.
 * Internal words are never validated again once encoded.
 */
public final class InvalidSymbolException extends IllegalArgumentException {

    private final char symbol;
    private final int position;

    public InvalidSymbolException(char symbol, int position, String alphabet) {
        super("invalid letter '" + symbol + "' (code " + (int) symbol + ") at position " + position
                + ", valid letters are \"" + alphabet + "\"");
        this.symbol = symbol;
        this.position = position;
    }

    public char symbol() {
        return symbol;
    }

    public int position() {
        return position;
    }
}
