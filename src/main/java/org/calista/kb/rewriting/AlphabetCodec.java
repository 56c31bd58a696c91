package org.calista.kb.rewriting;

import org.calista.kb.presentation.InvalidSymbolException;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * AlphabetCodec — bidirectional mapping between external letters and internal symbols.
 *
 * <p>The letter at alphabet index {@code i} is encoded as the char {@code i + 1}, so internal
 * words are ordinary strings whose {@code compareTo} follows alphabet order.</p>
 */
public final class AlphabetCodec {

    public static final int MAX_LETTERS = Character.MAX_VALUE - 1;

    private final String alphabet;
    private final Map<Character, Character> toInternal;
    private final boolean identity;

    public AlphabetCodec(String alphabet) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
        if (alphabet.length() > MAX_LETTERS) {
            throw new IllegalArgumentException("alphabet too large: " + alphabet.length() + " > " + MAX_LETTERS);
        }
        this.toInternal = new HashMap<>(alphabet.length() * 2);
        boolean same = true;
        for (int i = 0; i < alphabet.length(); i++) {
            char c = alphabet.charAt(i);
            if (toInternal.put(c, internalSymbol(i)) != null) {
                throw new IllegalArgumentException("duplicate letter '" + c + "' in alphabet");
            }
            if (c != internalSymbol(i)) same = false;
        }
        this.identity = same;
    }

    public static char internalSymbol(int index) {
        return (char) (index + 1);
    }

    public static int indexOf(char internal) {
        return internal - 1;
    }

    public String alphabet() {
        return alphabet;
    }

    public int size() {
        return alphabet.length();
    }

    /** True when external and internal words coincide and encoding is skipped. */
    public boolean internalIsSameAsExternal() {
        return identity;
    }

    /**
     * @throws InvalidSymbolException for a letter outside the alphabet
     */
    public String toInternal(String external) {
        Objects.requireNonNull(external, "word");
        if (identity) {
            validate(external);
            return external;
        }
        char[] out = new char[external.length()];
        for (int i = 0; i < out.length; i++) {
            char c = external.charAt(i);
            Character x = toInternal.get(c);
            if (x == null) throw new InvalidSymbolException(c, i, alphabet);
            out[i] = x;
        }
        return new String(out);
    }

    public String toExternal(String internal) {
        if (identity) return internal;
        char[] out = new char[internal.length()];
        for (int i = 0; i < out.length; i++) {
            out[i] = alphabet.charAt(indexOf(internal.charAt(i)));
        }
        return new String(out);
    }

    public void validate(String external) {
        for (int i = 0; i < external.length(); i++) {
            char c = external.charAt(i);
            if (!toInternal.containsKey(c)) throw new InvalidSymbolException(c, i, alphabet);
        }
    }
}
