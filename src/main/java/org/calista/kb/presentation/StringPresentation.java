package org.calista.kb.presentation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable {@link Presentation} over a {@code char} alphabet.
 * Every relation word is validated when the presentation is built.
 */
public final class StringPresentation implements Presentation {

    private final String alphabet;
    private final List<Relation> relations;
    private final boolean containsEmptyWord;

    private StringPresentation(String alphabet, List<Relation> relations, boolean containsEmptyWord) {
        this.alphabet = alphabet;
        this.relations = Collections.unmodifiableList(relations);
        this.containsEmptyWord = containsEmptyWord;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String alphabet() {
        return alphabet;
    }

    @Override
    public List<Relation> relations() {
        return relations;
    }

    @Override
    public boolean containsEmptyWord() {
        return containsEmptyWord;
    }

    @Override
    public String toString() {
        return "StringPresentation{alphabet=\"" + alphabet + "\", relations=" + relations + "}";
    }

    public static final class Builder {
        private String alphabet = "";
        private final List<Relation> relations = new ArrayList<>();
        private boolean containsEmptyWord = true;

        public Builder alphabet(String v) {
            this.alphabet = Objects.requireNonNull(v, "alphabet");
            return this;
        }

        public Builder rule(String lhs, String rhs) {
            relations.add(Relation.of(lhs, rhs));
            return this;
        }

        public Builder containsEmptyWord(boolean v) {
            this.containsEmptyWord = v;
            return this;
        }

        public StringPresentation build() {
            for (int i = 0; i < alphabet.length(); i++) {
                if (alphabet.indexOf(alphabet.charAt(i), i + 1) >= 0) {
                    throw new IllegalArgumentException("duplicate letter '" + alphabet.charAt(i) + "' in alphabet");
                }
            }
            StringPresentation p = new StringPresentation(alphabet, new ArrayList<>(relations), containsEmptyWord);
            for (Relation r : p.relations) {
                p.validateWord(r.lhs);
                p.validateWord(r.rhs);
                if (!containsEmptyWord && (r.lhs.isEmpty() || r.rhs.isEmpty())) {
                    throw new IllegalArgumentException("empty word in relation " + r + " but the empty word is not allowed");
                }
            }
            return p;
        }
    }
}
