package org.calista.kb.presentation;

import java.util.Objects;

/**
 * One defining relation {@code lhs = rhs} over the external alphabet.
 * Orientation carries no meaning; the engine orients by shortlex.
 */
public final class Relation {

    public final String lhs;
    public final String rhs;

    public Relation(String lhs, String rhs) {
        this.lhs = Objects.requireNonNull(lhs, "lhs");
        this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    public static Relation of(String lhs, String rhs) {
        return new Relation(lhs, rhs);
    }

    public boolean isTrivial() {
        return lhs.equals(rhs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Relation)) return false;
        Relation that = (Relation) o;
        return lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return 31 * lhs.hashCode() + rhs.hashCode();
    }

    @Override
    public String toString() {
        return lhs + " = " + rhs;
    }
}
