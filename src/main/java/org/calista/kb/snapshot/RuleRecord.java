package org.calista.kb.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One persisted rule {@code lhs -> rhs}, in external letters. A pending row is a candidate
 * that was still waiting on the stack and may not be oriented yet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RuleRecord {
    public String lhs;
    public String rhs;

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean pending;

    public static RuleRecord of(String lhs, String rhs) {
        RuleRecord r = new RuleRecord();
        r.lhs = lhs;
        r.rhs = rhs;
        return r;
    }

    public static RuleRecord pending(String lhs, String rhs) {
        RuleRecord r = of(lhs, rhs);
        r.pending = true;
        return r;
    }

    public void validate() {
        if (lhs == null) throw new IllegalArgumentException("rule record without lhs");
        if (rhs == null) throw new IllegalArgumentException("rule record without rhs");
        if (lhs.equals(rhs)) throw new IllegalArgumentException("trivial rule record: " + lhs + " = " + rhs);
    }

    @Override
    public String toString() {
        return pending ? lhs + " = " + rhs + " (pending)" : lhs + " -> " + rhs;
    }
}
