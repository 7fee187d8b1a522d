package info.isaksson.erland.mappinglint.model;

import java.util.List;
import java.util.Objects;

/**
 * Summary of one mapping expression.
 *
 * <p>An unsummarized shape ({@link #summarized} false) carries no facts; rules that depend on facts stay
 * silent for it.</p>
 */
public final class ExpressionShape {
    public final String text;

    /** Lambda parameter name; empty when the text is not a single-parameter lambda. */
    public final String parameterName;
    public final boolean summarized;
    public final List<ExpressionFact> facts;

    public ExpressionShape(String text, String parameterName, boolean summarized, List<ExpressionFact> facts) {
        this.text = Objects.requireNonNullElse(text, "");
        this.parameterName = Objects.requireNonNullElse(parameterName, "");
        this.summarized = summarized;
        this.facts = facts == null ? List.of() : List.copyOf(facts);
    }

    public static ExpressionShape unsummarized(String text) {
        return new ExpressionShape(text, "", false, List.of());
    }

    /** The accessor when the whole expression is a bare member read, otherwise null. */
    public AccessorRef bareAccess() {
        if (!summarized) return null;
        for (ExpressionFact f : facts) {
            if (f instanceof ExpressionFact.BareMemberAccess) {
                return ((ExpressionFact.BareMemberAccess) f).accessor();
            }
        }
        return null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExpressionShape)) return false;
        ExpressionShape that = (ExpressionShape) o;
        return summarized == that.summarized &&
                Objects.equals(text, that.text) &&
                Objects.equals(parameterName, that.parameterName) &&
                Objects.equals(facts, that.facts);
    }

    @Override public int hashCode() {
        return Objects.hash(text, parameterName, summarized, facts);
    }

    @Override public String toString() {
        return "ExpressionShape{" + text + (summarized ? ", " + facts : ", unsummarized") + "}";
    }
}
