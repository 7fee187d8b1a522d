package info.isaksson.erland.mappinglint.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Explicit configuration of one destination member inside a {@link MappingDeclaration}.
 *
 * <p>{@link #expression} is the Java lambda text for {@link MemberConfigKind#MAP_FROM} (and the condition or
 * constant text for the other kinds). {@link #shape} is the expression summary; it is not part of the JSON form
 * and is filled in by the analysis before rules run when the collector did not supply one.</p>
 */
@JsonPropertyOrder({"destMember","kind","expression","location"})
public final class MemberConfig {
    /** Destination member name; blank when the collector could not determine it. */
    public final String destMember;
    public final MemberConfigKind kind;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String expression;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final SourceLocation location;

    @JsonIgnore
    public final ExpressionShape shape;

    @JsonCreator
    public MemberConfig(
            @JsonProperty("destMember") String destMember,
            @JsonProperty("kind") MemberConfigKind kind,
            @JsonProperty("expression") String expression,
            @JsonProperty("location") SourceLocation location
    ) {
        this(destMember, kind, expression, location, null);
    }

    public MemberConfig(String destMember, MemberConfigKind kind, String expression, SourceLocation location, ExpressionShape shape) {
        this.destMember = Objects.requireNonNullElse(destMember, "");
        this.kind = kind == null ? MemberConfigKind.MAP_FROM : kind;
        this.expression = expression;
        this.location = location;
        this.shape = shape;
    }

    public static MemberConfig mapFrom(String destMember, String expression) {
        return new MemberConfig(destMember, MemberConfigKind.MAP_FROM, expression, null);
    }

    public static MemberConfig ignore(String destMember) {
        return new MemberConfig(destMember, MemberConfigKind.IGNORE, null, null);
    }

    @JsonIgnore
    public boolean isMapFrom() {
        return kind == MemberConfigKind.MAP_FROM;
    }

    /** True when the destination member is known, i.e. the config can pre-empt convention rules. */
    @JsonIgnore
    public boolean hasDestMember() {
        return !destMember.isBlank();
    }

    public MemberConfig withShape(ExpressionShape newShape) {
        return new MemberConfig(destMember, kind, expression, location, newShape);
    }

    /** Replaces the expression text; the old summary no longer applies and is dropped. */
    public MemberConfig withExpression(String newExpression) {
        return new MemberConfig(destMember, kind, newExpression, location, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemberConfig)) return false;
        MemberConfig that = (MemberConfig) o;
        return kind == that.kind &&
                Objects.equals(destMember, that.destMember) &&
                Objects.equals(expression, that.expression) &&
                Objects.equals(location, that.location);
    }

    @Override public int hashCode() {
        return Objects.hash(destMember, kind, expression, location);
    }

    @Override public String toString() {
        return "MemberConfig{" + destMember + " " + kind + (expression == null ? "" : " " + expression) + "}";
    }
}
