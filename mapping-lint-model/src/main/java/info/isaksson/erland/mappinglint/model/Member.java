package info.isaksson.erland.mappinglint.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** One member (property/field) of a {@link TypeShape}. */
@JsonPropertyOrder({"name","type","settable","required","nullable"})
public final class Member {
    public final String name;
    public final TypeRef type;

    /** Writable by a mapper (setter, public field or constructor-bound). Defaults to true. */
    public final boolean settable;

    /** Must receive a value during mapping. */
    public final boolean required;

    /** Declared nullable independently of {@link #type} (e.g. a nullness annotation). */
    public final boolean nullable;

    @JsonCreator
    public Member(
            @JsonProperty("name") String name,
            @JsonProperty("type") TypeRef type,
            @JsonProperty("settable") Boolean settable,
            @JsonProperty("required") boolean required,
            @JsonProperty("nullable") boolean nullable
    ) {
        this.name = Objects.requireNonNullElse(name, "");
        this.type = type == null ? TypeRef.unresolved("") : type;
        this.settable = settable == null || settable;
        this.required = required;
        this.nullable = nullable;
    }

    /** Settable, optional, non-nullable member with a parsed type. */
    public static Member of(String name, String typeText) {
        return new Member(name, TypeRefParser.parse(typeText), true, false, false);
    }

    public static Member required(String name, String typeText) {
        return new Member(name, TypeRefParser.parse(typeText), true, true, false);
    }

    /** The member type with the {@link #nullable} flag folded in. */
    public TypeRef effectiveType() {
        if (nullable && type.kind != TypeRefKind.NULLABLE && type.kind != TypeRefKind.UNRESOLVED) {
            return TypeRef.nullable(type);
        }
        return type;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Member)) return false;
        Member that = (Member) o;
        return settable == that.settable &&
                required == that.required &&
                nullable == that.nullable &&
                Objects.equals(name, that.name) &&
                Objects.equals(type, that.type);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type, settable, required, nullable);
    }

    @Override public String toString() {
        return name + ": " + effectiveType().display();
    }
}
