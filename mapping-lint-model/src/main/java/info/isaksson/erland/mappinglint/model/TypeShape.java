package info.isaksson.erland.mappinglint.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structural description of a type: its qualified name and ordered members.
 *
 * <p>Member order is the declaration order reported by the shape extractor; case-insensitive lookups
 * rely on it for their tie-break.</p>
 */
@JsonPropertyOrder({"qualifiedName","members"})
public final class TypeShape {
    public final String qualifiedName;
    public final List<Member> members;

    @JsonCreator
    public TypeShape(
            @JsonProperty("qualifiedName") String qualifiedName,
            @JsonProperty("members") List<Member> members
    ) {
        this.qualifiedName = Objects.requireNonNullElse(qualifiedName, "");
        this.members = members == null ? List.of() : List.copyOf(members);
    }

    public static TypeShape of(String qualifiedName, Member... members) {
        return new TypeShape(qualifiedName, List.of(members));
    }

    public String simpleName() {
        return TypeRef.simpleName(qualifiedName);
    }

    /** Exact (case-sensitive) lookup. */
    public Member findMember(String name) {
        if (name == null) return null;
        for (Member m : members) {
            if (name.equals(m.name)) return m;
        }
        return null;
    }

    /** Case-insensitive lookup; the first member in declaration order wins. */
    public Member findMemberIgnoreCase(String name) {
        if (name == null) return null;
        for (Member m : members) {
            if (name.equalsIgnoreCase(m.name)) return m;
        }
        return null;
    }

    /** Returns a copy with {@code member} appended, or this shape if a member with that name exists. */
    public TypeShape withMember(Member member) {
        if (member == null || findMember(member.name) != null) return this;
        List<Member> out = new ArrayList<>(members);
        out.add(member);
        return new TypeShape(qualifiedName, out);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeShape)) return false;
        TypeShape that = (TypeShape) o;
        return Objects.equals(qualifiedName, that.qualifiedName) && Objects.equals(members, that.members);
    }

    @Override public int hashCode() {
        return Objects.hash(qualifiedName, members);
    }

    @Override public String toString() {
        return "TypeShape{" + qualifiedName + ", " + members + "}";
    }
}
