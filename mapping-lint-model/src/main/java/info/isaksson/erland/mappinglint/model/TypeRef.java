package info.isaksson.erland.mappinglint.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structural description of a member type.
 *
 * <p>Equality is structural (kind, name, args). In JSON a type ref is written as its
 * {@link #canonical()} Java type string and read back through {@link TypeRefParser}.</p>
 */
public final class TypeRef {

    /** Container name used for Java arrays. */
    public static final String ARRAY = "[]";

    public final TypeRefKind kind;

    /**
     * Type name: scalar/primitive name, user-defined qualified name, container or raw generic name.
     * For {@link TypeRefKind#UNRESOLVED} the original text. Empty for {@link TypeRefKind#NULLABLE}.
     */
    public final String name;

    /** NULLABLE: wrapped type. COLLECTION: element type. GENERIC: type arguments. */
    public final List<TypeRef> args;

    public TypeRef(TypeRefKind kind, String name, List<TypeRef> args) {
        this.kind = kind == null ? TypeRefKind.UNRESOLVED : kind;
        this.name = Objects.requireNonNullElse(name, "");
        this.args = args == null ? List.of() : List.copyOf(new ArrayList<>(args));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TypeRef parse(String text) {
        return TypeRefParser.parse(text);
    }

    public static TypeRef primitive(String name) {
        return new TypeRef(TypeRefKind.PRIMITIVE, name, null);
    }

    public static TypeRef userDefined(String qualifiedName) {
        return new TypeRef(TypeRefKind.USER_DEFINED, qualifiedName, null);
    }

    public static TypeRef nullable(TypeRef inner) {
        if (inner == null) return unresolved("");
        if (inner.kind == TypeRefKind.NULLABLE) return inner;
        return new TypeRef(TypeRefKind.NULLABLE, "", List.of(inner));
    }

    public static TypeRef collection(String container, TypeRef element) {
        return new TypeRef(TypeRefKind.COLLECTION, container, List.of(element == null ? unresolved("") : element));
    }

    public static TypeRef generic(String rawName, List<TypeRef> args) {
        return new TypeRef(TypeRefKind.GENERIC, rawName, args);
    }

    public static TypeRef unresolved(String raw) {
        return new TypeRef(TypeRefKind.UNRESOLVED, raw, null);
    }

    public boolean isNullable() {
        return kind == TypeRefKind.NULLABLE;
    }

    public boolean isCollection() {
        return kind == TypeRefKind.COLLECTION;
    }

    public boolean isUserDefined() {
        return kind == TypeRefKind.USER_DEFINED;
    }

    /** True when this type and everything it wraps or contains is resolved. */
    public boolean isResolved() {
        if (kind == TypeRefKind.UNRESOLVED) return false;
        for (TypeRef a : args) {
            if (a == null || !a.isResolved()) return false;
        }
        return true;
    }

    /** The wrapped type for NULLABLE, otherwise this. */
    public TypeRef unwrapNullable() {
        if (kind == TypeRefKind.NULLABLE && !args.isEmpty()) return args.get(0);
        return this;
    }

    /** Element type for COLLECTION, otherwise null. */
    public TypeRef elementType() {
        if (kind != TypeRefKind.COLLECTION || args.isEmpty()) return null;
        return args.get(0);
    }

    /** Simple (unqualified) portion of {@link #name}. */
    public String simpleName() {
        return simpleName(name);
    }

    /** True for the Java primitive keywords ({@code int}, {@code boolean}...). */
    public boolean isJavaPrimitive() {
        return kind == TypeRefKind.PRIMITIVE && TypeRefParser.JAVA_PRIMITIVES.containsKey(name);
    }

    /** Java type text with full names, used as the JSON form. */
    @JsonValue
    public String canonical() {
        return render(true);
    }

    /** Short display text used in diagnostic messages, e.g. {@code List<String>} or {@code Integer}. */
    public String display() {
        return render(false);
    }

    private String render(boolean qualified) {
        switch (kind) {
            case PRIMITIVE:
                return name;
            case NULLABLE: {
                TypeRef inner = unwrapNullable();
                if (inner.isJavaPrimitive()) return TypeRefParser.JAVA_PRIMITIVES.get(inner.name);
                return "@Nullable " + inner.render(qualified);
            }
            case COLLECTION: {
                TypeRef element = elementType();
                String el = element == null ? "?" : element.render(qualified);
                if (ARRAY.equals(name)) return el + "[]";
                return (qualified ? name : simpleName(name)) + "<" + el + ">";
            }
            case GENERIC: {
                StringBuilder sb = new StringBuilder(qualified ? name : simpleName(name)).append('<');
                for (int i = 0; i < args.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(args.get(i).render(qualified));
                }
                return sb.append('>').toString();
            }
            case USER_DEFINED:
                return qualified ? name : simpleName(name);
            case UNRESOLVED:
            default:
                return name.isEmpty() ? "?" : name;
        }
    }

    static String simpleName(String name) {
        if (name == null) return "";
        int idx = name.lastIndexOf('.');
        return idx < 0 ? name : name.substring(idx + 1);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeRef)) return false;
        TypeRef that = (TypeRef) o;
        return kind == that.kind &&
                Objects.equals(name, that.name) &&
                Objects.equals(args, that.args);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, name, args);
    }

    @Override public String toString() {
        return display();
    }
}
