package info.isaksson.erland.mappinglint.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The visibility boundary of one analysis: the type shapes and the ordered mapping declarations that can see
 * each other. Declarations of different units are never combined.
 */
@JsonPropertyOrder({"name","types","declarations"})
public final class AnalysisUnit {
    public final String name;
    public final List<TypeShape> types;
    public final List<MappingDeclaration> declarations;

    @JsonCreator
    public AnalysisUnit(
            @JsonProperty("name") String name,
            @JsonProperty("types") List<TypeShape> types,
            @JsonProperty("declarations") List<MappingDeclaration> declarations
    ) {
        this.name = Objects.requireNonNullElse(name, "");
        this.types = types == null ? List.of() : List.copyOf(types);
        this.declarations = declarations == null ? List.of() : List.copyOf(declarations);
    }

    /**
     * Finds a type by qualified name. When nothing matches exactly, a name that is unique by simple name
     * is accepted (collectors sometimes report declarations with unqualified names).
     */
    public TypeShape findType(String typeName) {
        if (typeName == null || typeName.isBlank()) return null;
        for (TypeShape t : types) {
            if (typeName.equals(t.qualifiedName)) return t;
        }
        String simple = TypeRef.simpleName(typeName);
        TypeShape found = null;
        for (TypeShape t : types) {
            if (simple.equals(t.simpleName())) {
                if (found != null) return null;
                found = t;
            }
        }
        return found;
    }

    /** Returns a copy where the type with the same qualified name is replaced (or appended). */
    public AnalysisUnit withType(TypeShape type) {
        List<TypeShape> out = new ArrayList<>(types);
        boolean replaced = false;
        for (int i = 0; i < out.size(); i++) {
            if (out.get(i).qualifiedName.equals(type.qualifiedName)) {
                out.set(i, type);
                replaced = true;
                break;
            }
        }
        if (!replaced) out.add(type);
        return new AnalysisUnit(name, out, declarations);
    }

    /** Returns a copy where the declaration at {@code index} is replaced. */
    public AnalysisUnit withDeclaration(int index, MappingDeclaration declaration) {
        if (index < 0 || index >= declarations.size()) {
            throw new IllegalArgumentException("declaration index out of range: " + index);
        }
        List<MappingDeclaration> out = new ArrayList<>(declarations);
        out.set(index, declaration);
        return new AnalysisUnit(name, types, out);
    }

    public AnalysisUnit withDeclarations(List<MappingDeclaration> value) {
        return new AnalysisUnit(name, types, value);
    }

    /** Index of the first declaration with the given id, or -1. */
    public int indexOfDeclaration(String declarationId) {
        for (int i = 0; i < declarations.size(); i++) {
            if (declarations.get(i).id.equals(declarationId)) return i;
        }
        return -1;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalysisUnit)) return false;
        AnalysisUnit that = (AnalysisUnit) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(types, that.types) &&
                Objects.equals(declarations, that.declarations);
    }

    @Override public int hashCode() {
        return Objects.hash(name, types, declarations);
    }
}
