package info.isaksson.erland.mappinglint.analysis;

import info.isaksson.erland.mappinglint.model.AnalysisUnit;
import info.isaksson.erland.mappinglint.model.MappingDeclaration;
import info.isaksson.erland.mappinglint.model.Member;
import info.isaksson.erland.mappinglint.model.MemberConfig;
import info.isaksson.erland.mappinglint.model.MemberConfigKind;
import info.isaksson.erland.mappinglint.model.TypeRef;
import info.isaksson.erland.mappinglint.model.TypeShape;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursion risks of one declaration, following member types (and collection element types) through the
 * shapes of the unit.
 *
 * <p>A declaration with a max depth is never reported, nor is one that ignores a destination member closing
 * the loop: a source member typed as the destination, or a destination member typed as its own type.</p>
 */
public final class RecursionDetector {

    private enum Mark { ON_PATH, DONE }

    private final AnalysisUnit unit;

    public RecursionDetector(AnalysisUnit unit) {
        if (unit == null) throw new IllegalArgumentException("unit must not be null");
        this.unit = unit;
    }

    /** The self-reference or recursion finding for {@code declaration}, or null. */
    public Diagnostic detect(MappingDeclaration declaration, TypeShape source, TypeShape dest, ConfigOverrides overrides) {
        if (declaration.maxDepth != null) return null;

        for (String name : closingMembers(source, dest)) {
            MemberConfig c = overrides.get(name);
            if (c != null && c.kind == MemberConfigKind.IGNORE) return null;
        }

        String selfReferencing = null;
        if (!membersReferencing(source, source).isEmpty()) {
            selfReferencing = source.simpleName();
        } else if (!membersReferencing(dest, dest).isEmpty()) {
            selfReferencing = dest.simpleName();
        }
        if (selfReferencing != null) {
            return diagnostic(MappingRule.SELF_REFERENCING_TYPE, declaration, source, dest, selfReferencing);
        }
        if (reachesTargetOrCycle(source, dest.qualifiedName, new HashMap<>())) {
            return diagnostic(MappingRule.INFINITE_RECURSION_RISK, declaration, source, dest, "");
        }
        return null;
    }

    /** Members whose ignore config ends the loop: source members typed as the destination, then destination self-references. */
    public List<String> closingMembers(TypeShape source, TypeShape dest) {
        List<String> out = new ArrayList<>(membersReferencing(source, dest));
        for (String name : membersReferencing(dest, dest)) {
            if (!out.contains(name)) out.add(name);
        }
        return out;
    }

    /** Names of the members of {@code owner} typed as {@code target}, directly or as the element of a collection. */
    public List<String> membersReferencing(TypeShape owner, TypeShape target) {
        List<String> out = new ArrayList<>();
        for (Member m : owner.members) {
            if (target.qualifiedName.equals(referencedType(m))) out.add(m.name);
        }
        return out;
    }

    /** Depth-first walk; meeting a type that is still on the path is a cycle. */
    private boolean reachesTargetOrCycle(TypeShape current, String target, Map<String, Mark> marks) {
        marks.put(current.qualifiedName, Mark.ON_PATH);
        for (Member m : current.members) {
            String next = referencedType(m);
            if (next == null) continue;
            if (next.equals(target)) return true;
            Mark mark = marks.get(next);
            if (mark == Mark.ON_PATH) return true;
            if (mark == Mark.DONE) continue;
            TypeShape shape = unit.findType(next);
            if (shape != null && reachesTargetOrCycle(shape, target, marks)) return true;
        }
        marks.put(current.qualifiedName, Mark.DONE);
        return false;
    }

    /** Qualified name of the user-defined type a member holds, or null for scalars and unknown types. */
    private String referencedType(Member m) {
        TypeRef t = m.effectiveType().unwrapNullable();
        if (t.isCollection() && t.elementType() != null) t = t.elementType().unwrapNullable();
        if (!t.isUserDefined()) return null;
        TypeShape shape = unit.findType(t.name);
        return shape != null ? shape.qualifiedName : t.name;
    }

    private static Diagnostic diagnostic(MappingRule rule, MappingDeclaration declaration, TypeShape source,
                                         TypeShape dest, String detail) {
        return new Diagnostic(rule, null, declaration.id, "", source.simpleName(), "", dest.simpleName(), "",
                detail, declaration.location);
    }
}
