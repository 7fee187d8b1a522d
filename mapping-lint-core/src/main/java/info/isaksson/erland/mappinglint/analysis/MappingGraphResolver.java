package info.isaksson.erland.mappinglint.analysis;

import info.isaksson.erland.mappinglint.model.AnalysisUnit;
import info.isaksson.erland.mappinglint.model.MappingDeclaration;
import info.isaksson.erland.mappinglint.model.TypeRef;
import info.isaksson.erland.mappinglint.model.TypeShape;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One-hop reachability over the declarations of one {@link AnalysisUnit}.
 *
 * <p>Each declaration adds the edge {@code source -> dest}; a reverse-mapped declaration also adds
 * {@code dest -> source}. Chains are not followed. The edge set is complete once the constructor returns
 * and is never modified afterwards.</p>
 */
public final class MappingGraphResolver {

    private final AnalysisUnit unit;
    private final Set<Edge> edges;

    public MappingGraphResolver(AnalysisUnit unit) {
        if (unit == null) throw new IllegalArgumentException("unit must not be null");
        this.unit = unit;
        Set<Edge> out = new LinkedHashSet<>();
        for (MappingDeclaration d : unit.declarations) {
            String src = canonical(d.sourceType);
            String dst = canonical(d.destType);
            if (src.isEmpty() || dst.isEmpty()) continue;
            out.add(new Edge(src, dst));
            if (d.reverseMap) out.add(new Edge(dst, src));
        }
        this.edges = Collections.unmodifiableSet(out);
    }

    public boolean effectivelyMapped(TypeRef from, TypeRef to) {
        if (from == null || to == null) return false;
        return effectivelyMapped(from.name, to.name);
    }

    /**
     * True when {@code from -> to} is declared in this unit, directly or through a reverse-mapped declaration.
     * Names are compared qualified; an unqualified name on either side falls back to simple-name comparison.
     */
    public boolean effectivelyMapped(String from, String to) {
        String a = canonical(from);
        String b = canonical(to);
        if (a.isEmpty() || b.isEmpty()) return false;
        if (edges.contains(new Edge(a, b))) return true;
        if (a.contains(".") && b.contains(".")) return false;
        String sa = simpleName(a);
        String sb = simpleName(b);
        for (Edge e : edges) {
            if (matches(a, sa, e.from) && matches(b, sb, e.to)) return true;
        }
        return false;
    }

    private static boolean matches(String name, String simple, String edgeEnd) {
        if (name.equals(edgeEnd)) return true;
        if (name.contains(".") && edgeEnd.contains(".")) return false;
        return simple.equals(simpleName(edgeEnd));
    }

    private String canonical(String typeName) {
        if (typeName == null) return "";
        String t = typeName.trim();
        TypeShape shape = unit.findType(t);
        return shape != null ? shape.qualifiedName : t;
    }

    private static String simpleName(String name) {
        int idx = name.lastIndexOf('.');
        return idx < 0 ? name : name.substring(idx + 1);
    }

    private static final class Edge {
        final String from;
        final String to;

        Edge(String from, String to) {
            this.from = from;
            this.to = to;
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Edge)) return false;
            Edge that = (Edge) o;
            return from.equals(that.from) && to.equals(that.to);
        }

        @Override public int hashCode() {
            return 31 * from.hashCode() + to.hashCode();
        }
    }
}
