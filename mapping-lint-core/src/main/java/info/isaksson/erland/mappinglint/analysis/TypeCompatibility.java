package info.isaksson.erland.mappinglint.analysis;

import info.isaksson.erland.mappinglint.model.TypeRef;

import java.util.List;
import java.util.Map;

/** Java primitive widening, as permitted in assignment contexts. */
final class TypeCompatibility {

    private TypeCompatibility() {}

    private static final Map<String, List<String>> WIDENING = Map.of(
            "byte", List.of("short", "int", "long", "float", "double"),
            "short", List.of("int", "long", "float", "double"),
            "char", List.of("int", "long", "float", "double"),
            "int", List.of("long", "float", "double"),
            "long", List.of("float", "double"),
            "float", List.of("double")
    );

    static boolean widens(TypeRef from, TypeRef to) {
        if (from == null || to == null) return false;
        if (!from.isJavaPrimitive() || !to.isJavaPrimitive()) return false;
        List<String> targets = WIDENING.get(from.name);
        return targets != null && targets.contains(to.name);
    }
}
