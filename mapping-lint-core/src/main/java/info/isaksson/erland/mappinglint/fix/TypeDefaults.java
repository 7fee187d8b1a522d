package info.isaksson.erland.mappinglint.fix;

import info.isaksson.erland.mappinglint.model.TypeRef;
import info.isaksson.erland.mappinglint.model.TypeRefKind;

import java.util.Map;

/**
 * Java source literals used as fallback or placeholder values, per destination type. Types without an obvious
 * neutral value (user-defined types, dates, arrays) have none.
 */
final class TypeDefaults {

    private TypeDefaults() {}

    private static final Map<String, String> SCALAR_LITERALS = Map.ofEntries(
            Map.entry("String", "\"\""),
            Map.entry("CharSequence", "\"\""),
            Map.entry("boolean", "false"),
            Map.entry("byte", "(byte) 0"),
            Map.entry("short", "(short) 0"),
            Map.entry("char", "'\\0'"),
            Map.entry("int", "0"),
            Map.entry("long", "0L"),
            Map.entry("float", "0f"),
            Map.entry("double", "0d"),
            Map.entry("BigDecimal", "java.math.BigDecimal.ZERO"),
            Map.entry("BigInteger", "java.math.BigInteger.ZERO"),
            Map.entry("Duration", "java.time.Duration.ZERO"),
            Map.entry("Period", "java.time.Period.ZERO")
    );

    private static final Map<String, String> EMPTY_CONTAINERS = Map.of(
            "List", "java.util.List.of()",
            "Collection", "java.util.List.of()",
            "Iterable", "java.util.List.of()",
            "Set", "java.util.Set.of()"
    );

    /** Literal for {@code type}, or null when there is none. */
    static String literalFor(TypeRef type) {
        if (type == null) return null;
        TypeRef t = type.unwrapNullable();
        if (t.kind == TypeRefKind.PRIMITIVE) return SCALAR_LITERALS.get(t.name);
        if (t.kind == TypeRefKind.COLLECTION) return EMPTY_CONTAINERS.get(t.name);
        return null;
    }
}
