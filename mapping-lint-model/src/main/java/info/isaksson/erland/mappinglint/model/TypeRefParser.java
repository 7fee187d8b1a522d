package info.isaksson.erland.mappinglint.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Java type text ({@code List<String>}, {@code Integer}, {@code @Nullable Address}) into a {@link TypeRef}.
 *
 * <p>Parsing never throws. Text that cannot be read as a type yields {@link TypeRefKind#UNRESOLVED}.</p>
 */
public final class TypeRefParser {

    private TypeRefParser() {}

    /** Primitive keyword to boxed wrapper name. */
    static final Map<String, String> JAVA_PRIMITIVES = createPrimitives();

    private static final Map<String, String> WRAPPERS = invert(JAVA_PRIMITIVES);

    private static final Set<String> SCALARS = Set.of(
            "String", "CharSequence", "Object", "Number",
            "BigDecimal", "BigInteger",
            "UUID", "Date", "Currency", "Locale", "URI", "URL",
            "LocalDate", "LocalDateTime", "LocalTime", "Instant", "OffsetDateTime", "OffsetTime",
            "ZonedDateTime", "Duration", "Period", "Year", "YearMonth", "ZoneId"
    );

    private static final Set<String> CONTAINERS = Set.of(
            "Iterable", "Collection", "List", "Set", "SortedSet", "NavigableSet", "Queue", "Deque",
            "ArrayList", "LinkedList", "HashSet", "LinkedHashSet", "TreeSet", "ArrayDeque",
            "CopyOnWriteArrayList", "Vector"
    );

    private static final Pattern NULLABLE_PREFIX = Pattern.compile("^@([A-Za-z_$][\\w$]*\\.)*Nullable\\s+");
    private static final Pattern QUALIFIED_NAME = Pattern.compile("[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*");
    private static final Pattern TYPE_VARIABLE = Pattern.compile("[A-Z][0-9]?");

    public static TypeRef parse(String text) {
        if (text == null) return TypeRef.unresolved("");
        String s = text.trim();
        if (s.isEmpty()) return TypeRef.unresolved("");
        try {
            return parseTrimmed(s);
        } catch (RuntimeException e) {
            return TypeRef.unresolved(s);
        }
    }

    private static TypeRef parseTrimmed(String s) {
        Matcher nullable = NULLABLE_PREFIX.matcher(s);
        if (nullable.find()) {
            TypeRef inner = parse(s.substring(nullable.end()));
            return inner.kind == TypeRefKind.UNRESOLVED ? inner : TypeRef.nullable(inner);
        }

        if (s.endsWith("[]")) {
            TypeRef component = parse(s.substring(0, s.length() - 2));
            return TypeRef.collection(TypeRef.ARRAY, component);
        }

        if (s.startsWith("?")) {
            // wildcard: keep the bound when present
            String rest = s.substring(1).trim();
            if (rest.startsWith("extends ")) return parse(rest.substring("extends ".length()));
            return TypeRef.unresolved(s);
        }

        int lt = s.indexOf('<');
        if (lt >= 0) {
            if (!s.endsWith(">")) return TypeRef.unresolved(s);
            String raw = s.substring(0, lt).trim();
            if (!QUALIFIED_NAME.matcher(raw).matches()) return TypeRef.unresolved(s);
            List<String> argTexts = splitTopLevel(s.substring(lt + 1, s.length() - 1));
            if (argTexts == null || argTexts.isEmpty()) return TypeRef.unresolved(s);
            List<TypeRef> args = new ArrayList<>();
            for (String a : argTexts) {
                args.add(parse(a));
            }
            String simple = TypeRef.simpleName(raw);
            if (CONTAINERS.contains(simple) && args.size() == 1 && isJdkName(raw)) {
                return TypeRef.collection(simple, args.get(0));
            }
            return TypeRef.generic(raw, args);
        }

        if (!QUALIFIED_NAME.matcher(s).matches()) return TypeRef.unresolved(s);

        String simple = TypeRef.simpleName(s);
        boolean unqualified = simple.equals(s);
        if (unqualified && JAVA_PRIMITIVES.containsKey(s)) {
            return TypeRef.primitive(s);
        }
        if (WRAPPERS.containsKey(simple) && isJdkName(s)) {
            return TypeRef.nullable(TypeRef.primitive(WRAPPERS.get(simple)));
        }
        if (SCALARS.contains(simple) && isJdkName(s)) {
            return TypeRef.primitive(simple);
        }
        if (unqualified && (s.equals("var") || s.equals("void") || Character.isLowerCase(s.charAt(0))
                || TYPE_VARIABLE.matcher(s).matches())) {
            return TypeRef.unresolved(s);
        }
        return TypeRef.userDefined(s);
    }

    /** Unqualified names and {@code java.*} names count as JDK names. */
    private static boolean isJdkName(String name) {
        return !name.contains(".") || name.startsWith("java.");
    }

    /** Splits generic arguments on top-level commas; null when brackets are unbalanced. */
    private static List<String> splitTopLevel(String s) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '<') depth++;
            else if (c == '>') {
                depth--;
                if (depth < 0) return null;
            } else if (c == ',' && depth == 0) {
                out.add(s.substring(start, i).trim());
                start = i + 1;
            }
        }
        if (depth != 0) return null;
        String last = s.substring(start).trim();
        if (!last.isEmpty()) out.add(last);
        return out;
    }

    private static Map<String, String> createPrimitives() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("boolean", "Boolean");
        m.put("byte", "Byte");
        m.put("short", "Short");
        m.put("char", "Character");
        m.put("int", "Integer");
        m.put("long", "Long");
        m.put("float", "Float");
        m.put("double", "Double");
        return Map.copyOf(m);
    }

    private static Map<String, String> invert(Map<String, String> in) {
        Map<String, String> m = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : in.entrySet()) {
            m.put(e.getValue(), e.getKey());
        }
        return Map.copyOf(m);
    }
}
