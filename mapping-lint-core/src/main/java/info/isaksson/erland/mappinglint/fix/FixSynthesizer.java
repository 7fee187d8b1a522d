package info.isaksson.erland.mappinglint.fix;

import info.isaksson.erland.mappinglint.analysis.ConfigOverrides;
import info.isaksson.erland.mappinglint.analysis.Diagnostic;
import info.isaksson.erland.mappinglint.analysis.MissingDestinationDetector;
import info.isaksson.erland.mappinglint.analysis.RecursionDetector;
import info.isaksson.erland.mappinglint.expr.EnumerationMaterializer;
import info.isaksson.erland.mappinglint.model.AnalysisUnit;
import info.isaksson.erland.mappinglint.model.MappingDeclaration;
import info.isaksson.erland.mappinglint.model.Member;
import info.isaksson.erland.mappinglint.model.MemberConfig;
import info.isaksson.erland.mappinglint.model.TypeRef;
import info.isaksson.erland.mappinglint.model.TypeRefKind;
import info.isaksson.erland.mappinglint.model.TypeShape;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the independently selectable fixes for one diagnostic.
 *
 * <p>Fixes are computed against the unit the diagnostic was reported for and never assume another fix was
 * applied. Applying one and re-analyzing does not report the same rule for the member again, and does not
 * report another rule for it either (comment-only fixes excepted).</p>
 */
public final class FixSynthesizer {

    static final String MARKER_POPULATE = "TODO: Populate this property before mapping";
    static final String MARKER_AWAIT = "TODO: Await async operation before mapping";
    static final String MARKER_CALCULATE = "TODO: Calculate before mapping using ";
    static final String MARKER_CREATED = "TODO: Populate this property, added to keep mapped data";

    /** Depth offered for recursive mappings. */
    static final int SUGGESTED_MAX_DEPTH = 2;

    /** String to scalar parse calls, keyed by destination type name. */
    private static final Map<String, String> PARSERS = Map.of(
            "int", "Integer.parseInt",
            "long", "Long.parseLong",
            "short", "Short.parseShort",
            "byte", "Byte.parseByte",
            "double", "Double.parseDouble",
            "float", "Float.parseFloat",
            "boolean", "Boolean.parseBoolean",
            "BigDecimal", "new java.math.BigDecimal",
            "BigInteger", "new java.math.BigInteger"
    );

    /** String element to element conversions for stream mapping. */
    private static final Map<String, String> ELEMENT_PARSERS = Map.of(
            "int", "Integer::valueOf",
            "long", "Long::valueOf",
            "short", "Short::valueOf",
            "byte", "Byte::valueOf",
            "double", "Double::valueOf",
            "float", "Float::valueOf",
            "boolean", "Boolean::valueOf",
            "BigDecimal", "java.math.BigDecimal::new",
            "BigInteger", "java.math.BigInteger::new"
    );

    private static final Map<String, String> COLLECTORS = Map.of(
            "List", "java.util.stream.Collectors.toList()",
            "Collection", "java.util.stream.Collectors.toList()",
            "Iterable", "java.util.stream.Collectors.toList()",
            "ArrayList", "java.util.stream.Collectors.toCollection(java.util.ArrayList::new)",
            "Set", "java.util.stream.Collectors.toSet()",
            "HashSet", "java.util.stream.Collectors.toCollection(java.util.HashSet::new)",
            "LinkedHashSet", "java.util.stream.Collectors.toCollection(java.util.LinkedHashSet::new)",
            "SortedSet", "java.util.stream.Collectors.toCollection(java.util.TreeSet::new)",
            "TreeSet", "java.util.stream.Collectors.toCollection(java.util.TreeSet::new)"
    );

    private final AccessorStyle accessorStyle;
    private final String parameter;
    private final EnumerationMaterializer materializer = new EnumerationMaterializer();

    public FixSynthesizer() {
        this(AccessorStyle.GETTER, "src");
    }

    public FixSynthesizer(AccessorStyle accessorStyle, String sourceParameterName) {
        this.accessorStyle = accessorStyle == null ? AccessorStyle.GETTER : accessorStyle;
        this.parameter = sourceParameterName == null || sourceParameterName.isBlank() ? "src" : sourceParameterName.trim();
    }

    public List<Edit> synthesize(Diagnostic diagnostic, AnalysisUnit unit) {
        if (diagnostic == null) throw new IllegalArgumentException("diagnostic must not be null");
        if (unit == null) throw new IllegalArgumentException("unit must not be null");

        int index = unit.indexOfDeclaration(diagnostic.declarationId);
        if (index < 0) return List.of();
        MappingDeclaration declaration = unit.declarations.get(index);
        TypeShape source = unit.findType(declaration.sourceType);
        TypeShape dest = unit.findType(declaration.destType);
        if (source == null || dest == null) return List.of();
        Member dm = dest.findMember(diagnostic.member);

        Context ctx = new Context(diagnostic, declaration, source, dest, dm);
        switch (diagnostic.rule) {
            case PROPERTY_TYPE_MISMATCH:
                return propertyTypeMismatch(ctx);
            case GENERIC_TYPE_MISMATCH:
                return genericTypeMismatch(ctx);
            case NULLABLE_COMPATIBILITY:
                return nullableCompatibility(ctx);
            case CASE_SENSITIVITY_MISMATCH:
                return caseSensitivityMismatch(ctx);
            case UNMAPPED_REQUIRED_PROPERTY:
                return unmappedRequired(ctx);
            case REDUNDANT_MAP_FROM:
                return redundantMapFrom(ctx);
            case EXPENSIVE_OPERATION_IN_MAP_FROM:
                return moveToSource(ctx, MARKER_POPULATE);
            case TASK_RESULT_SYNCHRONOUS_ACCESS:
                return moveToSource(ctx, MARKER_AWAIT);
            case NON_DETERMINISTIC_OPERATION:
                return moveToSource(ctx, MARKER_CALCULATE + diagnostic.detail);
            case MULTIPLE_ENUMERATION:
                return materialize(ctx);
            case MISSING_DESTINATION_PROPERTY:
                return missingDestination(ctx);
            case INFINITE_RECURSION_RISK:
            case SELF_REFERENCING_TYPE:
                return recursion(ctx, new RecursionDetector(unit));
            case COMPLEX_TYPE_MAPPING_MISSING:
            case DUPLICATE_MAPPING:
            default:
                return List.of();
        }
    }

    private List<Edit> propertyTypeMismatch(Context ctx) {
        if (ctx.dm == null) return List.of();
        List<Edit> out = new ArrayList<>();
        Member sm = ctx.source.findMember(ctx.dm.name);
        if (sm != null) {
            String read = read(sm);
            TypeRef target = ctx.dm.effectiveType().unwrapNullable();
            TypeRef from = sm.effectiveType().unwrapNullable();
            if (isString(target)) {
                out.add(mapFrom(ctx, "convert", "Convert '" + ctx.dm.name + "' with String.valueOf",
                        "String.valueOf(" + read + ")"));
            } else if (isString(from) && target.kind == TypeRefKind.PRIMITIVE && PARSERS.containsKey(target.name)) {
                String parser = PARSERS.get(target.name);
                out.add(mapFrom(ctx, "convert", "Convert '" + ctx.dm.name + "' with " + parser,
                        parser + "(" + read + ")"));
            }
        }
        out.add(ignore(ctx));
        return out;
    }

    private List<Edit> genericTypeMismatch(Context ctx) {
        if (ctx.dm == null) return List.of();
        List<Edit> out = new ArrayList<>();
        Member sm = ctx.source.findMember(ctx.dm.name);
        if (sm != null) {
            TypeRef from = sm.effectiveType().unwrapNullable();
            TypeRef to = ctx.dm.effectiveType().unwrapNullable();
            String conversion = elementConversion(from, to);
            String collector = COLLECTORS.get(to.name);
            if (conversion != null && collector != null && from.isCollection()) {
                String read = read(sm);
                String stream = TypeRef.ARRAY.equals(from.name)
                        ? "java.util.Arrays.stream(" + read + ")"
                        : read + ".stream()";
                out.add(mapFrom(ctx, "convertElements", "Convert elements of '" + ctx.dm.name + "' with " + conversion,
                        stream + ".map(" + conversion + ").collect(" + collector + ")"));
            }
        }
        out.add(ignore(ctx));
        return out;
    }

    private static String elementConversion(TypeRef from, TypeRef to) {
        TypeRef a = from.elementType() == null ? null : from.elementType().unwrapNullable();
        TypeRef b = to.elementType() == null ? null : to.elementType().unwrapNullable();
        if (a == null || b == null) return null;
        if (isString(b)) return "String::valueOf";
        if (isString(a) && b.kind == TypeRefKind.PRIMITIVE) return ELEMENT_PARSERS.get(b.name);
        return null;
    }

    private List<Edit> nullableCompatibility(Context ctx) {
        if (ctx.dm == null) return List.of();
        Member sm = ctx.source.findMember(ctx.dm.name);
        if (sm == null) return List.of();
        // The fallback is typed like the read value; widening to the destination happens on assignment.
        String literal = TypeDefaults.literalFor(sm.effectiveType());
        if (literal == null) return List.of();
        return List.of(mapFrom(ctx, "defaultValue", "Use " + literal + " when '" + sm.name + "' is null",
                "java.util.Objects.requireNonNullElse(" + read(sm) + ", " + literal + ")"));
    }

    private List<Edit> caseSensitivityMismatch(Context ctx) {
        Member sm = ctx.source.findMember(ctx.diagnostic.detail);
        if (ctx.dm == null || sm == null) return List.of();
        String id = ctx.declaration.id;
        return List.of(
                mapFrom(ctx, "explicitMapping", "Map '" + ctx.dm.name + "' from '" + sm.name + "'", read(sm)),
                Edit.of(key(ctx, "caseInsensitiveProfile"), "Recommend case-insensitive member matching",
                        EditOperation.insertComment(id, ctx.dm.name,
                                "Consider case-insensitive member matching for this profile so '" + sm.name
                                        + "' maps to '" + ctx.dm.name + "'")),
                Edit.of(key(ctx, "renameSource"), "Recommend renaming '" + sm.name + "'",
                        EditOperation.insertComment(id, ctx.dm.name,
                                "Consider renaming " + ctx.source.simpleName() + "." + sm.name + " to '" + ctx.dm.name + "'"))
        );
    }

    private List<Edit> unmappedRequired(Context ctx) {
        if (ctx.dm == null) return List.of();
        List<Edit> out = new ArrayList<>();
        String literal = TypeDefaults.literalFor(ctx.dm.effectiveType());
        if (literal != null) {
            out.add(mapFrom(ctx, "constant", "Map '" + ctx.dm.name + "' to " + literal, literal));
        }
        out.add(Edit.of(key(ctx, "addSourceMember"), "Suggest a matching source member",
                EditOperation.insertComment(ctx.declaration.id, ctx.dm.name,
                        "Add '" + ctx.dm.name + "' (" + ctx.dm.effectiveType().display() + ") to "
                                + ctx.source.simpleName() + " or map it explicitly")));
        return out;
    }

    private List<Edit> redundantMapFrom(Context ctx) {
        MemberConfig config = ConfigOverrides.of(ctx.declaration).get(ctx.diagnostic.member);
        if (config == null) return List.of();
        return List.of(Edit.of(key(ctx, "remove"), "Remove redundant mapping for '" + config.destMember + "'",
                removeAllConfigs(ctx, config.destMember)));
    }

    /** One removal per distinct config of the member, so no shadowed config takes over. */
    private static EditOperation[] removeAllConfigs(Context ctx, String destMember) {
        List<EditOperation> out = new ArrayList<>();
        for (MemberConfig c : ctx.declaration.memberConfigs) {
            if (!c.destMember.equals(destMember)) continue;
            EditOperation op = EditOperation.removeConfig(ctx.declaration.id, c);
            if (!out.contains(op)) out.add(op);
        }
        return out.toArray(new EditOperation[0]);
    }

    /**
     * Removes the expression and adds a same-named, same-typed member to the source type so convention maps it.
     * Offered only when the source type has no member of that name with another type.
     */
    private List<Edit> moveToSource(Context ctx, String marker) {
        MemberConfig config = ConfigOverrides.of(ctx.declaration).get(ctx.diagnostic.member);
        if (config == null || ctx.dm == null || !ctx.dm.type.isResolved()) return List.of();
        Member existing = ctx.source.findMember(ctx.dm.name);
        if (existing != null && !existing.effectiveType().equals(ctx.dm.effectiveType())) return List.of();
        Member added = new Member(ctx.dm.name, ctx.dm.type, true, false, ctx.dm.nullable);
        List<EditOperation> ops = new ArrayList<>(List.of(removeAllConfigs(ctx, config.destMember)));
        ops.add(EditOperation.insertSourceMember(ctx.declaration.id, ctx.source.qualifiedName, added, marker));
        return List.of(Edit.of(key(ctx, "moveToSource"), "Move computation to source property",
                ops.toArray(new EditOperation[0])));
    }

    private List<Edit> materialize(Context ctx) {
        MemberConfig config = ConfigOverrides.of(ctx.declaration).get(ctx.diagnostic.member);
        if (config == null || config.expression == null) return List.of();
        Member sm = ctx.source.findMember(ctx.diagnostic.detail);
        boolean array = sm != null && TypeRef.ARRAY.equals(sm.effectiveType().unwrapNullable().name);
        String rewritten = materializer.materialize(config.expression, ctx.diagnostic.detail, array);
        if (rewritten == null) return List.of();
        return List.of(Edit.of(key(ctx, "materialize"), "Materialize '" + ctx.diagnostic.detail + "' once",
                EditOperation.rewriteExpression(ctx.declaration.id, config.destMember, rewritten)));
    }

    /**
     * Fixes for a source member nothing receives. For the inverse direction of a reverse map the roles swap:
     * the member belongs to the destination type and is lost on the way back to the source type.
     */
    private List<Edit> missingDestination(Context ctx) {
        boolean reverse = MissingDestinationDetector.REVERSE.equals(ctx.diagnostic.detail);
        TypeShape from = reverse ? ctx.dest : ctx.source;
        TypeShape to = reverse ? ctx.source : ctx.dest;
        Member lost = from.findMember(ctx.diagnostic.member);
        if (lost == null) return List.of();
        String id = ctx.declaration.id;
        List<Edit> out = new ArrayList<>();
        if (!reverse) {
            out.add(Edit.of(key(ctx, "ignoreSource"), "Ignore source property '" + lost.name + "'",
                    EditOperation.ignoreSourceMember(id, lost.name)));
        }
        if (lost.type.isResolved() && to.findMemberIgnoreCase(lost.name) == null) {
            Member created = new Member(lost.name, lost.type, true, false, lost.nullable);
            out.add(Edit.of(key(ctx, "createProperty"), "Create property '" + lost.name + "' on " + to.simpleName(),
                    EditOperation.insertSourceMember(id, to.qualifiedName, created, MARKER_CREATED)));
        }
        out.add(Edit.of(key(ctx, "customMapping"), "Add a mapping comment for '" + lost.name + "'",
                EditOperation.insertComment(id, "",
                        "TODO: Create destination property or map '" + lost.name + "' to an existing property")));
        return out;
    }

    /**
     * A depth limit, or ignoring the members that close the loop. A single such member is the narrower fix
     * and comes first.
     */
    private List<Edit> recursion(Context ctx, RecursionDetector detector) {
        String id = ctx.declaration.id;
        Edit depth = Edit.of(key(ctx, "maxDepth"), "Limit mapping depth to " + SUGGESTED_MAX_DEPTH,
                EditOperation.setMaxDepth(id, SUGGESTED_MAX_DEPTH));
        List<String> names = new ArrayList<>();
        for (String name : detector.closingMembers(ctx.source, ctx.dest)) {
            if (ctx.dest.findMember(name) != null) names.add(name);
        }
        if (names.isEmpty()) return List.of(depth);
        if (names.size() == 1) {
            Edit ignore = Edit.of(key(ctx, "ignore"), "Ignore '" + names.get(0) + "'",
                    EditOperation.appendConfig(id, MemberConfig.ignore(names.get(0))));
            return List.of(ignore, depth);
        }
        EditOperation[] ops = new EditOperation[names.size()];
        for (int i = 0; i < ops.length; i++) {
            ops[i] = EditOperation.appendConfig(id, MemberConfig.ignore(names.get(i)));
        }
        return List.of(depth, Edit.of(key(ctx, "ignoreAll"), "Ignore " + String.join(", ", names), ops));
    }

    private Edit mapFrom(Context ctx, String suffix, String title, String body) {
        MemberConfig config = MemberConfig.mapFrom(ctx.dm.name, parameter + " -> " + body);
        return Edit.of(key(ctx, suffix), title, EditOperation.appendConfig(ctx.declaration.id, config));
    }

    private static Edit ignore(Context ctx) {
        return Edit.of(key(ctx, "ignore"), "Ignore '" + ctx.dm.name + "'",
                EditOperation.appendConfig(ctx.declaration.id, MemberConfig.ignore(ctx.dm.name)));
    }

    private String read(Member member) {
        return accessorStyle.read(parameter, member);
    }

    private static String key(Context ctx, String suffix) {
        return ctx.diagnostic.ruleId + "." + suffix;
    }

    private static boolean isString(TypeRef t) {
        return t != null && t.kind == TypeRefKind.PRIMITIVE && Objects.equals("String", t.name);
    }

    private static final class Context {
        final Diagnostic diagnostic;
        final MappingDeclaration declaration;
        final TypeShape source;
        final TypeShape dest;
        final Member dm;

        Context(Diagnostic diagnostic, MappingDeclaration declaration, TypeShape source, TypeShape dest, Member dm) {
            this.diagnostic = diagnostic;
            this.declaration = declaration;
            this.source = source;
            this.dest = dest;
            this.dm = dm;
        }
    }
}
