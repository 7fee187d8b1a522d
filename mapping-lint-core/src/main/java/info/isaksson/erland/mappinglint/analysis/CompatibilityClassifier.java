package info.isaksson.erland.mappinglint.analysis;

import info.isaksson.erland.mappinglint.model.AccessorRef;
import info.isaksson.erland.mappinglint.model.MappingDeclaration;
import info.isaksson.erland.mappinglint.model.Member;
import info.isaksson.erland.mappinglint.model.MemberConfig;
import info.isaksson.erland.mappinglint.model.TypeRef;
import info.isaksson.erland.mappinglint.model.TypeShape;

import java.util.ArrayList;
import java.util.List;

/**
 * Convention rules for one declaration: compares every considered destination member with the source member
 * convention would read, and flags explicit mappings that convention already covers.
 *
 * <p>Each member is classified on its own; a failure on one member is recorded as a warning and the
 * remaining members are still classified.</p>
 */
public final class CompatibilityClassifier {

    private final MappingGraphResolver resolver;
    private final CollectionCompatibilityChecker collections;
    private final AnalysisOptions options;

    public CompatibilityClassifier(MappingGraphResolver resolver, AnalysisOptions options) {
        if (resolver == null) throw new IllegalArgumentException("resolver must not be null");
        this.resolver = resolver;
        this.collections = new CollectionCompatibilityChecker(resolver);
        this.options = options == null ? AnalysisOptions.DEFAULTS : options;
    }

    public List<Diagnostic> classify(MappingDeclaration declaration,
                                     TypeShape source,
                                     TypeShape dest,
                                     ConfigOverrides overrides,
                                     AnalysisWarnings warnings) {
        List<Diagnostic> out = new ArrayList<>();
        for (Member dm : dest.members) {
            if (!dm.settable && !isRequired(dm)) continue;
            try {
                Diagnostic d = classifyMember(declaration, source, dest, dm, overrides);
                if (d != null) out.add(d);
            } catch (RuntimeException e) {
                warnings.memberFailed(declaration.id, dm.name, e);
            }
        }
        for (MemberConfig config : overrides.effectiveMapFroms()) {
            try {
                Diagnostic d = redundantMapFrom(declaration, source, dest, config);
                if (d != null) out.add(d);
            } catch (RuntimeException e) {
                warnings.memberFailed(declaration.id, config.destMember, e);
            }
        }
        return out;
    }

    /** Required flag, or a non-nullable reference type when that option is on. */
    public boolean isRequired(Member dm) {
        if (dm.required) return true;
        if (!options.nonNullableReferencesRequired) return false;
        TypeRef t = dm.effectiveType();
        return t.isResolved() && !t.isNullable() && !t.isJavaPrimitive();
    }

    Diagnostic classifyMember(MappingDeclaration declaration, TypeShape source, TypeShape dest,
                              Member dm, ConfigOverrides overrides) {
        if (overrides.has(dm.name)) return null;

        Member sm = source.findMember(dm.name);
        if (sm == null) {
            Member ci = source.findMemberIgnoreCase(dm.name);
            if (ci != null) {
                return diagnostic(MappingRule.CASE_SENSITIVITY_MISMATCH, declaration, source, dest, dm, ci, ci.name);
            }
            if (isRequired(dm)) {
                return diagnostic(MappingRule.UNMAPPED_REQUIRED_PROPERTY, declaration, source, dest, dm, null, "");
            }
            return null;
        }

        MappingRule rule = compare(sm.effectiveType(), dm.effectiveType());
        return rule == null ? null : diagnostic(rule, declaration, source, dest, dm, sm, "");
    }

    /**
     * The convention rule violated by assigning {@code st} to {@code dt}, or null when compatible or unresolved.
     * Nullability is only reported when the unwrapped types are otherwise compatible.
     */
    MappingRule compare(TypeRef st, TypeRef dt) {
        if (!st.isResolved() || !dt.isResolved()) return null;
        if (st.equals(dt)) return null;
        boolean nullableLoss = st.isNullable() && !dt.isNullable();
        MappingRule mismatch = compareUnwrapped(st.unwrapNullable(), dt.unwrapNullable());
        if (mismatch != null) return mismatch;
        return nullableLoss ? MappingRule.NULLABLE_COMPATIBILITY : null;
    }

    private MappingRule compareUnwrapped(TypeRef s, TypeRef d) {
        if (s.equals(d)) return null;
        if (TypeCompatibility.widens(s, d)) return null;
        if (s.isCollection() && d.isCollection()) {
            return collections.compatible(s, d) ? null : MappingRule.GENERIC_TYPE_MISMATCH;
        }
        if (s.isUserDefined() && d.isUserDefined()) {
            return resolver.effectivelyMapped(s, d) ? null : MappingRule.COMPLEX_TYPE_MAPPING_MISSING;
        }
        return MappingRule.PROPERTY_TYPE_MISMATCH;
    }

    /**
     * A bare read of the same-named source member is what convention does anyway. Not flagged when the source
     * member is missing from the shape or its type differs from the destination's.
     */
    Diagnostic redundantMapFrom(MappingDeclaration declaration, TypeShape source, TypeShape dest, MemberConfig config) {
        if (config.shape == null) return null;
        AccessorRef accessor = config.shape.bareAccess();
        if (accessor == null || !accessor.matches(config.destMember)) return null;
        Member dm = dest.findMember(config.destMember);
        Member sm = accessor.resolve(source);
        if (dm == null || sm == null) return null;
        if (!sm.name.equals(dm.name)) return null;
        if (!sm.effectiveType().equals(dm.effectiveType())) return null;
        return new Diagnostic(MappingRule.REDUNDANT_MAP_FROM, null, declaration.id, dm.name,
                source.simpleName(), sm.effectiveType().display(), dest.simpleName(), dm.effectiveType().display(),
                accessor.text(), config.location != null ? config.location : declaration.location);
    }

    private static Diagnostic diagnostic(MappingRule rule, MappingDeclaration declaration, TypeShape source,
                                         TypeShape dest, Member dm, Member sm, String detail) {
        return new Diagnostic(rule, null, declaration.id, dm.name,
                source.simpleName(), sm == null ? "" : sm.effectiveType().display(),
                dest.simpleName(), dm.effectiveType().display(),
                detail, declaration.location);
    }
}
