package info.isaksson.erland.mappinglint.analysis;

import info.isaksson.erland.mappinglint.model.TypeRef;
import info.isaksson.erland.mappinglint.model.TypeRefKind;

/**
 * Element-type check for collection-to-collection members.
 *
 * <p>Container kinds may differ ({@code List} to {@code Set}, arrays to lists). Elements are compatible when
 * equal, when the source element widens to the destination element, or when both are user-defined and mapped
 * in the unit. Element nullability is ignored. Nested collections and generics are not classified.</p>
 */
public final class CollectionCompatibilityChecker {

    private final MappingGraphResolver resolver;

    public CollectionCompatibilityChecker(MappingGraphResolver resolver) {
        if (resolver == null) throw new IllegalArgumentException("resolver must not be null");
        this.resolver = resolver;
    }

    /** True when {@code from} can be mapped to {@code to} by convention; both must be collections. */
    public boolean compatible(TypeRef from, TypeRef to) {
        if (from == null || to == null || !from.isCollection() || !to.isCollection()) {
            throw new IllegalArgumentException("both types must be collections");
        }
        TypeRef a = from.elementType().unwrapNullable();
        TypeRef b = to.elementType().unwrapNullable();
        if (a.equals(b)) return true;
        if (isNested(a) || isNested(b)) return true;
        if (TypeCompatibility.widens(a, b)) return true;
        return a.isUserDefined() && b.isUserDefined() && resolver.effectivelyMapped(a, b);
    }

    private static boolean isNested(TypeRef t) {
        return t.kind == TypeRefKind.COLLECTION || t.kind == TypeRefKind.GENERIC;
    }
}
