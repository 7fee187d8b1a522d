package info.isaksson.erland.mappinglint.model;

/** Shape category of a {@link TypeRef}. */
public enum TypeRefKind {
    /** Java primitives and built-in scalar value types ({@code String}, {@code BigDecimal}, {@code java.time}...). */
    PRIMITIVE,
    /** Nullable wrapper around exactly one argument. */
    NULLABLE,
    /** Single-element container (List, Set, Iterable, arrays...). */
    COLLECTION,
    /** A type declared by the analysed application. */
    USER_DEFINED,
    /** Any other parameterized type (Optional, Map...). */
    GENERIC,
    /** Could not be resolved; members of this type are never classified. */
    UNRESOLVED
}
