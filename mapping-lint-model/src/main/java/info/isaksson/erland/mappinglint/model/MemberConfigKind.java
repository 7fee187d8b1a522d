package info.isaksson.erland.mappinglint.model;

/** Kind of explicit per-member configuration. */
public enum MemberConfigKind {
    MAP_FROM,
    IGNORE,
    CONDITION,
    CONSTANT
}
