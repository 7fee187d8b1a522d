package info.isaksson.erland.mappinglint.fix;

public enum EditOperationKind {
    /** Add a member config to the end of a declaration. */
    APPEND_MEMBER_CONFIG,
    /** Remove every config equal to the payload config. */
    REMOVE_MEMBER_CONFIG,
    /** Replace the expression of a member's effective config. */
    REWRITE_EXPRESSION,
    /** Advisory comment at the declaration; leaves the snapshot unchanged. */
    INSERT_COMMENT,
    /** Add a member to a type shape, with a marker comment. */
    INSERT_SOURCE_MEMBER,
    /** Exclude a source member from the declaration's data-loss check. */
    IGNORE_SOURCE_MEMBER,
    /** Limit the nesting depth of a declaration. */
    SET_MAX_DEPTH
}
