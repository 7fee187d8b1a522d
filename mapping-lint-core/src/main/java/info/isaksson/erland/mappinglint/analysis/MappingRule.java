package info.isaksson.erland.mappinglint.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The rules the analyzer reports, with their stable ids, default severities and message templates.
 *
 * <p>Templates use {@code {0}} member, {@code {1}} source type, {@code {2}} source member type,
 * {@code {3}} destination type, {@code {4}} destination member type and {@code {5}} detail.
 * Message wording is part of the output contract.</p>
 */
public enum MappingRule {
    PROPERTY_TYPE_MISMATCH("ML001", "PropertyTypeMismatch", Severity.ERROR, Group.CONVENTION,
            "Property '{0}' type mismatch: {1}.{0} is '{2}' but {3}.{0} is '{4}'"),
    NULLABLE_COMPATIBILITY("ML002", "NullableCompatibility", Severity.WARNING, Group.CONVENTION,
            "Property '{0}' has nullable compatibility issue: {1}.{0} ({2}) can be null but {3}.{0} ({4}) is non-nullable"),
    GENERIC_TYPE_MISMATCH("ML003", "GenericTypeMismatch", Severity.ERROR, Group.CONVENTION,
            "Property '{0}' has incompatible collection element types: {1}.{0} ({2}) cannot be mapped to {3}.{0} ({4}) without explicit conversion"),
    MISSING_DESTINATION_PROPERTY("ML004", "MissingDestinationProperty", Severity.WARNING, Group.CONVENTION,
            "Source property '{0}' will not be mapped - potential data loss"),
    CASE_SENSITIVITY_MISMATCH("ML005", "CaseSensitivityMismatch", Severity.WARNING, Group.CONVENTION,
            "Property '{5}' in source differs only in casing from destination property '{0}' - consider explicit mapping or case-insensitive configuration"),
    UNMAPPED_REQUIRED_PROPERTY("ML011", "UnmappedRequiredProperty", Severity.ERROR, Group.CONVENTION,
            "Required property '{0}' in destination is not mapped from any source property and will cause a runtime exception"),
    COMPLEX_TYPE_MAPPING_MISSING("ML020", "ComplexTypeMappingMissing", Severity.ERROR, Group.CONVENTION,
            "Property '{0}' requires mapping configuration between '{2}' and '{4}' ({1}.{0} to {3}.{0})"),
    INFINITE_RECURSION_RISK("ML022", "InfiniteRecursionRisk", Severity.WARNING, Group.STRUCTURE,
            "Potential infinite recursion detected: {1} to {3} mapping may cause stack overflow due to circular references"),
    SELF_REFERENCING_TYPE("ML023", "SelfReferencingType", Severity.WARNING, Group.STRUCTURE,
            "Self-referencing type detected: {5} contains properties of its own type, which may cause infinite recursion"),
    EXPENSIVE_OPERATION_IN_MAP_FROM("ML031", "ExpensiveOperationInMapFrom", Severity.WARNING, Group.HAZARD,
            "Property '{0}' mapping contains {5} that should be performed before mapping to avoid performance issues"),
    MULTIPLE_ENUMERATION("ML032", "MultipleEnumeration", Severity.WARNING, Group.HAZARD,
            "Property '{0}' mapping enumerates collection '{5}' multiple times. Consider materializing it once before use."),
    TASK_RESULT_SYNCHRONOUS_ACCESS("ML033", "TaskResultSynchronousAccess", Severity.WARNING, Group.HAZARD,
            "Property '{0}' mapping blocks on asynchronous result '{5}' which can cause deadlocks. Complete async operations before mapping."),
    NON_DETERMINISTIC_OPERATION("ML034", "NonDeterministicOperation", Severity.INFO, Group.HAZARD,
            "Property '{0}' mapping uses {5} which produces non-deterministic results. Consider computing before mapping for testability."),
    DUPLICATE_MAPPING("ML041", "DuplicateMapping", Severity.WARNING, Group.REGISTRATION,
            "Mapping from '{1}' to '{3}' is already registered"),
    REDUNDANT_MAP_FROM("ML050", "RedundantMapFrom", Severity.INFO, Group.CONVENTION,
            "Explicit mapping for '{0}' is redundant because the property name matches the source");

    /** Which part of the analysis produces the rule. */
    public enum Group {
        CONVENTION,
        HAZARD,
        STRUCTURE,
        REGISTRATION
    }

    public final String id;
    public final String displayName;
    public final Severity defaultSeverity;
    public final Group group;
    private final String template;

    MappingRule(String id, String displayName, Severity defaultSeverity, Group group, String template) {
        this.id = id;
        this.displayName = displayName;
        this.defaultSeverity = defaultSeverity;
        this.group = group;
        this.template = template;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    /** Fills the template. Null arguments render as empty text. */
    public String format(String member, String sourceType, String sourceMemberType,
                         String destType, String destMemberType, String detail) {
        String[] args = {member, sourceType, sourceMemberType, destType, destMemberType, detail};
        StringBuilder sb = new StringBuilder(template.length() + 64);
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{' && i + 2 < template.length() && template.charAt(i + 2) == '}'
                    && Character.isDigit(template.charAt(i + 1))) {
                int idx = template.charAt(i + 1) - '0';
                if (idx < args.length) {
                    sb.append(args[idx] == null ? "" : args[idx]);
                    i += 3;
                    continue;
                }
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    /** Looks a rule up by id ({@code ML001}), display name or constant name, ignoring case; null when unknown. */
    public static MappingRule fromKey(String key) {
        if (key == null) return null;
        String k = key.trim();
        for (MappingRule r : values()) {
            if (r.id.equalsIgnoreCase(k) || r.displayName.equalsIgnoreCase(k) || r.name().equalsIgnoreCase(k)) return r;
        }
        return null;
    }

    @Override public String toString() {
        return id + " " + displayName;
    }
}
