package info.isaksson.erland.mappinglint.core;

import info.isaksson.erland.mappinglint.analysis.Severity;
import info.isaksson.erland.mappinglint.fix.AccessorStyle;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Options for mapping-lint runs.
 *
 * <p>This mirrors the CLI flags in a structured form.</p>
 */
public final class MappingLintOptions {
    /** Rule ids ({@code ML050}) or names ({@code RedundantMapFrom}) to skip. */
    public Set<String> disabledRules = new LinkedHashSet<>();

    /** Rule id or name to the severity reported for it. */
    public Map<String, Severity> severityOverrides = new LinkedHashMap<>();

    /** Whether the expression hazard rules (ML031-ML034) run. */
    public boolean performanceRules = true;

    /**
     * Treat non-nullable reference-typed destination members as required, in addition to members flagged
     * {@code required} in the snapshot.
     */
    public boolean nonNullableReferencesRequired = false;

    /** Classify declarations in parallel. Output is identical either way. */
    public boolean parallel = false;

    /** Compute fixes for each finding. */
    public boolean synthesizeFixes = true;

    /** How generated fix expressions read source members. */
    public AccessorStyle accessorStyle = AccessorStyle.GETTER;

    /** Lambda parameter name used in generated fix expressions. */
    public String sourceParameterName = "src";
}
