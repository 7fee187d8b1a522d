package info.isaksson.erland.mappinglint.analysis;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/** Options for a single analysis pass. Immutable. */
public final class AnalysisOptions {

    public static final AnalysisOptions DEFAULTS = new AnalysisOptions(null, null, false, false);

    public final Set<MappingRule> disabledRules;
    public final Map<MappingRule, Severity> severityOverrides;

    /** Treat every non-nullable reference-typed destination member as required. */
    public final boolean nonNullableReferencesRequired;

    /** Classify declarations on the common fork-join pool. Output order is unaffected. */
    public final boolean parallel;

    public AnalysisOptions(Set<MappingRule> disabledRules,
                           Map<MappingRule, Severity> severityOverrides,
                           boolean nonNullableReferencesRequired,
                           boolean parallel) {
        this.disabledRules = disabledRules == null || disabledRules.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(MappingRule.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(disabledRules));
        this.severityOverrides = severityOverrides == null || severityOverrides.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(MappingRule.class))
                : Collections.unmodifiableMap(new EnumMap<>(severityOverrides));
        this.nonNullableReferencesRequired = nonNullableReferencesRequired;
        this.parallel = parallel;
    }

    public boolean isEnabled(MappingRule rule) {
        return !disabledRules.contains(rule);
    }

    public Severity severityOf(MappingRule rule) {
        return severityOverrides.getOrDefault(rule, rule.defaultSeverity);
    }
}
