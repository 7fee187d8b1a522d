package info.isaksson.erland.mappinglint.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.mappinglint.analysis.AnalysisWarning;
import info.isaksson.erland.mappinglint.analysis.Severity;
import info.isaksson.erland.mappinglint.analysis.UnitAnalysis;

import java.util.List;

/** Analysis result container for programmatic usage; also the findings document the CLI writes. */
@JsonPropertyOrder({"tool","schemaVersion","findings","warnings"})
public final class MappingLintResult {
    public static final String TOOL = "mapping-lint";

    public final String tool = TOOL;
    public final String schemaVersion;

    /** Unit order, then declaration order, then destination member order, then rule. */
    public final List<Finding> findings;
    public final List<AnalysisWarning> warnings;

    /** Per-unit analyses, including the units with completed expression summaries. */
    @JsonIgnore
    public final List<UnitAnalysis> units;

    MappingLintResult(String schemaVersion, List<Finding> findings, List<AnalysisWarning> warnings, List<UnitAnalysis> units) {
        this.schemaVersion = schemaVersion;
        this.findings = List.copyOf(findings);
        this.warnings = List.copyOf(warnings);
        this.units = List.copyOf(units);
    }

    /** Number of findings of {@code severity} or more severe. */
    public int countAtLeast(Severity severity) {
        int n = 0;
        for (Finding f : findings) {
            if (f.diagnostic.severity.isAtLeast(severity)) n++;
        }
        return n;
    }

    public int count(Severity severity) {
        int n = 0;
        for (Finding f : findings) {
            if (f.diagnostic.severity == severity) n++;
        }
        return n;
    }
}
