package info.isaksson.erland.mappinglint.analysis;

import info.isaksson.erland.mappinglint.model.AnalysisUnit;

import java.util.List;

/** Result of analyzing one {@link AnalysisUnit}. */
public final class UnitAnalysis {
    /** The analysed unit with every {@code MAP_FROM} expression summary filled in. */
    public final AnalysisUnit unit;

    /** Declaration order, then destination member order, then rule. */
    public final List<Diagnostic> diagnostics;
    public final List<AnalysisWarning> warnings;

    UnitAnalysis(AnalysisUnit unit, List<Diagnostic> diagnostics, List<AnalysisWarning> warnings) {
        this.unit = unit;
        this.diagnostics = List.copyOf(diagnostics);
        this.warnings = List.copyOf(warnings);
    }
}
