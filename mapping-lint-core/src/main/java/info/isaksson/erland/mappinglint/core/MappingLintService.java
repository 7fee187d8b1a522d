package info.isaksson.erland.mappinglint.core;

import info.isaksson.erland.mappinglint.analysis.AnalysisOptions;
import info.isaksson.erland.mappinglint.analysis.AnalysisWarning;
import info.isaksson.erland.mappinglint.analysis.Diagnostic;
import info.isaksson.erland.mappinglint.analysis.MappingAnalyzer;
import info.isaksson.erland.mappinglint.analysis.MappingRule;
import info.isaksson.erland.mappinglint.analysis.Severity;
import info.isaksson.erland.mappinglint.analysis.UnitAnalysis;
import info.isaksson.erland.mappinglint.expr.JavaLambdaSummarizer;
import info.isaksson.erland.mappinglint.fix.Edit;
import info.isaksson.erland.mappinglint.fix.FixSynthesizer;
import info.isaksson.erland.mappinglint.fix.SnapshotEditor;
import info.isaksson.erland.mappinglint.model.AnalysisUnit;
import info.isaksson.erland.mappinglint.model.ExpressionSummarizer;
import info.isaksson.erland.mappinglint.model.MappingModel;
import info.isaksson.erland.mappinglint.model.ModelJson;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Core API for analyzing mapping snapshots.
 *
 * <p>CLI and editor integrations should use this class instead of re-implementing the pipeline.</p>
 */
public final class MappingLintService {

    private final ExpressionSummarizer summarizer;
    private final SnapshotEditor editor = new SnapshotEditor();

    public MappingLintService() {
        this(new JavaLambdaSummarizer());
    }

    public MappingLintService(ExpressionSummarizer summarizer) {
        if (summarizer == null) throw new IllegalArgumentException("summarizer must not be null");
        this.summarizer = summarizer;
    }

    /** Analyze a JSON snapshot file. */
    public MappingLintResult analyze(Path snapshot, MappingLintOptions options) throws IOException {
        if (snapshot == null) throw new IllegalArgumentException("snapshot must not be null");
        return analyze(ModelJson.read(snapshot), options);
    }

    /** Analyze every unit of {@code model}; units are analysed independently. */
    public MappingLintResult analyze(MappingModel model, MappingLintOptions options) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        if (options == null) options = new MappingLintOptions();

        MappingAnalyzer analyzer = new MappingAnalyzer(summarizer, toAnalysisOptions(options));
        FixSynthesizer fixes = fixSynthesizer(options);

        List<UnitAnalysis> analyses = new ArrayList<>();
        List<Finding> findings = new ArrayList<>();
        List<AnalysisWarning> warnings = new ArrayList<>();
        for (AnalysisUnit unit : model.units) {
            UnitAnalysis analysis = analyzer.analyze(unit);
            analyses.add(analysis);
            for (Diagnostic d : analysis.diagnostics) {
                List<Edit> edits = options.synthesizeFixes ? fixes.synthesize(d, analysis.unit) : List.of();
                findings.add(new Finding(unit.name, d, edits));
            }
            warnings.addAll(analysis.warnings);
        }
        return new MappingLintResult(model.schemaVersion, findings, warnings, analyses);
    }

    /** Analyze a single unit. */
    public UnitAnalysis analyze(AnalysisUnit unit, MappingLintOptions options) {
        if (options == null) options = new MappingLintOptions();
        return new MappingAnalyzer(summarizer, toAnalysisOptions(options)).analyze(unit);
    }

    /**
     * Fixes for one diagnostic, computed against {@code unit} as it was analysed. Pass {@link UnitAnalysis#unit}
     * when the analysis assigned declaration ids.
     */
    public List<Edit> fixesFor(Diagnostic diagnostic, AnalysisUnit unit, MappingLintOptions options) {
        if (options == null) options = new MappingLintOptions();
        return fixSynthesizer(options).synthesize(diagnostic, unit);
    }

    /** Apply one fix to a unit; analyze the returned unit again to see the effect. */
    public AnalysisUnit applyFix(AnalysisUnit unit, Edit edit) {
        return editor.apply(unit, edit);
    }

    static AnalysisOptions toAnalysisOptions(MappingLintOptions options) {
        Set<MappingRule> disabled = EnumSet.noneOf(MappingRule.class);
        for (String key : options.disabledRules) {
            disabled.add(rule(key));
        }
        if (!options.performanceRules) {
            for (MappingRule r : MappingRule.values()) {
                if (r.group == MappingRule.Group.HAZARD) disabled.add(r);
            }
        }
        Map<MappingRule, Severity> severities = new EnumMap<>(MappingRule.class);
        for (Map.Entry<String, Severity> e : options.severityOverrides.entrySet()) {
            if (e.getValue() == null) throw new IllegalArgumentException("No severity given for rule " + e.getKey());
            severities.put(rule(e.getKey()), e.getValue());
        }
        return new AnalysisOptions(disabled, severities, options.nonNullableReferencesRequired, options.parallel);
    }

    private static FixSynthesizer fixSynthesizer(MappingLintOptions options) {
        return new FixSynthesizer(options.accessorStyle, options.sourceParameterName);
    }

    private static MappingRule rule(String key) {
        MappingRule r = MappingRule.fromKey(key);
        if (r == null) throw new IllegalArgumentException("Unknown rule: " + key);
        return r;
    }
}
