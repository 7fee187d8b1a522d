package info.isaksson.erland.mappinglint.analysis;

import info.isaksson.erland.mappinglint.model.AnalysisUnit;
import info.isaksson.erland.mappinglint.model.ExpressionShape;
import info.isaksson.erland.mappinglint.model.ExpressionSummarizer;
import info.isaksson.erland.mappinglint.model.MappingDeclaration;
import info.isaksson.erland.mappinglint.model.MemberConfig;
import info.isaksson.erland.mappinglint.model.SummaryContext;
import info.isaksson.erland.mappinglint.model.TypeShape;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Runs one analysis pass over an {@link AnalysisUnit}:
 * <ol>
 *   <li>gives blank or repeated declaration ids a unique one,</li>
 *   <li>fills in missing expression summaries,</li>
 *   <li>builds the {@link MappingGraphResolver},</li>
 *   <li>classifies each declaration (convention, hazard, structure and registration rules),</li>
 *   <li>applies rule settings and orders the output.</li>
 * </ol>
 *
 * <p>The pass only reads the unit. With {@link AnalysisOptions#parallel} declarations are classified
 * concurrently; the output is identical either way. The calling thread's interrupt flag is checked between
 * declarations and an interrupted pass ends with {@link CancellationException}.</p>
 */
public final class MappingAnalyzer {

    private final ExpressionSummarizer summarizer;
    private final AnalysisOptions options;
    private final PerformanceHazardDetector hazards = new PerformanceHazardDetector();
    private final MissingDestinationDetector missingDestinations = new MissingDestinationDetector();

    public MappingAnalyzer(ExpressionSummarizer summarizer, AnalysisOptions options) {
        this.summarizer = summarizer == null ? ExpressionSummarizer.NONE : summarizer;
        this.options = options == null ? AnalysisOptions.DEFAULTS : options;
    }

    public UnitAnalysis analyze(AnalysisUnit unit) {
        if (unit == null) throw new IllegalArgumentException("unit must not be null");
        Thread caller = Thread.currentThread();

        AnalysisWarnings unitWarnings = new AnalysisWarnings(unit.name);
        AnalysisUnit completed = completeSummaries(assignDeclarationIds(unit, unitWarnings), caller);
        MappingGraphResolver resolver = new MappingGraphResolver(completed);
        CompatibilityClassifier classifier = new CompatibilityClassifier(resolver, options);
        RecursionDetector recursion = new RecursionDetector(completed);
        Set<Integer> duplicates = duplicateDeclarations(completed);

        IntStream indexes = IntStream.range(0, completed.declarations.size());
        if (options.parallel) indexes = indexes.parallel();
        List<DeclarationResult> results = indexes
                .mapToObj(i -> {
                    checkInterrupted(caller);
                    return analyzeDeclaration(completed, completed.declarations.get(i), duplicates.contains(i),
                            classifier, recursion);
                })
                .collect(Collectors.toList());
        checkInterrupted(caller);

        List<Diagnostic> diagnostics = new ArrayList<>();
        AnalysisWarnings warnings = new AnalysisWarnings(unit.name);
        warnings.addAll(unitWarnings);
        for (DeclarationResult r : results) {
            diagnostics.addAll(r.diagnostics);
            warnings.addAll(r.warnings);
        }
        return new UnitAnalysis(completed, diagnostics, warnings.toDeterministicList());
    }

    /**
     * Fixes are located by declaration id, so each declaration needs its own. A blank id, or one already used by an
     * earlier declaration, is replaced by {@code <unit>#<position>} and a warning is recorded.
     */
    private static AnalysisUnit assignDeclarationIds(AnalysisUnit unit, AnalysisWarnings warnings) {
        Set<String> used = new HashSet<>();
        for (MappingDeclaration d : unit.declarations) {
            if (!d.id.isBlank()) used.add(d.id);
        }
        Set<String> seen = new HashSet<>();
        List<MappingDeclaration> out = new ArrayList<>(unit.declarations.size());
        boolean changed = false;
        for (int i = 0; i < unit.declarations.size(); i++) {
            MappingDeclaration d = unit.declarations.get(i);
            if (!d.id.isBlank() && seen.add(d.id)) {
                out.add(d);
                continue;
            }
            String base = (unit.name.isBlank() ? "declaration" : unit.name) + "#" + (i + 1);
            String id = base;
            for (int k = 2; used.contains(id); k++) {
                id = base + "." + k;
            }
            used.add(id);
            seen.add(id);
            warnings.declaration(AnalysisWarnings.DECLARATION_ID_ASSIGNED,
                    (d.id.isBlank() ? "Declaration has no id" : "Declaration id '" + d.id + "' is not unique")
                            + "; using " + id, id);
            out.add(d.withId(id));
            changed = true;
        }
        return changed ? unit.withDeclarations(out) : unit;
    }

    /** Collect phase: summarize every {@code MAP_FROM} expression that arrived without a summary. */
    private AnalysisUnit completeSummaries(AnalysisUnit unit, Thread caller) {
        List<MappingDeclaration> out = new ArrayList<>(unit.declarations.size());
        for (MappingDeclaration d : unit.declarations) {
            checkInterrupted(caller);
            SummaryContext context = new SummaryContext(unit.findType(d.sourceType), d.captures);
            List<MemberConfig> configs = new ArrayList<>(d.memberConfigs.size());
            boolean changed = false;
            for (MemberConfig c : d.memberConfigs) {
                if (c.isMapFrom() && c.shape == null && c.expression != null) {
                    ExpressionShape shape = summarizer.summarize(c.expression, context);
                    configs.add(c.withShape(shape == null ? ExpressionShape.unsummarized(c.expression) : shape));
                    changed = true;
                } else {
                    configs.add(c);
                }
            }
            out.add(changed ? d.withMemberConfigs(configs) : d);
        }
        return unit.withDeclarations(out);
    }

    private DeclarationResult analyzeDeclaration(AnalysisUnit unit, MappingDeclaration declaration, boolean duplicate,
                                                 CompatibilityClassifier classifier, RecursionDetector recursion) {
        List<Diagnostic> out = new ArrayList<>();
        AnalysisWarnings warnings = new AnalysisWarnings(unit.name);

        TypeShape source = unit.findType(declaration.sourceType);
        TypeShape dest = unit.findType(declaration.destType);
        String sourceName = source != null ? source.simpleName() : simpleName(declaration.sourceType);
        String destName = dest != null ? dest.simpleName() : simpleName(declaration.destType);

        if (duplicate) {
            out.add(new Diagnostic(MappingRule.DUPLICATE_MAPPING, null, declaration.id, "", sourceName, "",
                    destName, "", "", declaration.location));
        }
        if (source == null) {
            warnings.declaration(AnalysisWarnings.UNKNOWN_SOURCE_TYPE,
                    "Source type not found in unit: " + declaration.sourceType, declaration.id);
        }
        if (dest == null) {
            warnings.declaration(AnalysisWarnings.UNKNOWN_DEST_TYPE,
                    "Destination type not found in unit: " + declaration.destType, declaration.id);
        }

        if (source != null && dest != null) {
            ConfigOverrides overrides = ConfigOverrides.of(declaration);
            for (MemberConfig c : overrides.effectiveMapFroms()) {
                if (c.shape != null && !c.shape.summarized) {
                    warnings.member(AnalysisWarnings.EXPRESSION_NOT_SUMMARIZED,
                            "Expression could not be summarized: " + c.expression, declaration.id, c.destMember);
                }
            }
            out.addAll(classifier.classify(declaration, source, dest, overrides, warnings));
            out.addAll(missingDestinations.detect(declaration, source, dest, warnings));
            out.addAll(hazards.detect(declaration, source, dest, overrides, warnings));
            try {
                Diagnostic loop = recursion.detect(declaration, source, dest, overrides);
                if (loop != null) out.add(loop);
            } catch (RuntimeException e) {
                warnings.memberFailed(declaration.id, "", e);
            }
            out.sort(memberOrder(dest));
        }

        List<Diagnostic> kept = new ArrayList<>(out.size());
        for (Diagnostic d : out) {
            if (!options.isEnabled(d.rule)) continue;
            kept.add(d.withSeverity(options.severityOf(d.rule)));
        }
        return new DeclarationResult(kept, warnings);
    }

    /** Declaration-level findings first, then destination member order, then rule. Stable for ties. */
    private static Comparator<Diagnostic> memberOrder(TypeShape dest) {
        return Comparator
                .comparingInt((Diagnostic d) -> memberIndex(dest, d.member))
                .thenComparingInt(d -> d.rule.ordinal());
    }

    private static int memberIndex(TypeShape dest, String member) {
        if (member.isEmpty()) return -1;
        for (int i = 0; i < dest.members.size(); i++) {
            if (dest.members.get(i).name.equals(member)) return i;
        }
        return Integer.MAX_VALUE;
    }

    /** Indexes of declarations repeating an earlier (source, dest) pair. */
    private static Set<Integer> duplicateDeclarations(AnalysisUnit unit) {
        Set<String> seen = new HashSet<>();
        Set<Integer> out = new HashSet<>();
        for (int i = 0; i < unit.declarations.size(); i++) {
            MappingDeclaration d = unit.declarations.get(i);
            String key = qualified(unit, d.sourceType) + "\u0000" + qualified(unit, d.destType);
            if (!seen.add(key)) out.add(i);
        }
        return out;
    }

    private static String qualified(AnalysisUnit unit, String typeName) {
        TypeShape t = unit.findType(typeName);
        return t != null ? t.qualifiedName : typeName;
    }

    private static String simpleName(String name) {
        int idx = name.lastIndexOf('.');
        return idx < 0 ? name : name.substring(idx + 1);
    }

    private static void checkInterrupted(Thread caller) {
        if (caller.isInterrupted()) {
            throw new CancellationException("analysis interrupted");
        }
    }

    private static final class DeclarationResult {
        final List<Diagnostic> diagnostics;
        final AnalysisWarnings warnings;

        DeclarationResult(List<Diagnostic> diagnostics, AnalysisWarnings warnings) {
            this.diagnostics = diagnostics;
            this.warnings = warnings;
        }
    }
}
