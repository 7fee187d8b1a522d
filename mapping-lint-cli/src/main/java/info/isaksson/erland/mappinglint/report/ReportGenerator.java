package info.isaksson.erland.mappinglint.report;

import info.isaksson.erland.mappinglint.analysis.AnalysisWarning;
import info.isaksson.erland.mappinglint.analysis.Diagnostic;
import info.isaksson.erland.mappinglint.analysis.MappingRule;
import info.isaksson.erland.mappinglint.analysis.Severity;
import info.isaksson.erland.mappinglint.core.Finding;
import info.isaksson.erland.mappinglint.core.MappingLintResult;
import info.isaksson.erland.mappinglint.fix.Edit;
import info.isaksson.erland.mappinglint.model.SourceLocation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Human-readable markdown report.
 *
 * <p>Findings are listed in result order, so the report is as deterministic as {@code findings.json}.</p>
 */
public final class ReportGenerator {

    private ReportGenerator() {}

    public static void writeMarkdown(Path reportPath,
                                     Path inputPath,
                                     Path findingsPath,
                                     MappingLintResult result,
                                     List<String> disabledRules,
                                     String failOn) throws IOException {
        Files.writeString(reportPath, toMarkdown(inputPath, findingsPath, result, disabledRules, failOn));
    }

    public static String toMarkdown(Path inputPath,
                                    Path findingsPath,
                                    MappingLintResult result,
                                    List<String> disabledRules,
                                    String failOn) {
        StringBuilder report = new StringBuilder();
        report.append("# mapping-lint report\n\n");

        report.append("## Summary\n\n");
        report.append("- Snapshot: `").append(inputPath).append("`\n");
        report.append("- Findings JSON: `").append(findingsPath).append("`\n");
        report.append("- Schema version: `").append(result.schemaVersion).append("`\n");
        report.append("- Findings: **").append(result.findings.size()).append("**\n");
        for (Severity s : Severity.values()) {
            report.append("  - ").append(s.name().toLowerCase()).append(": **").append(result.count(s)).append("**\n");
        }
        report.append("- Analysis warnings: **").append(result.warnings.size()).append("**\n");
        report.append("- Disabled rules: ").append(disabledRules.isEmpty() ? "_(none)_" : "`" + String.join("`, `", disabledRules) + "`").append("\n");
        report.append("- Fail on: **").append(failOn).append("**\n\n");

        report.append("## Rules\n\n");
        Map<MappingRule, Integer> perRule = countByRule(result);
        if (perRule.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("| Rule | Name | Findings |\n");
            report.append("|---|---|---:|\n");
            for (var e : perRule.entrySet()) {
                report.append("| ").append(e.getKey().id).append(" | ").append(e.getKey().displayName)
                        .append(" | ").append(e.getValue()).append(" |\n");
            }
        }

        report.append("\n## Findings\n\n");
        if (result.findings.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("| Severity | Rule | Declaration | Member | Location | Message |\n");
            report.append("|---|---|---|---|---|---|\n");
            for (Finding f : result.findings) {
                Diagnostic d = f.diagnostic;
                report.append("| ").append(d.severity.name().toLowerCase())
                        .append(" | ").append(d.ruleId)
                        .append(" | `").append(cell(d.declarationId)).append("`")
                        .append(" | ").append(d.member.isEmpty() ? "" : "`" + cell(d.member) + "`")
                        .append(" | ").append(location(d.location))
                        .append(" | ").append(cell(d.message)).append(" |\n");
            }
        }

        report.append("\n## Available fixes\n\n");
        boolean anyFix = false;
        for (Finding f : result.findings) {
            if (f.fixes.isEmpty()) continue;
            anyFix = true;
            report.append("- ").append(f.diagnostic.ruleId).append(" `").append(f.diagnostic.declarationId).append("`");
            if (!f.diagnostic.member.isEmpty()) report.append(" `").append(f.diagnostic.member).append("`");
            report.append("\n");
            for (Edit e : f.fixes) {
                report.append("  - ").append(e.title).append(" (`").append(e.key).append("`");
                if (e.isCommentOnly()) report.append(", advice only");
                report.append(")\n");
            }
        }
        if (!anyFix) report.append("_(none)_\n");

        report.append("\n## Analysis warnings\n\n");
        if (result.warnings.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (AnalysisWarning w : result.warnings) {
                report.append("- ").append(w.code).append(": ").append(w.message);
                if (!w.context.isEmpty()) report.append(" ").append(w.context);
                report.append("\n");
            }
        }
        return report.toString();
    }

    private static Map<MappingRule, Integer> countByRule(MappingLintResult result) {
        Map<MappingRule, Integer> out = new EnumMap<>(MappingRule.class);
        for (Finding f : result.findings) {
            out.merge(f.diagnostic.rule, 1, Integer::sum);
        }
        return out;
    }

    private static String location(SourceLocation loc) {
        if (loc == null || loc.file.isEmpty()) return "";
        return "`" + loc.file + ":" + loc.line + "`";
    }

    // Pipes would split the table cell.
    private static String cell(String s) {
        return s.replace("|", "\\|").replace("\n", " ");
    }
}
