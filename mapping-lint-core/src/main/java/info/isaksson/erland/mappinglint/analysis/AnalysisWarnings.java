package info.isaksson.erland.mappinglint.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Warnings raised while one analysis unit is checked. Every warning carries the unit name and the
 * declaration it concerns, plus the member when there is one.
 *
 * <p>Not thread-safe; parallel passes collect per declaration and {@link #addAll} afterwards.</p>
 */
public final class AnalysisWarnings {

    public static final String UNKNOWN_SOURCE_TYPE = "UNKNOWN_SOURCE_TYPE";
    public static final String UNKNOWN_DEST_TYPE = "UNKNOWN_DEST_TYPE";
    public static final String MEMBER_CLASSIFICATION_FAILED = "MEMBER_CLASSIFICATION_FAILED";
    public static final String EXPRESSION_NOT_SUMMARIZED = "EXPRESSION_NOT_SUMMARIZED";
    public static final String DECLARATION_ID_ASSIGNED = "DECLARATION_ID_ASSIGNED";

    private static final Comparator<AnalysisWarning> ORDER = Comparator
            .comparing((AnalysisWarning w) -> w.code)
            .thenComparing(w -> w.context.getOrDefault("declaration", ""))
            .thenComparing(w -> w.context.getOrDefault("member", ""))
            .thenComparing(w -> w.message);

    private final String unit;
    private final List<AnalysisWarning> warnings = new ArrayList<>();

    public AnalysisWarnings(String unit) {
        this.unit = unit == null ? "" : unit;
    }

    public void declaration(String code, String message, String declarationId) {
        member(code, message, declarationId, null);
    }

    public void member(String code, String message, String declarationId, String member) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("unit", unit);
        context.put("declaration", declarationId == null ? "" : declarationId);
        if (member != null && !member.isEmpty()) context.put("member", member);
        warnings.add(new AnalysisWarning(code, message, context));
    }

    /** A check that threw on one member; the remaining members are still checked. */
    public void memberFailed(String declarationId, String member, RuntimeException e) {
        member(MEMBER_CLASSIFICATION_FAILED, e.getClass().getSimpleName() + ": " + e.getMessage(), declarationId, member);
    }

    public void addAll(AnalysisWarnings other) {
        if (other != null) warnings.addAll(other.warnings);
    }

    /** Ordered by code, declaration, member, then message; the unit is the same for all. */
    public List<AnalysisWarning> toDeterministicList() {
        List<AnalysisWarning> out = new ArrayList<>(warnings);
        out.sort(ORDER);
        return List.copyOf(out);
    }
}
