package info.isaksson.erland.mappinglint.core;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.mappinglint.analysis.Diagnostic;
import info.isaksson.erland.mappinglint.fix.Edit;

import java.util.List;
import java.util.Objects;

/** A diagnostic with the unit it was found in and its available fixes. */
@JsonPropertyOrder({"unit","diagnostic","fixes"})
public final class Finding {
    public final String unit;
    public final Diagnostic diagnostic;
    public final List<Edit> fixes;

    public Finding(String unit, Diagnostic diagnostic, List<Edit> fixes) {
        this.unit = Objects.requireNonNullElse(unit, "");
        this.diagnostic = Objects.requireNonNull(diagnostic, "diagnostic must not be null");
        this.fixes = fixes == null ? List.of() : List.copyOf(fixes);
    }
}
