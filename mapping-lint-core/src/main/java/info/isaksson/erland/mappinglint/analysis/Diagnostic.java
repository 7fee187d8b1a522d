package info.isaksson.erland.mappinglint.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.mappinglint.model.SourceLocation;

import java.util.Objects;

/**
 * One finding. Type texts are display texts (simple names); {@link #message} is filled from the rule's template.
 */
@JsonPropertyOrder({"ruleId","rule","severity","declarationId","member","sourceType","sourceMemberType",
        "destType","destMemberType","detail","message","location"})
public final class Diagnostic {
    public final String ruleId;
    public final MappingRule rule;
    public final Severity severity;
    public final String declarationId;

    /** Destination member name (the unmapped source member for data-loss findings); empty for declaration-level findings. */
    public final String member;
    public final String sourceType;
    public final String sourceMemberType;
    public final String destType;
    public final String destMemberType;

    /** Rule-specific detail (source member name, hazard description...). */
    public final String detail;
    public final String message;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final SourceLocation location;

    public Diagnostic(MappingRule rule,
                      Severity severity,
                      String declarationId,
                      String member,
                      String sourceType,
                      String sourceMemberType,
                      String destType,
                      String destMemberType,
                      String detail,
                      SourceLocation location) {
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.ruleId = rule.id;
        this.severity = severity == null ? rule.defaultSeverity : severity;
        this.declarationId = Objects.requireNonNullElse(declarationId, "");
        this.member = Objects.requireNonNullElse(member, "");
        this.sourceType = Objects.requireNonNullElse(sourceType, "");
        this.sourceMemberType = Objects.requireNonNullElse(sourceMemberType, "");
        this.destType = Objects.requireNonNullElse(destType, "");
        this.destMemberType = Objects.requireNonNullElse(destMemberType, "");
        this.detail = Objects.requireNonNullElse(detail, "");
        this.location = location;
        this.message = rule.format(this.member, this.sourceType, this.sourceMemberType,
                this.destType, this.destMemberType, this.detail);
    }

    /** Same finding with another severity. */
    public Diagnostic withSeverity(Severity newSeverity) {
        if (newSeverity == severity) return this;
        return new Diagnostic(rule, newSeverity, declarationId, member, sourceType, sourceMemberType,
                destType, destMemberType, detail, location);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return rule == that.rule &&
                severity == that.severity &&
                Objects.equals(declarationId, that.declarationId) &&
                Objects.equals(member, that.member) &&
                Objects.equals(message, that.message) &&
                Objects.equals(location, that.location);
    }

    @Override public int hashCode() {
        return Objects.hash(rule, severity, declarationId, member, message, location);
    }

    @Override public String toString() {
        return ruleId + " " + severity + " [" + declarationId + "] " + message;
    }
}
