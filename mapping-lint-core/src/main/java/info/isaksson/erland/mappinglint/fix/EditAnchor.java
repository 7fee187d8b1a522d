package info.isaksson.erland.mappinglint.fix;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Where an edit operation applies: a declaration, optionally one destination member, or a type. */
@JsonPropertyOrder({"declarationId","destMember","typeName"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class EditAnchor {
    public final String declarationId;
    public final String destMember;
    public final String typeName;

    public EditAnchor(String declarationId, String destMember, String typeName) {
        this.declarationId = Objects.requireNonNullElse(declarationId, "");
        this.destMember = Objects.requireNonNullElse(destMember, "");
        this.typeName = Objects.requireNonNullElse(typeName, "");
    }

    public static EditAnchor member(String declarationId, String destMember) {
        return new EditAnchor(declarationId, destMember, null);
    }

    public static EditAnchor type(String declarationId, String typeName) {
        return new EditAnchor(declarationId, null, typeName);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EditAnchor)) return false;
        EditAnchor that = (EditAnchor) o;
        return declarationId.equals(that.declarationId) && destMember.equals(that.destMember) && typeName.equals(that.typeName);
    }

    @Override public int hashCode() {
        return Objects.hash(declarationId, destMember, typeName);
    }
}
