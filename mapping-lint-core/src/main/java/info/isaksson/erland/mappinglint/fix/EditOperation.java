package info.isaksson.erland.mappinglint.fix;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.mappinglint.model.Member;
import info.isaksson.erland.mappinglint.model.MemberConfig;

import java.util.Objects;

/**
 * One step of an {@link Edit}. The payload depends on {@link #kind}: {@link #config} for append/remove,
 * {@link #text} for rewrite and comment, {@link #member} plus a marker {@link #text} for source member insertion,
 * the source member name or the depth as {@link #text} for the declaration-level kinds.
 */
@JsonPropertyOrder({"kind","anchor","config","member","text"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EditOperation {
    public final EditOperationKind kind;
    public final EditAnchor anchor;
    public final MemberConfig config;
    public final Member member;
    public final String text;

    private EditOperation(EditOperationKind kind, EditAnchor anchor, MemberConfig config, Member member, String text) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.anchor = Objects.requireNonNull(anchor, "anchor must not be null");
        this.config = config;
        this.member = member;
        this.text = text;
    }

    public static EditOperation appendConfig(String declarationId, MemberConfig config) {
        return new EditOperation(EditOperationKind.APPEND_MEMBER_CONFIG,
                EditAnchor.member(declarationId, config.destMember), config, null, null);
    }

    public static EditOperation removeConfig(String declarationId, MemberConfig config) {
        return new EditOperation(EditOperationKind.REMOVE_MEMBER_CONFIG,
                EditAnchor.member(declarationId, config.destMember), config, null, null);
    }

    public static EditOperation rewriteExpression(String declarationId, String destMember, String expression) {
        return new EditOperation(EditOperationKind.REWRITE_EXPRESSION,
                EditAnchor.member(declarationId, destMember), null, null, expression);
    }

    public static EditOperation insertComment(String declarationId, String destMember, String comment) {
        return new EditOperation(EditOperationKind.INSERT_COMMENT,
                EditAnchor.member(declarationId, destMember), null, null, comment);
    }

    public static EditOperation insertSourceMember(String declarationId, String typeName, Member member, String marker) {
        return new EditOperation(EditOperationKind.INSERT_SOURCE_MEMBER,
                EditAnchor.type(declarationId, typeName), null, member, marker);
    }

    public static EditOperation ignoreSourceMember(String declarationId, String sourceMember) {
        return new EditOperation(EditOperationKind.IGNORE_SOURCE_MEMBER,
                EditAnchor.member(declarationId, null), null, null, sourceMember);
    }

    public static EditOperation setMaxDepth(String declarationId, int depth) {
        if (depth < 1) throw new IllegalArgumentException("depth must be positive: " + depth);
        return new EditOperation(EditOperationKind.SET_MAX_DEPTH,
                EditAnchor.member(declarationId, null), null, null, Integer.toString(depth));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EditOperation)) return false;
        EditOperation that = (EditOperation) o;
        return kind == that.kind &&
                anchor.equals(that.anchor) &&
                Objects.equals(config, that.config) &&
                Objects.equals(member, that.member) &&
                Objects.equals(text, that.text);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, anchor, config, member, text);
    }

    @Override public String toString() {
        return kind + "@" + anchor.declarationId + (anchor.destMember.isEmpty() ? "" : "." + anchor.destMember);
    }
}
