package info.isaksson.erland.mappinglint.fix;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** An independently selectable fix: a stable key, a title and the operations to apply together. */
@JsonPropertyOrder({"key","title","operations"})
public final class Edit {
    public final String key;
    public final String title;
    public final List<EditOperation> operations;

    public Edit(String key, String title, List<EditOperation> operations) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.title = Objects.requireNonNullElse(title, key);
        if (operations == null || operations.isEmpty()) {
            throw new IllegalArgumentException("edit '" + key + "' has no operations");
        }
        this.operations = List.copyOf(operations);
    }

    public static Edit of(String key, String title, EditOperation... operations) {
        return new Edit(key, title, List.of(operations));
    }

    /** True when applying the edit leaves the snapshot unchanged (comment-only). */
    @JsonIgnore
    public boolean isCommentOnly() {
        for (EditOperation op : operations) {
            if (op.kind != EditOperationKind.INSERT_COMMENT) return false;
        }
        return true;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edit)) return false;
        Edit that = (Edit) o;
        return key.equals(that.key) && title.equals(that.title) && operations.equals(that.operations);
    }

    @Override public int hashCode() {
        return Objects.hash(key, title, operations);
    }

    @Override public String toString() {
        return key + ": " + title;
    }
}
