package info.isaksson.erland.mappinglint.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Where a declaration or member config sits in the analysed source (as reported by the collector). */
@JsonPropertyOrder({"file","line","column"})
public final class SourceLocation {
    public final String file;
    public final int line;
    public final int column;

    @JsonCreator
    public SourceLocation(
            @JsonProperty("file") String file,
            @JsonProperty("line") int line,
            @JsonProperty("column") int column
    ) {
        this.file = Objects.requireNonNullElse(file, "");
        this.line = Math.max(0, line);
        this.column = Math.max(0, column);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && Objects.equals(file, that.file);
    }

    @Override public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override public String toString() {
        return file + ":" + line + ":" + column;
    }
}
