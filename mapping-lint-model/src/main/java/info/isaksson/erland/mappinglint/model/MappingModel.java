package info.isaksson.erland.mappinglint.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Root of a mapping snapshot: everything the shape extractor and declaration collector reported.
 */
@JsonPropertyOrder({"schemaVersion","units"})
public final class MappingModel {
    public static final String SCHEMA_VERSION = "1.0";

    public final String schemaVersion;
    public final List<AnalysisUnit> units;

    @JsonCreator
    public MappingModel(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("units") List<AnalysisUnit> units
    ) {
        this.schemaVersion = (schemaVersion == null || schemaVersion.isBlank()) ? SCHEMA_VERSION : schemaVersion;
        this.units = units == null ? List.of() : List.copyOf(units);
    }

    public static MappingModel of(AnalysisUnit... units) {
        return new MappingModel(SCHEMA_VERSION, List.of(units));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MappingModel)) return false;
        MappingModel that = (MappingModel) o;
        return Objects.equals(schemaVersion, that.schemaVersion) && Objects.equals(units, that.units);
    }

    @Override public int hashCode() {
        return Objects.hash(schemaVersion, units);
    }
}
