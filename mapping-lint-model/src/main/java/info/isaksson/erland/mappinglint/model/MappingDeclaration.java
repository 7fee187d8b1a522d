package info.isaksson.erland.mappinglint.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A registered intent to map {@link #sourceType} to {@link #destType}, with its explicit member configs
 * in declaration order.
 */
@JsonPropertyOrder({"id","sourceType","destType","reverseMap","maxDepth","captures","ignoredSourceMembers","memberConfigs","location"})
public final class MappingDeclaration {
    public final String id;
    public final String sourceType;
    public final String destType;

    /** The declaration also registers the inverse mapping. */
    public final boolean reverseMap;

    /** Nesting limit configured on the declaration; null when unlimited. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final Integer maxDepth;

    /** Captured variables visible to member expressions: name to declared type text. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, String> captures;

    /** Source members deliberately left unmapped (not validated for data loss). */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> ignoredSourceMembers;

    public final List<MemberConfig> memberConfigs;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final SourceLocation location;

    @JsonCreator
    public MappingDeclaration(
            @JsonProperty("id") String id,
            @JsonProperty("sourceType") String sourceType,
            @JsonProperty("destType") String destType,
            @JsonProperty("reverseMap") boolean reverseMap,
            @JsonProperty("maxDepth") Integer maxDepth,
            @JsonProperty("captures") Map<String, String> captures,
            @JsonProperty("ignoredSourceMembers") List<String> ignoredSourceMembers,
            @JsonProperty("memberConfigs") List<MemberConfig> memberConfigs,
            @JsonProperty("location") SourceLocation location
    ) {
        this.id = Objects.requireNonNullElse(id, "");
        this.sourceType = Objects.requireNonNullElse(sourceType, "");
        this.destType = Objects.requireNonNullElse(destType, "");
        this.reverseMap = reverseMap;
        this.maxDepth = maxDepth;
        this.captures = captures == null || captures.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(captures));
        this.ignoredSourceMembers = ignoredSourceMembers == null ? List.of() : List.copyOf(ignoredSourceMembers);
        this.memberConfigs = memberConfigs == null ? List.of() : List.copyOf(memberConfigs);
        this.location = location;
    }

    public static MappingDeclaration of(String id, String sourceType, String destType, MemberConfig... configs) {
        return new MappingDeclaration(id, sourceType, destType, false, null, null, null, List.of(configs), null);
    }

    public MappingDeclaration withId(String value) {
        return new MappingDeclaration(value, sourceType, destType, reverseMap, maxDepth, captures, ignoredSourceMembers, memberConfigs, location);
    }

    public MappingDeclaration withReverseMap(boolean value) {
        return new MappingDeclaration(id, sourceType, destType, value, maxDepth, captures, ignoredSourceMembers, memberConfigs, location);
    }

    public MappingDeclaration withMaxDepth(Integer value) {
        return new MappingDeclaration(id, sourceType, destType, reverseMap, value, captures, ignoredSourceMembers, memberConfigs, location);
    }

    public MappingDeclaration withCaptures(Map<String, String> value) {
        return new MappingDeclaration(id, sourceType, destType, reverseMap, maxDepth, value, ignoredSourceMembers, memberConfigs, location);
    }

    /** Returns this declaration when {@code member} is already ignored. */
    public MappingDeclaration withIgnoredSourceMember(String member) {
        if (ignoredSourceMembers.contains(member)) return this;
        List<String> out = new ArrayList<>(ignoredSourceMembers);
        out.add(member);
        return new MappingDeclaration(id, sourceType, destType, reverseMap, maxDepth, captures, out, memberConfigs, location);
    }

    public MappingDeclaration withMemberConfigs(List<MemberConfig> value) {
        return new MappingDeclaration(id, sourceType, destType, reverseMap, maxDepth, captures, ignoredSourceMembers, value, location);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MappingDeclaration)) return false;
        MappingDeclaration that = (MappingDeclaration) o;
        return reverseMap == that.reverseMap &&
                Objects.equals(id, that.id) &&
                Objects.equals(sourceType, that.sourceType) &&
                Objects.equals(destType, that.destType) &&
                Objects.equals(maxDepth, that.maxDepth) &&
                Objects.equals(captures, that.captures) &&
                Objects.equals(ignoredSourceMembers, that.ignoredSourceMembers) &&
                Objects.equals(memberConfigs, that.memberConfigs) &&
                Objects.equals(location, that.location);
    }

    @Override public int hashCode() {
        return Objects.hash(id, sourceType, destType, reverseMap, maxDepth, captures, ignoredSourceMembers, memberConfigs, location);
    }

    @Override public String toString() {
        return "MappingDeclaration{" + id + ": " + sourceType + " -> " + destType + (reverseMap ? " (+reverse)" : "") + "}";
    }
}
