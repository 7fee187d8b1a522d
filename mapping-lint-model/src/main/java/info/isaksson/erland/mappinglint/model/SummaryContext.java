package info.isaksson.erland.mappinglint.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a summarizer may know besides the expression text: the source shape (may be null when unknown)
 * and the captured variables of the declaration.
 */
public final class SummaryContext {
    public final TypeShape sourceType;
    public final Map<String, String> captures;

    public SummaryContext(TypeShape sourceType, Map<String, String> captures) {
        this.sourceType = sourceType;
        this.captures = captures == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(captures));
    }

    public static SummaryContext of(TypeShape sourceType) {
        return new SummaryContext(sourceType, null);
    }
}
