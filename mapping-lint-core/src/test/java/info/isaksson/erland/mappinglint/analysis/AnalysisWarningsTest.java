package info.isaksson.erland.mappinglint.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class AnalysisWarningsTest {

    @Test
    void warningsCarryUnitDeclarationAndMember() {
        AnalysisWarnings warnings = new AnalysisWarnings("shop");
        warnings.member(AnalysisWarnings.EXPRESSION_NOT_SUMMARIZED, "Expression could not be summarized: x", "p1", "name");
        warnings.declaration(AnalysisWarnings.UNKNOWN_DEST_TYPE, "Destination type not found in unit: B", "p1");

        List<AnalysisWarning> list = warnings.toDeterministicList();
        assertEquals(Map.of("unit", "shop", "declaration", "p1", "member", "name"), list.get(0).context);
        assertEquals(Map.of("unit", "shop", "declaration", "p1"), list.get(1).context);
    }

    @Test
    void failuresAreOrderedByDeclarationThenMember() {
        AnalysisWarnings first = new AnalysisWarnings("u");
        first.memberFailed("p2", "age", new IllegalStateException("boom"));
        AnalysisWarnings second = new AnalysisWarnings("u");
        second.memberFailed("p1", "name", new NullPointerException("npe"));
        second.memberFailed("p1", "age", new NullPointerException("npe"));
        first.addAll(second);

        List<String> order = first.toDeterministicList().stream()
                .map(w -> w.context.get("declaration") + "." + w.context.get("member"))
                .collect(Collectors.toList());
        assertEquals(List.of("p1.age", "p1.name", "p2.age"), order);
        assertEquals("IllegalStateException: boom", first.toDeterministicList().get(2).message);
        assertThrows(UnsupportedOperationException.class, () -> first.toDeterministicList().clear());
    }
}
