package info.isaksson.erland.mappinglint.core;

import info.isaksson.erland.mappinglint.analysis.AnalysisWarnings;
import info.isaksson.erland.mappinglint.analysis.MappingRule;
import info.isaksson.erland.mappinglint.analysis.Severity;
import info.isaksson.erland.mappinglint.fix.AccessorStyle;
import info.isaksson.erland.mappinglint.fix.Edit;
import info.isaksson.erland.mappinglint.model.AnalysisUnit;
import info.isaksson.erland.mappinglint.model.MappingDeclaration;
import info.isaksson.erland.mappinglint.model.MappingModel;
import info.isaksson.erland.mappinglint.model.Member;
import info.isaksson.erland.mappinglint.model.MemberConfig;
import info.isaksson.erland.mappinglint.model.ModelJson;
import info.isaksson.erland.mappinglint.model.TypeShape;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MappingLintServiceTest {

    private final MappingLintService service = new MappingLintService();

    @Test
    void analyzesSnapshotFile() throws Exception {
        MappingLintResult result = service.analyze(fixture(), new MappingLintOptions());

        assertEquals(List.of("ML001", "ML002", "ML005", "ML050", "ML032", "ML031", "ML034", "ML011", "ML041"), ruleIds(result));
        assertEquals(2, result.count(Severity.ERROR));
        assertEquals(5, result.count(Severity.WARNING));
        assertEquals(2, result.count(Severity.INFO));
        assertEquals(7, result.countAtLeast(Severity.WARNING));
        assertTrue(result.warnings.isEmpty());

        Finding tier = result.findings.get(5);
        assertEquals("shop", tier.unit);
        assertEquals("loyaltyTier", tier.diagnostic.member);
        assertEquals(23, tier.diagnostic.location.line);
        assertEquals("Property 'loyaltyTier' mapping contains a database query 'tiers.lookupTier(...)' that should be "
                + "performed before mapping to avoid performance issues", tier.diagnostic.message);
        assertEquals(List.of("ML031.moveToSource"), tier.fixes.stream().map(e -> e.key).collect(Collectors.toList()));
    }

    @Test
    void rulesCanBeDisabledByIdOrName() throws Exception {
        MappingLintOptions options = new MappingLintOptions();
        options.disabledRules.add("ML001");
        options.disabledRules.add("DuplicateMapping");
        options.severityOverrides.put("RedundantMapFrom", Severity.WARNING);

        MappingLintResult result = service.analyze(fixture(), options);
        assertFalse(ruleIds(result).contains("ML001"));
        assertFalse(ruleIds(result).contains("ML041"));
        Finding redundant = result.findings.stream().filter(f -> f.diagnostic.rule == MappingRule.REDUNDANT_MAP_FROM)
                .findFirst().orElseThrow();
        assertEquals(Severity.WARNING, redundant.diagnostic.severity);
    }

    @Test
    void performanceRulesCanBeSwitchedOff() throws Exception {
        MappingLintOptions options = new MappingLintOptions();
        options.performanceRules = false;
        assertEquals(List.of("ML001", "ML002", "ML005", "ML050", "ML011", "ML041"), ruleIds(service.analyze(fixture(), options)));
    }

    @Test
    void unknownRuleKeyIsRejected() {
        MappingLintOptions options = new MappingLintOptions();
        options.disabledRules.add("ML999");
        assertThrows(IllegalArgumentException.class, () -> service.analyze(fixture(), options));
    }

    @Test
    void fixesCanBeSkippedOrStyled() throws Exception {
        MappingLintOptions noFixes = new MappingLintOptions();
        noFixes.synthesizeFixes = false;
        assertTrue(service.analyze(fixture(), noFixes).findings.stream().allMatch(f -> f.fixes.isEmpty()));

        MappingLintOptions fields = new MappingLintOptions();
        fields.accessorStyle = AccessorStyle.FIELD;
        fields.sourceParameterName = "c";
        Finding id = service.analyze(fixture(), fields).findings.get(0);
        assertEquals("c -> String.valueOf(c.id)", id.fixes.get(0).operations.get(0).config.expression);
    }

    @Test
    void applyingAFixClearsItsFinding() throws Exception {
        MappingLintResult result = service.analyze(fixture(), new MappingLintOptions());
        AnalysisUnit unit = ModelJson.read(fixture()).units.get(0);
        Finding nullable = result.findings.get(1);
        Edit fix = service.fixesFor(nullable.diagnostic, unit, null).get(0);

        AnalysisUnit fixed = service.applyFix(unit, fix);
        List<String> after = service.analyze(fixed, null).diagnostics.stream()
                .map(d -> d.ruleId + ":" + d.member).collect(Collectors.toList());
        assertFalse(after.contains("ML002:name"));
        assertEquals(8, after.size());
    }

    @Test
    void declarationsWithoutIdsStillGetTheirOwnFixes() {
        AnalysisUnit unit = new AnalysisUnit("u", List.of(
                TypeShape.of("com.acme.Person", Member.of("name", "String")),
                TypeShape.of("com.acme.PersonDto", Member.of("name", "String")),
                TypeShape.of("com.acme.Contact", Member.of("name", "String"))),
                List.of(MappingDeclaration.of(null, "com.acme.Person", "com.acme.PersonDto"),
                        MappingDeclaration.of(null, "com.acme.Person", "com.acme.Contact",
                                MemberConfig.mapFrom("name", "src -> src.getName()"))));
        MappingLintResult result = service.analyze(MappingModel.of(unit), new MappingLintOptions());

        assertEquals(List.of("ML050"), ruleIds(result));
        Finding redundant = result.findings.get(0);
        assertEquals("u#2", redundant.diagnostic.declarationId);
        assertEquals(List.of("ML050.remove"), redundant.fixes.stream().map(e -> e.key).collect(Collectors.toList()));
        assertEquals("u#2", redundant.fixes.get(0).operations.get(0).anchor.declarationId);
        assertEquals(2, result.warnings.stream().filter(w -> w.code.equals(AnalysisWarnings.DECLARATION_ID_ASSIGNED)).count());

        AnalysisUnit analysed = result.units.get(0).unit;
        AnalysisUnit fixed = service.applyFix(analysed, redundant.fixes.get(0));
        assertTrue(service.analyze(fixed, null).diagnostics.isEmpty());
    }

    @Test
    void declarationsInOtherUnitsDoNotCoverNestedTypes() {
        TypeShape address = TypeShape.of("com.acme.Address", Member.of("street", "String"));
        TypeShape addressDto = TypeShape.of("com.acme.AddressDto", Member.of("street", "String"));
        AnalysisUnit a = new AnalysisUnit("a", List.of(
                TypeShape.of("com.acme.Person", Member.of("name", "String"), Member.of("address", "com.acme.Address")),
                TypeShape.of("com.acme.PersonDto", Member.of("name", "String"), Member.of("address", "com.acme.AddressDto")),
                address, addressDto),
                List.of(MappingDeclaration.of("p1", "com.acme.Person", "com.acme.PersonDto")));
        AnalysisUnit b = new AnalysisUnit("b", List.of(address, addressDto),
                List.of(MappingDeclaration.of("a1", "com.acme.Address", "com.acme.AddressDto")));

        MappingLintResult result = service.analyze(MappingModel.of(a, b), new MappingLintOptions());
        assertEquals(1, result.findings.size());
        Finding complex = result.findings.get(0);
        assertEquals("a", complex.unit);
        assertEquals(MappingRule.COMPLEX_TYPE_MAPPING_MISSING, complex.diagnostic.rule);
        assertEquals("address", complex.diagnostic.member);
    }

    @Test
    void parallelOptionGivesSameFindings() throws Exception {
        MappingLintOptions parallel = new MappingLintOptions();
        parallel.parallel = true;
        assertEquals(ModelJson.toJsonString(service.analyze(fixture(), new MappingLintOptions())),
                ModelJson.toJsonString(service.analyze(fixture(), parallel)));
    }

    @Test
    void resultSerializesToJson() throws Exception {
        String json = ModelJson.toJsonString(service.analyze(fixture(), new MappingLintOptions()));
        assertTrue(json.startsWith("{\n  \"tool\" : \"mapping-lint\""), json);
        assertTrue(json.contains("\"ruleId\" : \"ML011\""));
        assertTrue(json.contains("\"rule\" : \"UnmappedRequiredProperty\""));
        assertTrue(json.contains("\"key\" : \"ML050.remove\""));
        assertFalse(json.contains("\"units\""));
    }

    private static List<String> ruleIds(MappingLintResult result) {
        return result.findings.stream().map(f -> f.diagnostic.ruleId).collect(Collectors.toList());
    }

    private static Path fixture() throws Exception {
        return Path.of(MappingLintServiceTest.class.getClassLoader().getResource("snapshots/shop.json").toURI());
    }
}
