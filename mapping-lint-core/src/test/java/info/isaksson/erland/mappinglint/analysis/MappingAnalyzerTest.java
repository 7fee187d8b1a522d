package info.isaksson.erland.mappinglint.analysis;

import info.isaksson.erland.mappinglint.expr.JavaLambdaSummarizer;
import info.isaksson.erland.mappinglint.model.AnalysisUnit;
import info.isaksson.erland.mappinglint.model.ExpressionFact;
import info.isaksson.erland.mappinglint.model.ExpressionShape;
import info.isaksson.erland.mappinglint.model.ExpressionSummarizer;
import info.isaksson.erland.mappinglint.model.MappingDeclaration;
import info.isaksson.erland.mappinglint.model.Member;
import info.isaksson.erland.mappinglint.model.MemberConfig;
import info.isaksson.erland.mappinglint.model.TypeShape;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MappingAnalyzerTest {

    private static final String SRC = "com.acme.Person";
    private static final String DST = "com.acme.PersonDto";

    @Test
    void identicalShapesProduceNoDiagnostics() {
        Member[] members = {
                Member.of("name", "String"),
                Member.of("age", "int"),
                Member.of("tags", "List<String>"),
                Member.of("nickname", "@Nullable String")
        };
        UnitAnalysis result = analyze(unit(TypeShape.of(SRC, members), TypeShape.of(DST, members), decl("p1", SRC, DST)));
        assertTrue(result.diagnostics.isEmpty(), result.diagnostics.toString());
        assertTrue(result.warnings.isEmpty());
    }

    @Test
    void scalarMismatchIsPropertyTypeMismatch() {
        UnitAnalysis result = analyze(unit(
                TypeShape.of(SRC, Member.of("age", "int")),
                TypeShape.of(DST, Member.of("age", "String")),
                decl("p1", SRC, DST)));

        assertEquals(1, result.diagnostics.size());
        Diagnostic d = result.diagnostics.get(0);
        assertEquals(MappingRule.PROPERTY_TYPE_MISMATCH, d.rule);
        assertEquals("ML001", d.ruleId);
        assertEquals(Severity.ERROR, d.severity);
        assertEquals("p1", d.declarationId);
        assertEquals("Property 'age' type mismatch: Person.age is 'int' but PersonDto.age is 'String'", d.message);
    }

    @Test
    void wideningAndEqualTypesAreCompatible() {
        UnitAnalysis result = analyze(unit(
                TypeShape.of(SRC, Member.of("count", "int"), Member.of("ratio", "float"), Member.of("code", "java.lang.String")),
                TypeShape.of(DST, Member.of("count", "long"), Member.of("ratio", "double"), Member.of("code", "String")),
                decl("p1", SRC, DST)));
        assertTrue(result.diagnostics.isEmpty(), result.diagnostics.toString());
    }

    @Test
    void nullableIntoNonNullableIsReportedOnlyWhenOtherwiseCompatible() {
        UnitAnalysis result = analyze(unit(
                TypeShape.of(SRC,
                        Member.of("name", "@Nullable String"),
                        Member.of("age", "Integer"),
                        Member.of("score", "Integer")),
                TypeShape.of(DST,
                        Member.of("name", "String"),
                        Member.of("age", "int"),
                        Member.of("score", "String")),
                decl("p1", SRC, DST)));

        assertEquals(List.of(MappingRule.NULLABLE_COMPATIBILITY, MappingRule.NULLABLE_COMPATIBILITY, MappingRule.PROPERTY_TYPE_MISMATCH),
                rules(result));
        assertEquals("Property 'name' has nullable compatibility issue: Person.name (@Nullable String) can be null "
                + "but PersonDto.name (String) is non-nullable", result.diagnostics.get(0).message);
        assertEquals(Severity.WARNING, result.diagnostics.get(0).severity);
        assertEquals("Integer", result.diagnostics.get(1).sourceMemberType);
    }

    @Test
    void incompatibleElementTypesAreGenericTypeMismatch() {
        UnitAnalysis result = analyze(unit(
                TypeShape.of(SRC, Member.of("codes", "List<String>"), Member.of("labels", "List<String>")),
                TypeShape.of(DST, Member.of("codes", "List<Integer>"), Member.of("labels", "Set<String>")),
                decl("p1", SRC, DST)));

        assertEquals(1, result.diagnostics.size());
        Diagnostic d = result.diagnostics.get(0);
        assertEquals(MappingRule.GENERIC_TYPE_MISMATCH, d.rule);
        assertEquals("codes", d.member);
        assertEquals("Property 'codes' has incompatible collection element types: Person.codes (List<String>) cannot be "
                + "mapped to PersonDto.codes (List<Integer>) without explicit conversion", d.message);
    }

    @Test
    void nestedUserTypesNeedTheirOwnDeclaration() {
        TypeShape person = TypeShape.of(SRC, Member.of("address", "com.acme.Address"),
                Member.of("previous", "List<com.acme.Address>"));
        TypeShape dto = TypeShape.of(DST, Member.of("address", "com.acme.AddressDto"),
                Member.of("previous", "List<com.acme.AddressDto>"));
        TypeShape address = TypeShape.of("com.acme.Address", Member.of("street", "String"));
        TypeShape addressDto = TypeShape.of("com.acme.AddressDto", Member.of("street", "String"));

        AnalysisUnit missing = new AnalysisUnit("u", List.of(person, dto, address, addressDto), List.of(decl("p1", SRC, DST)));
        UnitAnalysis result = analyze(missing);
        assertEquals(List.of(MappingRule.COMPLEX_TYPE_MAPPING_MISSING, MappingRule.GENERIC_TYPE_MISMATCH), rules(result));
        assertEquals("Property 'address' requires mapping configuration between 'Address' and 'AddressDto' "
                + "(Person.address to PersonDto.address)", result.diagnostics.get(0).message);

        AnalysisUnit direct = missing.withDeclarations(List.of(
                decl("p1", SRC, DST), decl("a1", "com.acme.Address", "com.acme.AddressDto")));
        assertTrue(analyze(direct).diagnostics.isEmpty());

        AnalysisUnit reverse = missing.withDeclarations(List.of(
                decl("p1", SRC, DST), decl("a1", "com.acme.AddressDto", "com.acme.Address").withReverseMap(true)));
        assertTrue(analyze(reverse).diagnostics.isEmpty());
    }

    @Test
    void addingDeclarationsNeverAddsComplexTypeFindings() {
        TypeShape person = TypeShape.of(SRC, Member.of("address", "com.acme.Address"), Member.of("owner", "com.acme.Owner"));
        TypeShape dto = TypeShape.of(DST, Member.of("address", "com.acme.AddressDto"), Member.of("owner", "com.acme.OwnerDto"));
        List<MappingDeclaration> declarations = new ArrayList<>(List.of(decl("p1", SRC, DST)));
        AnalysisUnit unit = new AnalysisUnit("u", List.of(person, dto), declarations);

        long before = count(analyze(unit), MappingRule.COMPLEX_TYPE_MAPPING_MISSING);
        assertEquals(2, before);
        declarations.add(decl("o1", "com.acme.Owner", "com.acme.OwnerDto"));
        long after = count(analyze(unit.withDeclarations(declarations)), MappingRule.COMPLEX_TYPE_MAPPING_MISSING);
        assertEquals(1, after);
        declarations.add(decl("x1", "com.acme.Other", "com.acme.OtherDto"));
        assertEquals(1, count(analyze(unit.withDeclarations(declarations)), MappingRule.COMPLEX_TYPE_MAPPING_MISSING));
    }

    @Test
    void casingDifferenceTakesFirstSourceMember() {
        UnitAnalysis result = analyze(unit(
                TypeShape.of(SRC, Member.of("NAME", "String"), Member.of("Name", "String")),
                TypeShape.of(DST, Member.of("name", "String")),
                decl("p1", SRC, DST)));

        assertEquals(1, result.diagnostics.size());
        Diagnostic d = result.diagnostics.get(0);
        assertEquals(MappingRule.CASE_SENSITIVITY_MISMATCH, d.rule);
        assertEquals("NAME", d.detail);
        assertEquals("Property 'NAME' in source differs only in casing from destination property 'name' - "
                + "consider explicit mapping or case-insensitive configuration", d.message);
    }

    @Test
    void requiredMembersWithoutSourceAreUnmapped() {
        AnalysisUnit unit = unit(
                TypeShape.of(SRC, Member.of("name", "String")),
                TypeShape.of(DST, Member.of("name", "String"), Member.required("code", "String"),
                        Member.of("label", "String"), Member.of("note", "@Nullable String"), Member.of("rank", "int")),
                decl("p1", SRC, DST));

        UnitAnalysis plain = analyze(unit);
        assertEquals(List.of(MappingRule.UNMAPPED_REQUIRED_PROPERTY), rules(plain));
        assertEquals("Required property 'code' in destination is not mapped from any source property and will cause "
                + "a runtime exception", plain.diagnostics.get(0).message);

        MappingAnalyzer strict = new MappingAnalyzer(new JavaLambdaSummarizer(), new AnalysisOptions(null, null, true, false));
        List<String> members = strict.analyze(unit).diagnostics.stream().map(d -> d.member).collect(Collectors.toList());
        assertEquals(List.of("code", "label"), members);
    }

    @Test
    void explicitConfigSuppressesConventionRules() {
        AnalysisUnit unit = unit(
                TypeShape.of(SRC, Member.of("age", "int"), Member.of("code", "long")),
                TypeShape.of(DST, Member.of("age", "String"), Member.required("missing", "String"), Member.of("code", "String")),
                decl("p1", SRC, DST,
                        MemberConfig.mapFrom("age", "src -> String.valueOf(src.getAge())"),
                        MemberConfig.ignore("missing"),
                        MemberConfig.ignore(""),
                        MemberConfig.mapFrom("code", "src -> String.valueOf(src.getCode())")));
        assertTrue(analyze(unit).diagnostics.isEmpty(), analyze(unit).diagnostics.toString());
    }

    @Test
    void bareSameNameReadIsRedundant() {
        TypeShape person = TypeShape.of(SRC, Member.of("name", "String"), Member.of("title", "String"));
        TypeShape dto = TypeShape.of(DST, Member.of("name", "String"), Member.of("title", "String"));

        UnitAnalysis redundant = analyze(unit(person, dto,
                decl("p1", SRC, DST, MemberConfig.mapFrom("name", "src -> src.getName()"))));
        assertEquals(List.of(MappingRule.REDUNDANT_MAP_FROM), rules(redundant));
        assertEquals(Severity.INFO, redundant.diagnostics.get(0).severity);
        assertEquals("Explicit mapping for 'name' is redundant because the property name matches the source",
                redundant.diagnostics.get(0).message);

        assertTrue(analyze(unit(person, dto,
                decl("p1", SRC, DST, MemberConfig.mapFrom("name", "src -> src.getName().toUpperCase()")))).diagnostics.isEmpty());
        assertTrue(analyze(unit(person, dto,
                decl("p1", SRC, DST, MemberConfig.mapFrom("name", "src -> other.getName()")))).diagnostics.isEmpty());
        assertTrue(analyze(unit(person, dto,
                decl("p1", SRC, DST, MemberConfig.mapFrom("name", "src -> src.getTitle()")))).diagnostics.isEmpty());
    }

    @Test
    void redundantCheckNeedsMatchingTypes() {
        UnitAnalysis result = analyze(unit(
                TypeShape.of(SRC, Member.of("name", "@Nullable String")),
                TypeShape.of(DST, Member.of("name", "String")),
                decl("p1", SRC, DST, MemberConfig.mapFrom("name", "src -> src.getName()"))));
        assertTrue(result.diagnostics.isEmpty());
    }

    @Test
    void dependencyCallInExpressionIsExpensive() {
        MappingDeclaration d = decl("p1", SRC, DST,
                MemberConfig.mapFrom("customerName", "src -> customers.findById(src.getCustomerId()).getName()"))
                .withCaptures(Map.of("customers", "com.acme.CustomerRepository"));
        UnitAnalysis result = analyze(unit(
                TypeShape.of(SRC, Member.of("customerId", "long")),
                TypeShape.of(DST, Member.of("customerName", "String")),
                d));

        assertEquals(List.of(MappingRule.EXPENSIVE_OPERATION_IN_MAP_FROM), rules(result));
        assertEquals("Property 'customerName' mapping contains a database query 'customers.findById(...)' that should "
                + "be performed before mapping to avoid performance issues", result.diagnostics.get(0).message);
    }

    @Test
    void repeatedCollectionTraversalIsMultipleEnumeration() {
        UnitAnalysis result = analyze(unit(
                TypeShape.of(SRC, Member.of("items", "List<com.acme.Item>")),
                TypeShape.of(DST, Member.of("total", "long")),
                decl("p1", SRC, DST, MemberConfig.mapFrom("total",
                        "src -> src.getItems().stream().count() + src.getItems().stream().mapToInt(i -> i.getQty()).sum()"))));

        assertEquals(List.of(MappingRule.MULTIPLE_ENUMERATION), rules(result));
        assertEquals("items", result.diagnostics.get(0).detail);

        UnitAnalysis once = analyze(unit(
                TypeShape.of(SRC, Member.of("items", "List<com.acme.Item>")),
                TypeShape.of(DST, Member.of("total", "long")),
                decl("p1", SRC, DST, MemberConfig.mapFrom("total", "src -> src.getItems().stream().count()"))));
        assertTrue(once.diagnostics.isEmpty());
    }

    @Test
    void blockingOnFutureIsSynchronousAccess() {
        UnitAnalysis result = analyze(unit(
                TypeShape.of(SRC, Member.of("total", "java.util.concurrent.CompletableFuture<java.math.BigDecimal>")),
                TypeShape.of(DST, Member.of("total", "java.math.BigDecimal")),
                decl("p1", SRC, DST, MemberConfig.mapFrom("total", "src -> src.getTotal().get()"))));

        assertEquals(List.of(MappingRule.TASK_RESULT_SYNCHRONOUS_ACCESS), rules(result));
        assertEquals("Property 'total' mapping blocks on asynchronous result 'src.getTotal().get()' which can cause "
                + "deadlocks. Complete async operations before mapping.", result.diagnostics.get(0).message);
    }

    @Test
    void clockReadIsNonDeterministic() {
        UnitAnalysis result = analyze(unit(
                TypeShape.of(SRC, Member.of("name", "String")),
                TypeShape.of(DST, Member.of("name", "String"), Member.of("created", "java.time.LocalDateTime")),
                decl("p1", SRC, DST, MemberConfig.mapFrom("created", "src -> LocalDateTime.now()"))));

        assertEquals(List.of(MappingRule.NON_DETERMINISTIC_OPERATION), rules(result));
        Diagnostic d = result.diagnostics.get(0);
        assertEquals(Severity.INFO, d.severity);
        assertEquals("Property 'created' mapping uses LocalDateTime.now() which produces non-deterministic results. "
                + "Consider computing before mapping for testability.", d.message);
    }

    @Test
    void repeatedPairIsDuplicateOnLaterDeclarations() {
        AnalysisUnit unit = new AnalysisUnit("u",
                List.of(TypeShape.of(SRC, Member.of("name", "String")), TypeShape.of(DST, Member.of("name", "String"))),
                List.of(decl("p1", SRC, DST), decl("p2", "Person", "PersonDto"), decl("p3", DST, SRC)));
        UnitAnalysis result = analyze(unit);

        assertEquals(1, result.diagnostics.size());
        Diagnostic d = result.diagnostics.get(0);
        assertEquals(MappingRule.DUPLICATE_MAPPING, d.rule);
        assertEquals("p2", d.declarationId);
        assertEquals("Mapping from 'Person' to 'PersonDto' is already registered", d.message);
    }

    @Test
    void unknownTypesAndUnparsableExpressionsBecomeWarnings() {
        AnalysisUnit unit = new AnalysisUnit("u",
                List.of(TypeShape.of(SRC, Member.of("name", "String")), TypeShape.of(DST, Member.of("name", "String"))),
                List.of(decl("p1", SRC, "com.acme.Missing"),
                        decl("p2", SRC, DST, MemberConfig.mapFrom("name", "src -> src."))));
        UnitAnalysis result = analyze(unit);

        assertTrue(result.diagnostics.isEmpty());
        List<String> codes = result.warnings.stream().map(w -> w.code).collect(Collectors.toList());
        assertEquals(List.of(AnalysisWarnings.EXPRESSION_NOT_SUMMARIZED, AnalysisWarnings.UNKNOWN_DEST_TYPE), codes);
    }

    @Test
    void diagnosticsFollowDestinationMemberOrder() {
        UnitAnalysis result = analyze(unit(
                TypeShape.of(SRC, Member.of("c", "int"), Member.of("a", "int"), Member.of("b", "int")),
                TypeShape.of(DST, Member.of("b", "String"), Member.of("c", "String"), Member.of("a", "String")),
                decl("p1", SRC, DST)));
        assertEquals(List.of("b", "c", "a"), result.diagnostics.stream().map(d -> d.member).collect(Collectors.toList()));
    }

    @Test
    void settingsDisableAndReclassifyRules() {
        AnalysisUnit unit = unit(
                TypeShape.of(SRC, Member.of("age", "int"), Member.of("name", "String")),
                TypeShape.of(DST, Member.of("age", "String"), Member.of("name", "String")),
                decl("p1", SRC, DST, MemberConfig.mapFrom("name", "src -> src.getName()")));

        AnalysisOptions options = new AnalysisOptions(EnumSet.of(MappingRule.PROPERTY_TYPE_MISMATCH),
                Map.of(MappingRule.REDUNDANT_MAP_FROM, Severity.ERROR), false, false);
        UnitAnalysis result = new MappingAnalyzer(new JavaLambdaSummarizer(), options).analyze(unit);

        assertEquals(List.of(MappingRule.REDUNDANT_MAP_FROM), rules(result));
        assertEquals(Severity.ERROR, result.diagnostics.get(0).severity);
    }

    @Test
    void parallelRunMatchesSequentialRun() {
        List<TypeShape> types = new ArrayList<>();
        List<MappingDeclaration> declarations = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            String src = "com.acme.S" + i;
            String dst = "com.acme.D" + i;
            types.add(TypeShape.of(src, Member.of("id", "int"), Member.of("name", "@Nullable String"),
                    Member.of("items", "List<String>")));
            types.add(TypeShape.of(dst, Member.of("id", i % 2 == 0 ? "String" : "long"), Member.of("name", "String"),
                    Member.of("items", "List<Integer>"), Member.required("code", "String")));
            declarations.add(decl("d" + i, src, dst, MemberConfig.mapFrom("name", "src -> src.getName()")));
        }
        AnalysisUnit unit = new AnalysisUnit("big", types, declarations);

        UnitAnalysis sequential = analyze(unit);
        UnitAnalysis parallel = new MappingAnalyzer(new JavaLambdaSummarizer(), new AnalysisOptions(null, null, false, true))
                .analyze(unit);
        assertFalse(sequential.diagnostics.isEmpty());
        assertEquals(sequential.diagnostics, parallel.diagnostics);
        assertEquals(sequential.diagnostics, analyze(unit).diagnostics);
    }

    @Test
    void interruptedCallerCancelsTheRun() {
        AnalysisUnit unit = unit(TypeShape.of(SRC, Member.of("age", "int")), TypeShape.of(DST, Member.of("age", "String")),
                decl("p1", SRC, DST));
        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> analyze(unit));
        } finally {
            Thread.interrupted();
        }
        assertEquals(1, analyze(unit).diagnostics.size());
    }

    @Test
    void unreadSourceMembersWithoutCounterpartAreDataLoss() {
        MappingDeclaration d = decl("p1", SRC, DST,
                MemberConfig.mapFrom("fullName", "src -> src.getFirst() + \" \" + src.getLast()"));
        AnalysisUnit unit = unit(
                TypeShape.of(SRC, Member.of("first", "String"), Member.of("last", "String"), Member.of("secret", "String"),
                        Member.of("address", "com.acme.Address"), Member.of("notes", "List<String>")),
                TypeShape.of(DST, Member.of("fullName", "String"), Member.of("addressStreet", "String")),
                d);
        UnitAnalysis result = analyze(unit);

        assertEquals(2, result.diagnostics.size(), result.diagnostics.toString());
        for (Diagnostic diagnostic : result.diagnostics) {
            assertEquals(MappingRule.MISSING_DESTINATION_PROPERTY, diagnostic.rule);
            assertEquals("Person", diagnostic.sourceType);
        }
        List<String> lost = result.diagnostics.stream().map(x -> x.member).sorted().collect(Collectors.toList());
        assertEquals(List.of("notes", "secret"), lost);
        assertTrue(result.diagnostics.stream().anyMatch(x ->
                x.message.equals("Source property 'secret' will not be mapped - potential data loss")));

        UnitAnalysis ignored = analyze(unit(unit.types.get(0), unit.types.get(1),
                d.withIgnoredSourceMember("secret").withIgnoredSourceMember("notes")));
        assertTrue(ignored.diagnostics.isEmpty(), ignored.diagnostics.toString());
    }

    @Test
    void reverseMapChecksTheInverseDirection() {
        UnitAnalysis result = analyze(unit(
                TypeShape.of(SRC, Member.of("name", "String")),
                TypeShape.of(DST, Member.of("name", "String"), Member.of("code", "String")),
                decl("p1", SRC, DST).withReverseMap(true)));

        assertEquals(List.of(MappingRule.MISSING_DESTINATION_PROPERTY), rules(result));
        Diagnostic d = result.diagnostics.get(0);
        assertEquals("code", d.member);
        assertEquals(MissingDestinationDetector.REVERSE, d.detail);
        assertEquals("PersonDto", d.sourceType);
        assertEquals("Person", d.destType);
    }

    @Test
    void selfReferenceIsReportedUnlessDepthOrIgnoreEndsIt() {
        TypeShape node = TypeShape.of("com.acme.Node", Member.of("name", "String"), Member.of("children", "List<com.acme.Node>"));
        TypeShape nodeDto = TypeShape.of("com.acme.NodeDto", Member.of("name", "String"), Member.of("children", "List<com.acme.NodeDto>"));
        MappingDeclaration d = decl("n1", "com.acme.Node", "com.acme.NodeDto");

        UnitAnalysis result = analyze(unit(node, nodeDto, d));
        assertEquals(List.of(MappingRule.SELF_REFERENCING_TYPE), rules(result));
        assertEquals("Self-referencing type detected: Node contains properties of its own type, which may cause "
                + "infinite recursion", result.diagnostics.get(0).message);
        assertEquals("", result.diagnostics.get(0).member);

        assertTrue(analyze(unit(node, nodeDto, d.withMaxDepth(3))).diagnostics.isEmpty());
        MappingDeclaration ignoring = decl("n1", "com.acme.Node", "com.acme.NodeDto", MemberConfig.ignore("children"));
        assertTrue(analyze(unit(node, nodeDto, ignoring)).diagnostics.isEmpty());
    }

    @Test
    void cycleThroughAnotherTypeIsRecursionRisk() {
        AnalysisUnit unit = new AnalysisUnit("u", List.of(
                TypeShape.of(SRC, Member.of("name", "String"), Member.of("address", "com.acme.Address")),
                TypeShape.of("com.acme.Address", Member.of("street", "String"), Member.of("resident", SRC)),
                TypeShape.of(DST, Member.of("name", "String"), Member.of("address", "com.acme.AddressDto")),
                TypeShape.of("com.acme.AddressDto", Member.of("street", "String"), Member.of("resident", DST))),
                List.of(decl("p1", SRC, DST), decl("a1", "com.acme.Address", "com.acme.AddressDto")));
        UnitAnalysis result = analyze(unit);

        assertEquals(List.of(MappingRule.INFINITE_RECURSION_RISK, MappingRule.INFINITE_RECURSION_RISK), rules(result));
        assertEquals("Potential infinite recursion detected: Person to PersonDto mapping may cause stack overflow "
                + "due to circular references", result.diagnostics.get(0).message);
        assertEquals(List.of("p1", "a1"), result.diagnostics.stream().map(d -> d.declarationId).collect(Collectors.toList()));
    }

    @Test
    void blankAndRepeatedIdsAreReplaced() {
        AnalysisUnit unit = new AnalysisUnit("shop", List.of(
                TypeShape.of(SRC, Member.of("name", "String")),
                TypeShape.of(DST, Member.of("name", "String")),
                TypeShape.of("com.acme.Contact", Member.of("name", "String"))),
                List.of(decl("", SRC, DST),
                        decl("p1", "com.acme.Contact", DST),
                        decl("p1", SRC, "com.acme.Contact", MemberConfig.mapFrom("name", "src -> src.getName()"))));
        UnitAnalysis result = analyze(unit);

        assertEquals(List.of("shop#1", "p1", "shop#3"),
                result.unit.declarations.stream().map(d -> d.id).collect(Collectors.toList()));
        assertEquals(List.of("Declaration has no id; using shop#1", "Declaration id 'p1' is not unique; using shop#3"),
                result.warnings.stream().map(w -> w.message).collect(Collectors.toList()));
        assertEquals("shop", result.warnings.get(0).context.get("unit"));
        assertEquals(List.of("shop#3"), result.diagnostics.stream().map(d -> d.declarationId).collect(Collectors.toList()));
    }

    @Test
    void failingHazardCheckBecomesWarningAndOthersContinue() {
        JavaLambdaSummarizer java = new JavaLambdaSummarizer();
        ExpressionSummarizer summarizer = (expression, context) -> expression.contains("legacy")
                ? new ExpressionShape(expression, "src", true, List.of(new ExpressionFact.DependencyCall("legacy", "find", null)))
                : java.summarize(expression, context);
        AnalysisUnit unit = unit(
                TypeShape.of(SRC, Member.of("name", "String")),
                TypeShape.of(DST, Member.of("name", "String"), Member.of("code", "String"),
                        Member.of("created", "java.time.LocalDateTime")),
                decl("p1", SRC, DST,
                        MemberConfig.mapFrom("code", "src -> legacy.find(src.getName())"),
                        MemberConfig.mapFrom("created", "src -> LocalDateTime.now()")));
        UnitAnalysis result = new MappingAnalyzer(summarizer, AnalysisOptions.DEFAULTS).analyze(unit);

        assertEquals(List.of(MappingRule.NON_DETERMINISTIC_OPERATION), rules(result));
        assertEquals(1, result.warnings.size());
        assertEquals(AnalysisWarnings.MEMBER_CLASSIFICATION_FAILED, result.warnings.get(0).code);
        assertEquals("code", result.warnings.get(0).context.get("member"));
        assertEquals("p1", result.warnings.get(0).context.get("declaration"));
    }

    @Test
    void analysisDoesNotModifyTheInput() {
        MappingDeclaration d = decl("p1", SRC, DST, MemberConfig.mapFrom("name", "src -> src.getName()"));
        AnalysisUnit unit = unit(TypeShape.of(SRC, Member.of("name", "String")), TypeShape.of(DST, Member.of("name", "String")), d);
        UnitAnalysis result = analyze(unit);

        assertNull(unit.declarations.get(0).memberConfigs.get(0).shape);
        assertNotNull(result.unit.declarations.get(0).memberConfigs.get(0).shape);
    }

    static AnalysisUnit unit(TypeShape source, TypeShape dest, MappingDeclaration... declarations) {
        return new AnalysisUnit("u", List.of(source, dest), List.of(declarations));
    }

    static MappingDeclaration decl(String id, String source, String dest, MemberConfig... configs) {
        return MappingDeclaration.of(id, source, dest, configs);
    }

    private static UnitAnalysis analyze(AnalysisUnit unit) {
        return new MappingAnalyzer(new JavaLambdaSummarizer(), AnalysisOptions.DEFAULTS).analyze(unit);
    }

    private static List<MappingRule> rules(UnitAnalysis result) {
        return result.diagnostics.stream().map(d -> d.rule).collect(Collectors.toList());
    }

    private static long count(UnitAnalysis result, MappingRule rule) {
        return result.diagnostics.stream().filter(d -> d.rule == rule).count();
    }
}
