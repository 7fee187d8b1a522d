package info.isaksson.erland.mappinglint.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AnalysisUnitTest {

    @Test
    void findTypeFallsBackToUniqueSimpleName() {
        AnalysisUnit unit = new AnalysisUnit("u", List.of(
                TypeShape.of("com.acme.a.Address"),
                TypeShape.of("com.acme.Order"),
                TypeShape.of("com.acme.b.Order")), null);

        assertEquals("com.acme.a.Address", unit.findType("Address").qualifiedName);
        assertEquals("com.acme.Order", unit.findType("com.acme.Order").qualifiedName);
        assertNull(unit.findType("Order"), "ambiguous simple name");
        assertNull(unit.findType("Missing"));
    }

    @Test
    void withTypeReplacesByQualifiedName() {
        AnalysisUnit unit = new AnalysisUnit("u", List.of(TypeShape.of("A", Member.of("x", "int"))), null);
        AnalysisUnit changed = unit.withType(TypeShape.of("A", Member.of("x", "int"), Member.of("y", "String")));

        assertEquals(1, changed.types.size());
        assertNotNull(changed.findType("A").findMember("y"));
        assertNull(unit.findType("A").findMember("y"));
    }

    @Test
    void accessorRefFollowsJavaBeansNaming() {
        AccessorRef getter = new AccessorRef("Name", true, "src.getName()");
        assertTrue(getter.matches("name"));
        assertFalse(getter.matches("fullName"));
        assertEquals("name", getter.propertyName());

        TypeShape shape = TypeShape.of("S", Member.of("name", "String"));
        assertSame(shape.members.get(0), getter.resolve(shape));

        AccessorRef field = new AccessorRef("name", false, "src.name");
        assertTrue(field.matches("name"));
        assertFalse(field.matches("Name"));
        assertEquals("URL", AccessorRef.decapitalize("URL"));
    }

    @Test
    void caseInsensitiveLookupPicksFirstDeclared() {
        TypeShape shape = TypeShape.of("S", Member.of("NAME", "String"), Member.of("Name", "String"));
        assertEquals("NAME", shape.findMemberIgnoreCase("name").name);
        assertNull(shape.findMember("name"));
    }
}
