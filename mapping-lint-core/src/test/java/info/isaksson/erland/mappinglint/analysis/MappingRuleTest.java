package info.isaksson.erland.mappinglint.analysis;

import info.isaksson.erland.mappinglint.model.MappingDeclaration;
import info.isaksson.erland.mappinglint.model.MemberConfig;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MappingRuleTest {

    @Test
    void idsAreUniqueAndStable() {
        Set<String> ids = new HashSet<>();
        for (MappingRule r : MappingRule.values()) {
            assertTrue(ids.add(r.id), r.id);
            assertTrue(r.id.matches("ML\\d{3}"), r.id);
        }
        assertEquals("ML001", MappingRule.PROPERTY_TYPE_MISMATCH.id);
        assertEquals("ML050", MappingRule.REDUNDANT_MAP_FROM.id);
    }

    @Test
    void lookupAcceptsIdNameAndConstant() {
        assertEquals(MappingRule.REDUNDANT_MAP_FROM, MappingRule.fromKey("ML050"));
        assertEquals(MappingRule.REDUNDANT_MAP_FROM, MappingRule.fromKey("ml050"));
        assertEquals(MappingRule.REDUNDANT_MAP_FROM, MappingRule.fromKey("RedundantMapFrom"));
        assertEquals(MappingRule.REDUNDANT_MAP_FROM, MappingRule.fromKey(" redundant_map_from "));
        assertNull(MappingRule.fromKey("ML999"));
        assertNull(MappingRule.fromKey(null));
    }

    @Test
    void formatFillsAllPlaceholders() {
        String message = MappingRule.COMPLEX_TYPE_MAPPING_MISSING.format("address", "Person", "Address", "PersonDto", "AddressDto", "");
        assertEquals("Property 'address' requires mapping configuration between 'Address' and 'AddressDto' "
                + "(Person.address to PersonDto.address)", message);
        assertEquals("Mapping from '' to 'B' is already registered",
                MappingRule.DUPLICATE_MAPPING.format(null, null, null, "B", null, null));
    }

    @Test
    void severityParsingAndOrdering() {
        assertEquals(Severity.WARNING, Severity.parse(" Warning "));
        assertThrows(IllegalArgumentException.class, () -> Severity.parse("fatal"));
        assertTrue(Severity.ERROR.isAtLeast(Severity.WARNING));
        assertTrue(Severity.INFO.isAtLeast(Severity.INFO));
        assertFalse(Severity.INFO.isAtLeast(Severity.WARNING));
        assertFalse(Severity.ERROR.isAtLeast(null));
    }

    @Test
    void lastConfigPerMemberWins() {
        MappingDeclaration d = MappingDeclaration.of("p1", "A", "B",
                MemberConfig.mapFrom("name", "src -> src.getName()"),
                MemberConfig.ignore("code"),
                MemberConfig.ignore("name"),
                MemberConfig.mapFrom("code", "src -> \"x\""));
        ConfigOverrides overrides = ConfigOverrides.of(d);

        assertEquals(2, overrides.size());
        assertFalse(overrides.get("name").isMapFrom());
        List<String> mapFroms = overrides.effectiveMapFroms().stream().map(c -> c.destMember).collect(Collectors.toList());
        assertEquals(List.of("code"), mapFroms);
    }
}
