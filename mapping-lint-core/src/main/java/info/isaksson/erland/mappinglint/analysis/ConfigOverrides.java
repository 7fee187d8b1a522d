package info.isaksson.erland.mappinglint.analysis;

import info.isaksson.erland.mappinglint.model.MappingDeclaration;
import info.isaksson.erland.mappinglint.model.MemberConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The effective explicit config per destination member of one declaration.
 *
 * <p>The last config for a member wins. Configs without a destination member are left out, so they never
 * suppress convention rules.</p>
 */
public final class ConfigOverrides {

    private final Map<String, MemberConfig> byMember;

    private ConfigOverrides(Map<String, MemberConfig> byMember) {
        this.byMember = byMember;
    }

    public static ConfigOverrides of(MappingDeclaration declaration) {
        Map<String, MemberConfig> map = new LinkedHashMap<>();
        if (declaration != null) {
            for (MemberConfig c : declaration.memberConfigs) {
                if (c == null || !c.hasDestMember()) continue;
                map.remove(c.destMember);
                map.put(c.destMember, c);
            }
        }
        return new ConfigOverrides(Collections.unmodifiableMap(map));
    }

    public boolean has(String destMember) {
        return byMember.containsKey(destMember);
    }

    /** Effective config for {@code destMember}, or null. */
    public MemberConfig get(String destMember) {
        return byMember.get(destMember);
    }

    /** Effective {@code MAP_FROM} configs, ordered by the position of the winning config. */
    public List<MemberConfig> effectiveMapFroms() {
        List<MemberConfig> out = new ArrayList<>();
        for (MemberConfig c : byMember.values()) {
            if (c.isMapFrom()) out.add(c);
        }
        return out;
    }

    public int size() {
        return byMember.size();
    }
}
