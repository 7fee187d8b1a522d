package info.isaksson.erland.mappinglint.analysis;

import info.isaksson.erland.mappinglint.model.AccessorRef;
import info.isaksson.erland.mappinglint.model.MappingDeclaration;
import info.isaksson.erland.mappinglint.model.Member;
import info.isaksson.erland.mappinglint.model.MemberConfig;
import info.isaksson.erland.mappinglint.model.TypeRefKind;
import info.isaksson.erland.mappinglint.model.TypeShape;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Source members whose value is dropped by a declaration: no destination member of the same name (ignoring
 * case), no flattened destination member and no config expression reading them.
 *
 * <p>A reverse-mapped declaration is also checked in the inverse direction. Member configs describe the forward
 * direction only, so none of them count there.</p>
 */
public final class MissingDestinationDetector {

    /** {@link Diagnostic#detail} of findings for the inverse direction of a reverse-mapped declaration. */
    public static final String REVERSE = "reverse";

    private static final Pattern MEMBER_SELECT = Pattern.compile("\\.\\s*([A-Za-z_$][A-Za-z0-9_$]*)");

    public List<Diagnostic> detect(MappingDeclaration declaration, TypeShape source, TypeShape dest,
                                   AnalysisWarnings warnings) {
        List<Diagnostic> out = new ArrayList<>();
        Set<String> selected = selectedNames(declaration);
        for (Member sm : source.members) {
            try {
                if (declaration.ignoredSourceMembers.contains(sm.name)) continue;
                if (isRead(sm.name, selected)) continue;
                if (lost(sm, dest)) out.add(diagnostic(declaration, source, dest, sm, ""));
            } catch (RuntimeException e) {
                warnings.memberFailed(declaration.id, sm.name, e);
            }
        }
        if (declaration.reverseMap) {
            for (Member dm : dest.members) {
                if (lost(dm, source)) out.add(diagnostic(declaration, dest, source, dm, REVERSE));
            }
        }
        return out;
    }

    /** True when nothing in {@code to} receives {@code member}, directly or flattened. */
    static boolean lost(Member member, TypeShape to) {
        if (to.findMemberIgnoreCase(member.name) != null) return false;
        if (member.effectiveType().unwrapNullable().kind == TypeRefKind.PRIMITIVE) return true;
        String prefix = member.name.toLowerCase(Locale.ROOT);
        for (Member m : to.members) {
            if (m.name.toLowerCase(Locale.ROOT).startsWith(prefix)) return false;
        }
        return true;
    }

    /** Names selected off any receiver ({@code x.name}, {@code x.getName()}) in the declaration's config texts. */
    static Set<String> selectedNames(MappingDeclaration declaration) {
        Set<String> out = new HashSet<>();
        for (MemberConfig c : declaration.memberConfigs) {
            if (c == null || c.expression == null) continue;
            Matcher m = MEMBER_SELECT.matcher(c.expression);
            while (m.find()) out.add(m.group(1));
        }
        return out;
    }

    private static boolean isRead(String member, Set<String> selected) {
        String suffix = AccessorRef.capitalize(member);
        return selected.contains(member) || selected.contains("get" + suffix) || selected.contains("is" + suffix);
    }

    private static Diagnostic diagnostic(MappingDeclaration declaration, TypeShape from, TypeShape to, Member member,
                                         String detail) {
        return new Diagnostic(MappingRule.MISSING_DESTINATION_PROPERTY, null, declaration.id, member.name,
                from.simpleName(), member.effectiveType().display(), to.simpleName(), "", detail,
                declaration.location);
    }
}
