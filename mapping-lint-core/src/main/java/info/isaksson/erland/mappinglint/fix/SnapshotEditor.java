package info.isaksson.erland.mappinglint.fix;

import info.isaksson.erland.mappinglint.model.AnalysisUnit;
import info.isaksson.erland.mappinglint.model.MappingDeclaration;
import info.isaksson.erland.mappinglint.model.MemberConfig;
import info.isaksson.erland.mappinglint.model.TypeShape;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies an {@link Edit} to an in-memory unit so a fix can be checked by analyzing again.
 *
 * <p>Applying the same edit twice gives the same unit as applying it once. Comments have no snapshot
 * representation and are skipped.</p>
 */
public final class SnapshotEditor {

    public AnalysisUnit apply(AnalysisUnit unit, Edit edit) {
        if (unit == null) throw new IllegalArgumentException("unit must not be null");
        if (edit == null) throw new IllegalArgumentException("edit must not be null");
        AnalysisUnit current = unit;
        for (EditOperation op : edit.operations) {
            current = apply(current, op);
        }
        return current;
    }

    private AnalysisUnit apply(AnalysisUnit unit, EditOperation op) {
        switch (op.kind) {
            case INSERT_COMMENT:
                return unit;
            case INSERT_SOURCE_MEMBER: {
                TypeShape shape = unit.findType(op.anchor.typeName);
                if (shape == null) throw new IllegalArgumentException("Unknown type: " + op.anchor.typeName);
                TypeShape changed = shape.withMember(op.member);
                return changed == shape ? unit : unit.withType(changed);
            }
            default:
                break;
        }

        int index = unit.indexOfDeclaration(op.anchor.declarationId);
        if (index < 0) throw new IllegalArgumentException("Unknown declaration: " + op.anchor.declarationId);
        MappingDeclaration declaration = unit.declarations.get(index);
        List<MemberConfig> configs = new ArrayList<>(declaration.memberConfigs);

        switch (op.kind) {
            case IGNORE_SOURCE_MEMBER: {
                MappingDeclaration changed = declaration.withIgnoredSourceMember(op.text);
                return changed == declaration ? unit : unit.withDeclaration(index, changed);
            }
            case SET_MAX_DEPTH: {
                Integer depth = Integer.valueOf(op.text);
                if (depth.equals(declaration.maxDepth)) return unit;
                return unit.withDeclaration(index, declaration.withMaxDepth(depth));
            }
            case APPEND_MEMBER_CONFIG: {
                MemberConfig last = lastFor(configs, op.config.destMember);
                if (last != null && sameConfig(last, op.config)) return unit;
                configs.add(op.config);
                break;
            }
            case REMOVE_MEMBER_CONFIG:
                if (!configs.removeIf(c -> sameConfig(c, op.config))) return unit;
                break;
            case REWRITE_EXPRESSION: {
                int at = lastIndexFor(configs, op.anchor.destMember);
                if (at < 0) throw new IllegalArgumentException("No config for member: " + op.anchor.destMember);
                if (Objects.equals(configs.get(at).expression, op.text)) return unit;
                configs.set(at, configs.get(at).withExpression(op.text));
                break;
            }
            default:
                throw new IllegalStateException("Unhandled operation: " + op.kind);
        }
        return unit.withDeclaration(index, declaration.withMemberConfigs(configs));
    }

    /** Location and summary are not part of a config's identity here. */
    private static boolean sameConfig(MemberConfig a, MemberConfig b) {
        return a.kind == b.kind &&
                a.destMember.equals(b.destMember) &&
                Objects.equals(a.expression, b.expression);
    }

    private static MemberConfig lastFor(List<MemberConfig> configs, String destMember) {
        int at = lastIndexFor(configs, destMember);
        return at < 0 ? null : configs.get(at);
    }

    private static int lastIndexFor(List<MemberConfig> configs, String destMember) {
        for (int i = configs.size() - 1; i >= 0; i--) {
            if (configs.get(i).destMember.equals(destMember)) return i;
        }
        return -1;
    }
}
