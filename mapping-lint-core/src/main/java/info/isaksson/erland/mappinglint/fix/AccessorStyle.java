package info.isaksson.erland.mappinglint.fix;

import info.isaksson.erland.mappinglint.model.AccessorRef;
import info.isaksson.erland.mappinglint.model.Member;
import info.isaksson.erland.mappinglint.model.TypeRef;

import java.util.Locale;

/** How generated expressions read source members. */
public enum AccessorStyle {
    /** {@code src.getName()}, {@code src.isActive()} for {@code boolean}. */
    GETTER,
    /** {@code src.name}. */
    FIELD;

    public String read(String parameter, Member member) {
        if (this == FIELD) return parameter + "." + member.name;
        TypeRef t = member.type;
        String prefix = t.isJavaPrimitive() && "boolean".equals(t.name) ? "is" : "get";
        return parameter + "." + prefix + AccessorRef.capitalize(member.name) + "()";
    }

    public static AccessorStyle parse(String text) {
        if (text == null) throw new IllegalArgumentException("accessor style is null");
        switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "getter":
            case "getters":
                return GETTER;
            case "field":
            case "fields":
                return FIELD;
            default:
                throw new IllegalArgumentException("Unknown accessor style: " + text + " (expected getter or field)");
        }
    }
}
