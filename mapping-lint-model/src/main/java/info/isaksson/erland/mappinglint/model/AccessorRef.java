package info.isaksson.erland.mappinglint.model;

/**
 * A read of a source member off the lambda parameter, either as a field ({@code src.name}) or through a
 * JavaBeans getter ({@code src.getName()}, {@code src.isActive()}).
 *
 * @param name   field name, or the getter name without its {@code get}/{@code is} prefix
 * @param getter true when read through a getter
 * @param text   the access as written, e.g. {@code src.getItems()}
 */
public record AccessorRef(String name, boolean getter, String text) {

    /** True when this accessor reads the member called {@code memberName}. */
    public boolean matches(String memberName) {
        if (memberName == null || memberName.isEmpty()) return false;
        if (getter) return capitalize(memberName).equals(name);
        return name.equals(memberName);
    }

    /** The member of {@code shape} this accessor reads, or null. Exact-name members are preferred. */
    public Member resolve(TypeShape shape) {
        if (shape == null) return null;
        if (!getter) return shape.findMember(name);
        Member exact = shape.findMember(decapitalize(name));
        if (exact != null) return exact;
        for (Member m : shape.members) {
            if (matches(m.name)) return m;
        }
        return null;
    }

    /** The member name this accessor reads by JavaBeans convention. */
    public String propertyName() {
        return getter ? decapitalize(name) : name;
    }

    public static String capitalize(String s) {
        if (s == null || s.isEmpty()) return "";
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    /** JavaBeans decapitalization: {@code URL} stays {@code URL}, {@code Name} becomes {@code name}. */
    public static String decapitalize(String s) {
        if (s == null || s.isEmpty()) return "";
        if (s.length() > 1 && Character.isUpperCase(s.charAt(0)) && Character.isUpperCase(s.charAt(1))) return s;
        return Character.toLowerCase(s.charAt(0)) + s.substring(1);
    }
}
