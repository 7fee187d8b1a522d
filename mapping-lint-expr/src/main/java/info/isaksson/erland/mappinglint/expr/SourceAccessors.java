package info.isaksson.erland.mappinglint.expr;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import info.isaksson.erland.mappinglint.model.AccessorRef;

/**
 * Recognizes member reads off the lambda parameter: {@code src.name}, {@code src.getName()}, {@code src.isActive()}.
 */
final class SourceAccessors {

    private SourceAccessors() {}

    /** The accessor read by {@code e}, or null when {@code e} is not a direct read off the parameter. */
    static AccessorRef accessorOf(Expression e, ParsedLambda lambda) {
        Expression u = ParsedLambda.unwrap(e);
        if (u instanceof FieldAccessExpr) {
            FieldAccessExpr fa = (FieldAccessExpr) u;
            if (lambda.isParameter(fa.getScope())) {
                return new AccessorRef(fa.getNameAsString(), false, fa.toString());
            }
            return null;
        }
        if (u instanceof MethodCallExpr) {
            MethodCallExpr mc = (MethodCallExpr) u;
            if (!mc.getArguments().isEmpty()) return null;
            if (mc.getScope().isEmpty() || !lambda.isParameter(mc.getScope().get())) return null;
            String suffix = getterSuffix(mc.getNameAsString());
            if (suffix == null) return null;
            return new AccessorRef(suffix, true, mc.toString());
        }
        return null;
    }

    /** {@code getName} yields {@code Name}; non-getter names yield null. */
    static String getterSuffix(String methodName) {
        if (methodName == null) return null;
        if (methodName.startsWith("get") && methodName.length() > 3 && Character.isUpperCase(methodName.charAt(3))) {
            return methodName.substring(3);
        }
        if (methodName.startsWith("is") && methodName.length() > 2 && Character.isUpperCase(methodName.charAt(2))) {
            return methodName.substring(2);
        }
        return null;
    }
}
