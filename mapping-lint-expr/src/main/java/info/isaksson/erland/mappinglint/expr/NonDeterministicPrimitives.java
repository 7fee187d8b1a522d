package info.isaksson.erland.mappinglint.expr;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import info.isaksson.erland.mappinglint.model.ExpressionFact;

import java.util.List;
import java.util.Set;

/** Recognizes clock reads and random-value sources. */
final class NonDeterministicPrimitives {

    private NonDeterministicPrimitives() {}

    private static final Set<String> CLOCK_TYPES = Set.of(
            "LocalDateTime", "LocalDate", "LocalTime", "Instant", "ZonedDateTime", "OffsetDateTime",
            "OffsetTime", "Year", "YearMonth", "MonthDay"
    );

    /** Zero-argument static calls, as {@code Owner.method}. */
    private static final Set<String> STATIC_PRIMITIVES = Set.of(
            "System.currentTimeMillis", "System.nanoTime", "UUID.randomUUID", "Math.random",
            "ThreadLocalRandom.current", "Clock.systemUTC", "Clock.systemDefaultZone"
    );

    private static final Set<String> RANDOM_TYPES = Set.of("Random", "SecureRandom", "SplittableRandom", "Date");

    static void collect(ParsedLambda lambda, List<ExpressionFact> out) {
        lambda.lambda.getBody().walk(node -> {
            if (node instanceof MethodCallExpr) {
                MethodCallExpr mc = (MethodCallExpr) node;
                if (!mc.getArguments().isEmpty()) return;
                String owner = ownerName(mc.getScope().orElse(null), lambda);
                if (owner == null) return;
                String name = mc.getNameAsString();
                if ((name.equals("now") && CLOCK_TYPES.contains(owner)) || STATIC_PRIMITIVES.contains(owner + "." + name)) {
                    out.add(new ExpressionFact.NonDeterministicPrimitive(owner + "." + name + "()"));
                }
            } else if (node instanceof ObjectCreationExpr) {
                ObjectCreationExpr oce = (ObjectCreationExpr) node;
                String type = oce.getType().getNameAsString();
                if (oce.getArguments().isEmpty() && RANDOM_TYPES.contains(type)) {
                    out.add(new ExpressionFact.NonDeterministicPrimitive("new " + type + "()"));
                }
            }
        });
    }

    /** Simple type name of a static call owner ({@code UUID} or {@code java.util.UUID}); null for variables. */
    private static String ownerName(Expression scope, ParsedLambda lambda) {
        Expression s = scope == null ? null : ParsedLambda.unwrap(scope);
        if (s instanceof NameExpr) {
            String n = ((NameExpr) s).getNameAsString();
            return lambda.isDeclaredInside(n) ? null : n;
        }
        if (s instanceof FieldAccessExpr) {
            return ((FieldAccessExpr) s).getNameAsString();
        }
        return null;
    }
}
