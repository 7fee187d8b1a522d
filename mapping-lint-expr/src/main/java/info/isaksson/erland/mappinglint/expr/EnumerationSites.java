package info.isaksson.erland.mappinglint.expr;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.ForEachStmt;
import info.isaksson.erland.mappinglint.model.AccessorRef;
import info.isaksson.erland.mappinglint.model.ExpressionFact;

import java.util.List;
import java.util.Set;

/**
 * Finds places where a source member is walked element by element.
 */
final class EnumerationSites {

    private EnumerationSites() {}

    /** Instance methods that traverse the receiver collection. */
    private static final Set<String> TRAVERSING_METHODS = Set.of(
            "stream", "parallelStream", "forEach", "iterator", "spliterator", "toArray",
            "containsAll", "removeIf"
    );

    /** Static helpers whose arguments are traversed: owner to methods. */
    private static final Set<String> TRAVERSING_STATICS = Set.of(
            "Collections.max", "Collections.min", "Collections.frequency", "Collections.unmodifiableList",
            "String.join", "List.copyOf", "Set.copyOf", "StreamSupport.stream", "Stream.of"
    );

    private static final Set<String> COPY_CONSTRUCTED = Set.of(
            "ArrayList", "LinkedList", "HashSet", "LinkedHashSet", "TreeSet", "ArrayDeque", "CopyOnWriteArrayList"
    );

    static void collect(ParsedLambda lambda, List<ExpressionFact> out) {
        lambda.lambda.getBody().walk(node -> {
            if (node instanceof MethodCallExpr) {
                visitCall((MethodCallExpr) node, lambda, out);
            } else if (node instanceof ObjectCreationExpr) {
                ObjectCreationExpr oce = (ObjectCreationExpr) node;
                if (COPY_CONSTRUCTED.contains(oce.getType().getNameAsString()) && oce.getArguments().size() == 1) {
                    add(oce.getArgument(0), "new " + oce.getType().getNameAsString(), lambda, out);
                }
            } else if (node instanceof ForEachStmt) {
                add(((ForEachStmt) node).getIterable(), "for", lambda, out);
            }
        });
    }

    private static void visitCall(MethodCallExpr mc, ParsedLambda lambda, List<ExpressionFact> out) {
        String name = mc.getNameAsString();
        Expression scope = mc.getScope().orElse(null);
        if (scope == null) return;
        if (TRAVERSING_METHODS.contains(name)) {
            add(scope, name, lambda, out);
            return;
        }
        Expression s = ParsedLambda.unwrap(scope);
        if (s instanceof NameExpr) {
            String owner = ((NameExpr) s).getNameAsString();
            if (lambda.isDeclaredInside(owner)) return;
            String qualified = owner + "." + name;
            if (!TRAVERSING_STATICS.contains(qualified)) return;
            for (Expression arg : mc.getArguments()) {
                add(arg, qualified, lambda, out);
            }
        }
    }

    private static void add(Expression candidate, String operation, ParsedLambda lambda, List<ExpressionFact> out) {
        AccessorRef accessor = SourceAccessors.accessorOf(candidate, lambda);
        if (accessor != null) {
            out.add(new ExpressionFact.EnumerationSite(accessor, operation));
        }
    }
}
