package info.isaksson.erland.mappinglint.expr;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import info.isaksson.erland.mappinglint.model.AccessorRef;
import info.isaksson.erland.mappinglint.model.ExpressionFact;
import info.isaksson.erland.mappinglint.model.Member;
import info.isaksson.erland.mappinglint.model.SummaryContext;

import java.util.List;
import java.util.Set;

/**
 * Recognizes synchronous waits on asynchronous results.
 *
 * <p>{@code block*} is always a wait. {@code join()} and {@code get()} only count when the receiver looks
 * asynchronous, so {@code Optional.get()} and {@code map.get(key)} stay silent.</p>
 */
final class BlockingUnwraps {

    private BlockingUnwraps() {}

    private static final Set<String> ALWAYS_BLOCKING = Set.of("block", "blockFirst", "blockLast", "blockOptional");

    private static final List<String> ASYNC_TYPE_TOKENS = List.of("Future", "CompletionStage", "Promise", "Deferred");

    static void collect(ParsedLambda lambda, SummaryContext context, List<ExpressionFact> out) {
        lambda.lambda.getBody().walk(MethodCallExpr.class, mc -> {
            Expression scope = mc.getScope().map(ParsedLambda::unwrap).orElse(null);
            if (scope == null) return;
            String name = mc.getNameAsString();
            int args = mc.getArguments().size();
            boolean waits = ALWAYS_BLOCKING.contains(name)
                    || (name.equals("join") && args == 0 && isAsync(scope, lambda, context))
                    || (name.equals("get") && (args == 0 || args == 2) && isAsync(scope, lambda, context));
            if (waits) {
                out.add(new ExpressionFact.BlockingUnwrap(scope.toString(), name + "()"));
            }
        });
    }

    private static boolean isAsync(Expression scope, ParsedLambda lambda, SummaryContext context) {
        if (scope instanceof MethodCallExpr) {
            String n = ((MethodCallExpr) scope).getNameAsString();
            if (n.endsWith("Async") || n.equals("toCompletableFuture")) return true;
            AccessorRef accessor = SourceAccessors.accessorOf(scope, lambda);
            return accessor != null && isAsyncMember(accessor, context);
        }
        if (scope instanceof NameExpr) {
            String n = ((NameExpr) scope).getNameAsString();
            if (lambda.isDeclaredInside(n)) return false;
            String declared = context.captures.get(n);
            if (declared != null && !declared.isBlank()) return isAsyncTypeText(declared);
            return n.endsWith("Future") || n.endsWith("future");
        }
        AccessorRef accessor = SourceAccessors.accessorOf(scope, lambda);
        return accessor != null && isAsyncMember(accessor, context);
    }

    private static boolean isAsyncMember(AccessorRef accessor, SummaryContext context) {
        Member m = accessor.resolve(context.sourceType);
        return m != null && isAsyncTypeText(m.type.canonical());
    }

    private static boolean isAsyncTypeText(String text) {
        int lt = text.indexOf('<');
        String raw = lt >= 0 ? text.substring(0, lt) : text;
        for (String token : ASYNC_TYPE_TOKENS) {
            if (raw.contains(token)) return true;
        }
        return false;
    }
}
