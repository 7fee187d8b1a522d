package info.isaksson.erland.mappinglint.expr;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import info.isaksson.erland.mappinglint.model.AccessorRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rewrites a mapping lambda so one source collection is copied into a local once and every read of it uses
 * that local:
 *
 * <pre>
 * src -&gt; src.getItems().size() + src.getItems().stream().count()
 * src -&gt; {
 *     var items = new java.util.ArrayList&lt;&gt;(src.getItems());
 *     return items.size() + items.stream().count();
 * }
 * </pre>
 *
 * <p>Arrays are already materialized, so an array member is read into a local as is.</p>
 */
public final class EnumerationMaterializer {

    private final JavaParser parser;

    public EnumerationMaterializer() {
        this.parser = JavaLambdaSummarizer.createParser();
    }

    public String materialize(String expression, String memberName) {
        return materialize(expression, memberName, false);
    }

    /**
     * @param expression lambda text
     * @param memberName source member whose reads are materialized
     * @param array the member is an array rather than a collection
     * @return the rewritten lambda text, or null when the expression is not a lambda reading {@code memberName}
     */
    public String materialize(String expression, String memberName, boolean array) {
        ParsedLambda lambda = ParsedLambda.parse(parser, expression);
        if (lambda == null || memberName == null || memberName.isBlank()) return null;

        List<Expression> reads = new ArrayList<>();
        AccessorRef first = null;
        for (Expression e : lambda.lambda.getBody().findAll(Expression.class)) {
            if (e instanceof EnclosedExpr) continue;
            AccessorRef accessor = SourceAccessors.accessorOf(e, lambda);
            if (accessor != null && accessor.matches(memberName)) {
                reads.add(e);
                if (first == null) first = accessor;
            }
        }
        if (first == null) return null;

        String local = freshName(first.propertyName(), lambda.usedNames());
        String initializer = array ? first.text() : "new java.util.ArrayList<>(" + first.text() + ")";
        ParseResult<Statement> declaration = parser.parseStatement("var " + local + " = " + initializer + ";");
        if (!declaration.isSuccessful() || declaration.getResult().isEmpty()) return null;

        for (Expression read : reads) {
            read.replace(new NameExpr(local));
        }

        Statement body = lambda.lambda.getBody();
        if (body instanceof BlockStmt) {
            ((BlockStmt) body).getStatements().addFirst(declaration.getResult().get());
        } else {
            Expression result = lambda.lambda.getExpressionBody()
                    .orElseThrow(() -> new IllegalStateException("lambda without body"));
            BlockStmt block = new BlockStmt();
            block.addStatement(declaration.getResult().get());
            block.addStatement(new ReturnStmt(result.clone()));
            lambda.lambda.setBody(block);
        }
        return lambda.lambda.toString();
    }

    private static String freshName(String base, Set<String> used) {
        String root = base.isEmpty() ? "items" : base;
        if (!used.contains(root)) return root;
        String candidate = root + "List";
        int i = 2;
        while (used.contains(candidate)) {
            candidate = root + i++;
        }
        return candidate;
    }
}
