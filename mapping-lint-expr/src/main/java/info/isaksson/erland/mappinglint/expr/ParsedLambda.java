package info.isaksson.erland.mappinglint.expr;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;

import java.util.HashSet;
import java.util.Set;

/**
 * A mapping expression parsed as a lambda whose first parameter is the source object.
 *
 * <p>Names declared inside the lambda (locals, nested lambda parameters, catch parameters) are collected up front
 * so receivers can be told apart from captured variables. Shadowing is ignored.</p>
 */
final class ParsedLambda {
    final LambdaExpr lambda;
    final String parameterName;
    private final Set<String> declaredNames;

    private ParsedLambda(LambdaExpr lambda, String parameterName, Set<String> declaredNames) {
        this.lambda = lambda;
        this.parameterName = parameterName;
        this.declaredNames = declaredNames;
    }

    /** Parses {@code text}; null when it is not a lambda with one or two parameters. */
    static ParsedLambda parse(JavaParser parser, String text) {
        if (text == null || text.isBlank()) return null;
        ParseResult<Expression> result = parser.parseExpression(text.trim());
        if (!result.isSuccessful() || result.getResult().isEmpty()) return null;
        Expression e = unwrap(result.getResult().get());
        if (!(e instanceof LambdaExpr)) return null;
        LambdaExpr lambda = (LambdaExpr) e;
        if (lambda.getParameters().isEmpty() || lambda.getParameters().size() > 2) return null;

        String param = lambda.getParameter(0).getNameAsString();
        Set<String> declared = new HashSet<>();
        lambda.getBody().walk(VariableDeclarator.class, vd -> declared.add(vd.getNameAsString()));
        lambda.getBody().walk(Parameter.class, p -> declared.add(p.getNameAsString()));
        for (int i = 1; i < lambda.getParameters().size(); i++) {
            declared.add(lambda.getParameter(i).getNameAsString());
        }
        declared.remove(param);
        return new ParsedLambda(lambda, param, declared);
    }

    /** Parses a method reference such as {@code Order::getName}; null otherwise. */
    static MethodReferenceExpr parseMethodReference(JavaParser parser, String text) {
        if (text == null || text.isBlank()) return null;
        ParseResult<Expression> result = parser.parseExpression(text.trim());
        if (!result.isSuccessful() || result.getResult().isEmpty()) return null;
        Expression e = unwrap(result.getResult().get());
        return e instanceof MethodReferenceExpr ? (MethodReferenceExpr) e : null;
    }

    /** The single result expression: the expression body, or the only statement of a block returning a value. */
    Expression resultExpression() {
        Statement body = lambda.getBody();
        if (lambda.getExpressionBody().isPresent()) return unwrap(lambda.getExpressionBody().get());
        if (body instanceof BlockStmt) {
            BlockStmt block = (BlockStmt) body;
            if (block.getStatements().size() == 1 && block.getStatement(0) instanceof ReturnStmt) {
                return ((ReturnStmt) block.getStatement(0)).getExpression().map(ParsedLambda::unwrap).orElse(null);
            }
        }
        return null;
    }

    boolean isParameter(Expression e) {
        Expression u = unwrap(e);
        return u instanceof NameExpr && ((NameExpr) u).getNameAsString().equals(parameterName);
    }

    /** Declared inside the lambda, including the parameter itself. */
    boolean isDeclaredInside(String name) {
        return name.equals(parameterName) || declaredNames.contains(name);
    }

    /** Names used anywhere in the lambda, for choosing fresh local names. */
    Set<String> usedNames() {
        Set<String> out = new HashSet<>(declaredNames);
        out.add(parameterName);
        lambda.walk(NameExpr.class, n -> out.add(n.getNameAsString()));
        return out;
    }

    static Expression unwrap(Expression e) {
        Expression cur = e;
        while (cur instanceof EnclosedExpr) {
            cur = ((EnclosedExpr) cur).getInner();
        }
        return cur;
    }
}
