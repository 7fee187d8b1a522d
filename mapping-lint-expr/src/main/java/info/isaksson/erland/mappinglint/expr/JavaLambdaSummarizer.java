package info.isaksson.erland.mappinglint.expr;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import info.isaksson.erland.mappinglint.model.AccessorRef;
import info.isaksson.erland.mappinglint.model.ExpressionFact;
import info.isaksson.erland.mappinglint.model.ExpressionShape;
import info.isaksson.erland.mappinglint.model.ExpressionSummarizer;
import info.isaksson.erland.mappinglint.model.SummaryContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Summarizes Java lambda mapping expressions ({@code src -> src.getName()}) into {@link ExpressionShape}s.
 *
 * <p>Works on syntax alone, without symbol solving:
 * <ul>
 *   <li>{@link SourceAccessors}: member reads off the lambda parameter,</li>
 *   <li>{@link EnumerationSites}: traversals of source members,</li>
 *   <li>{@link DependencyShapes}: repository/client/file/reflection calls,</li>
 *   <li>{@link NonDeterministicPrimitives}: clock and random reads,</li>
 *   <li>{@link BlockingUnwraps}: waits on futures and reactive publishers.</li>
 * </ul>
 * Text that does not parse as a lambda (or a getter method reference) is returned unsummarized.</p>
 */
public final class JavaLambdaSummarizer implements ExpressionSummarizer {

    private final JavaParser parser;

    public JavaLambdaSummarizer() {
        this.parser = createParser();
    }

    static JavaParser createParser() {
        ParserConfiguration cfg = new ParserConfiguration();
        cfg.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        return new JavaParser(cfg);
    }

    @Override
    public ExpressionShape summarize(String expression, SummaryContext context) {
        if (expression == null || expression.isBlank()) return ExpressionShape.unsummarized(expression);
        SummaryContext ctx = context == null ? SummaryContext.of(null) : context;
        try {
            ParsedLambda lambda = ParsedLambda.parse(parser, expression);
            if (lambda == null) return summarizeMethodReference(expression);

            List<ExpressionFact> facts = new ArrayList<>();
            Expression result = lambda.resultExpression();
            AccessorRef bare = result == null ? null : SourceAccessors.accessorOf(result, lambda);
            if (bare != null) facts.add(new ExpressionFact.BareMemberAccess(bare));
            EnumerationSites.collect(lambda, facts);
            DependencyShapes.collect(lambda, ctx, facts);
            NonDeterministicPrimitives.collect(lambda, facts);
            BlockingUnwraps.collect(lambda, ctx, facts);
            return new ExpressionShape(expression, lambda.parameterName, true, facts);
        } catch (RuntimeException e) {
            // Parser failures on exotic syntax leave the expression unsummarized.
            return ExpressionShape.unsummarized(expression);
        }
    }

    private ExpressionShape summarizeMethodReference(String expression) {
        MethodReferenceExpr ref = ParsedLambda.parseMethodReference(parser, expression);
        if (ref == null) return ExpressionShape.unsummarized(expression);
        String suffix = SourceAccessors.getterSuffix(ref.getIdentifier());
        if (suffix == null) return new ExpressionShape(expression, "", true, List.of());
        AccessorRef accessor = new AccessorRef(suffix, true, ref.toString());
        return new ExpressionShape(expression, "", true, List.of(new ExpressionFact.BareMemberAccess(accessor)));
    }
}
