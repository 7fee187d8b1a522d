package info.isaksson.erland.mappinglint.model;

/**
 * Turns mapping expression text into an {@link ExpressionShape}.
 *
 * <p>Implementations must not throw for malformed text; they return {@link ExpressionShape#unsummarized(String)}.</p>
 */
public interface ExpressionSummarizer {

    ExpressionShape summarize(String expression, SummaryContext context);

    /** Summarizer that knows nothing; every expression stays unsummarized. */
    ExpressionSummarizer NONE = (expression, context) -> ExpressionShape.unsummarized(expression);
}
