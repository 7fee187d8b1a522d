package info.isaksson.erland.mappinglint.model;

/**
 * Closed set of facts an expression summary can carry. Rules consume facts through {@link Visitor};
 * a new hazard adds a variant and a visitor method.
 */
public sealed interface ExpressionFact {

    <R> R accept(Visitor<R> visitor);

    /** The whole expression body is one member read off the lambda parameter. */
    record BareMemberAccess(AccessorRef accessor) implements ExpressionFact {
        @Override public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBareMemberAccess(this);
        }
    }

    /** A source member is enumerated (streamed, iterated, copied, aggregated). */
    record EnumerationSite(AccessorRef accessor, String operation) implements ExpressionFact {
        @Override public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEnumerationSite(this);
        }
    }

    /** A call on a dependency-shaped receiver (repository, client, file system...). */
    record DependencyCall(String receiver, String operation, DependencyCategory category) implements ExpressionFact {
        @Override public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDependencyCall(this);
        }
    }

    /** A time-dependent or random-value primitive such as {@code LocalDateTime.now()}. */
    record NonDeterministicPrimitive(String primitive) implements ExpressionFact {
        @Override public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNonDeterministicPrimitive(this);
        }
    }

    /** A synchronous wait on an asynchronous result such as {@code future.join()}. */
    record BlockingUnwrap(String receiver, String operation) implements ExpressionFact {
        @Override public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlockingUnwrap(this);
        }
    }

    interface Visitor<R> {
        R visitBareMemberAccess(BareMemberAccess fact);

        R visitEnumerationSite(EnumerationSite fact);

        R visitDependencyCall(DependencyCall fact);

        R visitNonDeterministicPrimitive(NonDeterministicPrimitive fact);

        R visitBlockingUnwrap(BlockingUnwrap fact);
    }
}
