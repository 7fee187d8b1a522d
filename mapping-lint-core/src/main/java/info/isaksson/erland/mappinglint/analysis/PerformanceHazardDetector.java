package info.isaksson.erland.mappinglint.analysis;

import info.isaksson.erland.mappinglint.model.AccessorRef;
import info.isaksson.erland.mappinglint.model.ExpressionFact;
import info.isaksson.erland.mappinglint.model.MappingDeclaration;
import info.isaksson.erland.mappinglint.model.Member;
import info.isaksson.erland.mappinglint.model.MemberConfig;
import info.isaksson.erland.mappinglint.model.TypeShape;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hazard rules over the facts of each effective {@code MAP_FROM} expression. Each rule fires at most once
 * per expression; unsummarized expressions are skipped. An expression whose facts cannot be evaluated is
 * recorded as a warning and the others are still checked.
 */
public final class PerformanceHazardDetector {

    public List<Diagnostic> detect(MappingDeclaration declaration, TypeShape source, TypeShape dest,
                                   ConfigOverrides overrides, AnalysisWarnings warnings) {
        List<Diagnostic> out = new ArrayList<>();
        for (MemberConfig config : overrides.effectiveMapFroms()) {
            if (config.shape == null || !config.shape.summarized) continue;
            try {
                out.addAll(detect(declaration, source, dest, config));
            } catch (RuntimeException e) {
                warnings.memberFailed(declaration.id, config.destMember, e);
            }
        }
        return out;
    }

    private List<Diagnostic> detect(MappingDeclaration declaration, TypeShape source, TypeShape dest,
                                    MemberConfig config) {
        List<Diagnostic> out = new ArrayList<>();
        HazardCollector hazards = new HazardCollector();
        for (ExpressionFact fact : config.shape.facts) {
            fact.accept(hazards);
        }
        Member dm = dest.findMember(config.destMember);
        String destMemberType = dm == null ? "" : dm.effectiveType().display();

        if (hazards.dependencyCall != null) {
            ExpressionFact.DependencyCall call = hazards.dependencyCall;
            String target = "<init>".equals(call.operation())
                    ? call.receiver() + "(...)"
                    : call.receiver() + "." + call.operation() + "(...)";
            String detail = call.category().description() + " '" + target + "'";
            out.add(hazard(MappingRule.EXPENSIVE_OPERATION_IN_MAP_FROM, declaration, source, dest, config, destMemberType, detail));
        }
        String enumerated = repeatedCollection(hazards.enumerations, source);
        if (enumerated != null) {
            out.add(hazard(MappingRule.MULTIPLE_ENUMERATION, declaration, source, dest, config, destMemberType, enumerated));
        }
        if (hazards.blockingUnwrap != null) {
            String detail = hazards.blockingUnwrap.receiver() + "." + hazards.blockingUnwrap.operation();
            out.add(hazard(MappingRule.TASK_RESULT_SYNCHRONOUS_ACCESS, declaration, source, dest, config, destMemberType, detail));
        }
        if (hazards.nonDeterministic != null) {
            out.add(hazard(MappingRule.NON_DETERMINISTIC_OPERATION, declaration, source, dest, config, destMemberType,
                    hazards.nonDeterministic.primitive()));
        }
        return out;
    }

    /** First source member enumerated twice or more whose type is a known collection; null otherwise. */
    private static String repeatedCollection(Map<String, List<AccessorRef>> enumerations, TypeShape source) {
        for (List<AccessorRef> sites : enumerations.values()) {
            if (sites.size() < 2) continue;
            Member m = sites.get(0).resolve(source);
            if (m != null && m.effectiveType().unwrapNullable().isCollection()) return m.name;
        }
        return null;
    }

    private static Diagnostic hazard(MappingRule rule, MappingDeclaration declaration, TypeShape source, TypeShape dest,
                                     MemberConfig config, String destMemberType, String detail) {
        return new Diagnostic(rule, null, declaration.id, config.destMember, source.simpleName(), "",
                dest.simpleName(), destMemberType, detail,
                config.location != null ? config.location : declaration.location);
    }

    /** Keeps the first fact per hazard and groups enumeration sites by member. */
    private static final class HazardCollector implements ExpressionFact.Visitor<Void> {
        ExpressionFact.DependencyCall dependencyCall;
        ExpressionFact.NonDeterministicPrimitive nonDeterministic;
        ExpressionFact.BlockingUnwrap blockingUnwrap;
        final Map<String, List<AccessorRef>> enumerations = new LinkedHashMap<>();

        @Override public Void visitBareMemberAccess(ExpressionFact.BareMemberAccess fact) {
            return null;
        }

        @Override public Void visitEnumerationSite(ExpressionFact.EnumerationSite fact) {
            enumerations.computeIfAbsent(fact.accessor().propertyName(), k -> new ArrayList<>()).add(fact.accessor());
            return null;
        }

        @Override public Void visitDependencyCall(ExpressionFact.DependencyCall fact) {
            if (dependencyCall == null) dependencyCall = fact;
            return null;
        }

        @Override public Void visitNonDeterministicPrimitive(ExpressionFact.NonDeterministicPrimitive fact) {
            if (nonDeterministic == null) nonDeterministic = fact;
            return null;
        }

        @Override public Void visitBlockingUnwrap(ExpressionFact.BlockingUnwrap fact) {
            if (blockingUnwrap == null) blockingUnwrap = fact;
            return null;
        }
    }
}
