package com.architecture.memory.codegraph.model.graph;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of resolving one call site: exactly one of {@link Resolved}, {@link Unresolved} or
 * {@link Ambiguous}. Ambiguity is kept as data together with the candidate set.
 */
public abstract class Resolution {

    public enum Status {
        RESOLVED,
        UNRESOLVED,
        AMBIGUOUS
    }

    private Resolution() {
    }

    public abstract Status getStatus();

    public static Resolution resolved(String targetId) {
        return new Resolved(targetId);
    }

    public static Resolution unresolved() {
        return Unresolved.INSTANCE;
    }

    public static Resolution ambiguous(List<String> candidateIds) {
        return new Ambiguous(candidateIds);
    }

    /**
     * Reads the resolution persisted on a CallSite node and its RESOLVES_TO edge.
     */
    public static Resolution of(GraphNode callSite, GraphState view) {
        Status status = parseStatus(callSite.stringProperty(NodeProperties.RESOLUTION_STATUS));
        return switch (status) {
            case RESOLVED -> view.outgoing(callSite.getId(), EdgeKind.RESOLVES_TO).stream()
                    .findFirst()
                    .map(edge -> resolved(edge.getTargetId()))
                    .orElse(unresolved());
            case AMBIGUOUS -> ambiguous(callSite.listProperty(NodeProperties.CANDIDATES));
            case UNRESOLVED -> unresolved();
        };
    }

    private static Status parseStatus(String value) {
        if (value == null) {
            return Status.UNRESOLVED;
        }
        try {
            return Status.valueOf(value);
        } catch (IllegalArgumentException e) {
            return Status.UNRESOLVED;
        }
    }

    public static final class Resolved extends Resolution {
        private final String targetId;

        private Resolved(String targetId) {
            this.targetId = Objects.requireNonNull(targetId);
        }

        public String getTargetId() {
            return targetId;
        }

        @Override
        public Status getStatus() {
            return Status.RESOLVED;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Resolved other && targetId.equals(other.targetId);
        }

        @Override
        public int hashCode() {
            return targetId.hashCode();
        }

        @Override
        public String toString() {
            return "Resolved(" + targetId + ")";
        }
    }

    public static final class Unresolved extends Resolution {
        private static final Unresolved INSTANCE = new Unresolved();

        private Unresolved() {
        }

        @Override
        public Status getStatus() {
            return Status.UNRESOLVED;
        }

        @Override
        public String toString() {
            return "Unresolved";
        }
    }

    public static final class Ambiguous extends Resolution {
        private final List<String> candidateIds;

        private Ambiguous(List<String> candidateIds) {
            this.candidateIds = candidateIds.stream().sorted().toList();
        }

        public List<String> getCandidateIds() {
            return candidateIds;
        }

        @Override
        public Status getStatus() {
            return Status.AMBIGUOUS;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Ambiguous other && candidateIds.equals(other.candidateIds);
        }

        @Override
        public int hashCode() {
            return candidateIds.hashCode();
        }

        @Override
        public String toString() {
            return "Ambiguous" + candidateIds;
        }
    }
}
