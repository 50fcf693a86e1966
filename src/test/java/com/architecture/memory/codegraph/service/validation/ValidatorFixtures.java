package com.architecture.memory.codegraph.service.validation;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.repository.graph.GraphStore;

import java.util.List;

/**
 * A {@link ConservationValidator} wired with every check, as the application context would.
 */
public final class ValidatorFixtures {

    private ValidatorFixtures() {
    }

    public static ConservationValidator validator(GraphStore store, CodeGraphProperties properties) {
        SignatureConservationCheck signatureCheck = new SignatureConservationCheck(properties);
        List<ConservationCheck> checks = List.of(
                signatureCheck,
                new ReferenceIntegrityCheck(properties),
                new DataFlowConsistencyCheck(properties, new TypeCompatibilityPolicy(properties)),
                new StructuralIntegrityCheck());
        return new ConservationValidator(store, checks, signatureCheck, properties);
    }
}
