package com.architecture.memory.codegraph.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code codegraph.*} namespace of application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "codegraph")
public class CodeGraphProperties {

    @Valid
    private Store store = new Store();

    @Valid
    private Snapshot snapshot = new Snapshot();

    @Valid
    private Validation validation = new Validation();

    @Valid
    private Resolution resolution = new Resolution();

    @Data
    public static class Store {
        /** memory | neo4j */
        @NotNull
        private String type = "memory";
    }

    @Data
    public static class Snapshot {
        /** memory | mongo */
        @NotNull
        private String store = "memory";

        /** Snapshots older than this are removed by the cleanup job; 0 keeps them forever. */
        @Min(0)
        private int ttlHours = 0;

        @Min(1000)
        private long cleanupIntervalMs = 3_600_000L;
    }

    @Data
    public static class Validation {
        /** Severity reported for call sites that resolve to nothing. */
        @NotNull
        private String unresolvedSeverity = "warning";

        /** exact | lenient */
        @NotNull
        private String typeCompatibility = "lenient";

        @Min(0)
        private int incrementalHops = 1;

        private List<String> builtinTypes = new ArrayList<>(List.of(
                "int", "float", "complex", "str", "bytes", "bool", "None", "list", "dict", "set",
                "tuple", "frozenset", "bytearray"));

        private List<String> wildcardTypes = new ArrayList<>(List.of("Any", "object"));

        private List<String> annotationExemptParameters = new ArrayList<>(List.of("self", "cls"));
    }

    @Data
    public static class Resolution {
        /** Receiver prefixes stripped before bare-name lookup, e.g. {@code self.helper()}. */
        private List<String> receiverNames = new ArrayList<>(List.of("self", "this", "cls"));
    }
}
