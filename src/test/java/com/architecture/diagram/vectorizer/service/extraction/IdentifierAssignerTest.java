package com.architecture.diagram.vectorizer.service.extraction;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierAssignerTest {

    private final IdentifierAssigner assigner = new IdentifierAssigner();

    @Test
    void normalize_collapsesNonAlphanumericRuns() {
        assertThat(assigner.normalize("Process Data")).isEqualTo("process_data");
        assertThat(assigner.normalize("  API -- Gateway!! ")).isEqualTo("api_gateway");
        assertThat(assigner.normalize("User-Service_v2")).isEqualTo("user_service_v2");
    }

    @Test
    void normalize_fallsBackForEmptyAndNumericLabels() {
        assertThat(assigner.normalize("")).isEqualTo("node");
        assertThat(assigner.normalize("???")).isEqualTo("node");
        assertThat(assigner.normalize(null)).isEqualTo("node");
        assertThat(assigner.normalize("3rd Party")).isEqualTo("node_3rd_party");
    }

    @Test
    void normalize_ignoresDefaultLocale() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            assertThat(assigner.normalize("LINK SERVICE")).isEqualTo("link_service");
            assertThat(assigner.assign("Billing", "PRIMARY", IdRegistry.of(Set.of("billing"))).getId())
                    .isEqualTo("billing_primary");
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void assign_usesNormalizedLabelWhenFree() {
        IdAssignment assignment = assigner.assign("Load Balancer", null, IdRegistry.empty());

        assertThat(assignment.getId()).isEqualTo("load_balancer");
        assertThat(assignment.getRegistry().asSet()).containsExactly("load_balancer");
    }

    @Test
    void assign_prefersContextBeforeNumericSuffix() {
        IdRegistry registry = IdRegistry.of(Set.of("artifact"));

        IdAssignment assignment = assigner.assign("Artifact", "PROD", registry);

        assertThat(assignment.getId()).isEqualTo("artifact_prod");
    }

    @Test
    void assign_appendsNumericSuffixWithoutContext() {
        IdRegistry registry = IdRegistry.empty();
        registry = assigner.assign("Worker", null, registry).getRegistry();
        IdAssignment second = assigner.assign("Worker", null, registry);
        IdAssignment third = assigner.assign("Worker", null, second.getRegistry());

        assertThat(second.getId()).isEqualTo("worker_2");
        assertThat(third.getId()).isEqualTo("worker_3");
    }

    @Test
    void assign_suffixesQualifiedIdWhenContextAlsoTaken() {
        IdRegistry registry = IdRegistry.of(Set.of("artifact", "artifact_dev"));

        IdAssignment assignment = assigner.assign("Artifact", "dev", registry);

        assertThat(assignment.getId()).isEqualTo("artifact_dev_2");
    }

    @Test
    void assign_leavesInputRegistryUntouched() {
        IdRegistry registry = IdRegistry.of(Set.of("cache"));

        IdAssignment assignment = assigner.assign("Cache", null, registry);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(assignment.getRegistry().size()).isEqualTo(2);
    }

    @Test
    void assignQualified_qualifiesEvenWhenPlainTokenIsFree() {
        IdAssignment dev = assigner.assignQualified("Artifact", "DEV", IdRegistry.empty());
        IdAssignment prod = assigner.assignQualified("Artifact", "PROD", dev.getRegistry());

        assertThat(dev.getId()).isEqualTo("artifact_dev");
        assertThat(prod.getId()).isEqualTo("artifact_prod");
    }

    @Test
    void assignQualified_withoutContextBehavesLikeAssign() {
        IdAssignment assignment = assigner.assignQualified("Artifact", "  ", IdRegistry.empty());

        assertThat(assignment.getId()).isEqualTo("artifact");
    }

    @Test
    void assignEdge_numbersParallelEdges() {
        IdAssignment first = assigner.assignEdge("api", "db", IdRegistry.empty());
        IdAssignment second = assigner.assignEdge("api", "db", first.getRegistry());
        IdAssignment reverse = assigner.assignEdge("db", "api", second.getRegistry());

        assertThat(first.getId()).isEqualTo("api_to_db");
        assertThat(second.getId()).isEqualTo("api_to_db_2");
        assertThat(reverse.getId()).isEqualTo("db_to_api");
    }

    @Test
    void assign_isDeterministicForSameEncounterOrder() {
        String[] labels = {"Service", "Service", "DB", "service", "Queue"};

        assertThat(assignAll(labels)).isEqualTo(assignAll(labels));
        assertThat(assignAll(labels)).containsExactly("service", "service_2", "db", "service_3", "queue");
    }

    private List<String> assignAll(String[] labels) {
        List<String> ids = new ArrayList<>();
        IdRegistry registry = IdRegistry.empty();
        for (String label : labels) {
            IdAssignment assignment = assigner.assign(label, null, registry);
            ids.add(assignment.getId());
            registry = assignment.getRegistry();
        }
        return ids;
    }
}
