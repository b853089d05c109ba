package ai.docsite.autodoc.agent;

import ai.docsite.autodoc.agent.tools.ActionName;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered phases for one task.
 */
public record PhasePlan(PlanVariant variant, List<Phase> phases) {

    public PhasePlan {
        Objects.requireNonNull(variant, "variant");
        phases = List.copyOf(phases);
    }

    public Phase phase(PhaseName name) {
        return phases.stream()
                .filter(phase -> phase.name() == name)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No phase " + name + " in plan"));
    }

    public int totalBudget() {
        return phases.stream().mapToInt(Phase::stepBudget).sum();
    }

    public Set<ActionName> allRequiredActions() {
        Set<ActionName> all = new LinkedHashSet<>();
        phases.forEach(phase -> all.addAll(phase.requiredActions()));
        return all;
    }
}
