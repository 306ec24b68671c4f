package fr.lapetina.clusterclient.domain.strategy;

import fr.lapetina.clusterclient.domain.model.ClusterNode;
import fr.lapetina.clusterclient.domain.model.ServiceType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Random selection.
 *
 * Picks a random candidate; if the admission gate rejects it, the remaining
 * candidates are tried in random order. Thread-safe via ThreadLocalRandom.
 */
public final class RandomStrategy implements NodeSelectionStrategy {

    @Override
    public String getName() {
        return "random";
    }

    @Override
    public Optional<ClusterNode> selectNode(List<ClusterNode> candidates, ServiceType service, Predicate<ClusterNode> admission) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        List<ClusterNode> remaining = new ArrayList<>(candidates);
        while (!remaining.isEmpty()) {
            int index = ThreadLocalRandom.current().nextInt(remaining.size());
            ClusterNode node = remaining.remove(index);
            if (admission.test(node)) {
                return Optional.of(node);
            }
        }

        return Optional.empty();
    }
}
