package io.herald4j.selection;

import io.herald4j.core.SelectionPolicy;
import io.herald4j.core.Variant;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Picks the variant an occurrence publishes.
 *
 * <p>Deterministic: for the same variants, policy, context and seed the same variant is returned. Variants are
 * validated first, then the no-repeat window is applied (falling back to the unfiltered pool when it would
 * leave nothing), and the pool is ordered by id before drawing so storage order does not matter.
 */
public class VariantSelector {

    private static final Comparator<Variant> BY_ID = Comparator.comparing(Variant::id);

    private final VariantValidator validator;

    public VariantSelector() {
        this(new VariantValidator());
    }

    public VariantSelector(VariantValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /**
     * @param seed explicit seed, or null to derive it from (scheduleId, plannedAt)
     * @return empty when no variant is eligible
     */
    public Optional<Selection> select(List<Variant> variants, SelectionPolicy policy, SelectionContext context,
                                      Instant plannedAt, Long seed) {
        Objects.requireNonNull(context, "context must not be null");
        SelectionPolicy effective = policy == null ? SelectionPolicy.UNIFORM_RANDOM : policy;

        List<Variant> eligible = validator.eligible(variants);
        if (eligible.isEmpty()) {
            return Optional.empty();
        }

        long seedUsed = seed != null ? seed : SelectionSeeds.seed(context.scheduleId(), plannedAt);
        List<Variant> pool = applyNoRepeatWindow(eligible, context).stream().sorted(BY_ID).toList();

        Random rng = new Random(seedUsed);
        return Optional.of(switch (effective) {
            case UNIFORM_RANDOM, NO_REPEAT_WINDOW ->
                    new Selection(pool.get(rng.nextInt(pool.size())), seedUsed, effective, null);
            case WEIGHTED_RANDOM -> new Selection(weighted(pool, rng), seedUsed, effective, null);
            case ROUND_ROBIN -> {
                int current = context.roundRobinCursor() == null ? -1 : context.roundRobinCursor();
                int next = Math.floorMod(current + 1, pool.size());
                yield new Selection(pool.get(next), seedUsed, effective, next);
            }
        });
    }

    private static List<Variant> applyNoRepeatWindow(List<Variant> eligible, SelectionContext context) {
        if (context.noRepeatWindow() <= 0 || context.recentVariantIds().isEmpty()) {
            return eligible;
        }
        Set<String> recent = new HashSet<>(context.recentVariantIds()
                .subList(0, Math.min(context.noRepeatWindow(), context.recentVariantIds().size())));
        List<Variant> filtered = eligible.stream()
                .filter(v -> !recent.contains(v.id()))
                .toList();
        return filtered.isEmpty() ? eligible : filtered;
    }

    private static Variant weighted(List<Variant> pool, Random rng) {
        double total = 0;
        for (Variant v : pool) {
            if (v.weight() > 0) {
                total += v.weight();
            }
        }
        if (total <= 0) {
            return pool.get(rng.nextInt(pool.size()));
        }

        double r = rng.nextDouble() * total;
        double cumulative = 0;
        Variant last = null;
        for (Variant v : pool) {
            if (v.weight() <= 0) {
                continue;
            }
            cumulative += v.weight();
            last = v;
            if (r < cumulative) {
                return v;
            }
        }
        // rounding at the upper edge
        return last;
    }
}
