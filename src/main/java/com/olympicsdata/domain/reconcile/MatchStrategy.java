package com.olympicsdata.domain.reconcile;

import java.util.Optional;

/**
 * One tier of natural-key matching. Tiers are tried in order and the first
 * hit wins, so the tier name and confidence travel with every resolution.
 *
 * @param <K> natural key type
 */
public interface MatchStrategy<K> {

    String strategyName();

    MatchConfidence confidence();

    Optional<String> match(K key, NaturalKeyIndex index);
}
