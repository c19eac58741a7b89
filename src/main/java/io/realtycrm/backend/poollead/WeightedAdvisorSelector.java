package io.realtycrm.backend.poollead;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.random.RandomGenerator;
import org.springframework.stereotype.Component;

/**
 * Roulette-wheel selection: each candidate is picked with probability proportional to its weight,
 * so advisors in higher phases receive more pool leads.
 */
@Component
public class WeightedAdvisorSelector {

  /** An eligible advisor and the lead weight of its current phase. */
  public record Candidate(UUID userId, long weight) {}

  private final RandomGenerator random;

  public WeightedAdvisorSelector(RandomGenerator random) {
    this.random = random;
  }

  /**
   * Draws {@code r} uniformly in [0, total weight) and returns the first candidate whose cumulative
   * weight reaches {@code r}. Candidates with weight zero are never picked. Empty when there are no
   * candidates or all weights are zero.
   */
  public Optional<UUID> select(List<Candidate> candidates) {
    long totalWeight = totalWeight(candidates);
    if (candidates.isEmpty() || totalWeight == 0) {
      return Optional.empty();
    }

    double r = random.nextDouble() * totalWeight;
    long cumulative = 0;
    Candidate first = null;
    for (Candidate candidate : candidates) {
      if (candidate.weight() <= 0) {
        continue;
      }
      if (first == null) {
        first = candidate;
      }
      cumulative += candidate.weight();
      if (r <= cumulative) {
        return Optional.of(candidate.userId());
      }
    }
    // floating point guard, unreachable for r < totalWeight
    return Optional.of(first.userId());
  }

  public static long totalWeight(List<Candidate> candidates) {
    return candidates.stream().mapToLong(Candidate::weight).sum();
  }
}
