package com.questrail.timeoutlink.gate;

import com.questrail.timeoutlink.api.RemainingTimeOracle;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * DeadlineBudget
 * =============================================================================
 * Time a request may spend in the pipeline before the gate's deadline timer
 * fires. Computed once per request and never changed.
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link Hosted}: a remaining-time oracle was present. The budget is
 *       {@code remaining - safetyBuffer}, floored at zero.</li>
 *   <li>{@link Unhosted}: no oracle (local/dev). The budget is the configured
 *       unhosted budget, so only the original signal is effectively
 *       operative.</li>
 * </ul>
 */
public sealed interface DeadlineBudget permits DeadlineBudget.Hosted, DeadlineBudget.Unhosted {

    /**
     * @return the delay the deadline timer is armed with; never negative
     */
    Duration effective();

    /**
     * @return what the host reported, empty when unhosted
     */
    Optional<Duration> hostRemaining();

    /**
     * @return {@code true} if no time is left and the pipeline must be skipped
     */
    default boolean isExhausted() {
        return effective().isZero();
    }

    static DeadlineBudget compute(Optional<RemainingTimeOracle> oracle, TimeoutLinkConfig config) {
        Objects.requireNonNull(oracle, "oracle");
        Objects.requireNonNull(config, "config");

        return oracle
            .<DeadlineBudget>map(o -> hosted(o.remainingTime(), config.safetyBuffer()))
            .orElseGet(() -> new Unhosted(config.unhostedBudget()));
    }

    static Hosted hosted(Duration remaining, Duration safetyBuffer) {
        Objects.requireNonNull(remaining, "remaining");
        Objects.requireNonNull(safetyBuffer, "safetyBuffer");

        Duration effective = remaining.compareTo(safetyBuffer) > 0
            ? remaining.minus(safetyBuffer)
            : Duration.ZERO;
        return new Hosted(remaining, safetyBuffer, effective);
    }

    record Hosted(Duration remaining, Duration safetyBuffer, Duration effective) implements DeadlineBudget {
        public Hosted {
            Objects.requireNonNull(remaining, "remaining");
            Objects.requireNonNull(safetyBuffer, "safetyBuffer");
            Objects.requireNonNull(effective, "effective");
            if (effective.isNegative()) {
                throw new IllegalArgumentException("effective must be non-negative");
            }
        }

        @Override
        public Optional<Duration> hostRemaining() {
            return Optional.of(remaining);
        }
    }

    record Unhosted(Duration effective) implements DeadlineBudget {
        public Unhosted {
            Objects.requireNonNull(effective, "effective");
            if (effective.isNegative() || effective.isZero()) {
                throw new IllegalArgumentException("effective must be positive");
            }
        }

        @Override
        public Optional<Duration> hostRemaining() {
            return Optional.empty();
        }
    }
}
