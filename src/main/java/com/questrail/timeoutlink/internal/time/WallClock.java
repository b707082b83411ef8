package com.questrail.timeoutlink.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly to timestamp observability events.
 *
 * <p>
 * It MUST NOT be used for deadlines or attribution ordering.
 * </p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
