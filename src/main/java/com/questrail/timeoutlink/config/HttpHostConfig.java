package com.questrail.timeoutlink.config;

import com.questrail.timeoutlink.gate.TimeoutLinkConfig;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the time-boxed HTTP host.
 *
 * <ul>
 *   <li><b>bindAddress</b>: listen address; port 0 picks an ephemeral port.</li>
 *   <li><b>gate</b>: safety buffer and unhosted budget of the installed gate.</li>
 *   <li><b>invocationTimeout</b>: hard wall-clock limit per request, counted
 *       from acceptance. When present every request carries a remaining-time
 *       oracle; when absent the host behaves like local/dev execution.</li>
 *   <li><b>workerThreads</b>: threads running pipelines.</li>
 *   <li><b>maxContentLength</b>: largest request body accepted, in bytes.</li>
 * </ul>
 */
public record HttpHostConfig(
    InetSocketAddress bindAddress,
    TimeoutLinkConfig gate,
    Optional<Duration> invocationTimeout,
    int workerThreads,
    int maxContentLength
) {
    public HttpHostConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(gate, "gate");
        Objects.requireNonNull(invocationTimeout, "invocationTimeout");

        invocationTimeout.ifPresent(t -> {
            if (t.isNegative() || t.isZero()) {
                throw new IllegalArgumentException("invocationTimeout must be positive (current: " + t + ")");
            }
        });
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive (current: " + workerThreads + ")");
        }
        if (maxContentLength <= 0) {
            throw new IllegalArgumentException("maxContentLength must be positive (current: " + maxContentLength + ")");
        }
    }

    public boolean isTimeBoxed() {
        return invocationTimeout.isPresent();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private TimeoutLinkConfig gate = TimeoutLinkConfig.defaults();
        private Duration invocationTimeout;
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private int maxContentLength = 1024 * 1024;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withSafetyBuffer(Duration safetyBuffer) {
            this.gate = new TimeoutLinkConfig(safetyBuffer, gate.unhostedBudget());
            return this;
        }

        public Builder withGate(TimeoutLinkConfig gate) {
            this.gate = gate;
            return this;
        }

        /**
         * @param invocationTimeout per-request limit, or {@code null} to run unhosted
         */
        public Builder withInvocationTimeout(Duration invocationTimeout) {
            this.invocationTimeout = invocationTimeout;
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder withMaxContentLength(int maxContentLength) {
            this.maxContentLength = maxContentLength;
            return this;
        }

        public HttpHostConfig build() {
            return new HttpHostConfig(
                bindAddress, gate, Optional.ofNullable(invocationTimeout), workerThreads, maxContentLength);
        }
    }
}
