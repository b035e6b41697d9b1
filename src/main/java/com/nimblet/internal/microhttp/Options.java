package com.nimblet.internal.microhttp;

import java.time.Duration;

/**
 * Immutable event loop settings. Acquire a builder via {@link #builder()}.
 */
public record Options(
        String host,
        int port,
        boolean reuseAddr,
        Duration resolution,
        Duration requestTimeout,
        Duration idleTimeout,
        Duration sweepInterval,
        int readBufferSize,
        int acceptLength,
        int maxRequestSize,
        int concurrency,
        int maxConnections) {

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8080;
        private boolean reuseAddr = true;
        private Duration resolution = Duration.ofMillis(100);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration idleTimeout = Duration.ofMinutes(2);
        private Duration sweepInterval = Duration.ofSeconds(1);
        private int readBufferSize = 1_024 * 64;
        private int acceptLength = 0;
        private int maxRequestSize = 1_024 * 1_024 * 10;
        private int concurrency = 1;
        private int maxConnections = 0;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder reuseAddr(boolean reuseAddr) {
            this.reuseAddr = reuseAddr;
            return this;
        }

        public Builder resolution(Duration resolution) {
            this.resolution = resolution;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        public Builder readBufferSize(int readBufferSize) {
            this.readBufferSize = readBufferSize;
            return this;
        }

        public Builder acceptLength(int acceptLength) {
            this.acceptLength = acceptLength;
            return this;
        }

        public Builder maxRequestSize(int maxRequestSize) {
            this.maxRequestSize = maxRequestSize;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Options build() {
            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be >= 1");
            }
            if (readBufferSize < 1) {
                throw new IllegalArgumentException("readBufferSize must be >= 1");
            }
            return new Options(host, port, reuseAddr, resolution, requestTimeout, idleTimeout, sweepInterval,
                    readBufferSize, acceptLength, maxRequestSize, concurrency, maxConnections);
        }
    }
}
