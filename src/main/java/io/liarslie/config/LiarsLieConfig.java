package io.liarslie.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class LiarsLieConfig {
    public static final String DEFAULT_AGENT_ADDRESS = "127.0.0.1";
    public static final int DEFAULT_FIRST_AGENT_ID = 1;
    public static final int DEFAULT_BASE_PORT = 5_000;
    public static final String DEFAULT_ROSTER_FILE = "agents.config";
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 2_000;
    public static final int DEFAULT_READ_TIMEOUT_MS = 5_000;
    public static final long DEFAULT_READY_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_MAX_FRAME_BYTES = 1024 * 1024;
    public static final double DEFAULT_TAMPER_PROBABILITY = 0.5d;

    private final String agentAddress;
    private final int firstAgentId;
    private final int basePort;
    private final Path rosterFile;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final long readyTimeoutMs;
    private final int maxFrameBytes;
    private final double defaultTamperProbability;

    public LiarsLieConfig(
            String agentAddress,
            int firstAgentId,
            int basePort,
            Path rosterFile,
            int connectTimeoutMs,
            int readTimeoutMs,
            long readyTimeoutMs,
            int maxFrameBytes,
            double defaultTamperProbability
    ) {
        if (agentAddress == null || agentAddress.isBlank()) {
            throw new IllegalArgumentException("agent address cannot be empty");
        }
        if (firstAgentId <= 0) {
            throw new IllegalArgumentException("first agent id must be positive: " + firstAgentId);
        }
        if (basePort <= 0 || basePort > 65535) {
            throw new IllegalArgumentException("invalid base port: " + basePort);
        }
        if (defaultTamperProbability < 0.0d || defaultTamperProbability > 1.0d) {
            throw new IllegalArgumentException("tamper probability must be within [0.0, 1.0]: " + defaultTamperProbability);
        }
        this.agentAddress = agentAddress.trim();
        this.firstAgentId = firstAgentId;
        this.basePort = basePort;
        this.rosterFile = rosterFile == null ? Paths.get(DEFAULT_ROSTER_FILE) : rosterFile;
        this.connectTimeoutMs = Math.max(100, connectTimeoutMs);
        this.readTimeoutMs = Math.max(100, readTimeoutMs);
        this.readyTimeoutMs = Math.max(100L, readyTimeoutMs);
        this.maxFrameBytes = Math.max(1024, maxFrameBytes);
        this.defaultTamperProbability = defaultTamperProbability;
    }

    // Shell options override the network and storage defaults; a blank roster path keeps the default file.
    public static LiarsLieConfig fromOptions(String roster, String address, int basePort, int timeoutMs) {
        Path resolved = roster == null || roster.isBlank()
                ? Paths.get(DEFAULT_ROSTER_FILE)
                : Paths.get(roster);
        return new LiarsLieConfig(
                address == null || address.isBlank() ? DEFAULT_AGENT_ADDRESS : address,
                DEFAULT_FIRST_AGENT_ID,
                basePort,
                resolved.toAbsolutePath().normalize(),
                timeoutMs,
                timeoutMs,
                DEFAULT_READY_TIMEOUT_MS,
                DEFAULT_MAX_FRAME_BYTES,
                DEFAULT_TAMPER_PROBABILITY
        );
    }

    public String agentAddress() {
        return agentAddress;
    }

    public int firstAgentId() {
        return firstAgentId;
    }

    public int basePort() {
        return basePort;
    }

    public Path rosterFile() {
        return rosterFile;
    }

    public int connectTimeoutMs() {
        return connectTimeoutMs;
    }

    public int readTimeoutMs() {
        return readTimeoutMs;
    }

    public long readyTimeoutMs() {
        return readyTimeoutMs;
    }

    public int maxFrameBytes() {
        return maxFrameBytes;
    }

    public double defaultTamperProbability() {
        return defaultTamperProbability;
    }
}
