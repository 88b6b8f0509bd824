package io.liarslie.lifecycle;

import io.liarslie.agent.Agent;
import io.liarslie.agent.AgentIdentity;
import io.liarslie.config.LiarsLieConfig;
import io.liarslie.model.AgentStatus;
import io.liarslie.security.Signatures;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentSupervisorTest {
    private static final LiarsLieConfig CONFIG = new LiarsLieConfig(
            "127.0.0.1", 1, 5000, null, 500, 2000, 3000, 1024 * 1024, 0.5d);
    private static final String CLIENT_KEY = Signatures.generateKeyPair().publicKey();

    @Test
    void spawnShouldMarkAcknowledgedAgentsReady() throws Exception {
        Agent first = agent(1, freePort());
        Agent second = agent(2, freePort());
        try (AgentSupervisor supervisor = new AgentSupervisor(CONFIG)) {
            AgentSupervisor.SpawnReport report = supervisor.spawn(List.of(first, second));

            assertEquals(List.of(1, 2), report.spawned());
            assertTrue(report.failed().isEmpty());
            assertEquals(AgentStatus.READY, first.status());
            assertEquals(AgentStatus.READY, second.status());
        }
    }

    @Test
    void agentThatCannotBindShouldBeReportedAndNeverReady() throws Exception {
        try (ServerSocket occupied = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"));
             AgentSupervisor supervisor = new AgentSupervisor(CONFIG)) {
            Agent healthy = agent(1, freePort());
            Agent blocked = agent(2, occupied.getLocalPort());

            AgentSupervisor.SpawnReport report = supervisor.spawn(List.of(healthy, blocked));

            assertEquals(List.of(1), report.spawned());
            assertEquals(List.of(2), report.failed());
            assertEquals(AgentStatus.READY, healthy.status());
            assertFalse(blocked.status() == AgentStatus.READY);
        }
    }

    @Test
    void spawnShouldSkipAgentsAlreadyStarted() throws Exception {
        Agent agent = agent(1, freePort());
        try (AgentSupervisor supervisor = new AgentSupervisor(CONFIG)) {
            supervisor.spawn(List.of(agent));

            AgentSupervisor.SpawnReport again = supervisor.spawn(List.of(agent));

            assertTrue(again.spawned().isEmpty());
            assertTrue(again.failed().isEmpty());
        }
    }

    @Test
    void stoppedAgentShouldEndUpKilled() throws Exception {
        Agent agent = agent(1, freePort());
        try (AgentSupervisor supervisor = new AgentSupervisor(CONFIG)) {
            supervisor.spawn(List.of(agent));

            supervisor.stop(agent);

            assertTrue(supervisor.awaitStopped(agent, 5000));
            assertEquals(AgentStatus.KILLED, agent.status());
        }
    }

    private static Agent agent(int id, int port) {
        return new Agent(new AgentIdentity(id, 42L, "127.0.0.1", port, Signatures.generateKeyPair(), CLIENT_KEY, false, 0.0d));
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
