package io.liarslie.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.liarslie.model.AgentDescriptor;
import io.liarslie.util.Jsons;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentRosterStoreTest {
    @TempDir
    Path tempDir;

    @Test
    void writeShouldProduceSnakeCaseJsonArray() throws Exception {
        AgentRosterStore store = new AgentRosterStore(tempDir.resolve("agents.config"));
        List<AgentDescriptor> roster = List.of(
                new AgentDescriptor(1, "127.0.0.1", 5001, "a2V5LTE="),
                new AgentDescriptor(2, "127.0.0.1", 5002, "a2V5LTI=")
        );

        store.write(roster);

        assertTrue(store.exists());
        JsonNode json = Jsons.mapper().readTree(store.file().toFile());
        assertTrue(json.isArray());
        assertEquals(1, json.get(0).get("agent_id").asInt());
        assertEquals("127.0.0.1", json.get(0).get("address").asText());
        assertEquals(5001, json.get(0).get("port").asInt());
        assertEquals("a2V5LTE=", json.get(0).get("public_key").asText());
        assertEquals(roster, store.read());
        assertFalse(Files.exists(tempDir.resolve("agents.config.tmp")));
    }

    @Test
    void writeShouldReplaceExistingRoster() throws Exception {
        AgentRosterStore store = new AgentRosterStore(tempDir.resolve("agents.config"));
        store.write(List.of(new AgentDescriptor(1, "127.0.0.1", 5001, "a2V5LTE=")));

        store.write(List.of());

        assertTrue(store.read().isEmpty());
    }

    @Test
    void readingMissingRosterShouldFail() {
        AgentRosterStore store = new AgentRosterStore(tempDir.resolve("missing.config"));

        assertFalse(store.exists());
        assertThrows(NoSuchFileException.class, store::read);
    }

    @Test
    void deleteShouldRemoveRosterOnce() throws Exception {
        AgentRosterStore store = new AgentRosterStore(tempDir.resolve("agents.config"));
        store.write(List.of());

        assertTrue(store.delete());
        assertFalse(store.delete());
        assertFalse(store.exists());
    }

    @Test
    void writeOverNonEmptyDirectoryShouldFail() throws Exception {
        Path blocked = tempDir.resolve("agents.config");
        Files.createDirectories(blocked);
        Files.writeString(blocked.resolve("keep"), "x");

        AgentRosterStore store = new AgentRosterStore(blocked);

        assertThrows(IOException.class, () -> store.write(List.of()));
    }

    @Test
    void malformedRosterShouldFailToRead() throws Exception {
        Path file = tempDir.resolve("agents.config");
        Files.writeString(file, "[{\"agent_id\": 0, \"address\": \"127.0.0.1\", \"port\": 5000, \"public_key\": \"k\"}]");

        assertThrows(IOException.class, () -> new AgentRosterStore(file).read());
    }
}
