package io.liarslie.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.liarslie.model.AgentDescriptor;
import io.liarslie.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * The roster file: a pretty-printed JSON array of agent descriptors that tells the client
 * which agents exist, where they listen and which key signs their answers.
 */
public final class AgentRosterStore {
    private static final TypeReference<List<AgentDescriptor>> ROSTER_TYPE = new TypeReference<>() {
    };

    private final Path file;

    public AgentRosterStore(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("roster file cannot be null");
        }
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        return Files.isRegularFile(file);
    }

    public List<AgentDescriptor> read() throws IOException {
        if (!exists()) {
            throw new NoSuchFileException(file.toString(), null, "roster file not found");
        }
        List<AgentDescriptor> roster = Jsons.mapper().readValue(file.toFile(), ROSTER_TYPE);
        return roster == null ? List.of() : List.copyOf(roster);
    }

    // Written to a sibling temp file, then moved over the roster.
    public void write(List<AgentDescriptor> roster) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Jsons.mapper().writerFor(ROSTER_TYPE).writeValue(temp.toFile(), roster);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }

    public boolean delete() throws IOException {
        return Files.deleteIfExists(file);
    }
}
