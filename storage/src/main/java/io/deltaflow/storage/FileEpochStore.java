package io.deltaflow.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.deltaflow.core.RecoveryException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.UnaryOperator;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Epoch metadata as a small JSON file, replaced atomically on every update.
 * <p>
 * The in-memory copy is authoritative while the process runs; the file is
 * only read once, on construction.
 */
public final class FileEpochStore implements EpochStore {
    private final Path file;
    private final ObjectMapper json = new ObjectMapper();

    // guarded by this
    private EpochMetadata current;

    public FileEpochStore(Path file) {
        this.file = file;
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create dir for " + file, e);
        }
        this.current = read();
    }

    @Override
    public synchronized EpochMetadata load() {
        return current;
    }

    @Override
    public synchronized EpochMetadata update(UnaryOperator<EpochMetadata> change) {
        EpochMetadata next = change.apply(current);
        if (next.equals(current)) return current;
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            json.writeValue(tmp.toFile(), next);
            Files.move(tmp, file, ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write epoch store " + file, e);
        }
        current = next;
        return next;
    }

    private EpochMetadata read() {
        if (!Files.exists(file)) return EpochMetadata.INITIAL;
        try {
            return json.readValue(file.toFile(), EpochMetadata.class);
        } catch (IOException e) {
            throw new RecoveryException("unreadable epoch store " + file, e);
        }
    }
}
