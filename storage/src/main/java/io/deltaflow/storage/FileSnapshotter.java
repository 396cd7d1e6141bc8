package io.deltaflow.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.deltaflow.core.RecoveryException;
import io.deltaflow.core.Row;
import io.deltaflow.core.state.StateImage;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation: one file per (operator, shard, epoch).
 * <p>
 * Layout:
 *   &lt;dir&gt;/images/&lt;operator&gt;/shard-&lt;n&gt;/epoch-&lt;20 digits&gt;.snap
 *   &lt;dir&gt;/manifests/epoch-&lt;20 digits&gt;.json
 * <p>
 * Image format:
 *   int32 magic
 *   int32 sectionCount
 *   repeated sectionCount times:
 *     - name:     int32 len + UTF-8 bytes
 *     - rowCount: int32
 *       repeated rowCount times:
 *         - key:   int32 len + UTF-8 bytes
 *         - value: tagged value (ValueCodec)
 *         - epoch: int64
 *         - diff:  int64
 * <p>
 * Atomicity:
 *   - We write to "&lt;name&gt;.tmp" first,
 *   - then move to "&lt;name&gt;" using ATOMIC_MOVE.
 *   Manifests use the same scheme, so a manifest is either absent or complete.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final Logger log = Logger.getLogger(FileSnapshotter.class.getName());
    private static final int IMAGE_MAGIC = 0xDF5A0001;

    private final Path images;
    private final Path manifests;
    private final ObjectMapper json = new ObjectMapper();

    public FileSnapshotter(Path dir) {
        this.images = dir.resolve("images");
        this.manifests = dir.resolve("manifests");
        try {
            Files.createDirectories(images);
            Files.createDirectories(manifests);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create snapshot dirs under " + dir, e);
        }
    }

    @Override
    public void writeImage(String operatorId, int shard, long epoch, StateImage image) {
        Path dst = imagePath(operatorId, shard, epoch);
        if (Files.exists(dst)) {
            log.log(Level.FINE, "image {0} already written, keeping it", dst);
            return;
        }
        Path tmp = dst.resolveSibling(dst.getFileName() + ".tmp");
        try {
            Files.createDirectories(dst.getParent());
            try (var out = new DataOutputStream(Files.newOutputStream(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING))) {
                out.writeInt(IMAGE_MAGIC);
                out.writeInt(image.sections().size());
                for (var section : image.sections().entrySet()) {
                    writeString(out, section.getKey());
                    out.writeInt(section.getValue().size());
                    for (Row r : section.getValue()) {
                        writeString(out, r.key());
                        ValueCodec.write(out, r.value());
                        out.writeLong(r.epoch());
                        out.writeLong(r.diff());
                    }
                }
            }
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write snapshot image " + dst, e);
        }
    }

    @Override
    public Optional<StateImage> readImage(String operatorId, int shard, long epoch) {
        Path src = imagePath(operatorId, shard, epoch);
        if (!Files.exists(src)) return Optional.empty();
        try (var in = new DataInputStream(Files.newInputStream(src))) {
            if (in.readInt() != IMAGE_MAGIC) {
                throw new RecoveryException("not a snapshot image: " + src);
            }
            int sections = in.readInt();
            TreeMap<String, List<Row>> map = new TreeMap<>();
            for (int s = 0; s < sections; s++) {
                String name = readString(in);
                int rowCount = in.readInt();
                List<Row> rows = new ArrayList<>(rowCount);
                for (int i = 0; i < rowCount; i++) {
                    String key = readString(in);
                    var value = ValueCodec.read(in);
                    long rowEpoch = in.readLong();
                    long diff = in.readLong();
                    rows.add(new Row(key, value, rowEpoch, diff));
                }
                map.put(name, rows);
            }
            return Optional.of(new StateImage(map));
        } catch (IOException | IllegalArgumentException e) {
            throw new RecoveryException("corrupt snapshot image " + src, e);
        }
    }

    @Override
    public void writeManifest(SnapshotManifest manifest) {
        Path dst = manifestPath(manifest.epoch());
        Path tmp = dst.resolveSibling(dst.getFileName() + ".tmp");
        try {
            json.writeValue(tmp.toFile(), manifest);
            Files.move(tmp, dst, ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write manifest " + dst, e);
        }
        log.log(Level.INFO, "snapshot complete at epoch {0} ({1} operators)",
                new Object[]{manifest.epoch(), manifest.shards().size()});
    }

    @Override
    public Optional<SnapshotManifest> latestManifest() {
        List<Long> epochs = manifestEpochs();
        if (epochs.isEmpty()) return Optional.empty();
        Path src = manifestPath(epochs.get(epochs.size() - 1));
        try {
            return Optional.of(json.readValue(src.toFile(), SnapshotManifest.class));
        } catch (IOException e) {
            throw new RecoveryException("unreadable manifest " + src, e);
        }
    }

    @Override
    public List<Long> manifestEpochs() {
        List<Long> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(manifests)) {
            files.map(p -> p.getFileName().toString())
                    .filter(n -> n.startsWith("epoch-") && n.endsWith(".json"))
                    .sorted()
                    .forEach(n -> out.add(Long.parseLong(n.substring("epoch-".length(), n.length() - ".json".length()))));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list " + manifests, e);
        }
        return out;
    }

    @Override
    public int deleteBefore(long epoch) {
        int deleted = 0;
        for (long e : manifestEpochs()) {
            if (e < epoch && deleteQuietly(manifestPath(e))) deleted++;
        }
        List<Path> stale = new ArrayList<>();
        try (Stream<Path> files = Files.walk(images)) {
            files.filter(p -> {
                String n = p.getFileName().toString();
                return n.startsWith("epoch-") && n.endsWith(".snap") && epochOf(n) < epoch;
            }).forEach(stale::add);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot scan " + images, e);
        }
        for (Path p : stale) {
            if (deleteQuietly(p)) deleted++;
        }
        return deleted;
    }

    // ---------- helpers ----------

    private Path imagePath(String operatorId, int shard, long epoch) {
        return images.resolve(operatorId).resolve("shard-" + shard)
                .resolve(String.format("epoch-%020d.snap", epoch));
    }

    private Path manifestPath(long epoch) {
        return manifests.resolve(String.format("epoch-%020d.json", epoch));
    }

    private static long epochOf(String fileName) {
        return Long.parseLong(fileName.substring("epoch-".length(), fileName.length() - ".snap".length()));
    }

    private static boolean deleteQuietly(Path p) {
        try {
            return Files.deleteIfExists(p);
        } catch (IOException e) {
            log.log(Level.WARNING, "cannot delete " + p, e);
            return false;
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    private static String readString(DataInputStream in) throws IOException {
        int len = in.readInt();
        byte[] b = in.readNBytes(len);
        if (b.length != len) throw new IOException("truncated string");
        return new String(b, StandardCharsets.UTF_8);
    }
}
