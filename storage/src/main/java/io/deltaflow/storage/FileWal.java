package io.deltaflow.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - cuts off a torn tail left by a crash (so new records are readable),
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - Reader:
 *      - walks all segments in name order,
 *      - reads fixed-size header (11 bytes),
 *      - validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true); // fsync: metadata too, so new file appears durable after rotation
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed on " + current, e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            current = dir.resolve(segmentName(segmentIndex(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public WalReader openReader() {
        return new Reader(listSegments());
    }

    @Override
    public synchronized List<String> closedSegments() {
        List<String> out = new ArrayList<>();
        for (Path p : listSegments()) {
            if (!p.equals(current)) out.add(p.getFileName().toString());
        }
        return out;
    }

    @Override
    public WalReader openSegment(String segment) {
        return new Reader(List.of(dir.resolve(segment)));
    }

    @Override
    public synchronized void deleteSegment(String segment) {
        Path p = dir.resolve(segment);
        if (p.equals(current)) throw new IllegalStateException("cannot delete active segment " + segment);
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to delete WAL segment " + p, e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one, drop any torn tail
     *    and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        try {
            List<Path> segments = listSegments();
            current = segments.isEmpty() ? dir.resolve(segmentName(1)) : segments.get(segments.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validPrefix(ch);
            if (valid < ch.size()) {
                log.log(Level.WARNING, "Truncating torn WAL tail of {0}: {1} -> {2} bytes",
                        new Object[]{current.getFileName(), ch.size(), valid});
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(writtenInSegment);
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private List<Path> listSegments() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    private static int segmentIndex(Path segment) {
        return Integer.parseInt(segment.getFileName().toString().replace(".log", ""));
    }

    /** Length of the longest prefix of whole, CRC-valid records. */
    private static long validPrefix(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            byte[] payload = readPayload(ch, pos);
            if (payload == null) return pos;
            pos += RecordCodec.HEADER_BYTES + payload.length;
        }
    }

    private static byte[] readPayload(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < RecordCodec.HEADER_BYTES) return null; // EOF or truncated header at tail
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
        if (pos + RecordCodec.HEADER_BYTES + len > ch.size()) return null; // truncated payload
        ByteBuffer payload = ByteBuffer.allocate(len);
        int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
        if (r2 < len) return null;
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != crc) return null; // bad tail, stop
        return bytes;
    }

    /**
     * Sequential reader over a list of segments used during recovery.
     * A corrupt record ends the whole read, not just its segment: later
     * segments cannot be trusted to follow on from a gap.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segmentIdx = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped = false;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null) {
                        if (++segmentIdx >= segments.size()) return null;
                        ch = FileChannel.open(segments.get(segmentIdx), READ);
                        pos = 0;
                    }
                    byte[] payload = readPayload(ch, pos);
                    if (payload != null) {
                        pos += RecordCodec.HEADER_BYTES + payload.length;
                        return payload;
                    }
                    boolean atEnd = pos >= ch.size();
                    ch.close();
                    ch = null;
                    if (!atEnd) {
                        stopped = true;
                        return null;
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
