package io.droplite.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
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
 *      - cuts off a torn tail left by a crash so new records stay reachable,
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
            throw new UncheckedIOException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            String next = String.format("%08d.log", Integer.parseInt(
                    current.getFileName().toString().replace(".log", "")) + 1);
            current = dir.resolve(next);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public synchronized void close() throws Exception { if (ch != null) ch.close(); }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one, truncate anything after the
     *    last valid record and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments(dir);
            current = segs.isEmpty() ? dir.resolve("00000001.log") : segs.get(segs.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validLength(ch);
            if (valid < ch.size()) {
                log.log(Level.WARNING, "WAL segment {0}: dropping {1} torn tail bytes",
                        new Object[]{current.getFileName(), ch.size() - valid});
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(writtenInSegment);
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .toList();
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    /** Byte offset just past the last intact record of a segment. */
    private static long validLength(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            int len = recordLengthAt(ch, pos);
            if (len < 0) return pos;
            pos += RecordCodec.HEADER_BYTES + len;
        }
    }

    /**
     * Payload length of the intact record at pos, or -1 when the record at pos is
     * missing, truncated or fails its checks.
     */
    private static int recordLengthAt(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < RecordCodec.HEADER_BYTES) return -1; // EOF, empty or truncated header
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return -1;
        ByteBuffer payload = ByteBuffer.allocate(len);
        int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
        if (r2 < len) return -1; // truncated payload
        if (RecordCodec.crc32(payload.array()) != crc) return -1;
        return len;
    }

    /**
     * Sequential reader for WAL segments used during recovery.
     * A bad record ends the scan: nothing after it (in any segment) is trusted.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segIdx = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean done;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            try {
                while (!done) {
                    if (ch == null && !openNext()) return null;
                    if (pos >= ch.size()) {
                        ch.close();
                        ch = null;
                        continue;
                    }
                    int len = recordLengthAt(ch, pos);
                    if (len < 0) {
                        done = true; // bad tail, stop
                        return null;
                    }
                    ByteBuffer payload = ByteBuffer.allocate(len);
                    ch.read(payload, pos + RecordCodec.HEADER_BYTES);
                    pos += RecordCodec.HEADER_BYTES + len;
                    return payload.array();
                }
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        private boolean openNext() throws IOException {
            if (++segIdx >= segments.size()) {
                done = true;
                return false;
            }
            ch = FileChannel.open(segments.get(segIdx), READ);
            pos = 0;
            return true;
        }

        @Override public void close() throws Exception { if (ch != null) ch.close(); }
    }
}
