package io.droplite.storage;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int64 walPosition
 *   int32 count
 *   repeated 'count' times:
 *     - payload: int32 len + RecordCodec payload bytes (no WAL header)
 *   int32 crc32 over everything above
 * <p>
 * Files are named "snapshot-&lt;walPosition, zero padded&gt;.bin" so name order is
 * replay order.
 * <p>
 * Atomicity:
 *   - We write to "snapshot-&lt;pos&gt;.bin.tmp" first,
 *   - then move to "snapshot-&lt;pos&gt;.bin" using ATOMIC_MOVE.
 */
public final class FileSnapshotter implements Snapshotter {
    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public String writeSnapshot(List<LedgerEvent> state, long walPosition) {
        String name = String.format("snapshot-%020d.bin", walPosition);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        var body = new ByteArrayOutputStream();
        try (var out = new DataOutputStream(body)) {
            out.writeLong(walPosition);
            out.writeInt(state.size());
            for (LedgerEvent e : state) {
                byte[] payload = RecordCodec.encodePayload(e);
                out.writeInt(payload.length);
                out.write(payload);
            }
        } catch (IOException ex) { throw new UncheckedIOException(ex); }

        byte[] bytes = body.toByteArray();
        try (var out = new DataOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING))) {
            out.write(bytes);
            out.writeInt(RecordCodec.crc32(bytes));
        } catch (IOException ex) { throw new UncheckedIOException(ex); }

        try { Files.move(tmp, dst, ATOMIC_MOVE, REPLACE_EXISTING); }
        catch (IOException e) { throw new UncheckedIOException(e); }

        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        Path snap;
        try (Stream<Path> files = Files.list(dir)) {
            snap = files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith("snapshot-") && n.endsWith(".bin");
                    })
                    .sorted()
                    .reduce((a, b) -> b)
                    .orElse(null);
        } catch (IOException e) { throw new UncheckedIOException(e); }

        if (snap == null) return null;

        try {
            byte[] all = Files.readAllBytes(snap);
            if (all.length < 4) throw new IllegalStateException("Snapshot too short: " + snap);
            byte[] body = Arrays.copyOf(all, all.length - 4);
            int expected = ByteBuffer.wrap(all, all.length - 4, 4).getInt();
            if (RecordCodec.crc32(body) != expected) {
                throw new IllegalStateException("Snapshot checksum mismatch: " + snap);
            }

            try (var in = new DataInputStream(new ByteArrayInputStream(body))) {
                long walPosition = in.readLong();
                int count = in.readInt();
                List<LedgerEvent> events = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    int len = in.readInt();
                    events.add(RecordCodec.decode(in.readNBytes(len)));
                }
                return new LoadedSnapshot(snap.getFileName().toString(), events, walPosition);
            }
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }
}
