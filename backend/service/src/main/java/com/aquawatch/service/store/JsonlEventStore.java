package com.aquawatch.service.store;

import com.aquawatch.core.events.Event;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Alert and failure history kept as one JSON document per line.
 * <p>
 * Reads stream the file and hold at most {@code limit} matches. A process killed mid-append can
 * leave a partial last line; reads skip it with a warning and the next append drops it. A bad line
 * anywhere else fails the read.
 */
public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this.file = file.toAbsolutePath();
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Files.createDirectories(file.getParent());
            dropPartialTrailingLine();
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot record " + event.type() + " in " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void dropPartialTrailingLine() throws IOException {
        if (!Files.exists(file)) {
            return;
        }
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = channel.size();
            if (size == 0 || byteAt(channel, size - 1) == '\n') {
                return;
            }
            long keep = size - 1;
            while (keep > 0 && byteAt(channel, keep - 1) != '\n') {
                keep--;
            }
            LOGGER.warning("Dropping partial trailing line (" + (size - keep) + " bytes) from " + file);
            channel.truncate(keep);
        }
    }

    private static byte byteAt(FileChannel channel, long position) throws IOException {
        ByteBuffer single = ByteBuffer.allocate(1);
        channel.read(single, position);
        return single.get(0);
    }

    @Override
    public List<Event> query(EventQuery query) {
        lock.lock();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Deque<Event> newest = new ArrayDeque<>(Math.min(query.limit(), 1024));
            RuntimeException undecodable = null;
            int undecodableLine = 0;
            int lineNumber = 0;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                if (undecodable != null) {
                    throw new IllegalStateException("Corrupt event history " + file + " at line " + undecodableLine, undecodable);
                }
                Event event;
                try {
                    event = EventCodec.fromJsonLine(line);
                } catch (RuntimeException decodeError) {
                    undecodable = decodeError;
                    undecodableLine = lineNumber;
                    continue;
                }
                if (!query.matches(event)) {
                    continue;
                }
                if (newest.size() == query.limit()) {
                    newest.removeFirst();
                }
                newest.addLast(event);
            }
            if (undecodable != null) {
                LOGGER.warning("Ignoring partial trailing line " + undecodableLine + " in " + file
                        + ": " + undecodable.getMessage());
            }
            return List.copyOf(newest);
        } catch (NoSuchFileException missing) {
            return List.of();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read event history " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
