package io.coordmesh.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.coordmesh.util.Hashing;
import io.coordmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One JSON file per keyed record under {@code <state-root>/<kind>/}, and a JSONL file per
 * append-only collection. Record files are replaced with a same-directory rename so a crash
 * mid-write leaves either the old or the new record.
 */
public final class FileStore implements Store {
    private static final Logger log = LoggerFactory.getLogger(FileStore.class);
    private static final String RECORD_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final int MAX_ENCODED_KEY_CHARS = 160;
    private static final String LINE_END = "\n";
    private static final int TAIL_WINDOW_BYTES = 8192;

    private final Path stateRoot;

    public FileStore(Path stateRoot) {
        this.stateRoot = stateRoot;
        try {
            for (RecordKind kind : RecordKind.values()) {
                Files.createDirectories(kindDir(kind));
            }
        } catch (IOException e) {
            throw new StoreException("Failed to initialize store directories under " + stateRoot, e);
        }
    }

    @Override
    public <T> Optional<T> read(RecordKind kind, String key, Class<T> type) {
        Store.requireKeyed(kind);
        Path file = recordPath(kind, key);
        try {
            String raw = Files.readString(file, StandardCharsets.UTF_8);
            return Optional.of(Jsons.mapper().readValue(raw, type));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreException("Failed to read " + kind.dirName() + " record: " + key, e);
        }
    }

    @Override
    public <T> List<T> readAll(RecordKind kind, Class<T> type) {
        Store.requireKeyed(kind);
        List<Path> files = listRecordFiles(kindDir(kind));
        List<T> out = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                out.add(Jsons.mapper().readValue(Files.readString(file, StandardCharsets.UTF_8), type));
            } catch (NoSuchFileException e) {
                // deleted between listing and reading
                log.debug("Record vanished during scan: {}", file);
            } catch (IOException e) {
                throw new StoreException("Failed to read record file: " + file, e);
            }
        }
        return out;
    }

    @Override
    public void write(RecordKind kind, String key, Object record) {
        Store.requireKeyed(kind);
        Path target = recordPath(kind, key);
        Path temp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        try {
            Files.writeString(temp, Jsons.toJson(record), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE, StandardOpenOption.SYNC);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to write " + kind.dirName() + " record: " + key, e);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.warn("Failed to remove temp file {}: {}", temp, e.getMessage());
            }
        }
    }

    @Override
    public boolean delete(RecordKind kind, String key) {
        Store.requireKeyed(kind);
        try {
            return Files.deleteIfExists(recordPath(kind, key));
        } catch (IOException e) {
            throw new StoreException("Failed to delete " + kind.dirName() + " record: " + key, e);
        }
    }

    @Override
    public void append(RecordKind kind, Object record) {
        Store.requireAppendOnly(kind);
        Path file = logPath(kind);
        try {
            String line = Jsons.toCompactJson(record) + LINE_END;
            if (endsMidLine(file)) {
                // terminate a torn line so this record starts on its own line
                log.warn("Terminating torn trailing line in {} log", kind.dirName());
                line = LINE_END + line;
            }
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StoreException("Failed to append to " + kind.dirName() + " log", e);
        }
    }

    @Override
    public <T> List<T> readLog(RecordKind kind, Class<T> type) {
        Store.requireAppendOnly(kind);
        List<T> out = new ArrayList<>();
        for (String line : readLogLines(kind)) {
            T parsed = parseLine(kind, line, type);
            if (parsed != null) {
                out.add(parsed);
            }
        }
        return out;
    }

    /**
     * Scans backwards from the end of the log in growing windows.
     */
    @Override
    public <T> Optional<T> readLast(RecordKind kind, Class<T> type) {
        Store.requireAppendOnly(kind);
        Path file = logPath(kind);
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long size = channel.size();
            int window = TAIL_WINDOW_BYTES;
            while (true) {
                long start = Math.max(0L, size - window);
                byte[] tail = readRange(channel, start, (int) (size - start));
                List<String> lines = splitLines(tail, start > 0);
                for (int i = lines.size() - 1; i >= 0; i--) {
                    T parsed = parseLine(kind, lines.get(i), type);
                    if (parsed != null) {
                        return Optional.of(parsed);
                    }
                }
                if (start == 0L) {
                    return Optional.empty();
                }
                window = (int) Math.min((long) window * 2, Integer.MAX_VALUE - 8);
            }
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreException("Failed to read " + kind.dirName() + " log tail", e);
        }
    }

    @Override
    public String describe() {
        return "files:" + stateRoot;
    }

    Path recordPath(RecordKind kind, String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("record key must not be empty");
        }
        return kindDir(kind).resolve(fileNameFor(key) + RECORD_SUFFIX);
    }

    static String fileNameFor(String key) {
        String encoded = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(key.getBytes(StandardCharsets.UTF_8));
        if (encoded.length() <= MAX_ENCODED_KEY_CHARS) {
            return encoded;
        }
        return "h_" + Hashing.sha256Hex(key);
    }

    private Path kindDir(RecordKind kind) {
        return stateRoot.resolve(kind.dirName());
    }

    private Path logPath(RecordKind kind) {
        return kindDir(kind).resolve(kind.dirName() + ".jsonl");
    }

    private List<String> readLogLines(RecordKind kind) {
        Path file = logPath(kind);
        try {
            List<String> lines = new ArrayList<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    lines.add(line);
                }
            }
            return lines;
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new StoreException("Failed to read " + kind.dirName() + " log", e);
        }
    }

    private static boolean endsMidLine(Path file) throws IOException {
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0L) {
                return false;
            }
            return readRange(channel, size - 1, 1)[0] != '\n';
        } catch (NoSuchFileException e) {
            return false;
        }
    }

    private static byte[] readRange(SeekableByteChannel channel, long start, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        channel.position(start);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                break;
            }
        }
        return Arrays.copyOf(buffer.array(), buffer.position());
    }

    /**
     * Splits on {@code \n}. When the window does not start at the beginning of the file, the first
     * segment may be the tail of an earlier line and is dropped.
     */
    private static List<String> splitLines(byte[] bytes, boolean dropFirst) {
        List<String> lines = new ArrayList<>();
        int from = 0;
        boolean first = true;
        for (int i = 0; i <= bytes.length; i++) {
            if (i == bytes.length || bytes[i] == '\n') {
                if (!(first && dropFirst)) {
                    String line = new String(bytes, from, i - from, StandardCharsets.UTF_8).strip();
                    if (!line.isEmpty()) {
                        lines.add(line);
                    }
                }
                first = false;
                from = i + 1;
            }
        }
        return lines;
    }

    private <T> T parseLine(RecordKind kind, String line, Class<T> type) {
        try {
            return Jsons.mapper().readValue(line, type);
        } catch (JsonProcessingException e) {
            // a partially flushed trailing line from a crashed writer
            log.warn("Skipping unreadable {} log line: {}", kind.dirName(), e.getOriginalMessage());
            return null;
        }
    }

    private List<Path> listRecordFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + RECORD_SUFFIX)) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (NoSuchFileException e) {
            return files;
        } catch (IOException e) {
            throw new StoreException("Failed to list records in " + dir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }
}
