package io.lightchain.core.storage;

import io.lightchain.core.protocol.BlockHeaderCodec;
import io.lightchain.core.protocol.Bytes;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Flat files of fixed-size header records: record {@code i} lives at byte offset {@code i * 120}.
 * <ul>
 *   <li>{@code <headersDir>/blockchain_headers}: best chain, sparse-preallocated</li>
 *   <li>{@code <headersDir>/forks/fork2_*}: one file per fork</li>
 * </ul>
 */
public final class HeaderFile {
    private static final Logger LOG = Logger.getLogger(HeaderFile.class.getName());

    public static final int RECORD_SIZE = BlockHeaderCodec.RECORD_SIZE;
    public static final String BEST_CHAIN_FILE = "blockchain_headers";
    public static final String FORKS_DIR = "forks";
    public static final String FORK_PREFIX = "fork2_";

    private final Path headersDir;

    public HeaderFile(Path headersDir) {
        this.headersDir = headersDir;
    }

    public Path headersDir() { return headersDir; }
    public Path bestChainPath() { return headersDir.resolve(BEST_CHAIN_FILE); }
    public Path forksDir() { return headersDir.resolve(FORKS_DIR); }

    public void ensureDirectories() {
        try {
            Files.createDirectories(forksDir());
        } catch (IOException e) {
            throw new HeaderStorageException("Cannot create headers dir " + headersDir, e);
        }
    }

    public void assertAvailable(Path file) {
        if (Files.exists(file)) {
            return;
        }
        if (!Files.exists(headersDir)) {
            throw new HeaderStorageException("headers dir does not exist. Was it deleted while running?",
                    new NoSuchFileException(headersDir.toString()));
        }
        throw new HeaderStorageException("Cannot find headers file but headers dir is there. Should be at " + file,
                new NoSuchFileException(file.toString()));
    }

    /** Whole records in the file; 0 when it does not exist. */
    public int recordCount(Path file) {
        try {
            return Files.exists(file) ? (int) (Files.size(file) / RECORD_SIZE) : 0;
        } catch (IOException e) {
            throw new HeaderStorageException("Cannot stat " + file, e);
        }
    }

    /** Record at {@code index}, or null when the slot is all zeros (a hole in a preallocated file). */
    public byte[] readRecord(Path file, int index) {
        byte[] record = read(file, (long) index * RECORD_SIZE, RECORD_SIZE);
        if (record.length < RECORD_SIZE) {
            throw new HeaderStorageException("Expected to read a full header. This was only " + record.length + " bytes",
                    new IOException("short read in " + file));
        }
        return Bytes.isAllZero(record) ? null : record;
    }

    /** Up to {@code length} bytes from {@code offset}; shorter at end of file. */
    public byte[] read(Path file, long offset, int length) {
        assertAvailable(file);
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            long available = Math.max(0, ch.size() - offset);
            ByteBuffer buf = ByteBuffer.allocate((int) Math.min(length, available));
            while (buf.hasRemaining()) {
                if (ch.read(buf, offset + buf.position()) < 0) break;
            }
            return buf.array();
        } catch (IOException e) {
            throw new HeaderStorageException("Cannot read " + file, e);
        }
    }

    public byte[] readAll(Path file) {
        assertAvailable(file);
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new HeaderStorageException("Cannot read " + file, e);
        }
    }

    /**
     * Writes {@code data} at {@code offset} and forces it to disk. With {@code truncate}, anything past
     * {@code offset} is dropped first unless the write is a plain append.
     */
    public void write(Path file, byte[] data, long offset, boolean truncate) {
        assertAvailable(file);
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            long records = ch.size() / RECORD_SIZE;
            if (truncate && offset != records * RECORD_SIZE) {
                ch.truncate(offset);
            }
            ByteBuffer buf = ByteBuffer.wrap(data);
            long pos = offset;
            while (buf.hasRemaining()) {
                pos += ch.write(buf, pos);
            }
            ch.force(true);
        } catch (IOException e) {
            throw new HeaderStorageException("Cannot write " + file, e);
        }
    }

    public void createEmpty(Path file) {
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, new byte[0]);
        } catch (IOException e) {
            throw new HeaderStorageException("Cannot create " + file, e);
        }
    }

    /** Grows {@code file} to at least {@code length} bytes without writing the gap (sparse on most filesystems). */
    public void preallocate(Path file, long length) {
        try {
            Files.createDirectories(file.getParent());
            if (Files.exists(file) && Files.size(file) >= length) {
                return;
            }
            try (FileChannel ch = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                    StandardOpenOption.SPARSE)) {
                if (length > 0) {
                    ch.write(ByteBuffer.wrap(new byte[1]), length - 1);
                }
            }
            LOG.fine(() -> "Preallocated " + file + " to " + length + " bytes");
        } catch (IOException e) {
            throw new HeaderStorageException("Cannot preallocate " + file, e);
        }
    }

    public void move(Path from, Path to) {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new HeaderStorageException("Cannot rename " + from + " to " + to, e);
        }
    }

    public void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new HeaderStorageException("Cannot delete " + file, e);
        }
    }

    /** Fork file names (without dots), unsorted. */
    public List<String> listForkFiles() {
        ensureDirectories();
        List<String> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(forksDir())) {
            files.map(p -> p.getFileName().toString())
                    .filter(n -> n.startsWith(FORK_PREFIX) && !n.contains("."))
                    .forEach(out::add);
        } catch (IOException e) {
            throw new HeaderStorageException("Cannot list " + forksDir(), e);
        }
        return out;
    }
}
