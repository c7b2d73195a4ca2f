package com.phillippitts.hsie.service.store;

import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.exception.IntegrityException;
import com.phillippitts.hsie.exception.PipelineStage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Store persisting each Evidence as {@code {baseDir}/{id}.json}.
 *
 * <p>Writes go to a temp file in the same directory and are moved into place atomically, so a
 * reader never sees a half-written document. At start-up every file is parsed, its name checked
 * against its id and its content re-hashed; any mismatch or dangling parent aborts start-up with
 * an {@link IntegrityException}. The in-memory index then serves reads.
 *
 * <p>One store instance owns a directory; committed documents are never rewritten.
 */
public class FileSystemEvidenceStore extends InMemoryEvidenceStore {

    private static final Logger LOG = LogManager.getLogger(FileSystemEvidenceStore.class);

    static final String SUFFIX = ".json";

    private static final int WRITE_LOCK_STRIPES = 64;

    private final Path baseDir;
    private final Object[] writeLocks = new Object[WRITE_LOCK_STRIPES];

    public FileSystemEvidenceStore(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        for (int i = 0; i < writeLocks.length; i++) {
            writeLocks[i] = new Object();
        }
        try {
            Files.createDirectories(this.baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create evidence directory " + this.baseDir, e);
        }
        int loaded = loadExisting();
        LOG.info("Evidence store opened at {} ({} documents)", this.baseDir, loaded);
    }

    public Path getBaseDir() {
        return baseDir;
    }

    /**
     * Equal content racing through here is serialized per id, and the document that reaches disk
     * first is the one the index holds. A later writer gets that document back, so the cache never
     * disagrees with the file.
     */
    @Override
    protected Evidence doPutIfAbsent(Evidence evidence) {
        synchronized (writeLockFor(evidence.id())) {
            Evidence previous = doGet(evidence.id());
            if (previous != null) {
                return previous;
            }
            Path target = fileFor(evidence.id());
            if (Files.exists(target)) {
                Evidence onDisk = readVerified(target);
                super.doPutIfAbsent(onDisk);
                return onDisk;
            }
            writeAtomically(evidence, target);
            return super.doPutIfAbsent(evidence);
        }
    }

    /**
     * Verifies the document on disk, not only the cached copy.
     */
    @Override
    public Evidence verify(String id) {
        Evidence cached = super.verify(id);
        Evidence onDisk = read(fileFor(id));
        if (!onDisk.id().equals(id) || !EvidenceFactory.addressOf(onDisk).equals(id)) {
            throw new IntegrityException("Document " + fileFor(id) + " does not hash to " + id,
                    PipelineStage.STORE, id);
        }
        return cached;
    }

    private void writeAtomically(Evidence evidence, Path target) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile(baseDir, evidence.id() + "-", ".tmp");
            Files.writeString(tmp, EvidenceJsonCodec.canonical(evidence), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Failed to persist Evidence " + evidence.id(), e);
        }
    }

    private int loadExisting() {
        List<Evidence> documents = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(baseDir, "*" + SUFFIX)) {
            for (Path file : files) {
                documents.add(readVerified(file));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list evidence directory " + baseDir, e);
        }
        // Parents first; siblings in commit order
        documents.sort(Comparator.comparing((Evidence e) -> e.versionKind().ordinal())
                .thenComparing(Evidence::createdAt)
                .thenComparing(Evidence::id));
        for (Evidence e : documents) {
            if (e.parentId() != null && doGet(e.parentId()) == null) {
                throw new IntegrityException("Stored Evidence " + e.id() + " references missing parent "
                        + e.parentId(), PipelineStage.STORE, e.id());
            }
            super.doPutIfAbsent(e);
        }
        return documents.size();
    }

    private Evidence readVerified(Path file) {
        Evidence e = read(file);
        String name = file.getFileName().toString();
        String expectedId = name.substring(0, name.length() - SUFFIX.length());
        if (!expectedId.equals(e.id())) {
            throw new IntegrityException("File " + name + " contains Evidence " + e.id(),
                    PipelineStage.STORE, expectedId);
        }
        String actual = EvidenceFactory.addressOf(e);
        if (!actual.equals(e.id())) {
            throw new IntegrityException("Content of " + name + " hashes to " + actual,
                    PipelineStage.STORE, e.id());
        }
        return e;
    }

    private Evidence read(Path file) {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
        try {
            return EvidenceJsonCodec.parse(json);
        } catch (IllegalArgumentException e) {
            throw new IntegrityException("Unreadable Evidence document " + file.getFileName() + ": "
                    + e.getMessage(), PipelineStage.STORE, null, e);
        }
    }

    private Object writeLockFor(String id) {
        return writeLocks[Math.floorMod(id.hashCode(), writeLocks.length)];
    }

    private Path fileFor(String id) {
        return baseDir.resolve(id + SUFFIX);
    }

    private static void deleteQuietly(Path p) {
        if (p == null) {
            return;
        }
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOG.warn("Could not remove temp file {}: {}", p, e.toString());
        }
    }
}
