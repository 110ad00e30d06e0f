package ai.pipestream.frames.storage;

import ai.pipestream.frames.exception.BlobStorageException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link BlobStore} on the local filesystem, used for development and tests.
 * Keys resolve under a single root directory; a key that normalizes outside
 * the root is refused.
 */
public class FileSystemBlobStore implements BlobStore {

    private static final Logger LOG = Logger.getLogger(FileSystemBlobStore.class);

    private final Path root;

    public FileSystemBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new BlobStorageException("init", this.root.toString(), e);
        }
    }

    @Override
    public void put(String key, byte[] data, String contentType) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), ".blob-", ".tmp");
            Files.write(temp, data);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOG.debugf("Stored %s (bytes=%d, type=%s)", target, data.length, contentType);
        } catch (IOException e) {
            throw BlobStorageException.writeFailed(key, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        Path target = resolve(key);
        try {
            return Optional.of(Files.readAllBytes(target));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw BlobStorageException.readFailed(key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw BlobStorageException.deleteFailed(key, e);
        }
    }

    @Override
    public int deletePrefix(String prefix) {
        Path dir = resolve(prefix);
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            throw BlobStorageException.deleteFailed(prefix, e);
        }
        int removed = 0;
        for (Path path : paths) {
            try {
                boolean file = Files.isRegularFile(path);
                Files.deleteIfExists(path);
                if (file) {
                    removed++;
                }
            } catch (IOException e) {
                throw BlobStorageException.deleteFailed(root.relativize(path).toString(), e);
            }
        }
        return removed;
    }

    @Override
    public void ping() {
        if (!Files.isDirectory(root) || !Files.isWritable(root)) {
            throw new BlobStorageException("ping", root.toString(), "root directory missing or not writable");
        }
    }

    @Override
    public String describe() {
        return "file://" + root;
    }

    Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new BlobStorageException("resolve", String.valueOf(key), "key cannot be empty");
        }
        Path candidate = root.resolve(key).normalize();
        if (!candidate.startsWith(root) || candidate.equals(root)) {
            throw new BlobStorageException("resolve", key, "key escapes storage root");
        }
        return candidate;
    }
}
