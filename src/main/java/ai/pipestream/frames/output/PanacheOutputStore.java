package ai.pipestream.frames.output;

import ai.pipestream.frames.entity.FrameOutput;
import ai.pipestream.frames.entity.FrameProject;
import ai.pipestream.frames.exception.BlobStorageException;
import ai.pipestream.frames.storage.BlobKeys;
import ai.pipestream.frames.storage.BlobStore;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Status;
import jakarta.transaction.Synchronization;
import jakarta.transaction.TransactionSynchronizationRegistry;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link OutputStore} on Hibernate ORM Panache, with images in the {@link BlobStore}.
 */
@ApplicationScoped
public class PanacheOutputStore implements OutputStore {

    private static final Logger LOG = Logger.getLogger(PanacheOutputStore.class);

    private static final Sort NEWEST_FIRST = Sort.descending("generatedAt").and("productId", Sort.Direction.Ascending);

    @Inject
    BlobStore blobStore;

    @Inject
    TransactionSynchronizationRegistry txRegistry;

    @Override
    @Transactional
    public boolean upsert(long projectId, String productId, OutputResult result) {
        FrameProject project = FrameProject.findById(projectId);
        if (project == null) {
            LOG.debugf("Dropping output for product %s: project %d no longer exists", productId, projectId);
            return false;
        }

        Instant now = Instant.now();
        FrameOutput output = FrameOutput.find("project.id = ?1 and productId = ?2", projectId, productId)
                .firstResult();
        String staleKey = null;
        if (output == null) {
            output = new FrameOutput();
            output.project = project;
            output.productId = productId;
            output.createdAt = now;
        }

        String writtenKey = null;
        if (result.isSucceeded()) {
            String key = BlobKeys.output(projectId, productId, result.format());
            blobStore.put(key, result.image(), result.format().mediaType());
            if (!key.equals(output.outputKey)) {
                writtenKey = key;
                staleKey = output.outputKey;
            }
            output.outputKey = key;
            output.contentType = result.format().mediaType();
            output.failureReason = null;
        } else {
            staleKey = output.outputKey;
            output.outputKey = null;
            output.contentType = null;
            output.failureReason = result.failureReason();
        }
        output.status = result.status();
        output.productImageUrl = result.productImageUrl();
        output.generatedAt = now;
        output.persist();

        if (writtenKey != null || staleKey != null) {
            cleanUpOnCompletion(writtenKey, staleKey);
        }
        return true;
    }

    @Override
    @Transactional
    public OutputPage page(long projectId, String filter, int offset, int limit) {
        int size = OutputStore.clampLimit(limit);
        int start = Math.max(0, offset);

        long total = FrameOutput.count("project.id", projectId);
        String needle = filter == null ? "" : filter.trim();

        List<FrameOutput> rows;
        long filtered;
        if (needle.isEmpty()) {
            filtered = total;
            rows = FrameOutput.find("project.id = :projectId", NEWEST_FIRST,
                            Parameters.with("projectId", projectId))
                    .range(start, start + size - 1)
                    .list();
        } else {
            Parameters params = Parameters.with("projectId", projectId).and("pattern", likePattern(needle));
            String query = "project.id = :projectId and lower(productId) like :pattern escape '\\'";
            filtered = FrameOutput.count(query, params);
            rows = FrameOutput.find(query, NEWEST_FIRST, params)
                    .range(start, start + size - 1)
                    .list();
        }

        List<StoredOutput> views = rows.stream()
                .map(o -> toStored(projectId, o))
                .collect(Collectors.toList());
        return new OutputPage(total, filtered, start, size, views);
    }

    @Override
    @Transactional
    public Optional<StoredOutput> find(long projectId, String productId) {
        return FrameOutput.<FrameOutput>find("project.id = ?1 and productId = ?2", projectId, productId)
                .firstResultOptional()
                .map(o -> toStored(projectId, o));
    }

    @Override
    public Optional<byte[]> readImage(long projectId, String productId) {
        return find(projectId, productId)
                .filter(o -> o.status() == OutputStatus.SUCCEEDED && o.outputKey() != null)
                .flatMap(o -> blobStore.get(o.outputKey()));
    }

    @Override
    @Transactional
    public long deleteAll(long projectId) {
        long removed = FrameOutput.delete("project.id", projectId);
        int blobs = blobStore.deletePrefix(BlobKeys.outputPrefix(projectId));
        LOG.infof("Deleted outputs of project %d: rows=%d, images=%d", projectId, removed, blobs);
        return removed;
    }

    /**
     * The blob write is not part of the transaction. A rollback (for example a
     * concurrent project delete) discards the newly written key; a commit
     * removes the image the row no longer points at.
     */
    private void cleanUpOnCompletion(String writtenKey, String staleKey) {
        txRegistry.registerInterposedSynchronization(new Synchronization() {
            @Override
            public void beforeCompletion() {
            }

            @Override
            public void afterCompletion(int status) {
                if (status == Status.STATUS_COMMITTED) {
                    if (staleKey != null) {
                        removeImage(staleKey, "stale");
                    }
                } else if (writtenKey != null) {
                    removeImage(writtenKey, "orphaned");
                }
            }
        });
    }

    private void removeImage(String key, String kind) {
        try {
            blobStore.delete(key);
            LOG.debugf("Removed %s output image %s", kind, key);
        } catch (BlobStorageException e) {
            LOG.warnf("Could not remove %s output image %s: %s", kind, key, e.getMessage());
        }
    }

    static String likePattern(String needle) {
        String escaped = needle.toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private static StoredOutput toStored(long projectId, FrameOutput o) {
        return new StoredOutput(projectId, o.productId, o.productImageUrl, o.status, o.failureReason,
                o.outputKey, o.contentType, o.createdAt, o.generatedAt);
    }
}
