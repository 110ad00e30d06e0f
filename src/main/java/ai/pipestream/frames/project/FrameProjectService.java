package ai.pipestream.frames.project;

import ai.pipestream.frames.bulk.BulkRunRegistry;
import ai.pipestream.frames.bulk.FrameProjectSnapshot;
import ai.pipestream.frames.composite.FrameTemplate;
import ai.pipestream.frames.composite.OverlayRect;
import ai.pipestream.frames.config.CompositeConfiguration;
import ai.pipestream.frames.config.FeedConfiguration;
import ai.pipestream.frames.entity.FrameProject;
import ai.pipestream.frames.entity.FrameStatus;
import ai.pipestream.frames.exception.BlobStorageException;
import ai.pipestream.frames.exception.FeedException;
import ai.pipestream.frames.exception.FrameConfigurationException;
import ai.pipestream.frames.exception.FrameProjectNotFoundException;
import ai.pipestream.frames.exception.UrlValidationException;
import ai.pipestream.frames.feed.FeedCache;
import ai.pipestream.frames.feed.ProductRecord;
import ai.pipestream.frames.fetch.UrlSafetyValidator;
import ai.pipestream.frames.fetch.UrlVerdict;
import ai.pipestream.frames.output.OutputStore;
import ai.pipestream.frames.preview.PreviewEngine;
import ai.pipestream.frames.preview.PreviewImage;
import ai.pipestream.frames.preview.ProductImageRef;
import ai.pipestream.frames.storage.BlobKeys;
import ai.pipestream.frames.storage.BlobStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;

/**
 * Frame project lifecycle: create, configure the overlay, preview, delete.
 */
@ApplicationScoped
public class FrameProjectService {

    private static final Logger LOG = Logger.getLogger(FrameProjectService.class);

    static final int MAX_NAME_LENGTH = 200;

    @Inject
    BlobStore blobStore;

    @Inject
    OutputStore outputStore;

    @Inject
    UrlSafetyValidator urlValidator;

    @Inject
    FeedCache feedCache;

    @Inject
    PreviewEngine previewEngine;

    @Inject
    BulkRunRegistry runRegistry;

    @Inject
    CompositeConfiguration compositeConfig;

    @Inject
    FeedConfiguration feedConfig;

    /**
     * Creates a project from an uploaded template. The overlay starts at
     * (0, 0, 100, 100) clamped to the template.
     *
     * @param feedUrl optional; the configured default feed is used when blank
     * @throws FrameConfigurationException when the name or template is invalid
     * @throws UrlValidationException when the feed URL fails the static checks
     */
    @Transactional
    public FrameProject create(String name, String ownerId, String feedUrl, byte[] templateBytes) {
        if (name == null || name.isBlank()) {
            throw FrameConfigurationException.missingField("create-project", "name");
        }
        String trimmedName = name.trim();
        if (trimmedName.length() > MAX_NAME_LENGTH) {
            throw new FrameConfigurationException("create-project",
                    "name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        String resolvedFeed = (feedUrl == null || feedUrl.isBlank()) ? feedConfig.defaultUrl() : feedUrl.trim();
        UrlVerdict verdict = urlValidator.checkSyntax(resolvedFeed);
        if (!verdict.allowed()) {
            throw new UrlValidationException(resolvedFeed, verdict.reason());
        }

        FrameTemplate template = FrameTemplate.decode(templateBytes, compositeConfig.templateMaxBytes(),
                compositeConfig.templateMaxDimension());

        Instant now = Instant.now();
        FrameProject project = new FrameProject();
        project.name = trimmedName;
        project.ownerId = ownerId == null || ownerId.isBlank() ? null : ownerId.trim();
        project.feedUrl = resolvedFeed;
        project.templateFormat = template.format();
        project.templateWidth = template.width();
        project.templateHeight = template.height();
        project.templateSizeBytes = template.sizeBytes();
        project.applyOverlay(OverlayRect.initialFor(template.width(), template.height()));
        project.coordinatesSet = false;
        project.status = FrameStatus.DRAFT;
        project.createdAt = now;
        project.updatedAt = now;
        // key needs the generated id
        project.templateKey = "pending";
        project.persistAndFlush();

        project.templateKey = BlobKeys.template(project.id, template.format());
        blobStore.put(project.templateKey, template.bytes(), template.format().mediaType());

        LOG.infof("Created frame project %d (%s): template %dx%d %s, feed=%s",
                project.id, project.name, template.width(), template.height(), template.format(), resolvedFeed);
        return project;
    }

    /**
     * @throws FrameProjectNotFoundException when no project has this id
     */
    @Transactional
    public FrameProject get(long projectId) {
        FrameProject project = FrameProject.findById(projectId);
        if (project == null) {
            throw new FrameProjectNotFoundException(projectId);
        }
        return project;
    }

    /**
     * Replaces the overlay rectangle. A rectangle that does not fit the
     * template is rejected and the stored one is left untouched.
     *
     * @throws FrameConfigurationException with {@code BOUNDS_ERROR} when the rectangle leaves the template
     */
    @Transactional
    public FrameProject setOverlayRect(long projectId, OverlayRect rect) {
        FrameProject project = get(projectId);
        rect.requireWithin(project.templateWidth, project.templateHeight);

        project.applyOverlay(rect);
        project.coordinatesSet = true;
        if (project.status == FrameStatus.DRAFT) {
            project.status = FrameStatus.COORDINATES_SET;
        }
        project.updatedAt = Instant.now();
        LOG.infof("Project %d overlay set to (%d, %d, %d, %d)",
                projectId, rect.x(), rect.y(), rect.width(), rect.height());
        return project;
    }

    /**
     * Renders a preview with the given rectangle, which need not be saved.
     * Without an image reference the first product of the project's feed is used.
     */
    public PreviewImage preview(long projectId, OverlayRect rect, ProductImageRef ref) {
        FrameProjectSnapshot snapshot = snapshot(projectId);
        rect.requireWithin(snapshot.template().width(), snapshot.template().height());

        ProductImageRef resolved = ref;
        if (resolved == null) {
            ProductRecord first = feedCache.firstProduct(snapshot.feedUrl())
                    .orElseThrow(() -> new FeedException("feed has no usable products for a preview"));
            resolved = ProductImageRef.ofUrl(first.imageUrl());
            LOG.debugf("Preview for project %d uses first feed product %s", projectId, first.productId());
        }
        return previewEngine.preview(snapshot.template(), rect, resolved);
    }

    /**
     * Copies what a run needs, with the template decoded from blob storage.
     */
    @Transactional
    public FrameProjectSnapshot snapshot(long projectId) {
        FrameProject project = get(projectId);
        byte[] bytes = blobStore.get(project.templateKey)
                .orElseThrow(() -> new BlobStorageException("read", project.templateKey, "template blob missing"));
        FrameTemplate template = FrameTemplate.decode(bytes, Math.max(bytes.length, compositeConfig.templateMaxBytes()),
                compositeConfig.templateMaxDimension());
        return new FrameProjectSnapshot(project.id, template, project.overlay(), project.feedUrl);
    }

    /**
     * Cancels any active run, then removes outputs, images, the template and the project.
     */
    @Transactional
    public void delete(long projectId) {
        FrameProject project = get(projectId);
        runRegistry.cancel(projectId);

        long outputs = outputStore.deleteAll(projectId);
        blobStore.deletePrefix(BlobKeys.templatePrefix(projectId));
        feedCache.invalidate(project.feedUrl);
        project.delete();
        runRegistry.forget(projectId);

        LOG.infof("Deleted frame project %d (%d outputs)", projectId, outputs);
    }
}
