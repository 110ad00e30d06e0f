package ai.pipestream.frames.project;

import ai.pipestream.frames.bulk.FrameProjectSnapshot;
import ai.pipestream.frames.composite.ImageFormat;
import ai.pipestream.frames.composite.OverlayRect;
import ai.pipestream.frames.entity.FrameProject;
import ai.pipestream.frames.entity.FrameStatus;
import ai.pipestream.frames.exception.FrameConfigurationException;
import ai.pipestream.frames.exception.FrameProjectNotFoundException;
import ai.pipestream.frames.output.OutputResult;
import ai.pipestream.frames.output.OutputStore;
import ai.pipestream.frames.storage.BlobKeys;
import ai.pipestream.frames.storage.BlobStore;
import ai.pipestream.frames.support.TestImages;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.awt.Color;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
class FrameProjectServiceTest {

    @Inject
    FrameProjectService projects;

    @Inject
    OutputStore outputs;

    @Inject
    BlobStore blobs;

    private FrameProject create() {
        return projects.create("Service test", "owner-1", "https://feeds.example/service.xml",
                TestImages.png(640, 480, Color.WHITE));
    }

    @Test
    void createStoresTemplateBlobAndStartsInDraft() {
        FrameProject project = create();

        assertEquals(FrameStatus.DRAFT, project.status);
        assertFalse(project.coordinatesSet);
        assertEquals(BlobKeys.template(project.id, ImageFormat.PNG), project.templateKey);
        assertTrue(blobs.get(project.templateKey).isPresent());
        assertTrue(project.overlay().fitsWithin(640, 480));
    }

    @Test
    void rejectsOverlongNames() {
        assertThrows(FrameConfigurationException.class, () -> projects.create("n".repeat(201), null,
                "https://feeds.example/a.xml", TestImages.png(10, 10, Color.WHITE)));
    }

    @Test
    void overlayMovesDraftToCoordinatesSetAndFeedsTheSnapshot() {
        FrameProject project = create();

        projects.setOverlayRect(project.id, new OverlayRect(10, 20, 300, 200));

        FrameProject reloaded = projects.get(project.id);
        assertEquals(FrameStatus.COORDINATES_SET, reloaded.status);
        assertTrue(reloaded.coordinatesSet);

        FrameProjectSnapshot snapshot = projects.snapshot(project.id);
        assertEquals(new OverlayRect(10, 20, 300, 200), snapshot.rect());
        assertEquals(640, snapshot.template().width());
        assertEquals("https://feeds.example/service.xml", snapshot.feedUrl());
    }

    @Test
    void outOfBoundsOverlayLeavesStoredRectUntouched() {
        FrameProject project = create();
        projects.setOverlayRect(project.id, new OverlayRect(0, 0, 100, 100));

        FrameConfigurationException e = assertThrows(FrameConfigurationException.class,
                () -> projects.setOverlayRect(project.id, new OverlayRect(600, 0, 100, 100)));

        assertTrue(e.isBoundsError());
        assertEquals(new OverlayRect(0, 0, 100, 100), projects.get(project.id).overlay());
    }

    @Test
    void deleteRemovesOutputsTemplateAndRow() {
        FrameProject project = create();
        outputs.upsert(project.id, "SKU-1", OutputResult.succeeded("https://cdn.example/1.png",
                TestImages.png(10, 10, Color.RED), ImageFormat.PNG));
        String templateKey = project.templateKey;

        projects.delete(project.id);

        assertThrows(FrameProjectNotFoundException.class, () -> projects.get(project.id));
        assertTrue(blobs.get(templateKey).isEmpty());
        assertTrue(blobs.get(BlobKeys.output(project.id, "SKU-1", ImageFormat.PNG)).isEmpty());
        assertTrue(outputs.find(project.id, "SKU-1").isEmpty());
    }
}
