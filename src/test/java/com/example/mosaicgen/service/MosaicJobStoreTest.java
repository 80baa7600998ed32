package com.example.mosaicgen.service;

import com.example.mosaicgen.model.JobStatus;
import com.example.mosaicgen.model.MosaicJob;
import com.example.mosaicgen.model.MosaicStyle;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MosaicJobStoreTest {

    private final MosaicJobStore store = new MosaicJobStore();

    @Test
    void shouldCreateProcessingJobWithZeroProgress() {
        MosaicJob job = store.create(template(1, 10));

        assertNotNull(job.getId());
        assertEquals(JobStatus.PROCESSING, job.getStatus());
        assertEquals(0, job.getProgress());
        assertNotNull(job.getCreatedAt());
        assertEquals(job.getCreatedAt(), job.getUpdatedAt());
    }

    @Test
    void shouldCaptureTileListAtSubmission() {
        List<String> tiles = new ArrayList<>(List.of("a.png", "b.png"));
        MosaicJob template = template(1, 10).toBuilder().tileImages(tiles).build();

        MosaicJob job = store.create(template);
        tiles.add("c.png");

        assertEquals(List.of("a.png", "b.png"), store.get(job.getId()).orElseThrow().getTileImages());
        assertThrows(UnsupportedOperationException.class, () -> job.getTileImages().add("d.png"));
    }

    @Test
    void shouldReturnSnapshotsNotLiveRecords() {
        MosaicJob job = store.create(template(1, 10));

        MosaicJob snapshot = store.get(job.getId()).orElseThrow();
        snapshot.setProgress(70);

        assertEquals(0, store.get(job.getId()).orElseThrow().getProgress());

        store.save(snapshot);
        assertEquals(70, store.get(job.getId()).orElseThrow().getProgress());
    }

    @Test
    void shouldFindJobOnlyForOwner() {
        MosaicJob job = store.create(template(1, 10));

        assertTrue(store.findByUser(1, job.getId()).isPresent());
        assertTrue(store.findByUser(2, job.getId()).isEmpty());
        assertTrue(store.findByUser(1, "unknown").isEmpty());
        assertTrue(store.get(null).isEmpty());
    }

    @Test
    void shouldListProjectJobsNewestFirst() {
        MosaicJob older = store.create(template(1, 10));
        older.setCreatedAt(older.getCreatedAt().minusMinutes(5));
        store.save(older);
        MosaicJob newer = store.create(template(1, 10));
        store.create(template(1, 11));
        store.create(template(2, 10));

        List<MosaicJob> jobs = store.findByProject(1, 10);

        assertEquals(2, jobs.size());
        assertEquals(newer.getId(), jobs.get(0).getId());
        assertEquals(older.getId(), jobs.get(1).getId());
    }

    private MosaicJob template(long userId, long projectId) {
        return MosaicJob.builder()
                .userId(userId)
                .projectId(projectId)
                .mainImage("main.jpg")
                .tileImages(List.of("t1.png"))
                .tileSize(50)
                .tileDensity(80)
                .colorAdjustment(50)
                .style(MosaicStyle.CLASSIC)
                .build();
    }
}
