package com.evertz.featured.infrastructure.persistence.adapter;

import com.evertz.featured.core.model.FeaturedVideo;
import com.evertz.featured.infrastructure.persistence.dao.FeaturedPoolLockDao;
import com.evertz.featured.infrastructure.persistence.repository.FeaturedPoolLockJpaRepository;
import com.evertz.featured.infrastructure.persistence.repository.FeaturedVideoJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class FeaturedVideoPoolAdapterTest {

    @Autowired
    private FeaturedVideoJpaRepository jpaRepository;

    @Autowired
    private FeaturedPoolLockJpaRepository lockRepository;

    private FeaturedVideoPoolAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new FeaturedVideoPoolAdapter(jpaRepository, lockRepository);
    }

    private long generation() {
        return lockRepository.findById(FeaturedPoolLockDao.POOL_LOCK_ID).orElseThrow().getGeneration();
    }

    private static FeaturedVideo video(String id) {
        return new FeaturedVideo(id, "Title " + id, "Description " + id, "https://img/" + id);
    }

    @Test
    void emptyByDefault() {
        assertThat(adapter.findAllOrderedByPosition()).isEmpty();
        assertThat(adapter.count()).isZero();
    }

    @Test
    void replaceAllKeepsListOrder() {
        adapter.replaceAll(List.of(video("c"), video("a"), video("b")));

        List<FeaturedVideo> pool = adapter.findAllOrderedByPosition();
        assertThat(pool).extracting(FeaturedVideo::getVideoId).containsExactly("c", "a", "b");
        assertThat(pool.get(0).getDescription()).isEqualTo("Description c");
        assertThat(pool.get(0).getThumbnailUrl()).isEqualTo("https://img/c");
    }

    @Test
    void secondReplaceDropsEveryPreviousVideo() {
        adapter.replaceAll(List.of(video("a"), video("b"), video("c"), video("d")));
        adapter.findAllOrderedByPosition();

        adapter.replaceAll(List.of(video("x"), video("y")));

        assertThat(adapter.findAllOrderedByPosition()).extracting(FeaturedVideo::getVideoId)
                .containsExactly("x", "y");
        assertThat(adapter.count()).isEqualTo(2);
    }

    @Test
    void duplicateVideosOccupySeparatePositions() {
        adapter.replaceAll(List.of(video("a"), video("a")));

        assertThat(adapter.findAllOrderedByPosition()).hasSize(2);
    }

    @Test
    void clearEmptiesPool() {
        adapter.replaceAll(List.of(video("a")));

        adapter.clear();

        assertThat(adapter.count()).isZero();
    }

    @Test
    void lockRowIsSeededAndCountsReplacements() {
        long before = generation();

        adapter.replaceAll(List.of(video("a")));
        adapter.replaceAll(List.of(video("b")));

        assertThat(generation()).isEqualTo(before + 2);
    }
}
