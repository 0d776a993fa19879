package com.evertz.featured.infrastructure.persistence.adapter;

import com.evertz.featured.application.port.FeaturedVideoPoolPort;
import com.evertz.featured.core.model.FeaturedVideo;
import com.evertz.featured.infrastructure.persistence.dao.FeaturedPoolLockDao;
import com.evertz.featured.infrastructure.persistence.dao.FeaturedVideoDao;
import com.evertz.featured.infrastructure.persistence.repository.FeaturedPoolLockJpaRepository;
import com.evertz.featured.infrastructure.persistence.repository.FeaturedVideoJpaRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Adapter implementing FeaturedVideoPoolPort using Spring Data JPA.
 * Maps between JPA DAOs and core domain entities; list index becomes the stored position.
 * Writers lock the single {@code featured_pool_lock} row first, so concurrent replacements
 * run one after another inside the caller's transaction.
 */
@Component
public class FeaturedVideoPoolAdapter implements FeaturedVideoPoolPort {

    private final FeaturedVideoJpaRepository jpaRepository;
    private final FeaturedPoolLockJpaRepository lockRepository;

    public FeaturedVideoPoolAdapter(FeaturedVideoJpaRepository jpaRepository,
                                    FeaturedPoolLockJpaRepository lockRepository) {
        this.jpaRepository = jpaRepository;
        this.lockRepository = lockRepository;
    }

    @Override
    public List<FeaturedVideo> findAllOrderedByPosition() {
        return jpaRepository.findAllByOrderByPositionAsc()
                .stream()
                .map(this::toCoreEntity)
                .toList();
    }

    @Override
    public int count() {
        return Math.toIntExact(jpaRepository.count());
    }

    @Override
    public void replaceAll(List<FeaturedVideo> videos) {
        FeaturedPoolLockDao lock = lockWriters();
        jpaRepository.deleteAllPositions();

        List<FeaturedVideoDao> daos = new ArrayList<>(videos.size());
        for (int position = 0; position < videos.size(); position++) {
            daos.add(toDao(position, videos.get(position)));
        }
        jpaRepository.saveAll(daos);
        lock.setGeneration(lock.getGeneration() + 1);
        lockRepository.save(lock);
    }

    @Override
    public void clear() {
        lockWriters();
        jpaRepository.deleteAllPositions();
    }

    private FeaturedPoolLockDao lockWriters() {
        return lockRepository.findForUpdate(FeaturedPoolLockDao.POOL_LOCK_ID)
                .orElseThrow(() -> new IllegalStateException(
                        "featured_pool_lock row " + FeaturedPoolLockDao.POOL_LOCK_ID + " is missing"));
    }

    private FeaturedVideo toCoreEntity(FeaturedVideoDao dao) {
        return new FeaturedVideo(
                dao.getVideoId(),
                dao.getTitle(),
                dao.getDescription(),
                dao.getThumbnailUrl()
        );
    }

    private FeaturedVideoDao toDao(int position, FeaturedVideo video) {
        return new FeaturedVideoDao(
                position,
                video.getVideoId(),
                video.getTitle(),
                video.getDescription(),
                video.getThumbnailUrl()
        );
    }
}
