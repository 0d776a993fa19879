package com.evertz.featured.infrastructure.persistence.repository;

import com.evertz.featured.infrastructure.persistence.dao.FeaturedVideoDao;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the featured video pool.
 */
@Repository
public interface FeaturedVideoJpaRepository extends JpaRepository<FeaturedVideoDao, Integer> {

    /**
     * Finds the whole pool ordered by position.
     */
    List<FeaturedVideoDao> findAllByOrderByPositionAsc();

    /**
     * Deletes every position and detaches any loaded slots so they can be re-inserted.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM FeaturedVideoDao v")
    void deleteAllPositions();
}
