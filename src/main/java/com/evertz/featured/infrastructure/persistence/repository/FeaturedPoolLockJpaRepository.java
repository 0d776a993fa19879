package com.evertz.featured.infrastructure.persistence.repository;

import com.evertz.featured.infrastructure.persistence.dao.FeaturedPoolLockDao;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Spring Data JPA repository for the pool writer lock row.
 */
@Repository
public interface FeaturedPoolLockJpaRepository extends JpaRepository<FeaturedPoolLockDao, Integer> {

    /**
     * Loads the lock row with SELECT ... FOR UPDATE; blocks until concurrent writers commit.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM FeaturedPoolLockDao l WHERE l.id = :id")
    Optional<FeaturedPoolLockDao> findForUpdate(@Param("id") int id);
}
