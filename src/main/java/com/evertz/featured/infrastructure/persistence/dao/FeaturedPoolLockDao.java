package com.evertz.featured.infrastructure.persistence.dao;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Single-row table that pool writers lock before touching {@code featured_videos}.
 * The generation counts completed replacements.
 */
@Entity
@Table(name = "featured_pool_lock")
public class FeaturedPoolLockDao {

    public static final int POOL_LOCK_ID = 1;

    @Id
    @Column(name = "id", nullable = false)
    private int id;

    @Column(name = "generation", nullable = false)
    private long generation;

    public FeaturedPoolLockDao() {
    }

    public FeaturedPoolLockDao(int id, long generation) {
        this.id = id;
        this.generation = generation;
    }

    public int getId() {
        return id;
    }

    public void setId(int id) {
        this.id = id;
    }

    public long getGeneration() {
        return generation;
    }

    public void setGeneration(long generation) {
        this.generation = generation;
    }
}
