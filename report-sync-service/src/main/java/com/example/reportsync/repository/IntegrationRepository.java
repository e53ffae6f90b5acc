package com.example.reportsync.repository;

import com.example.reportsync.entity.Integration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface IntegrationRepository extends JpaRepository<Integration, String> {

    List<Integration> findByProjectIdOrderByCreatedAtAsc(String projectId);

    /**
     * Bump usage counters in one statement so concurrent queue workers do not lose increments.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Integration i SET i.lastUsedAt = :now, i.usageCount = i.usageCount + 1 " +
            "WHERE i.id = :id")
    int markUsed(@Param("id") String id, @Param("now") Instant now);
}
