package com.flamingo.ai.chainsearch.domain.repository;

import com.flamingo.ai.chainsearch.domain.entity.ChainEmbeddingTask;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for pending chain embedding runs. */
@Repository
public interface ChainEmbeddingTaskRepository extends JpaRepository<ChainEmbeddingTask, UUID> {

  Optional<ChainEmbeddingTask> findByAuthorIdAndContextKey(UUID authorId, String contextKey);

  /** Tasks whose debounce delay has elapsed, oldest due first. */
  @Query("SELECT t FROM ChainEmbeddingTask t WHERE t.dueAt <= :now ORDER BY t.dueAt ASC")
  List<ChainEmbeddingTask> findDue(@Param("now") Instant now, Pageable pageable);

  /**
   * Deletes a task only if nobody re-armed it since it was read.
   *
   * @return 1 if the task was deleted, 0 if it changed or is gone
   */
  @Modifying
  @Query("DELETE FROM ChainEmbeddingTask t WHERE t.id = :id AND t.version = :version")
  int deleteIfUnchanged(@Param("id") UUID id, @Param("version") Long version);
}
