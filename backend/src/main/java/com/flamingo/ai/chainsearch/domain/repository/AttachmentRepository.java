package com.flamingo.ai.chainsearch.domain.repository;

import com.flamingo.ai.chainsearch.domain.entity.Attachment;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Attachment entities. */
@Repository
public interface AttachmentRepository extends JpaRepository<Attachment, UUID> {

  /** Loads an attachment with the owning message, its author and its channel or conversation. */
  @EntityGraph(
      attributePaths = {"message", "message.author", "message.channel", "message.conversation"})
  @Query("SELECT a FROM Attachment a WHERE a.id = :id")
  Optional<Attachment> findWithMessageById(@Param("id") UUID id);
}
