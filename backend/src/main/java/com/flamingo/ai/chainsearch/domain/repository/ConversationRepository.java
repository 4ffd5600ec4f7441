package com.flamingo.ai.chainsearch.domain.repository;

import com.flamingo.ai.chainsearch.domain.entity.Conversation;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Conversation entities. */
@Repository
public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

  /** Loads a conversation together with its participants. */
  @EntityGraph(attributePaths = "participants")
  @Query("SELECT c FROM Conversation c WHERE c.id = :id")
  Optional<Conversation> findWithParticipantsById(@Param("id") UUID id);
}
