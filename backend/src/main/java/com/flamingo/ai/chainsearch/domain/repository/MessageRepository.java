package com.flamingo.ai.chainsearch.domain.repository;

import com.flamingo.ai.chainsearch.domain.entity.Message;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Message entities. */
@Repository
public interface MessageRepository extends JpaRepository<Message, Long> {

  /** Loads a message with its author, channel, conversation and attachments. */
  @EntityGraph(attributePaths = {"author", "channel", "conversation", "attachments"})
  @Query("SELECT m FROM Message m WHERE m.id = :id")
  Optional<Message> findDetailedById(@Param("id") Long id);

  /** Loads search hits with sender and channel joined in. */
  @EntityGraph(attributePaths = {"author", "channel"})
  @Query("SELECT m FROM Message m WHERE m.id IN :ids")
  List<Message> findWithSenderByIdIn(@Param("ids") Collection<Long> ids);

  /**
   * Messages by one author in one channel that are not newer than the anchor message, newest
   * first. Ties on {@code createdAt} are broken by id.
   */
  @EntityGraph(attributePaths = {"author", "attachments"})
  @Query(
      "SELECT m FROM Message m WHERE m.author.id = :authorId AND m.channel.id = :channelId "
          + "AND (m.createdAt < :before OR (m.createdAt = :before AND m.id <= :anchorId)) "
          + "ORDER BY m.createdAt DESC, m.id DESC")
  List<Message> findAuthorChannelHistory(
      @Param("authorId") UUID authorId,
      @Param("channelId") UUID channelId,
      @Param("before") Instant before,
      @Param("anchorId") Long anchorId,
      Pageable pageable);

  /** Conversation counterpart of {@link #findAuthorChannelHistory}. */
  @EntityGraph(attributePaths = {"author", "attachments"})
  @Query(
      "SELECT m FROM Message m WHERE m.author.id = :authorId "
          + "AND m.conversation.id = :conversationId "
          + "AND (m.createdAt < :before OR (m.createdAt = :before AND m.id <= :anchorId)) "
          + "ORDER BY m.createdAt DESC, m.id DESC")
  List<Message> findAuthorConversationHistory(
      @Param("authorId") UUID authorId,
      @Param("conversationId") UUID conversationId,
      @Param("before") Instant before,
      @Param("anchorId") Long anchorId,
      Pageable pageable);

  /**
   * Messages by one author in one channel posted after the anchor message, oldest first. Only ids
   * and timestamps are needed, so nothing is fetched eagerly.
   */
  @Query(
      "SELECT m FROM Message m WHERE m.author.id = :authorId AND m.channel.id = :channelId "
          + "AND (m.createdAt > :after OR (m.createdAt = :after AND m.id > :anchorId)) "
          + "ORDER BY m.createdAt ASC, m.id ASC")
  List<Message> findAuthorChannelFollowing(
      @Param("authorId") UUID authorId,
      @Param("channelId") UUID channelId,
      @Param("after") Instant after,
      @Param("anchorId") Long anchorId,
      Pageable pageable);

  /** Conversation counterpart of {@link #findAuthorChannelFollowing}. */
  @Query(
      "SELECT m FROM Message m WHERE m.author.id = :authorId "
          + "AND m.conversation.id = :conversationId "
          + "AND (m.createdAt > :after OR (m.createdAt = :after AND m.id > :anchorId)) "
          + "ORDER BY m.createdAt ASC, m.id ASC")
  List<Message> findAuthorConversationFollowing(
      @Param("authorId") UUID authorId,
      @Param("conversationId") UUID conversationId,
      @Param("after") Instant after,
      @Param("anchorId") Long anchorId,
      Pageable pageable);

  /** Full channel history in display order. */
  @EntityGraph(attributePaths = {"author", "attachments"})
  @Query("SELECT m FROM Message m WHERE m.channel.id = :channelId ORDER BY m.createdAt, m.id")
  List<Message> findChannelHistory(@Param("channelId") UUID channelId);

  /** Full conversation history in display order. */
  @EntityGraph(attributePaths = {"author", "attachments"})
  @Query(
      "SELECT m FROM Message m WHERE m.conversation.id = :conversationId "
          + "ORDER BY m.createdAt, m.id")
  List<Message> findConversationHistory(@Param("conversationId") UUID conversationId);

  /** Messages that hold a chain embedding, for index reconciliation. */
  @EntityGraph(attributePaths = {"author", "channel", "conversation"})
  @Query("SELECT m FROM Message m WHERE m.embedding IS NOT NULL ORDER BY m.id")
  List<Message> findEmbedded(Pageable pageable);

  /** Number of messages that hold a chain embedding. */
  @Query("SELECT COUNT(m) FROM Message m WHERE m.embedding IS NOT NULL")
  long countEmbedded();

  /**
   * Clears the embedding triple on the given messages. Rows already cleared are not touched.
   *
   * @return number of rows that were cleared
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE Message m SET m.embedding = NULL, m.context = NULL, m.formattedChain = NULL "
          + "WHERE m.id IN :ids AND m.embedding IS NOT NULL")
  int clearEmbeddings(@Param("ids") Collection<Long> ids);
}
