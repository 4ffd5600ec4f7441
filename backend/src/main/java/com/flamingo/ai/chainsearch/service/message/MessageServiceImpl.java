package com.flamingo.ai.chainsearch.service.message;

import com.flamingo.ai.chainsearch.domain.entity.Attachment;
import com.flamingo.ai.chainsearch.domain.entity.Channel;
import com.flamingo.ai.chainsearch.domain.entity.Conversation;
import com.flamingo.ai.chainsearch.domain.entity.Message;
import com.flamingo.ai.chainsearch.domain.entity.Profile;
import com.flamingo.ai.chainsearch.domain.model.ChatContext;
import com.flamingo.ai.chainsearch.domain.repository.ChannelRepository;
import com.flamingo.ai.chainsearch.domain.repository.ConversationRepository;
import com.flamingo.ai.chainsearch.domain.repository.MessageRepository;
import com.flamingo.ai.chainsearch.domain.repository.ProfileRepository;
import com.flamingo.ai.chainsearch.elasticsearch.MessageEmbeddingIndexService;
import com.flamingo.ai.chainsearch.exception.ChatContextNotFoundException;
import com.flamingo.ai.chainsearch.exception.InvalidMessageException;
import com.flamingo.ai.chainsearch.exception.MessageNotFoundException;
import com.flamingo.ai.chainsearch.exception.ProfileNotFoundException;
import com.flamingo.ai.chainsearch.service.chain.ChainBuilder;
import com.flamingo.ai.chainsearch.service.chain.ChainEmbeddingQueue;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/** Implementation of {@link MessageService}. */
@Service
@Slf4j
public class MessageServiceImpl implements MessageService {

  private final MessageRepository messageRepository;
  private final ProfileRepository profileRepository;
  private final ChannelRepository channelRepository;
  private final ConversationRepository conversationRepository;
  private final ChainBuilder chainBuilder;
  private final ChainEmbeddingQueue chainEmbeddingQueue;
  private final MessageEmbeddingIndexService indexService;
  private final TransactionTemplate transactionTemplate;
  private final MeterRegistry meterRegistry;

  public MessageServiceImpl(
      MessageRepository messageRepository,
      ProfileRepository profileRepository,
      ChannelRepository channelRepository,
      ConversationRepository conversationRepository,
      ChainBuilder chainBuilder,
      ChainEmbeddingQueue chainEmbeddingQueue,
      MessageEmbeddingIndexService indexService,
      PlatformTransactionManager transactionManager,
      MeterRegistry meterRegistry) {
    this.messageRepository = messageRepository;
    this.profileRepository = profileRepository;
    this.channelRepository = channelRepository;
    this.conversationRepository = conversationRepository;
    this.chainBuilder = chainBuilder;
    this.chainEmbeddingQueue = chainEmbeddingQueue;
    this.indexService = indexService;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Transactional
  public Message createMessage(NewMessage newMessage) {
    if ((newMessage.channelId() == null) == (newMessage.conversationId() == null)) {
      throw new InvalidMessageException(
          "A message must be posted to exactly one channel or conversation");
    }

    Profile author =
        profileRepository
            .findById(newMessage.authorId())
            .orElseThrow(() -> new ProfileNotFoundException(newMessage.authorId()));

    Message message =
        Message.builder()
            .author(author)
            .parentId(newMessage.parentId())
            .content(newMessage.content())
            .build();

    if (newMessage.channelId() != null) {
      message.setChannel(resolveChannel(newMessage.channelId()));
    } else {
      message.setConversation(resolveConversation(newMessage.conversationId(), author.getId()));
    }

    if (newMessage.parentId() != null) {
      validateParent(newMessage.parentId(), message.getChatContext());
    }

    for (NewMessage.NewAttachment file : newMessage.attachments()) {
      message.addAttachment(
          Attachment.builder()
              .fileName(file.fileName())
              .mimeType(file.mimeType())
              .fileUrl(file.fileUrl())
              .fileSize(file.fileSize())
              .build());
    }

    Message saved = messageRepository.save(message);
    chainEmbeddingQueue.enqueue(author.getId(), saved.getChatContext(), saved.getId());

    meterRegistry.counter("messages.created").increment();
    log.info(
        "Created message {} by {} in {} with {} attachments",
        saved.getId(),
        author.getId(),
        saved.getChatContext().key(),
        saved.getAttachments().size());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Message getMessage(Long messageId) {
    return messageRepository
        .findDetailedById(messageId)
        .orElseThrow(() -> new MessageNotFoundException(messageId));
  }

  @Override
  public void deleteMessage(Long messageId) {
    Boolean heldEmbedding = transactionTemplate.execute(status -> deleteRow(messageId));

    if (Boolean.TRUE.equals(heldEmbedding)
        && !indexService.deleteMessages(List.of(messageId))) {
      log.warn("Message {} deleted but its index document could not be removed", messageId);
    }
    meterRegistry.counter("messages.deleted").increment();
  }

  private boolean deleteRow(Long messageId) {
    Message message =
        messageRepository
            .findDetailedById(messageId)
            .orElseThrow(() -> new MessageNotFoundException(messageId));

    UUID authorId = message.getAuthor().getId();
    ChatContext chatContext = message.getChatContext();
    boolean heldEmbedding = message.hasEmbedding();
    Optional<Long> previous = chainBuilder.findPreviousByAuthor(message);
    Optional<Long> next = chainBuilder.findNextByAuthor(message);

    messageRepository.delete(message);
    messageRepository.flush();

    Optional<Long> earlierTerminal = previous.flatMap(chainBuilder::findRunTerminal);
    Optional<Long> laterTerminal = next.flatMap(chainBuilder::findRunTerminal);
    if (earlierTerminal.isPresent()
        && laterTerminal.isPresent()
        && !earlierTerminal.equals(laterTerminal)) {
      chainEmbeddingQueue.enqueueSplit(
          authorId, chatContext, earlierTerminal.get(), laterTerminal.get());
      log.debug(
          "Deleting message {} split its chain, re-queued chains ending at {} and {}",
          messageId,
          earlierTerminal.get(),
          laterTerminal.get());
    } else {
      earlierTerminal
          .or(() -> laterTerminal)
          .ifPresent(
              terminalId -> {
                chainEmbeddingQueue.enqueue(authorId, chatContext, terminalId);
                log.debug(
                    "Re-queued chain ending at message {} after deleting message {}",
                    terminalId,
                    messageId);
              });
    }

    log.info("Deleted message {} from {}", messageId, chatContext.key());
    return heldEmbedding;
  }

  private Channel resolveChannel(UUID channelId) {
    return channelRepository
        .findById(channelId)
        .orElseThrow(() -> new ChatContextNotFoundException(ChatContext.ofChannel(channelId)));
  }

  private Conversation resolveConversation(UUID conversationId, UUID authorId) {
    Conversation conversation =
        conversationRepository
            .findWithParticipantsById(conversationId)
            .orElseThrow(
                () ->
                    new ChatContextNotFoundException(ChatContext.ofConversation(conversationId)));
    boolean participant =
        conversation.getParticipants().stream().anyMatch(p -> p.getId().equals(authorId));
    if (!participant) {
      throw new InvalidMessageException("Author is not a participant of this conversation");
    }
    return conversation;
  }

  private void validateParent(Long parentId, ChatContext chatContext) {
    Message parent =
        messageRepository
            .findById(parentId)
            .orElseThrow(() -> new InvalidMessageException("Parent message does not exist"));
    if (!parent.getChatContext().equals(chatContext)) {
      throw new InvalidMessageException("Replies must be posted where their parent was posted");
    }
  }
}
