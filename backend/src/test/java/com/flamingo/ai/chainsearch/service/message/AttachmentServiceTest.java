package com.flamingo.ai.chainsearch.service.message;

import static com.flamingo.ai.chainsearch.TestMessages.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chainsearch.TestMessages;
import com.flamingo.ai.chainsearch.config.ChainSearchConfig;
import com.flamingo.ai.chainsearch.domain.entity.Attachment;
import com.flamingo.ai.chainsearch.domain.entity.Channel;
import com.flamingo.ai.chainsearch.domain.entity.Conversation;
import com.flamingo.ai.chainsearch.domain.entity.Message;
import com.flamingo.ai.chainsearch.domain.entity.Profile;
import com.flamingo.ai.chainsearch.domain.model.ChatContext;
import com.flamingo.ai.chainsearch.domain.repository.AttachmentRepository;
import com.flamingo.ai.chainsearch.exception.AttachmentNotFoundException;
import com.flamingo.ai.chainsearch.service.chain.ChainBuilder;
import com.flamingo.ai.chainsearch.service.chain.ChainEmbeddingQueue;
import com.flamingo.ai.chainsearch.service.transcript.TranscriptRenderer;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("AttachmentService Tests")
class AttachmentServiceTest {

  @Mock private AttachmentRepository attachmentRepository;
  @Mock private ChainBuilder chainBuilder;
  @Mock private ChainEmbeddingQueue chainEmbeddingQueue;

  private AttachmentService attachmentService;
  private Profile ana;

  @BeforeEach
  void setUp() {
    attachmentService =
        new AttachmentService(
            attachmentRepository,
            chainBuilder,
            chainEmbeddingQueue,
            new TranscriptRenderer(new ChainSearchConfig()));
    ana = TestMessages.profile("Ana");
  }

  @Test
  @DisplayName("Should store raw and wrapped description and re-queue the run")
  void shouldStoreDescriptions_andRequeueRun() {
    Channel general = TestMessages.channel("general");
    Message message = TestMessages.channelMessage(4L, ana, general, "listen", T0);
    Attachment memo = TestMessages.attachment(message, "memo.m4a", "audio/mp4", null);
    when(attachmentRepository.findWithMessageById(memo.getId())).thenReturn(Optional.of(memo));
    when(chainBuilder.findRunTerminal(4L)).thenReturn(Optional.of(6L));

    attachmentService.recordDescription(memo.getId(), "Voice memo", "Ana reads out the agenda.");

    assertThat(memo.getCaption()).isEqualTo("Voice memo");
    assertThat(memo.getRawDescription()).isEqualTo("Ana reads out the agenda.");
    assertThat(memo.getDescription())
        .isEqualTo(
            "[Ana shared 'memo.m4a' in #general on 5 October 2023, 09:00. "
                + "Audio description: Ana reads out the agenda.]");
    verify(attachmentRepository).save(memo);
    verify(chainEmbeddingQueue).enqueue(ana.getId(), ChatContext.ofChannel(general.getId()), 6L);
  }

  @Test
  @DisplayName("Should name the direct message recipient in the wrapper")
  void shouldNameRecipient_forDirectMessage() {
    Profile ben = TestMessages.profile("Ben");
    Conversation dm = TestMessages.conversation(ana, ben);
    Message message = TestMessages.conversationMessage(4L, ana, dm, "look", T0);
    Attachment photo = TestMessages.attachment(message, "cat.jpg", "image/jpeg", null);
    when(attachmentRepository.findWithMessageById(photo.getId())).thenReturn(Optional.of(photo));
    when(chainBuilder.findRunTerminal(4L)).thenReturn(Optional.of(4L));

    attachmentService.recordDescription(photo.getId(), null, "A cat on a keyboard.");

    assertThat(photo.getDescription())
        .startsWith("[Ana shared 'cat.jpg' in a direct message with Ben on ")
        .endsWith("Image description: A cat on a keyboard.]");
  }

  @Test
  @DisplayName("Should throw when the attachment does not exist")
  void shouldThrow_whenAttachmentMissing() {
    UUID attachmentId = UUID.randomUUID();
    when(attachmentRepository.findWithMessageById(attachmentId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> attachmentService.recordDescription(attachmentId, null, "text"))
        .isInstanceOf(AttachmentNotFoundException.class);
    verifyNoInteractions(chainEmbeddingQueue);
    verify(attachmentRepository, never()).save(any());
  }
}
