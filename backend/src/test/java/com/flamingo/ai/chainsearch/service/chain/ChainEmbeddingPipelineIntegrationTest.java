package com.flamingo.ai.chainsearch.service.chain;

import static com.flamingo.ai.chainsearch.TestMessages.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import com.flamingo.ai.chainsearch.TestMessages;
import com.flamingo.ai.chainsearch.domain.entity.ChainEmbeddingTask;
import com.flamingo.ai.chainsearch.domain.entity.Channel;
import com.flamingo.ai.chainsearch.domain.entity.Message;
import com.flamingo.ai.chainsearch.domain.entity.Profile;
import com.flamingo.ai.chainsearch.domain.repository.ChainEmbeddingTaskRepository;
import com.flamingo.ai.chainsearch.domain.repository.ChannelRepository;
import com.flamingo.ai.chainsearch.domain.repository.MessageRepository;
import com.flamingo.ai.chainsearch.domain.repository.ProfileRepository;
import com.flamingo.ai.chainsearch.service.chain.ProcessingOutcome.Status;
import com.flamingo.ai.chainsearch.service.message.MessageService;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Runs the chain pipeline against the SQLite test database with the model and index clients
 * mocked.
 */
@SpringBootTest
@DisplayName("Chain embedding pipeline Integration Tests")
class ChainEmbeddingPipelineIntegrationTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private StreamingChatModel streamingChatModel;
  @MockitoBean private EmbeddingModel embeddingModel;
  @MockitoBean private ElasticsearchClient elasticsearchClient;

  @Autowired private ChainEmbeddingProcessor processor;
  @Autowired private MessageRepository messageRepository;
  @Autowired private ProfileRepository profileRepository;
  @Autowired private ChannelRepository channelRepository;
  @Autowired private ChainEmbeddingTaskRepository taskRepository;
  @Autowired private ChainEmbeddingQueue queue;
  @Autowired private MessageService messageService;

  private Profile ana;
  private Channel general;

  @BeforeEach
  void setUp() throws IOException {
    ana = profileRepository.save(TestMessages.profile("Ana"));
    general = channelRepository.save(TestMessages.channel("general"));

    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {0.6f, 0.8f})));
    BulkResponse bulkResponse = mock(BulkResponse.class);
    when(bulkResponse.errors()).thenReturn(false);
    when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(bulkResponse);
  }

  @AfterEach
  void tearDown() {
    taskRepository.deleteAll();
    messageRepository.deleteAll();
    channelRepository.deleteAll();
    profileRepository.deleteAll();
  }

  private Message post(String content, Instant createdAt) {
    return messageRepository.save(
        Message.builder()
            .author(ana)
            .channel(general)
            .content(content)
            .createdAt(createdAt)
            .build());
  }

  private Message reload(Message message) {
    return messageRepository.findById(message.getId()).orElseThrow();
  }

  @Test
  @DisplayName("Should embed a burst as one chain held by its newest message")
  void shouldEmbedBurst_onNewestMessage() {
    Message first = post("release is today", T0);
    Message second = post("QA signed off", T0.plus(Duration.ofMinutes(10)));
    Message third = post("tagging v2.3 now", T0.plus(Duration.ofMinutes(20)));

    ProcessingOutcome outcome = processor.process(third.getId());

    assertThat(outcome.status()).isEqualTo(Status.EMBEDDED);
    assertThat(outcome.chainSize()).isEqualTo(3);
    assertThat(reload(first).hasEmbedding()).isFalse();
    assertThat(reload(second).hasEmbedding()).isFalse();
    Message holder = reload(third);
    assertThat(holder.getEmbedding()).containsExactly(0.6f, 0.8f);
    assertThat(holder.getFormattedChain())
        .startsWith("Channel: general\n")
        .contains("[Ana, 09:00]: release is today")
        .contains("[Ana, 09:10]: QA signed off")
        .endsWith("[Ana, 09:20]: tagging v2.3 now");
  }

  @Test
  @DisplayName("Should move the embedding forward when a chain grows")
  void shouldMoveEmbedding_whenChainGrows() {
    Message first = post("who owns the flaky test?", T0);
    processor.process(first.getId());
    assertThat(reload(first).hasEmbedding()).isTrue();

    Message second = post("it fails on CI only", T0.plus(Duration.ofMinutes(30)));
    processor.process(second.getId());

    assertThat(reload(first).hasEmbedding()).isFalse();
    assertThat(reload(second).hasEmbedding()).isTrue();
  }

  @Test
  @DisplayName("Should start a new chain after a long pause")
  void shouldStartNewChain_afterLongPause() {
    Message morning = post("standup notes posted", T0);
    processor.process(morning.getId());

    Message afternoon = post("retro at 4", T0.plus(Duration.ofMinutes(61)));
    ProcessingOutcome outcome = processor.process(afternoon.getId());

    assertThat(outcome.chainSize()).isEqualTo(1);
    assertThat(reload(morning).hasEmbedding()).isTrue();
    assertThat(reload(afternoon).hasEmbedding()).isTrue();
    assertThat(reload(afternoon).getFormattedChain()).doesNotContain("standup notes posted");
  }

  @Test
  @DisplayName("Should skip a message deleted before processing")
  void shouldSkip_whenMessageDeleted() {
    Message gone = post("typo", T0);
    messageRepository.delete(gone);

    assertThat(processor.process(gone.getId()).status()).isEqualTo(Status.SKIPPED);
  }

  @Test
  @DisplayName("Should embed both halves when deleting a message splits a chain")
  void shouldEmbedBothHalves_whenDeletionSplitsChain() {
    Message opening = post("migration starts at 8", T0);
    Message bridge = post("halfway through", T0.plus(Duration.ofMinutes(40)));
    Message closing = post("migration finished", T0.plus(Duration.ofMinutes(80)));
    processor.process(closing.getId());
    assertThat(reload(closing).getFormattedChain()).contains("halfway through");

    messageService.deleteMessage(bridge.getId());

    List<ChainEmbeddingTask> tasks = taskRepository.findAll();
    assertThat(tasks).hasSize(1);
    assertThat(tasks.get(0).getLatestMessageId()).isEqualTo(closing.getId());
    assertThat(tasks.get(0).getSplitMessageId()).isEqualTo(opening.getId());

    queue.runTask(tasks.get(0));

    Message earlier = reload(opening);
    Message later = reload(closing);
    assertThat(earlier.hasEmbedding()).isTrue();
    assertThat(earlier.getFormattedChain()).contains("migration starts at 8");
    assertThat(later.hasEmbedding()).isTrue();
    assertThat(later.getFormattedChain())
        .doesNotContain("halfway through")
        .doesNotContain("migration starts at 8");
    assertThat(taskRepository.findAll()).isEmpty();
  }
}
