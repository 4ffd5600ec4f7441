package com.flamingo.ai.chainsearch.service.chain;

import com.flamingo.ai.chainsearch.config.ChainSearchConfig;
import com.flamingo.ai.chainsearch.domain.entity.ChainEmbeddingTask;
import com.flamingo.ai.chainsearch.domain.model.ChatContext;
import com.flamingo.ai.chainsearch.domain.repository.ChainEmbeddingTaskRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable, debounced queue of chain embedding runs.
 *
 * <p>There is at most one pending task per author and channel or conversation. Enqueueing a newer
 * message re-arms that task, so a burst of messages produces a single run once the author has been
 * quiet for the configured delay. Tasks live in the database and survive restarts.
 */
@Service
@Slf4j
public class ChainEmbeddingQueue {

  private static final int MAX_ERROR_LENGTH = 1000;

  private final ChainEmbeddingTaskRepository taskRepository;
  private final ChainEmbeddingProcessor processor;
  private final ChainSearchConfig config;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public ChainEmbeddingQueue(
      ChainEmbeddingTaskRepository taskRepository,
      ChainEmbeddingProcessor processor,
      ChainSearchConfig config,
      PlatformTransactionManager transactionManager,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.taskRepository = taskRepository;
    this.processor = processor;
    this.config = config;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Schedules the chain ending at {@code messageId}. Joins the caller's transaction, so the task is
   * only visible once the message itself is committed.
   */
  @Transactional
  public void enqueue(UUID authorId, ChatContext chatContext, Long messageId) {
    arm(authorId, chatContext, messageId);
  }

  /**
   * Schedules both halves of a run that a deletion split in two. The task keeps pointing at the
   * later half and carries the earlier half's terminal until both have run.
   */
  @Transactional
  public void enqueueSplit(
      UUID authorId, ChatContext chatContext, Long earlierTerminalId, Long laterTerminalId) {
    ChainEmbeddingTask task = arm(authorId, chatContext, laterTerminalId);
    task.holdSplit(earlierTerminalId);
    taskRepository.save(task);
    log.debug(
        "Queued split chains ending at messages {} and {} in {}",
        earlierTerminalId,
        laterTerminalId,
        chatContext);
  }

  private ChainEmbeddingTask arm(UUID authorId, ChatContext chatContext, Long messageId) {
    Instant dueAt = clock.instant().plus(config.getProcessing().getDelay());
    Optional<ChainEmbeddingTask> existing =
        taskRepository.findByAuthorIdAndContextKey(authorId, chatContext.key());

    if (existing.isPresent()) {
      ChainEmbeddingTask task = existing.get();
      task.rearm(messageId, dueAt);
      meterRegistry.counter("chain.queue.enqueued", "result", "rearmed").increment();
      log.debug("Re-armed chain task for {} in {} at message {}", authorId, chatContext, messageId);
      return taskRepository.save(task);
    }

    ChainEmbeddingTask task =
        ChainEmbeddingTask.builder()
            .authorId(authorId)
            .contextKey(chatContext.key())
            .latestMessageId(messageId)
            .dueAt(dueAt)
            .build();
    meterRegistry.counter("chain.queue.enqueued", "result", "created").increment();
    log.debug("Queued chain task for {} in {} at message {}", authorId, chatContext, messageId);
    return taskRepository.save(task);
  }

  /** Runs every task whose delay has elapsed. */
  @Scheduled(
      fixedDelayString = "${chain-search.processing.poll-interval-ms:5000}",
      initialDelayString = "${chain-search.processing.initial-delay-ms:10000}")
  public void pollDueTasks() {
    List<ChainEmbeddingTask> due =
        taskRepository.findDue(
            clock.instant(), PageRequest.of(0, config.getProcessing().getBatchSize()));
    if (due.isEmpty()) {
      return;
    }

    log.debug("Processing {} due chain tasks", due.size());
    for (ChainEmbeddingTask task : due) {
      try {
        runTask(task);
      } catch (Exception e) {
        log.error("Chain task {} could not be settled: {}", task.getId(), e.getMessage(), e);
      }
    }
  }

  void runTask(ChainEmbeddingTask task) {
    ProcessingOutcome outcome = processor.process(task.getLatestMessageId());
    if (!outcome.isFailed() && task.getSplitMessageId() != null) {
      outcome = processor.process(task.getSplitMessageId());
    }
    if (outcome.isFailed()) {
      recordFailure(task, outcome.error());
      return;
    }

    Integer deleted =
        transactionTemplate.execute(
            status -> taskRepository.deleteIfUnchanged(task.getId(), task.getVersion()));
    if (deleted == null || deleted == 0) {
      log.debug("Chain task {} was re-armed while running, keeping it", task.getId());
    }
  }

  private void recordFailure(ChainEmbeddingTask task, String error) {
    int attempts = task.getAttempts() + 1;
    int maxAttempts = config.getProcessing().getMaxAttempts();
    try {
      transactionTemplate.executeWithoutResult(
          status -> {
            if (attempts >= maxAttempts) {
              if (taskRepository.deleteIfUnchanged(task.getId(), task.getVersion()) > 0) {
                meterRegistry.counter("chain.queue.abandoned").increment();
                log.error(
                    "Giving up on chain ending at message {} after {} attempts: {}",
                    task.getLatestMessageId(),
                    attempts,
                    error);
              }
              return;
            }
            Duration backoff = config.getProcessing().getRetryBackoff().multipliedBy(attempts);
            task.recordFailure(truncate(error), clock.instant().plus(backoff));
            taskRepository.save(task);
            log.warn(
                "Chain ending at message {} failed (attempt {}/{}), retrying in {}: {}",
                task.getLatestMessageId(),
                attempts,
                maxAttempts,
                backoff,
                error);
          });
    } catch (OptimisticLockingFailureException e) {
      log.debug("Chain task {} was re-armed while running, keeping it", task.getId());
    }
  }

  private static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }
}
