package com.flamingo.ai.chainsearch.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for SSE streaming chunks. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamChunkResponse {

  /** Event type: token, source, done, error. */
  private String eventType;

  /** Event data (JSON object). */
  private Object data;

  /** Creates a token event. */
  public static StreamChunkResponse token(String content) {
    return StreamChunkResponse.builder().eventType("token").data(new TokenData(content)).build();
  }

  /** Creates a source event for a workspace message the answer drew on. */
  public static StreamChunkResponse source(
      Long messageId, String senderName, String channelName, double similarity, String preview) {
    return StreamChunkResponse.builder()
        .eventType("source")
        .data(new SourceData(messageId, senderName, channelName, similarity, preview))
        .build();
  }

  /** Creates a done event. */
  public static StreamChunkResponse done(int sourceCount, int completionTokens) {
    return StreamChunkResponse.builder()
        .eventType("done")
        .data(new DoneData(sourceCount, completionTokens))
        .build();
  }

  /** Creates an error event. */
  public static StreamChunkResponse error(String errorId, String message) {
    return StreamChunkResponse.builder()
        .eventType("error")
        .data(new ErrorData(errorId, message))
        .build();
  }

  /** Token event data. */
  @Data
  @AllArgsConstructor
  public static class TokenData {
    private String content;
  }

  /** Source event data. {@code channelName} is null for direct messages. */
  @Data
  @AllArgsConstructor
  public static class SourceData {
    private Long messageId;
    private String senderName;
    private String channelName;
    private double similarity;
    private String preview;
  }

  /** Done event data. */
  @Data
  @AllArgsConstructor
  public static class DoneData {
    private int sourceCount;
    private int completionTokens;
  }

  /** Error event data. */
  @Data
  @AllArgsConstructor
  public static class ErrorData {
    private String errorId;
    private String message;
  }
}
