package com.flamingo.ai.chainsearch.api.rest;

import static com.flamingo.ai.chainsearch.TestMessages.T0;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.chainsearch.api.dto.request.SearchRequest;
import com.flamingo.ai.chainsearch.exception.GlobalExceptionHandler;
import com.flamingo.ai.chainsearch.service.search.MessageSearchService;
import com.flamingo.ai.chainsearch.service.search.SearchOptions;
import com.flamingo.ai.chainsearch.service.search.SearchResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("SearchController Tests")
class SearchControllerTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @Mock private MessageSearchService messageSearchService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new SearchController(messageSearchService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper();
  }

  @Test
  @DisplayName("Should return hits with sender and channel")
  void shouldReturnHits() throws Exception {
    SearchRequest request =
        SearchRequest.builder().query("release date").similarityThreshold(0.4).build();
    when(messageSearchService.search(
            eq("release date"), eq(new SearchOptions(0.4, null, null))))
        .thenReturn(
            List.of(
                new SearchResult(
                    8L, "we ship friday", null, 0.77, "Ana", "general", T0, null)));

    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].messageId").value(8))
        .andExpect(jsonPath("$[0].senderName").value("Ana"))
        .andExpect(jsonPath("$[0].channelName").value("general"))
        .andExpect(jsonPath("$[0].similarity").value(0.77));

    verify(messageSearchService).search("release date", new SearchOptions(0.4, null, null));
  }

  @Test
  @DisplayName("Should reject blank query")
  void shouldRejectBlankQuery() throws Exception {
    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"  \"}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(messageSearchService);
  }

  @Test
  @DisplayName("Should reject threshold outside 0..1")
  void shouldRejectThresholdOutOfRange() throws Exception {
    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"deploy\",\"similarityThreshold\":1.5}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }
}
