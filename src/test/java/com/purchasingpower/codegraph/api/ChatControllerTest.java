package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.query.RetrievalContext;
import com.purchasingpower.codegraph.query.RetrievalOrchestrator;
import com.purchasingpower.codegraph.query.RetrievalScenario;
import com.purchasingpower.codegraph.query.Synthesizer;
import com.purchasingpower.codegraph.search.EntityRelationships;
import com.purchasingpower.codegraph.service.ConversationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for the chat endpoint, with retrieval and synthesis mocked.
 */
@DisplayName("Chat API")
class ChatControllerTest {

    private RetrievalOrchestrator retrievalOrchestrator;
    private Synthesizer synthesizer;
    private ConversationStore conversationStore;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        retrievalOrchestrator = mock(RetrievalOrchestrator.class);
        synthesizer = mock(Synthesizer.class);
        conversationStore = mock(ConversationStore.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ChatController(retrievalOrchestrator, synthesizer, conversationStore))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should answer a question and store both turns")
    void shouldAnswerQuestion() throws Exception {
        // Given
        RetrievalContext context = RetrievalContext.builder()
                .query("What does Repository do?")
                .scenario(RetrievalScenario.MULTI_ENTITY_ANALYSIS)
                .success(true)
                .message("Found 1 relevant entities")
                .entity(EntityRelationships.isolated("Repository", "Class"))
                .build();
        when(retrievalOrchestrator.retrieve("What does Repository do?", null, "s1", "demo")).thenReturn(context);
        when(synthesizer.synthesize("What does Repository do?", context)).thenReturn("It stores entities.");

        // When / Then
        mockMvc.perform(post("/api/v1/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"What does Repository do?\", \"sessionId\": \"s1\", \"repoId\": \"demo\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.sessionId").value("s1"))
                .andExpect(jsonPath("$.answer").value("It stores entities."))
                .andExpect(jsonPath("$.scenario").value("multi_entity_analysis"))
                .andExpect(jsonPath("$.entities", hasSize(1)))
                .andExpect(jsonPath("$.entities[0].name").value("Repository"));

        verify(conversationStore).appendTurn("s1", "user", "What does Repository do?");
        verify(conversationStore).appendTurn("s1", "assistant", "It stores entities.");
    }

    @Test
    @DisplayName("Should generate a session id and still answer when history cannot be stored")
    void shouldGenerateSessionId() throws Exception {
        // Given
        RetrievalContext context = RetrievalContext.builder()
                .query("What is Unknown123?")
                .scenario(RetrievalScenario.MEMORY_FALLBACK)
                .success(true)
                .message("No search results and no memory context available")
                .build();
        when(retrievalOrchestrator.retrieve(eq("What is Unknown123?"), eq("Unknown123"), anyString(), isNull()))
                .thenReturn(context);
        when(synthesizer.synthesize(anyString(), any(RetrievalContext.class))).thenReturn("Nothing found.");
        doThrow(new IllegalStateException("database down"))
                .when(conversationStore).appendTurn(anyString(), anyString(), anyString());

        // When / Then
        mockMvc.perform(post("/api/v1/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"What is Unknown123?\", \"entityName\": \"Unknown123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.sessionId", notNullValue()))
                .andExpect(jsonPath("$.scenario").value("memory_fallback"))
                .andExpect(jsonPath("$.message").value("No search results and no memory context available"));
    }

    @Test
    @DisplayName("Should reject a request without a query")
    void shouldRejectMissingQuery() throws Exception {
        mockMvc.perform(post("/api/v1/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_failed"))
                .andExpect(jsonPath("$.message").value("query is required"));

        verifyNoInteractions(retrievalOrchestrator, synthesizer);
    }
}
