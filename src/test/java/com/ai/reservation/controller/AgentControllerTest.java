package com.ai.reservation.controller;

import com.ai.reservation.conversation.ConversationContext;
import com.ai.reservation.conversation.ConversationStep;
import com.ai.reservation.dto.ReservationEvent;
import com.ai.reservation.dto.TurnResponse;
import com.ai.reservation.service.ConversationOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AgentController.class)
@DisplayName("Agent intent API")
class AgentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationOrchestrator orchestrator;

    @Test
    @DisplayName("a turn returns the spoken response and the next position in snake_case")
    void intentTurn() throws Exception {
        // given
        TurnResponse turn = new TurnResponse("Thank you, Ada. How many guests will be joining us?", List.of(),
                ConversationContext.NEW_RESERVATION, ConversationStep.COLLECT);
        given(orchestrator.handleIntent("call-1", "set_name", Map.of("name", "Ada"))).willReturn(turn);

        // when / then
        mockMvc.perform(post("/bobbystable/sessions/call-1/intents/set_name")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Ada\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response_text").value(turn.responseText()))
                .andExpect(jsonPath("$.next_context").value("new_reservation"))
                .andExpect(jsonPath("$.next_step").value("collect"))
                .andExpect(jsonPath("$.events").isEmpty());
    }

    @Test
    @DisplayName("a turn without a body passes no arguments and relays emitted events")
    void intentTurnWithoutBody() throws Exception {
        // given
        TurnResponse turn = new TurnResponse("Your reservation for Ada has been cancelled.",
                List.of(ReservationEvent.cancelled("482913")),
                ConversationContext.GREETING, ConversationStep.WELCOME);
        given(orchestrator.handleIntent(eq("call-1"), eq("cancel_existing_reservation"), isNull())).willReturn(turn);

        // when / then
        mockMvc.perform(post("/bobbystable/sessions/call-1/intents/cancel_existing_reservation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events[0].type").value("reservation_cancelled"))
                .andExpect(jsonPath("$.events[0].reservation_id").value("482913"))
                .andExpect(jsonPath("$.events[0].reservation").doesNotExist())
                .andExpect(jsonPath("$.next_context").value("greeting"));
    }

    @Test
    @DisplayName("an unexpected failure is a 500 with a generic error body")
    void unexpectedFailure() throws Exception {
        given(orchestrator.handleIntent(eq("call-1"), eq("confirm_reservation"), isNull()))
                .willThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/bobbystable/sessions/call-1/intents/confirm_reservation"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("COMMON_001"));
    }

    @Test
    @DisplayName("ending a session is 204, ending an unknown one is 404")
    void endSession() throws Exception {
        given(orchestrator.endSession("call-1")).willReturn(true);
        given(orchestrator.endSession("call-2")).willReturn(false);

        mockMvc.perform(delete("/bobbystable/sessions/call-1"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/bobbystable/sessions/call-2"))
                .andExpect(status().isNotFound());
    }
}
