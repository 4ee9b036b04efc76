package com.example.password_expiry.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.password_expiry.model.QueueItem;
import com.example.password_expiry.model.QueueItemStatus;
import com.example.password_expiry.service.DeliveryQueue;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(QueueController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class QueueControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private DeliveryQueue deliveryQueue;

  @Test
  void listReturnsQueuedItems() throws Exception {
    when(deliveryQueue.list())
        .thenReturn(
            List.of(
                new QueueItem(
                    "q-1",
                    Instant.parse("2024-04-01T00:00:00Z"),
                    "alice@example.com",
                    List.of(),
                    "subject",
                    "body",
                    "p-1",
                    "Expiry warning",
                    QueueItemStatus.FAILED,
                    3,
                    false,
                    Instant.parse("2024-03-31T00:00:00Z"),
                    null,
                    null)));

    mockMvc
        .perform(get("/api/queue"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value("q-1"))
        .andExpect(jsonPath("$[0].status").value("FAILED"))
        .andExpect(jsonPath("$[0].retryCount").value(3))
        .andExpect(jsonPath("$[0].scheduledFor").value("2024-04-01T00:00:00Z"));
  }

  @Test
  void cancelRemovesItem() throws Exception {
    when(deliveryQueue.remove("q-1")).thenReturn(true);

    mockMvc.perform(delete("/api/queue/q-1")).andExpect(status().isNoContent());
  }

  @Test
  void cancelUnknownItemReturns404() throws Exception {
    when(deliveryQueue.remove("q-404")).thenReturn(false);

    mockMvc
        .perform(delete("/api/queue/q-404"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void clearEmptiesQueue() throws Exception {
    mockMvc.perform(post("/api/queue/clear")).andExpect(status().isNoContent());

    verify(deliveryQueue).clear();
  }
}
