package com.example.password_expiry.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.password_expiry.model.JobLogEntry;
import com.example.password_expiry.model.JobLogLevel;
import com.example.password_expiry.model.JobMode;
import com.example.password_expiry.model.JobResult;
import com.example.password_expiry.model.NotificationProfile;
import com.example.password_expiry.model.PreviewRow;
import com.example.password_expiry.model.RecipientPolicy;
import com.example.password_expiry.service.ExpiryNotificationJobService;
import com.example.password_expiry.service.ProfileNotFoundException;
import com.example.password_expiry.service.ProfileService;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(JobController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class JobControllerTest {

  private static final NotificationProfile PROFILE =
      new NotificationProfile(
          "p-1",
          "Expiry warning",
          null,
          "Expires in {{daysUntilExpiry}} days",
          "Hello {{user.displayName}}",
          Set.of(7),
          RecipientPolicy.userOnly(),
          List.of("All Users"),
          null);

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ExpiryNotificationJobService jobService;
  @MockitoBean private ProfileService profileService;

  @Test
  void runStoredProfileInPreviewByDefault() throws Exception {
    when(profileService.get("p-1")).thenReturn(PROFILE);
    when(jobService.runJob(any()))
        .thenReturn(
            new JobResult(
                true,
                List.of(
                    new JobLogEntry(
                        Instant.parse("2024-03-31T00:00:00Z"),
                        JobLogLevel.SUCCESS,
                        "Job completed",
                        null)),
                List.of(
                    new PreviewRow(
                        "Alice",
                        "alice@example.com",
                        7,
                        Instant.parse("2024-04-07T00:00:00Z"),
                        "All Users"))));

    mockMvc
        .perform(
            post("/api/jobs/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"profileId\":\"p-1\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.logs[0].level").value("SUCCESS"))
        .andExpect(jsonPath("$.previewRows[0].principalName").value("alice@example.com"))
        .andExpect(jsonPath("$.previewRows[0].daysRemaining").value(7));

    verify(jobService)
        .runJob(
            argThat(request -> request.mode() == JobMode.PREVIEW && request.profile() == PROFILE));
  }

  @Test
  void legacyPathRunsInlineProfileInTestMode() throws Exception {
    when(jobService.runJob(any())).thenReturn(new JobResult(true, List.of(), List.of()));

    mockMvc
        .perform(
            post("/api/run-job")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"mode":"TEST","testEmail":"me@example.com",
                     "profile":{"id":"p-9","name":"Inline","subjectTemplate":"s",
                     "emailTemplate":"b","cadence":[3],"assignedGroupNames":["IT"]}}
                    """))
        .andExpect(status().isOk());

    verify(jobService)
        .runJob(
            argThat(
                request ->
                    request.mode() == JobMode.TEST
                        && "me@example.com".equals(request.testRecipient())
                        && "p-9".equals(request.profile().id())));
    verifyNoInteractions(profileService);
  }

  @Test
  void missingProfileReferenceReturns400() throws Exception {
    mockMvc
        .perform(post("/api/jobs/run").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void unknownProfileReturns404() throws Exception {
    when(profileService.get("missing")).thenThrow(new ProfileNotFoundException("missing"));

    mockMvc
        .perform(
            post("/api/jobs/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"profileId\":\"missing\",\"mode\":\"LIVE\"}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }
}
