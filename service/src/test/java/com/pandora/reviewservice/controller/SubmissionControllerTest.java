package com.pandora.reviewservice.controller;

import com.pandora.reviewservice.dto.*;
import com.pandora.reviewservice.entity.ContentType;
import com.pandora.reviewservice.entity.SubmissionEvent;
import com.pandora.reviewservice.entity.SubmissionStatus;
import com.pandora.reviewservice.exception.*;
import com.pandora.reviewservice.service.RequestContext;
import com.pandora.reviewservice.service.SubmissionExportService;
import com.pandora.reviewservice.service.SubmissionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.web.config.EnableSpringDataWebSupport;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SubmissionController.class)
@Import(GlobalExceptionHandler.class)
@EnableSpringDataWebSupport
class SubmissionControllerTest {

    @Autowired private MockMvc mockMvc;

    @MockBean private SubmissionService submissionService;
    @MockBean private SubmissionExportService exportService;

    private SubmissionResponse buildResponse(Long id, SubmissionStatus status) {
        SubmissionResponse r = new SubmissionResponse();
        r.setId(id);
        r.setTitle("Flood Update");
        r.setContentType(ContentType.PRESS_RELEASE);
        r.setStatus(status);
        r.setMacAcronym("MOH");
        r.setTagList(List.of("flood", "weather"));
        r.setSubmittedAt(OffsetDateTime.now());
        r.setComments(Collections.emptyList());
        return r;
    }

    // ── POST /api/submissions ─────────────────────────────────────────────────

    @Test
    void createSubmission_validRequest_returns201() throws Exception {
        when(submissionService.create(any(), any())).thenReturn(buildResponse(1L, SubmissionStatus.PENDING));

        mockMvc.perform(post("/api/submissions")
                        .header("X-Actor-Id", "10")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title":"Flood Update","contentType":"PRESS_RELEASE",
                                 "description":"Water levels rising","artifactRef":"uploads/flood.pdf"}
                                """))
                .andDo(print())
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.tagList[1]").value("weather"));
    }

    @Test
    void createSubmission_missingFields_returns400WithEveryComplaint() throws Exception {
        mockMvc.perform(post("/api/submissions")
                        .header("X-Actor-Id", "10")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title":"","description":""}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.length()").value(3))
                .andExpect(jsonPath("$.details", hasItem("Content type is required")));
        verifyNoInteractions(submissionService);
    }

    @Test
    void createSubmission_reviewerWithoutArtifact_returns403() throws Exception {
        when(submissionService.create(any(), any()))
                .thenThrow(new PermissionDeniedException("Only MAC officers of an active agency can create submissions"));

        mockMvc.perform(post("/api/submissions")
                        .header("X-Actor-Id", "20")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title":"Flood Update","contentType":"PRESS_RELEASE","description":"d"}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void createSubmission_missingActorHeader_returns400() throws Exception {
        mockMvc.perform(post("/api/submissions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title":"Flood Update","contentType":"PRESS_RELEASE","description":"d"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void createSubmission_unknownContentType_returns400() throws Exception {
        mockMvc.perform(post("/api/submissions")
                        .header("X-Actor-Id", "10")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title":"Flood Update","contentType":"PODCAST","description":"d"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void createSubmission_serviceValidation_returns400() throws Exception {
        when(submissionService.create(any(), any()))
                .thenThrow(new SubmissionValidationException(List.of("An agency must be selected")));

        mockMvc.perform(post("/api/submissions")
                        .header("X-Actor-Id", "30")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title":"Flood Update","contentType":"PRESS_RELEASE","description":"d","artifactRef":"a"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0]").value("An agency must be selected"));
    }

    // ── Transitions ───────────────────────────────────────────────────────────

    @Test
    void startReview_usesFirstForwardedHopAsOrigin() throws Exception {
        when(submissionService.startReview(any(), eq(5L))).thenReturn(buildResponse(5L, SubmissionStatus.UNDER_REVIEW));

        mockMvc.perform(post("/api/submissions/5/start-review")
                        .header("X-Actor-Id", "20")
                        .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UNDER_REVIEW"));

        verify(submissionService).startReview(new RequestContext(20L, "203.0.113.7"), 5L);
    }

    @Test
    void review_conflict_returns409() throws Exception {
        when(submissionService.review(any(), eq(5L), any()))
                .thenThrow(new InvalidStatusTransitionException(5L, SubmissionStatus.APPROVED, SubmissionEvent.DENY));

        mockMvc.perform(post("/api/submissions/5/review")
                        .header("X-Actor-Id", "21")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"action":"DENY","denialReason":"late"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT"));
    }

    @Test
    void review_missingAction_returns400() throws Exception {
        mockMvc.perform(post("/api/submissions/5/review")
                        .header("X-Actor-Id", "20")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0]").value("Review action is required"));
    }

    @Test
    void review_byOfficer_returns403() throws Exception {
        when(submissionService.review(any(), eq(5L), any()))
                .thenThrow(new PermissionDeniedException("Only MICAT reviewers can review submissions"));

        mockMvc.perform(post("/api/submissions/5/review")
                        .header("X-Actor-Id", "10")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"action":"APPROVE","publish":true}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"))
                .andExpect(jsonPath("$.details").doesNotExist());
    }

    @Test
    void deleteSubmission_returns204() throws Exception {
        mockMvc.perform(delete("/api/submissions/5").header("X-Actor-Id", "10"))
                .andExpect(status().isNoContent());

        verify(submissionService).delete(argThat(ctx -> ctx.actorId() == 10L), eq(5L));
    }

    @Test
    void addComment_returns201() throws Exception {
        CommentResponse comment = new CommentResponse();
        comment.setId(9L);
        comment.setText("Please add a source");
        comment.setInternal(true);
        when(submissionService.addComment(any(), eq(5L), any())).thenReturn(comment);

        mockMvc.perform(post("/api/submissions/5/comments")
                        .header("X-Actor-Id", "20")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"Please add a source","internal":true}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.internal").value(true));
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    @Test
    void getSubmission_notFound_returns404() throws Exception {
        when(submissionService.get(any(), eq(99L))).thenThrow(ResourceNotFoundException.submission(99L));

        mockMvc.perform(get("/api/submissions/99").header("X-Actor-Id", "10"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Submission not found: 99"));
    }

    @Test
    void searchSubmissions_bindsFiltersAndPaging() throws Exception {
        when(submissionService.search(any(), any(), any()))
                .thenReturn(new PageImpl<>(List.of(buildResponse(1L, SubmissionStatus.PENDING)), PageRequest.of(0, 20), 1));

        mockMvc.perform(get("/api/submissions")
                        .header("X-Actor-Id", "20")
                        .param("status", "PENDING")
                        .param("search", "flood"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].id").value(1))
                .andExpect(jsonPath("$.totalElements").value(1));

        verify(submissionService).search(any(),
                argThat(req -> req.getStatus() == SubmissionStatus.PENDING && "flood".equals(req.getSearch())),
                argThat(p -> p.getPageSize() == 20 && p.getSort().getOrderFor("submittedAt") != null));
    }

    @Test
    void getStats_returnsCounts() throws Exception {
        StatusCountsResponse stats = new StatusCountsResponse();
        stats.setTotal(3);
        stats.setByStatus(Map.of(SubmissionStatus.PENDING, 3L));
        when(submissionService.stats(any())).thenReturn(stats);

        mockMvc.perform(get("/api/submissions/stats").header("X-Actor-Id", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.byStatus.PENDING").value(3));
    }

    @Test
    void exportSubmissions_returnsCsvAttachment() throws Exception {
        when(exportService.export(any(), eq(SubmissionStatus.APPROVED), isNull())).thenReturn("ID,Title\n1,Flood Update\n");

        mockMvc.perform(get("/api/submissions/export")
                        .header("X-Actor-Id", "20")
                        .param("status", "APPROVED"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("submissions.csv")))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string(containsString("Flood Update")));
    }
}
