package com.pandora.reviewservice.controller;

import com.pandora.reviewservice.dto.*;
import com.pandora.reviewservice.entity.SubmissionStatus;
import com.pandora.reviewservice.service.SubmissionExportService;
import com.pandora.reviewservice.service.SubmissionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/submissions")
@RequiredArgsConstructor
public class SubmissionController {

    private final SubmissionService submissionService;
    private final SubmissionExportService exportService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SubmissionResponse createSubmission(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            @Valid @RequestBody SubmissionRequest req,
            HttpServletRequest request) {
        return submissionService.create(RequestContexts.of(actorId, request), req);
    }

    @PutMapping("/{id}")
    public SubmissionResponse updateSubmission(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            @PathVariable("id") Long id,
            @Valid @RequestBody SubmissionRequest req,
            HttpServletRequest request) {
        return submissionService.update(RequestContexts.of(actorId, request), id, req);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteSubmission(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            @PathVariable("id") Long id,
            HttpServletRequest request) {
        submissionService.delete(RequestContexts.of(actorId, request), id);
    }

    @PostMapping("/{id}/start-review")
    public SubmissionResponse startReview(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            @PathVariable("id") Long id,
            HttpServletRequest request) {
        return submissionService.startReview(RequestContexts.of(actorId, request), id);
    }

    @PostMapping("/{id}/review")
    public SubmissionResponse reviewSubmission(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            @PathVariable("id") Long id,
            @Valid @RequestBody ReviewRequest req,
            HttpServletRequest request) {
        return submissionService.review(RequestContexts.of(actorId, request), id, req);
    }

    @PostMapping("/{id}/comments")
    @ResponseStatus(HttpStatus.CREATED)
    public CommentResponse addComment(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            @PathVariable("id") Long id,
            @Valid @RequestBody CommentRequest req,
            HttpServletRequest request) {
        return submissionService.addComment(RequestContexts.of(actorId, request), id, req);
    }

    @GetMapping("/{id}")
    public SubmissionResponse getSubmission(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            @PathVariable("id") Long id,
            HttpServletRequest request) {
        return submissionService.get(RequestContexts.of(actorId, request), id);
    }

    @GetMapping
    public Page<SubmissionResponse> searchSubmissions(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            @ModelAttribute SubmissionSearchRequest searchReq,
            @PageableDefault(size = 20, sort = "submittedAt", direction = Sort.Direction.DESC) Pageable pageable,
            HttpServletRequest request) {
        return submissionService.search(RequestContexts.of(actorId, request), searchReq, pageable);
    }

    @GetMapping("/stats")
    public StatusCountsResponse getStats(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            HttpServletRequest request) {
        return submissionService.stats(RequestContexts.of(actorId, request));
    }

    @GetMapping(value = "/export", produces = "text/csv")
    public ResponseEntity<String> exportSubmissions(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            @RequestParam(name = "status", required = false) SubmissionStatus status,
            @RequestParam(name = "macId", required = false) Long macId,
            HttpServletRequest request) {
        String csv = exportService.export(RequestContexts.of(actorId, request), status, macId);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"submissions.csv\"")
                .contentType(new MediaType("text", "csv"))
                .body(csv);
    }
}
