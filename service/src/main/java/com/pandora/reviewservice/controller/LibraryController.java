package com.pandora.reviewservice.controller;

import com.pandora.reviewservice.dto.SubmissionResponse;
import com.pandora.reviewservice.dto.SubmissionSearchRequest;
import com.pandora.reviewservice.service.SubmissionService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/library")
@RequiredArgsConstructor
public class LibraryController {

    private final SubmissionService submissionService;

    @GetMapping
    public Page<SubmissionResponse> browseLibrary(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            @ModelAttribute SubmissionSearchRequest searchReq,
            @PageableDefault(size = 20, sort = "publishedAt", direction = Sort.Direction.DESC) Pageable pageable,
            HttpServletRequest request) {
        return submissionService.library(RequestContexts.of(actorId, request), searchReq, pageable);
    }
}
