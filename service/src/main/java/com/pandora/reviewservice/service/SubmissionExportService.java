package com.pandora.reviewservice.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.pandora.reviewservice.access.AccessAction;
import com.pandora.reviewservice.access.AccessEvaluator;
import com.pandora.reviewservice.access.SubmissionScope;
import com.pandora.reviewservice.access.VisibilityFilter;
import com.pandora.reviewservice.entity.Submission;
import com.pandora.reviewservice.entity.SubmissionStatus;
import com.pandora.reviewservice.entity.User;
import com.pandora.reviewservice.repository.SubmissionRepository;
import com.pandora.reviewservice.repository.SubmissionSpecification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.UncheckedIOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * CSV export of the submissions an actor can see, newest first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionExportService {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final String MISSING = "N/A";

    private final SubmissionRepository submissionRepository;
    private final AccessEvaluator accessEvaluator;
    private final VisibilityFilter visibilityFilter;
    private final ActorResolver actorResolver;

    private final CsvMapper csvMapper = new CsvMapper();

    @Transactional(readOnly = true)
    public String export(RequestContext ctx, SubmissionStatus status, Long macId) {
        User actor = actorResolver.resolve(ctx);
        accessEvaluator.check(actor, AccessAction.EXPORT_SUBMISSIONS, null, "You cannot export submissions");

        SubmissionScope scope = visibilityFilter.scopeFor(actor);
        Specification<Submission> filters = Specification
                .where(SubmissionSpecification.hasStatus(status))
                .and(SubmissionSpecification.hasMac(macId));
        List<ExportRow> rows = submissionRepository
                .findAllByScope(scope, filters, Sort.by(Sort.Direction.DESC, "submittedAt"))
                .stream()
                .map(SubmissionExportService::toRow)
                .toList();

        CsvSchema schema = csvMapper.schemaFor(ExportRow.class).withHeader();
        try {
            String csv = csvMapper.writer(schema).writeValueAsString(rows);
            log.info("User {} exported {} submissions", actor.getId(), rows.size());
            return csv;
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render submission export", e);
        }
    }

    static ExportRow toRow(Submission s) {
        return new ExportRow(
                String.valueOf(s.getId()),
                s.getTitle(),
                s.getMac() != null ? s.getMac().getAcronym() : MISSING,
                s.getContentType() != null ? s.getContentType().getLabel() : MISSING,
                s.getStatus() != null ? s.getStatus().getLabel() : MISSING,
                s.getSubmittedBy() != null ? s.getSubmittedBy().getFullName() : MISSING,
                format(s.getSubmittedAt()),
                s.getReviewedBy() != null ? s.getReviewedBy().getFullName() : MISSING,
                format(s.getReviewedAt()),
                format(s.getApprovedAt()),
                format(s.getPublishedAt()),
                s.getTags() != null ? s.getTags() : "");
    }

    private static String format(OffsetDateTime at) {
        return at == null ? MISSING : at.withOffsetSameInstant(ZoneOffset.UTC).format(TIMESTAMP);
    }

    @JsonPropertyOrder({"ID", "Title", "MAC", "Content Type", "Status", "Submitted By", "Submitted At",
            "Reviewed By", "Reviewed At", "Approved At", "Published At", "Tags"})
    record ExportRow(
            @JsonProperty("ID") String id,
            @JsonProperty("Title") String title,
            @JsonProperty("MAC") String mac,
            @JsonProperty("Content Type") String contentType,
            @JsonProperty("Status") String status,
            @JsonProperty("Submitted By") String submittedBy,
            @JsonProperty("Submitted At") String submittedAt,
            @JsonProperty("Reviewed By") String reviewedBy,
            @JsonProperty("Reviewed At") String reviewedAt,
            @JsonProperty("Approved At") String approvedAt,
            @JsonProperty("Published At") String publishedAt,
            @JsonProperty("Tags") String tags) {
    }
}
