package com.pandora.reviewservice.access;

import com.pandora.reviewservice.entity.Comment;
import com.pandora.reviewservice.entity.Submission;
import com.pandora.reviewservice.entity.User;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

@Component
@RequiredArgsConstructor
public class VisibilityFilter {

    private final AccessEvaluator accessEvaluator;

    public SubmissionScope scopeFor(User actor) {
        if (actor == null || actor.getRole() == null) {
            return SubmissionScope.none();
        }
        return switch (actor.getRole()) {
            case MICAT_REVIEWER, ADMIN -> SubmissionScope.all();
            case MAC_OFFICER -> actor.getMac() == null
                    ? SubmissionScope.none()
                    : SubmissionScope.agency(actor.getMac().getId());
        };
    }

    public SubmissionScope publicScope() {
        return SubmissionScope.publicLibrary();
    }

    public boolean canSee(User actor, Submission submission) {
        return scopeFor(actor).matches(submission)
                && accessEvaluator.canPerform(actor, AccessAction.VIEW_SUBMISSION, submission);
    }

    /** Reviewers and admins get every comment; everyone else only the non-internal ones. */
    public List<Comment> visibleComments(User actor, Submission submission, List<Comment> comments) {
        if (!accessEvaluator.canPerform(actor, AccessAction.VIEW_COMMENTS, submission)) {
            return Collections.emptyList();
        }
        if (accessEvaluator.canPerform(actor, AccessAction.VIEW_INTERNAL_COMMENTS, submission)) {
            return comments;
        }
        return comments.stream().filter(c -> !c.isInternal()).toList();
    }
}
