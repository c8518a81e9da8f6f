package com.pandora.reviewservice.access;

import com.pandora.reviewservice.entity.Submission;
import com.pandora.reviewservice.entity.SubmissionStatus;
import com.pandora.reviewservice.entity.User;
import com.pandora.reviewservice.entity.UserRole;
import com.pandora.reviewservice.exception.PermissionDeniedException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Role capability table. Every (role, action) pair not listed is denied.
 *
 * <p>Stateless: decisions depend only on the actor, the action and the submission passed in.
 * The resource may be {@code null} for actions that are not about one submission
 * (create, export, audit log).
 */
@Component
public class AccessEvaluator {

    @FunctionalInterface
    interface Rule {
        boolean test(User actor, Submission resource);
    }

    private static final Rule ALWAYS = (actor, resource) -> true;

    private static final Set<SubmissionStatus> OFFICER_EDITABLE =
            EnumSet.of(SubmissionStatus.PENDING, SubmissionStatus.RETURNED);

    private static final Map<UserRole, Map<AccessAction, Rule>> CAPABILITIES = buildCapabilities();

    public boolean canPerform(User actor, AccessAction action, Submission resource) {
        if (actor == null || actor.getRole() == null || action == null) {
            return false;
        }
        Rule rule = CAPABILITIES.getOrDefault(actor.getRole(), Collections.emptyMap()).get(action);
        return rule != null && rule.test(actor, resource);
    }

    public void check(User actor, AccessAction action, Submission resource, String deniedMessage) {
        if (!canPerform(actor, action, resource)) {
            throw new PermissionDeniedException(deniedMessage);
        }
    }

    private static Map<UserRole, Map<AccessAction, Rule>> buildCapabilities() {
        Map<AccessAction, Rule> officer = new EnumMap<>(AccessAction.class);
        officer.put(AccessAction.CREATE_SUBMISSION,
                (actor, s) -> actor.getMac() != null && actor.getMac().isActive());
        officer.put(AccessAction.VIEW_SUBMISSION, AccessEvaluator::sameAgency);
        officer.put(AccessAction.VIEW_COMMENTS, AccessEvaluator::sameAgency);
        officer.put(AccessAction.EDIT_SUBMISSION,
                (actor, s) -> s != null && s.isSubmittedBy(actor) && OFFICER_EDITABLE.contains(s.getStatus()));
        officer.put(AccessAction.DELETE_SUBMISSION,
                (actor, s) -> s != null && s.isSubmittedBy(actor) && s.getStatus() == SubmissionStatus.PENDING);
        officer.put(AccessAction.EXPORT_SUBMISSIONS, (actor, s) -> actor.getMac() != null);

        Map<AccessAction, Rule> reviewer = new EnumMap<>(AccessAction.class);
        for (AccessAction action : EnumSet.of(
                AccessAction.VIEW_SUBMISSION,
                AccessAction.REVIEW_SUBMISSION,
                AccessAction.ADD_COMMENT,
                AccessAction.VIEW_COMMENTS,
                AccessAction.VIEW_INTERNAL_COMMENTS,
                AccessAction.EXPORT_SUBMISSIONS)) {
            reviewer.put(action, ALWAYS);
        }

        Map<AccessAction, Rule> admin = new EnumMap<>(AccessAction.class);
        for (AccessAction action : AccessAction.values()) {
            admin.put(action, ALWAYS);
        }

        Map<UserRole, Map<AccessAction, Rule>> table = new EnumMap<>(UserRole.class);
        table.put(UserRole.MAC_OFFICER, Collections.unmodifiableMap(officer));
        table.put(UserRole.MICAT_REVIEWER, Collections.unmodifiableMap(reviewer));
        table.put(UserRole.ADMIN, Collections.unmodifiableMap(admin));
        return Collections.unmodifiableMap(table);
    }

    private static boolean sameAgency(User actor, Submission s) {
        return s != null && s.belongsTo(actor.getMac());
    }
}
