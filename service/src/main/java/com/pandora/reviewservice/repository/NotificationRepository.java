package com.pandora.reviewservice.repository;

import com.pandora.reviewservice.entity.Notification;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, Long> {

    boolean existsByRecipientIdAndEventKey(Long recipientId, String eventKey);

    Page<Notification> findAllByRecipientIdOrderByCreatedAtDesc(Long recipientId, Pageable pageable);

    long countByRecipientIdAndReadFalse(Long recipientId);

    @Modifying
    @Query("DELETE FROM Notification n WHERE n.submission.id = :submissionId")
    int deleteAllBySubmissionId(@Param("submissionId") Long submissionId);
}
