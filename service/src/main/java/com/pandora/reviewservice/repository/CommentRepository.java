package com.pandora.reviewservice.repository;

import com.pandora.reviewservice.entity.Comment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CommentRepository extends JpaRepository<Comment, Long> {

    List<Comment> findAllBySubmissionIdOrderByCreatedAtDesc(Long submissionId);
}
