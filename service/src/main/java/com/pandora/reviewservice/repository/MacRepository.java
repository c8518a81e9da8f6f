package com.pandora.reviewservice.repository;

import com.pandora.reviewservice.entity.Mac;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MacRepository extends JpaRepository<Mac, Long> {

    long countByActiveTrue();
}
