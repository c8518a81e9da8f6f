package com.pandora.reviewservice.repository;

import com.pandora.reviewservice.entity.User;
import com.pandora.reviewservice.entity.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface UserRepository extends JpaRepository<User, Long> {

    List<User> findAllByRoleAndActiveTrue(UserRole role);

    long countByActiveTrue();
}
