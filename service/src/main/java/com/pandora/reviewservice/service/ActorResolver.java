package com.pandora.reviewservice.service;

import com.pandora.reviewservice.entity.User;
import com.pandora.reviewservice.exception.PermissionDeniedException;
import com.pandora.reviewservice.exception.ResourceNotFoundException;
import com.pandora.reviewservice.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ActorResolver {

    private final UserRepository userRepository;

    public User resolve(RequestContext ctx) {
        if (ctx == null || ctx.actorId() == null) {
            throw new PermissionDeniedException("No authenticated actor");
        }
        User actor = userRepository.findById(ctx.actorId())
                .orElseThrow(() -> ResourceNotFoundException.user(ctx.actorId()));
        if (!actor.isActive()) {
            throw new PermissionDeniedException("Account " + actor.getUsername() + " is inactive");
        }
        return actor;
    }
}
