package com.pandora.reviewservice.service;

/**
 * Who is acting and from where. Built by the web layer from request headers.
 */
public record RequestContext(Long actorId, String originAddress) {
}
