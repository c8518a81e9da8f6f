package com.pandora.reviewservice.entity;

public enum UserRole {
    MAC_OFFICER,
    MICAT_REVIEWER,
    ADMIN
}
