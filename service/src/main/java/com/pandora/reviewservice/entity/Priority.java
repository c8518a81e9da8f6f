package com.pandora.reviewservice.entity;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
