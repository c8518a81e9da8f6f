package com.pandora.reviewservice.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ContentType {
    PRESS_RELEASE("Press Release"),
    ANNOUNCEMENT("Announcement"),
    SPEECH("Speech"),
    PHOTO("Photo"),
    VIDEO("Video"),
    DOCUMENT("Document"),
    OTHER("Other");

    private final String label;
}
