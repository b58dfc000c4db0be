package com.example.styleverify.model;

public enum TemplateStatus {
    ACTIVE,
    INACTIVE,
    ARCHIVED
}
