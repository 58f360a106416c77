package com.allowance.domain.model;

public enum CategoryRestriction {
    ALLOWED,
    REQUIRES_APPROVAL,
    BLOCKED
}
