package com.allowance.domain.exception;

public class NotFoundException extends GovernanceException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "NOT_FOUND";
    }
}
