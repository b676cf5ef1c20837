package com.flagship.recon_ledger.exception;

import java.util.UUID;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String entityType, UUID id) {
        super(entityType + " not found: " + id);
    }
}
