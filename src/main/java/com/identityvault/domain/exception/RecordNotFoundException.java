package com.identityvault.domain.exception;

import java.util.UUID;

public class RecordNotFoundException extends VaultException {

    public RecordNotFoundException(UUID id) {
        super("Record not found: " + id);
    }
}
