package com.retailsales.domain.service;

import java.util.UUID;

public class UploadNotFoundException extends RuntimeException {

    public UploadNotFoundException(UUID uploadId) {
        super("Upload not found: " + uploadId);
    }
}
