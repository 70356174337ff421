package com.williamcallahan.book_import_engine.controller;

import com.williamcallahan.book_import_engine.controller.support.ErrorResponseUtils;
import com.williamcallahan.book_import_engine.exception.ImportJobNotFoundException;
import com.williamcallahan.book_import_engine.exception.ImportJobStateException;
import com.williamcallahan.book_import_engine.exception.InvalidFieldMappingException;
import com.williamcallahan.book_import_engine.exception.MappingTemplateNotFoundException;
import com.williamcallahan.book_import_engine.exception.UnsupportedImportFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps import exceptions onto HTTP statuses for the import API.
 */
@RestControllerAdvice(assignableTypes = {ImportJobController.class, MappingTemplateController.class})
public class ImportApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ImportApiExceptionHandler.class);

    @ExceptionHandler(ImportJobNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(ImportJobNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponseUtils.errorBody("job_not_found", e.getMessage()));
    }

    @ExceptionHandler(MappingTemplateNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleTemplateNotFound(MappingTemplateNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponseUtils.errorBody("template_not_found", e.getMessage()));
    }

    @ExceptionHandler(ImportJobStateException.class)
    public ResponseEntity<Map<String, String>> handleState(ImportJobStateException e) {
        logger.debug("Rejected import job request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponseUtils.errorBody("invalid_job_state", e.getMessage()));
    }

    @ExceptionHandler({UnsupportedImportFileException.class, InvalidFieldMappingException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(ErrorResponseUtils.errorBody("invalid_request", e.getMessage()));
    }
}
