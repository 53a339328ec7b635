package com.gt.flashstudy.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(StudyEngineException.class)
    public ResponseEntity<ErrorResponse> handleStudyEngineException(StudyEngineException ex) {
        return toResponse(ex.getKind(), ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
                       MissingServletRequestParameterException.class,
                       MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex) {
        log.warn("Rejected malformed request: {}", ex.getMessage());
        return toResponse(ErrorKind.ValidationError, "Malformed request");
    }

    @ExceptionHandler({DataAccessException.class, DaoException.class, MappingException.class})
    public ResponseEntity<ErrorResponse> handlePersistenceException(RuntimeException ex) {
        log.error("Persistence failure while handling request", ex);
        return toResponse(ErrorKind.ServerError, "Persistence failure, the request can be retried");
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleUnexpectedException(RuntimeException ex) {
        log.error("Unexpected failure while handling request", ex);
        return toResponse(ErrorKind.ServerError, "Unexpected server error");
    }

    private static ResponseEntity<ErrorResponse> toResponse(ErrorKind kind, String message) {
        return ResponseEntity.status(kind.getHttpStatus()).body(new ErrorResponse(kind, message));
    }
}
