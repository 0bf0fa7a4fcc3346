package com.nei10u.cosmic.controller;

import com.nei10u.cosmic.exception.FingerprintBuildException;
import com.nei10u.cosmic.exception.InvalidBirthDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 统一错误体（RFC 7807）。500 只给通用说明，细节留在日志里。
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidBirthDataException.class)
    public ResponseEntity<ProblemDetail> handleInvalidBirthData(InvalidBirthDataException ex) {
        log.warn("invalid birth data: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        problem.setTitle("Invalid birth data");
        problem.setDetail(ex.getMessage());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("unreadable request body: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        problem.setTitle("Invalid request payload");
        problem.setDetail("Request body is missing or is not valid JSON.");
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(FingerprintBuildException.class)
    public ResponseEntity<ProblemDetail> handleBuildFailure(FingerprintBuildException ex) {
        log.error("fingerprint build failed in {}", ex.getComponent(), ex);
        ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
        problem.setTitle("Fingerprint unavailable");
        problem.setDetail("The cosmic fingerprint could not be calculated. Please try again later.");
        return ResponseEntity.internalServerError().body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex) {
        log.error("Unhandled exception", ex);
        ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
        problem.setTitle("Unexpected error");
        problem.setDetail("Something went wrong. Please try again later.");
        return ResponseEntity.internalServerError().body(problem);
    }
}
