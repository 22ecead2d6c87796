package com.nexus.skillplan.api;

import com.nexus.skillplan.domain.SessionNotFoundException;
import com.nexus.skillplan.domain.SkillPlanException;
import com.nexus.skillplan.domain.UnknownSkillException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger LOG = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SkillPlanException.class)
    public ResponseEntity<ErrorResponse> handleSkillPlan(SkillPlanException ex) {
        HttpStatus status = ex instanceof SessionNotFoundException || ex instanceof UnknownSkillException
                ? HttpStatus.NOT_FOUND
                : HttpStatus.BAD_REQUEST;
        LOG.warn("[API] {} {}: {}", status.value(), ex.code(), ex.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(ex.code(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("[API] Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", ex.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
