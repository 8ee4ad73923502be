package com.sigi.indicators.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceNotFoundException extends ErrorResponseException {

    public ResourceNotFoundException(String detail) {
        super(HttpStatus.NOT_FOUND, createProblem("Recurso não encontrado", detail), null);
    }

    private static ProblemDetail createProblem(String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
        problem.setTitle(title);
        problem.setDetail(detail);
        return problem;
    }
}
