package com.sigi.indicators.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Client input the service cannot act on: missing required fields, malformed
 * documents, invalid comparison criteria.
 */
public class InvalidRequestException extends ErrorResponseException {

    public InvalidRequestException(String detail) {
        this(detail, null);
    }

    public InvalidRequestException(String detail, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, createProblem(detail), cause);
    }

    public static InvalidRequestException missingField(String field) {
        return new InvalidRequestException("Campo obrigatório ausente no JSON: '" + field + "'");
    }

    private static ProblemDetail createProblem(String detail) {
        ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        problem.setTitle("Requisição inválida");
        problem.setDetail(detail);
        return problem;
    }
}
