package com.sigi.indicators.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class DuplicateImportException extends ErrorResponseException {

    public DuplicateImportException(String municipality, String stateCode) {
        super(HttpStatus.BAD_REQUEST, createProblem(municipality, stateCode), null);
    }

    private static ProblemDetail createProblem(String municipality, String stateCode) {
        ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        problem.setTitle("Conjunto já importado");
        problem.setDetail("Este conjunto de indicadores já foi importado para o município "
                + municipality + "/" + stateCode + ".");
        return problem;
    }
}
