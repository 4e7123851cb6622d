package com.gtmalpha.research.orchestration.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveResearchRunException extends RuntimeException {
    public ActiveResearchRunException(String message) {
        super(message);
    }
}
