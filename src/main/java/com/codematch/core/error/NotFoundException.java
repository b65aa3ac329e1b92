package com.codematch.core.error;

public class NotFoundException extends CodematchException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
