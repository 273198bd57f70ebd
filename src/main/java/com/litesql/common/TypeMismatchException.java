package com.litesql.common;

public class TypeMismatchException extends LiteSqlException {

    public TypeMismatchException(String message) {
        super(ErrorCode.BAD_REQUEST, message);
    }
}
