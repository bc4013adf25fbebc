package com.apitool.exception;

public class UnsupportedSchemeException extends ToolEngineException {

    public UnsupportedSchemeException(String message) {
        super(ErrorKind.UNSUPPORTED_SCHEME, message);
    }
}
