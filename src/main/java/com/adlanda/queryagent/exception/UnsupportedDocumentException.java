package com.adlanda.queryagent.exception;

public class UnsupportedDocumentException extends AgentException {

    public UnsupportedDocumentException(String fileName, String contentType) {
        super(ErrorKind.UNSUPPORTED_DOCUMENT,
                "Cannot extract text from '" + fileName + "' (" + contentType + "); upload a PDF or a text file");
    }

    public UnsupportedDocumentException(String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_DOCUMENT, message, cause);
    }
}
