package com.lexis.activation.api.exceptions;

public class UnknownDocumentTypeException extends ActivationException {

    public UnknownDocumentTypeException(String documentType) {
        super("No module catalog for document type '" + documentType + "'");
    }
}
