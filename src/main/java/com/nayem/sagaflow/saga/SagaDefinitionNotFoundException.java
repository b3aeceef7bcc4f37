package com.nayem.sagaflow.saga;

public class SagaDefinitionNotFoundException extends SagaException {

    private final String definitionName;

    public SagaDefinitionNotFoundException(String definitionName) {
        super(null, "saga definition not found: " + definitionName);
        this.definitionName = definitionName;
    }

    public String getDefinitionName() {
        return definitionName;
    }
}
