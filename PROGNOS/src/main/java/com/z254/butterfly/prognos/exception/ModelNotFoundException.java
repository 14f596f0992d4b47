package com.z254.butterfly.prognos.exception;

public class ModelNotFoundException extends PrognosException {

    private final String modelId;

    public ModelNotFoundException(String modelId) {
        super("Model not found: " + modelId);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
