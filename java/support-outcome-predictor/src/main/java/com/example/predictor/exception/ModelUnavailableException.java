package com.example.predictor.exception;

import com.example.predictor.model.Capability;

/** No loaded artifact for the requested capability/version. */
public class ModelUnavailableException extends PredictorException {

    private final Capability capability;
    private final String version;

    public ModelUnavailableException(Capability capability, String version) {
        super(ErrorCode.MODEL_UNAVAILABLE, version == null
            ? "No model loaded for capability " + capability.wireName()
            : "No model loaded for capability " + capability.wireName() + " version " + version);
        this.capability = capability;
        this.version = version;
    }

    public Capability getCapability() {
        return capability;
    }

    public String getVersion() {
        return version;
    }
}
