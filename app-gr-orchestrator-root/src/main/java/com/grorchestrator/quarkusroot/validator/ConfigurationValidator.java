package com.grorchestrator.quarkusroot.validator;

public interface ConfigurationValidator {
    /**
     * Logs every problem found.
     *
     * @return true if configuration is valid
     */
    boolean validate();
}
