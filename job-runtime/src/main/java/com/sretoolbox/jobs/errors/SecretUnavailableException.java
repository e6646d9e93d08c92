package com.sretoolbox.jobs.errors;

public class SecretUnavailableException extends JobRuntimeException {
    private final String secretName;

    public SecretUnavailableException(String toolkit, String secretName) {
        super("Credential '" + secretName + "' for toolkit '" + toolkit
                + "' is not available; configure it in the secret store and retry");
        this.secretName = secretName;
    }

    public String getSecretName() {
        return secretName;
    }
}
