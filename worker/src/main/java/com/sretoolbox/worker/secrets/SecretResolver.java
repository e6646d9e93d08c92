package com.sretoolbox.worker.secrets;

/**
 * Synchronous credential lookup for toolkit operations.
 */
public interface SecretResolver {

    /**
     * @throws com.sretoolbox.jobs.errors.SecretUnavailableException when the credential is not configured
     */
    String resolve(String toolkit, String name);
}
