package com.sretoolbox.worker.secrets;

import com.sretoolbox.jobs.errors.SecretUnavailableException;
import com.sretoolbox.support.EnvConfig;

import java.util.Locale;

/**
 * Resolves {@code (toolkit, name)} from {@code TOOLKIT_SECRET_<TOOLKIT>_<NAME>}; anything outside
 * {@code [A-Z0-9]} becomes an underscore.
 */
public class EnvSecretResolver implements SecretResolver {
    private final EnvConfig env;

    public EnvSecretResolver(EnvConfig env) {
        this.env = env;
    }

    public static String variableName(String toolkit, String name) {
        return "TOOLKIT_SECRET_" + normalize(toolkit) + "_" + normalize(name);
    }

    private static String normalize(String part) {
        return (part == null ? "" : part).toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
    }

    @Override
    public String resolve(String toolkit, String name) {
        String value = env.get(variableName(toolkit, name), null);
        if (value == null) {
            throw new SecretUnavailableException(toolkit, name);
        }
        return value;
    }
}
