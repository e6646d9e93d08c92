package com.sretoolbox.worker.secrets;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import com.sretoolbox.jobs.errors.SecretUnavailableException;
import com.sretoolbox.support.EnvConfig;
import java.util.Map;
import org.junit.Test;

public class EnvSecretResolverTest {

    @Test
    public void variableNameIsNormalized() {
        assertThat(EnvSecretResolver.variableName("zabbix-prod", "api token"),
                is("TOOLKIT_SECRET_ZABBIX_PROD_API_TOKEN"));
    }

    @Test
    public void resolvesConfiguredSecret() {
        EnvSecretResolver resolver = new EnvSecretResolver(
                new EnvConfig(Map.of("TOOLKIT_SECRET_ZABBIX_API_TOKEN", "  tok  ")));
        assertThat(resolver.resolve("zabbix", "api_token"), is("tok"));
    }

    @Test
    public void missingSecretNamesTheCredential() {
        EnvSecretResolver resolver = new EnvSecretResolver(new EnvConfig(Map.of()));
        try {
            resolver.resolve("zabbix", "api_token");
            fail("expected SecretUnavailableException");
        } catch (SecretUnavailableException e) {
            assertThat(e.getSecretName(), is("api_token"));
            assertThat(e.getMessage(), containsString("'zabbix'"));
        }
    }
}
