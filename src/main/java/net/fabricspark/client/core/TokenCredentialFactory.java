package net.fabricspark.client.core;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.AzureCliCredentialBuilder;
import com.azure.identity.ClientSecretCredentialBuilder;

/** Chooses the identity provider that issues bearer tokens for a set of credentials. */
@FunctionalInterface
public interface TokenCredentialFactory {
  TokenCredential create(LivyCredentials credentials);

  /**
   * <code>cli</code> authentication uses the token cached by a prior <code>az login</code>,
   * anything else a service principal client secret.
   */
  TokenCredentialFactory DEFAULT =
      credentials -> {
        if (credentials.isCliAuthentication()) {
          return new AzureCliCredentialBuilder().build();
        }
        return new ClientSecretCredentialBuilder()
            .tenantId(credentials.getTenantId())
            .clientId(credentials.getClientId())
            .clientSecret(credentials.getClientSecret())
            .build();
      };
}
