package uz.greenwhite.delegation.oauth2.client;

import uz.greenwhite.delegation.oauth2.model.ClientConfig;
import uz.greenwhite.delegation.oauth2.model.ProviderToken;

public interface OAuth2Client {

    /**
     * Redeem an authorization code (authorization_code grant)
     */
    ProviderToken exchangeCode(ClientConfig config, String code);

    /**
     * Rotate token material (refresh_token grant)
     */
    ProviderToken refreshAccessToken(ClientConfig config, String refreshToken);
}
