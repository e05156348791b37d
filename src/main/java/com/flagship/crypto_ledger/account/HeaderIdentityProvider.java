package com.flagship.crypto_ledger.account;

import com.flagship.crypto_ledger.exception.InvalidOperationException;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Reads the identity an upstream authenticating proxy put on the request.
 * The display name falls back to the external id.
 */
public class HeaderIdentityProvider implements IdentityProvider {

    public static final String EXTERNAL_ID_HEADER = "X-External-Id";
    public static final String DISPLAY_NAME_HEADER = "X-Display-Name";

    private final HttpServletRequest request;

    public HeaderIdentityProvider(HttpServletRequest request) {
        this.request = request;
    }

    @Override
    public ExternalIdentity authenticate() {
        String externalId = request.getHeader(EXTERNAL_ID_HEADER);
        if (externalId == null || externalId.isBlank()) {
            throw new InvalidOperationException("Missing " + EXTERNAL_ID_HEADER + " header");
        }
        String displayName = request.getHeader(DISPLAY_NAME_HEADER);
        if (displayName == null || displayName.isBlank()) {
            displayName = externalId;
        }
        return new ExternalIdentity(externalId.trim(), displayName.trim());
    }
}
