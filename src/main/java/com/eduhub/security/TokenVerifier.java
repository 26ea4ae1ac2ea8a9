package com.eduhub.security;

import java.util.Map;
import java.util.Optional;

/**
 * Verifies bearer tokens issued by the authentication service.
 */
public interface TokenVerifier {
    
    /**
     * Verify a token's signature and validity.
     * 
     * @param token the raw token, without the "Bearer " prefix
     * @return the verified claims, or empty if the token cannot be trusted
     */
    Optional<Map<String, Object>> verify(String token);
}
