package com.eduhub.directory;

/**
 * Thrown when tenant registration collides with an identifier that is
 * already claimed by another tenant.
 * 
 * The registration flow surfaces this so the institution can pick
 * another subdomain or domain.
 */
public class DuplicateIdentifierException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    private final String identifierType;
    private final String identifier;
    
    public DuplicateIdentifierException(String identifierType, String identifier) {
        super(String.format("%s '%s' is already claimed by another tenant", identifierType, identifier));
        this.identifierType = identifierType;
        this.identifier = identifier;
    }
    
    /**
     * @return "subdomain", "custom domain" or "id"
     */
    public String getIdentifierType() {
        return identifierType;
    }
    
    public String getIdentifier() {
        return identifier;
    }
}
