package com.company.footprint.identity;

import java.util.Optional;

/**
 * Source of display metadata for cluster logins.
 */
public interface IdentityDirectory {

    /**
     * @return the login's metadata, or empty if the directory has no exact match
     * or could not be reached
     */
    Optional<IdentityRecord> lookup(String login);
}
