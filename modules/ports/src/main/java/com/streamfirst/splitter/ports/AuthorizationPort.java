package com.streamfirst.splitter.ports;

import com.streamfirst.splitter.domain.AccountId;

import java.util.Optional;

/**
 * Port for the single privileged-caller capability.
 * Administrative operations (initialization, fee registration and reimbursement)
 * consult it with the identity of whoever is calling.
 */
public interface AuthorizationPort {

    /**
     * Checks whether the caller currently holds the owner capability.
     *
     * @param caller the identity attempting an administrative operation
     * @return true if the caller is the owner, false otherwise (including when no owner exists)
     */
    boolean isAuthorized(AccountId caller);

    /**
     * Gets the current owner.
     *
     * @return the owner, or empty if ownership was renounced
     */
    Optional<AccountId> owner();
}
