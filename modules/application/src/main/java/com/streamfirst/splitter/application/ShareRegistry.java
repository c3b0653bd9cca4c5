package com.streamfirst.splitter.application;

import com.streamfirst.splitter.domain.*;
import com.streamfirst.splitter.ports.AuthorizationPort;
import com.streamfirst.splitter.ports.EventPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the fixed set of payees and their share weights.
 * The registry is written exactly once, by the owner, and is read-only afterwards
 * except for the released totals maintained by {@link DistributionEngine}.
 */
@Slf4j
@RequiredArgsConstructor
public class ShareRegistry {

    private final AuthorizationPort authorizationPort;
    private final EventPort eventPort;
    private final String topic;

    // insertion order is the payee index order
    private final Map<AccountId, Payee> payees = new LinkedHashMap<>();
    private long totalShares;
    private boolean initialized;

    /**
     * Registers every payee with its share weight, in order. Can succeed only once.
     * Either every pair is registered or none is.
     *
     * @param caller the identity performing the call; must be the owner
     * @param identities payee identities, no duplicates, none zero
     * @param shareWeights positive weights, one per identity
     * @throws AuthorizationException if the caller is not the owner
     * @throws StateException if the registry was already initialized
     * @throws ValidationException if the lists are empty, differ in length or contain an invalid pair
     */
    public void initialize(AccountId caller, List<AccountId> identities, List<Long> shareWeights) {
        if (!authorizationPort.isAuthorized(caller)) {
            log.warn("Rejected initialization by non-owner {}", caller);
            throw new AuthorizationException(ErrorCode.NOT_OWNER, "Caller " + caller + " is not the owner");
        }
        if (initialized) {
            log.warn("Rejected repeated initialization by {}", caller);
            throw new StateException(ErrorCode.ALREADY_INITIALIZED, "Share registry is already initialized");
        }
        if (identities == null || shareWeights == null || identities.size() != shareWeights.size()) {
            throw new ValidationException(ErrorCode.LENGTH_MISMATCH, "Payees and shares length mismatch");
        }
        if (identities.isEmpty()) {
            throw new ValidationException(ErrorCode.NO_PAYEES, "No payees");
        }

        Map<AccountId, Payee> staged = new LinkedHashMap<>();
        long stagedTotal = 0;
        for (int i = 0; i < identities.size(); i++) {
            Payee payee = addPayee(staged, identities.get(i), shareWeights.get(i));
            stagedTotal = Math.addExact(stagedTotal, payee.getShares());
        }

        payees.putAll(staged);
        totalShares = stagedTotal;
        initialized = true;
        staged.values().forEach(p -> eventPort.publish(topic, PayeeAdded.of(p.getId(), p.getShares())));

        log.info("Share registry initialized with {} payees and {} total shares", payees.size(), totalShares);
    }

    private Payee addPayee(Map<AccountId, Payee> staged, AccountId identity, Long shareWeight) {
        if (identity == null || identity.isZero()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTITY, "Account is the zero identity");
        }
        if (shareWeight == null || shareWeight <= 0) {
            throw new ValidationException(ErrorCode.INVALID_SHARES,
                "Shares must be positive for " + identity + ": " + shareWeight);
        }
        if (staged.containsKey(identity)) {
            throw new ValidationException(ErrorCode.DUPLICATE_PAYEE, "Account " + identity + " already has shares");
        }
        Payee payee = Payee.register(identity, shareWeight);
        staged.put(identity, payee);
        log.debug("Staged payee {} with {} shares", identity, shareWeight);
        return payee;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public long totalShares() {
        return totalShares;
    }

    /**
     * Gets the share weight of an identity, or 0 if it is not a payee.
     */
    public long shares(AccountId identity) {
        return findPayee(identity).map(Payee::getShares).orElse(0L);
    }

    /**
     * Gets the amount already released to an identity, or 0 if it is not a payee.
     */
    public long released(AccountId identity) {
        return findPayee(identity).map(Payee::getReleased).orElse(0L);
    }

    public Optional<Payee> findPayee(AccountId identity) {
        return Optional.ofNullable(payees.get(identity));
    }

    /**
     * Gets the payee registered at a position of the initialization order.
     *
     * @throws ValidationException if the index is out of range
     */
    public AccountId payeeAt(int index) {
        if (index < 0 || index >= payees.size()) {
            throw new ValidationException(ErrorCode.INDEX_OUT_OF_RANGE,
                "Payee index " + index + " out of range [0, " + payees.size() + ")");
        }
        return listPayees().get(index);
    }

    public List<AccountId> listPayees() {
        return List.copyOf(payees.keySet());
    }

    public int payeeCount() {
        return payees.size();
    }

    void recordPayment(AccountId identity, long amount) {
        payees.computeIfPresent(identity, (id, payee) -> payee.withPayment(amount));
    }
}
