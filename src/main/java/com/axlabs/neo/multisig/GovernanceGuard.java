package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Decides whether a call comes from the wallet's own execution path. The signer set and the governance form of
 * proposal cancellation are only reachable with a capability that this guard issued and has not yet revoked.
 */
final class GovernanceGuard {

    private final Hash160 wallet;
    private final Set<GovernanceCapability> active = Collections.newSetFromMap(new IdentityHashMap<>());

    GovernanceGuard(Hash160 wallet) {
        this.wallet = wallet;
    }

    GovernanceCapability issue(int proposalId) {
        GovernanceCapability capability = new GovernanceCapability(wallet, proposalId);
        active.add(capability);
        return capability;
    }

    void revoke(GovernanceCapability capability) {
        active.remove(capability);
    }

    void check(GovernanceCapability capability, String method) {
        if (capability == null || !active.contains(capability)) {
            throw new AuthorizationException(method, "Method only callable by the wallet itself");
        }
    }
}
