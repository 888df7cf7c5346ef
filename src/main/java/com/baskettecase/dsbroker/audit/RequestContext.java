package com.baskettecase.dsbroker.audit;

/**
 * The parts of an inbound request the auditor needs.
 */
public interface RequestContext {

    /**
     * Identity of the originating requester, as forwarded by the front proxy
     */
    String forwardedIdentity();
}
