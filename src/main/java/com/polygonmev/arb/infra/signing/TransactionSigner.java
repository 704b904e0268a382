package com.polygonmev.arb.infra.signing;

import com.polygonmev.arb.domain.TransactionIntent;

/**
 * Signs transaction intents on behalf of a named identity.
 */
public interface TransactionSigner {

    /**
     * Identity that pays for and submits every trade.
     */
    String EXECUTOR = "executor";

    /**
     * Owner of the executor contract, allowed to withdraw profits.
     */
    String ADMIN = "admin";

    boolean hasIdentity(String identity);

    /**
     * @throws SigningException if the identity is unknown
     */
    String address(String identity);

    /**
     * @return the signed EIP-1559 transaction, hex encoded
     * @throws SigningException if the identity is unknown or the intent is incomplete
     */
    String sign(TransactionIntent intent, String identity);
}
