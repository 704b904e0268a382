package com.polygonmev.arb.infra.signing;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.TransactionIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

import java.util.HashMap;
import java.util.Map;

/**
 * Local key signer. The executor key comes from configuration; startup fails
 * when it is missing.
 */
@Slf4j
@Component
public class CredentialsTransactionSigner implements TransactionSigner {

    private final long chainId;
    private final Map<String, Credentials> identities;

    @Autowired
    public CredentialsTransactionSigner(EngineProperties properties) {
        this(properties.chainId(), identities(properties.wallet()));
    }

    public CredentialsTransactionSigner(long chainId, Map<String, Credentials> identities) {
        this.chainId = chainId;
        this.identities = Map.copyOf(identities);
        this.identities.forEach((name, credentials) ->
                log.info("Signing identity '{}' loaded: {}", name, credentials.getAddress()));
    }

    @Override
    public boolean hasIdentity(String identity) {
        return identities.containsKey(identity);
    }

    @Override
    public String address(String identity) {
        return credentials(identity).getAddress();
    }

    @Override
    public String sign(TransactionIntent intent, String identity) {
        Credentials credentials = credentials(identity);
        if (intent.getNonce() == null || intent.getFees() == null || intent.getGasLimit() == null
                || intent.getTarget() == null) {
            throw new SigningException("Intent of cycle " + intent.getCycleId()
                    + " is missing nonce, fees, gas limit or target");
        }

        RawTransaction raw = RawTransaction.createTransaction(
                chainId,
                intent.getNonce(),
                intent.getGasLimit(),
                intent.getTarget(),
                intent.getValue(),
                intent.getCalldata() == null ? "0x" : intent.getCalldata(),
                intent.getFees().maxPriorityFeePerGas(),
                intent.getFees().maxFeePerGas());

        try {
            return Numeric.toHexString(TransactionEncoder.signMessage(raw, credentials));
        } catch (RuntimeException e) {
            throw new SigningException("Failed to sign intent of cycle " + intent.getCycleId(), e);
        }
    }

    private Credentials credentials(String identity) {
        Credentials credentials = identities.get(identity);
        if (credentials == null) {
            throw new SigningException("Unknown signing identity: " + identity);
        }
        return credentials;
    }

    private static Map<String, Credentials> identities(EngineProperties.Wallet wallet) {
        String executorKey = wallet.executorPrivateKey();
        if (executorKey == null || executorKey.isBlank()) {
            throw new IllegalStateException(
                    "No executor signing identity configured (engine.wallet.executor-private-key)");
        }
        Map<String, Credentials> identities = new HashMap<>();
        identities.put(EXECUTOR, load(EXECUTOR, executorKey));
        if (wallet.adminPrivateKey() != null && !wallet.adminPrivateKey().isBlank()) {
            identities.put(ADMIN, load(ADMIN, wallet.adminPrivateKey()));
        }
        return identities;
    }

    private static Credentials load(String identity, String key) {
        try {
            return Credentials.create(key.trim());
        } catch (RuntimeException e) {
            throw new IllegalStateException("Private key of identity '" + identity + "' is malformed", e);
        }
    }
}
