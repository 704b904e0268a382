package com.polygonmev.arb.infra.rpc;

import com.polygonmev.arb.domain.EndpointTier;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class HttpTierClientFactory implements TierClientFactory {

    private final OkHttpClient rpcHttpClient;

    public HttpTierClientFactory(OkHttpClient httpClient) {
        // Retries are the failover manager's job, not OkHttp's.
        this.rpcHttpClient = httpClient.newBuilder()
                .addInterceptor(new RateLimitInterceptor())
                .retryOnConnectionFailure(false)
                .readTimeout(15, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public Web3j create(EndpointTier tier) {
        log.info("[FAILOVER] Creating client for tier {} (priority {})", tier.getName(), tier.getPriorityRank());
        return Web3j.build(new HttpService(tier.getHttpUrl(), rpcHttpClient));
    }
}
