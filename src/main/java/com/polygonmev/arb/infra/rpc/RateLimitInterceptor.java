package com.polygonmev.arb.infra.rpc;

import okhttp3.Interceptor;
import okhttp3.Response;

import java.io.IOException;

public class RateLimitInterceptor implements Interceptor {

    private static final int TOO_MANY_REQUESTS = 429;

    @Override
    public Response intercept(Chain chain) throws IOException {
        Response response = chain.proceed(chain.request());
        if (response.code() == TOO_MANY_REQUESTS) {
            String retryAfter = response.header("Retry-After");
            response.close();
            throw new RateLimitedIOException(chain.request().url().host(), retryAfter);
        }
        return response;
    }
}
