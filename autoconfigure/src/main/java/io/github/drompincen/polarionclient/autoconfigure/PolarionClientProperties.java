package io.github.drompincen.polarionclient.autoconfigure;

import io.github.drompincen.polarionclient.client.ClientConfig;
import io.github.drompincen.polarionclient.client.OversizedItemPolicy;
import io.github.drompincen.polarionclient.runtime.retry.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("polarion.client")
public class PolarionClientProperties {

    /** REST root, e.g. https://alm.example.com/polarion/rest/v1. */
    private String baseUrl;
    /** Personal access token. */
    private String token;
    private int batchSize = ClientConfig.DEFAULT_BATCH_SIZE;
    private int pageSize = ClientConfig.DEFAULT_PAGE_SIZE;
    private int maxContentSize = ClientConfig.DEFAULT_MAX_CONTENT_SIZE;
    private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
    private Duration retryMinWait = RetryPolicy.DEFAULT_MIN_WAIT;
    private Duration retryMaxWait = RetryPolicy.DEFAULT_MAX_WAIT;
    private Duration requestTimeout = ClientConfig.DEFAULT_REQUEST_TIMEOUT;
    private Duration connectTimeout = ClientConfig.DEFAULT_CONNECT_TIMEOUT;
    private OversizedItemPolicy oversizedItemPolicy = OversizedItemPolicy.SKIP_AND_REPORT;

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public int getPageSize() { return pageSize; }
    public void setPageSize(int pageSize) { this.pageSize = pageSize; }

    public int getMaxContentSize() { return maxContentSize; }
    public void setMaxContentSize(int maxContentSize) { this.maxContentSize = maxContentSize; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public Duration getRetryMinWait() { return retryMinWait; }
    public void setRetryMinWait(Duration retryMinWait) { this.retryMinWait = retryMinWait; }

    public Duration getRetryMaxWait() { return retryMaxWait; }
    public void setRetryMaxWait(Duration retryMaxWait) { this.retryMaxWait = retryMaxWait; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public OversizedItemPolicy getOversizedItemPolicy() { return oversizedItemPolicy; }
    public void setOversizedItemPolicy(OversizedItemPolicy oversizedItemPolicy) { this.oversizedItemPolicy = oversizedItemPolicy; }

    ClientConfig toClientConfig() {
        return ClientConfig.builder(baseUrl, token == null ? "" : token)
                .batchSize(batchSize)
                .pageSize(pageSize)
                .maxContentSize(maxContentSize)
                .maxRetries(maxRetries)
                .retryWaits(retryMinWait, retryMaxWait)
                .requestTimeout(requestTimeout)
                .connectTimeout(connectTimeout)
                .oversizedItemPolicy(oversizedItemPolicy)
                .build();
    }
}
