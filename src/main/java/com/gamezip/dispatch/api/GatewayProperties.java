package com.gamezip.dispatch.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "gamezip.http")
public class GatewayProperties {

    private boolean allowCrossDomain = true;
    /** Seconds a browser may cache a preflight answer. */
    private long preflightMaxAge = 86_400;
    private long maxRequestBodySize = 1024 * 1024;
    private String serviceName = "flashpoint-gamezip-server";

    public boolean isAllowCrossDomain() { return allowCrossDomain; }
    public void setAllowCrossDomain(boolean allowCrossDomain) { this.allowCrossDomain = allowCrossDomain; }
    public long getPreflightMaxAge() { return preflightMaxAge; }
    public void setPreflightMaxAge(long preflightMaxAge) { this.preflightMaxAge = preflightMaxAge; }
    public long getMaxRequestBodySize() { return maxRequestBodySize; }
    public void setMaxRequestBodySize(long maxRequestBodySize) { this.maxRequestBodySize = maxRequestBodySize; }
    public String getServiceName() { return serviceName; }
    public void setServiceName(String serviceName) { this.serviceName = serviceName; }
}
