package com.poolhistory.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
@Slf4j
public class RestTemplateConfig {

    private static final String USER_AGENT = "pool-history/1.0";

    @Bean
    @Qualifier("llamaRestTemplate")
    public RestTemplate llamaRestTemplate(AppProps props) {
        return buildRestTemplate(props.getLlama().getTimeoutMs(), null);
    }

    @Bean
    @Qualifier("duneRestTemplate")
    public RestTemplate duneRestTemplate(AppProps props) {
        String apiKey = props.getDune().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[dune] app.dune.api-key is not set; uploads will be rejected by the API");
        }
        return buildRestTemplate(props.getDune().getTimeoutMs(), apiKey);
    }

    private RestTemplate buildRestTemplate(long timeoutMs, String duneApiKey) {
        RequestConfig rc = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(timeoutMs))
                .setConnectTimeout(Timeout.ofMilliseconds(timeoutMs))
                .setResponseTimeout(Timeout.ofMilliseconds(timeoutMs))
                .build();
        CloseableHttpClient httpClient = HttpClients.custom()
                .setDefaultRequestConfig(rc)
                .build();
        HttpComponentsClientHttpRequestFactory f = new HttpComponentsClientHttpRequestFactory(httpClient);

        RestTemplate rt = new RestTemplate(f);
        rt.getInterceptors().add((request, body, execution) -> {
            HttpHeaders h = request.getHeaders();
            h.set(HttpHeaders.USER_AGENT, USER_AGENT);
            if (duneApiKey != null && !duneApiKey.isBlank()) {
                h.set("X-Dune-Api-Key", duneApiKey);
            }
            log.debug("[http] -> {} {}", request.getMethod(), request.getURI());
            return execution.execute(request, body);
        });
        return rt;
    }
}
