package de.arbeitsagentur.keycloak.vct.bdd.config;

import de.arbeitsagentur.keycloak.vct.bdd.fixture.FixtureRegistry;
import de.arbeitsagentur.keycloak.vct.bdd.polling.Poller;
import de.arbeitsagentur.keycloak.vct.bdd.polling.RetryPolicy;
import de.arbeitsagentur.keycloak.vct.bdd.steps.VctClientFactory;
import de.arbeitsagentur.keycloak.vct.client.MerkleLeafHasher;
import de.arbeitsagentur.keycloak.vct.client.Rfc6962LeafHasher;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(VctBddProperties.class)
public class VctBddConfiguration {
    private final VctBddProperties properties;

    public VctBddConfiguration(VctBddProperties properties) {
        this.properties = properties;
    }

    @Bean
    RestTemplate vctRestTemplate() {
        Duration timeout = properties.httpTimeout();
        HttpComponentsClientHttpRequestFactory factory = new HttpComponentsClientHttpRequestFactory();
        factory.setConnectionRequestTimeout(timeout);
        factory.setReadTimeout(timeout);
        factory.setHttpClient(buildHttpClient(timeout));
        return new RestTemplate(factory);
    }

    @Bean
    VctClientFactory vctClientFactory(RestTemplate vctRestTemplate) {
        return new VctClientFactory(vctRestTemplate);
    }

    @Bean
    FixtureRegistry fixtureRegistry() throws IOException {
        return FixtureRegistry.load(properties.fixtures());
    }

    @Bean
    Poller poller() {
        VctBddProperties.Retry retry = properties.retry();
        return new Poller(RetryPolicy.fixed(retry.interval(), retry.maxAttempts()));
    }

    @Bean
    MerkleLeafHasher merkleLeafHasher() {
        return Rfc6962LeafHasher.INSTANCE;
    }

    private HttpClient buildHttpClient(Duration timeout) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(Timeout.of(timeout))
                .setConnectionRequestTimeout(Timeout.of(timeout))
                .setResponseTimeout(Timeout.of(timeout))
                .build();
        // newer httpclient5 releases read the connect timeout from the connection config only
        PoolingHttpClientConnectionManager manager = PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.of(timeout))
                        .setSocketTimeout(Timeout.of(timeout))
                        .build())
                .build();
        return HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .setConnectionManager(manager)
                .build();
    }
}
