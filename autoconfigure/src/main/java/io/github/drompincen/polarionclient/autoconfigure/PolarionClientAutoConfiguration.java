package io.github.drompincen.polarionclient.autoconfigure;

import io.github.drompincen.polarionclient.client.ClientConfig;
import io.github.drompincen.polarionclient.client.PolarionClient;
import io.github.drompincen.polarionclient.runtime.http.HttpTransport;
import io.github.drompincen.polarionclient.runtime.http.JdkHttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link PolarionClient} when {@code polarion.client.base-url} is set.
 */
@AutoConfiguration
@ConditionalOnClass(PolarionClient.class)
@ConditionalOnProperty(prefix = "polarion.client", name = "base-url")
@EnableConfigurationProperties(PolarionClientProperties.class)
public class PolarionClientAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PolarionClientAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    ClientConfig polarionClientConfig(PolarionClientProperties properties) {
        ClientConfig config = properties.toClientConfig();
        log.debug("Polarion client configuration: {}", config);
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    HttpTransport polarionHttpTransport(ClientConfig config) {
        return new JdkHttpTransport(config.connectTimeout(), config.requestTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    PolarionClient polarionClient(ClientConfig config, HttpTransport transport) {
        return PolarionClient.create(config, transport);
    }
}
