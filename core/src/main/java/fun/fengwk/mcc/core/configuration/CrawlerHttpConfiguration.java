package fun.fengwk.mcc.core.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * HTTP client shared by the direct and archive fetch strategies.
 *
 * @author fengwk
 */
@Configuration
@EnableConfigurationProperties(HttpClientProxyProperties.class)
public class CrawlerHttpConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public HttpClient crawlerHttpClient(HttpClientProxyProperties proxyProperties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(15));
        ProxySelector proxySelector = proxyProperties.toProxySelector();
        if (proxySelector != null) {
            builder.proxy(proxySelector);
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

}
