package de.htwsaar.streamrelay.relay;

import de.htwsaar.streamrelay.relay.adapter.http.HttpUpstreamClient;
import de.htwsaar.streamrelay.relay.config.RefererTable;
import de.htwsaar.streamrelay.relay.domain.UpstreamClient;
import de.htwsaar.streamrelay.relay.service.CredentialResolver;
import de.htwsaar.streamrelay.relay.service.PlaylistRewriter;
import de.htwsaar.streamrelay.relay.service.RelayService;
import de.htwsaar.streamrelay.relay.service.ResponseClassifier;
import de.htwsaar.streamrelay.relay.service.RetryPolicy;
import de.htwsaar.streamrelay.relay.web.CorsHeaderFilter;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.Ordered;

/**
 * Zentrale Spring-Verdrahtung der Relay-Komponenten.
 *
 * <p>Schichtung: Controller → Service → Domain/Ports → Adapter</p>
 */
@Configuration
@Profile("relay")
public class RelayBeans {

    /**
     * Systemuhr für den Relay-Kontext.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Gemeinsamer HTTP-Client für alle Upstream-Versuche; folgt Redirects wie ein Browser.
     *
     * @param connectTimeoutMs Verbindungs-Timeout in ms (Standard: 10000)
     * @return {@link HttpClient}
     */
    @Bean
    public HttpClient upstreamHttpClient(@Value("${relay.upstream.connect-timeout-ms:10000}") long connectTimeoutMs) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(1, connectTimeoutMs)))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Adapter-Implementierung des {@link UpstreamClient}-Ports via HTTP.
     *
     * @param httpClient       HTTP-Client
     * @param requestTimeoutMs Timeout pro Versuch in ms (Standard: 25000)
     * @return {@link HttpUpstreamClient}
     */
    @Bean
    public UpstreamClient upstreamClient(
            HttpClient httpClient, @Value("${relay.upstream.request-timeout-ms:25000}") long requestTimeoutMs) {
        return new HttpUpstreamClient(httpClient, Duration.ofMillis(Math.max(1, requestTimeoutMs)));
    }

    /**
     * Referer-Tabelle mit konfigurierbarem Standard für unbekannte Hosts.
     *
     * @param defaultReferer Standard-Referer
     * @return {@link RefererTable}
     */
    @Bean
    public RefererTable refererTable(@Value("${relay.referer.default:https://megacloud.blog/}") String defaultReferer) {
        return RefererTable.defaults().withDefaultReferer(defaultReferer.trim());
    }

    /**
     * @param fallbacks geordnete Fallback-Referer (kommagetrennt)
     * @return {@link RetryPolicy}
     */
    @Bean
    public RetryPolicy retryPolicy(
            @Value("${relay.retry.fallback-referers:"
                            + "https://megacloud.blog/,https://megacloud.tv/,https://hianime.to/,https://aniwatch.to/}")
                    List<String> fallbacks) {
        return new RetryPolicy(fallbacks);
    }

    @Bean
    public RelayService relayService(
            UpstreamClient upstreamClient,
            CredentialResolver credentialResolver,
            ResponseClassifier classifier,
            RetryPolicy retryPolicy,
            PlaylistRewriter rewriter,
            Clock clock,
            @Value("${relay.upstream.total-deadline-ms:60000}") long totalDeadlineMs) {
        return new RelayService(
                upstreamClient,
                credentialResolver,
                classifier,
                retryPolicy,
                rewriter,
                clock,
                Duration.ofMillis(Math.max(1, totalDeadlineMs)));
    }

    /**
     * CORS-Header für alle Antworten, vor dem Trace-Filter registriert.
     *
     * @return Filter-Registrierung
     */
    @Bean
    public FilterRegistrationBean<CorsHeaderFilter> corsHeaderFilter() {
        FilterRegistrationBean<CorsHeaderFilter> registration = new FilterRegistrationBean<>(new CorsHeaderFilter());
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }
}
