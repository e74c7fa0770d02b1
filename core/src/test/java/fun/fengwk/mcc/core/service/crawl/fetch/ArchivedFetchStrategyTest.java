package fun.fengwk.mcc.core.service.crawl.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mcc.core.service.crawl.StubHttpSite;
import fun.fengwk.mcc.core.service.crawl.identity.IdentityPool;
import fun.fengwk.mcc.core.service.crawl.identity.IdentityProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ArchivedFetchStrategyTest {

    private static final String PAGE_URL = "https://example.com/a";

    private StubHttpSite archive;
    private ArchivedFetchStrategy strategy;

    @BeforeEach
    public void setUp() throws Exception {
        archive = new StubHttpSite();
        FetchProperties fetchProperties = new FetchProperties();
        fetchProperties.setArchiveBaseUrl(archive.origin() + "/");
        fetchProperties.setArchiveTimeoutMs(3000);
        IdentityProperties identityProperties = new IdentityProperties();
        identityProperties.setMinPaceMs(0);
        identityProperties.setMaxPaceMs(0);
        strategy = new ArchivedFetchStrategy(HttpClient.newHttpClient(), fetchProperties,
            new IdentityPool(identityProperties, new Random(1), millis -> { }), new ObjectMapper());
    }

    @AfterEach
    public void tearDown() {
        archive.close();
    }

    @Test
    public void shouldFetchLatestSnapshot() throws Exception {
        AtomicReference<String> lookupQuery = new AtomicReference<>();
        archive.handle("/__wb/sparkline", exchange -> {
            lookupQuery.set(exchange.getRequestURI().getRawQuery());
            StubHttpSite.write(exchange, 200, "{\"last_ts\":\"20240101000000\",\"first_ts\":\"20100101000000\"}");
        });
        archive.html("/web/20240101000000/" + PAGE_URL, "<article>archived widgets</article>");

        String html = strategy.attempt(PAGE_URL, "widgets");

        assertThat(html).isEqualTo("<article>archived widgets</article>");
        assertThat(lookupQuery.get())
            .isEqualTo("url=https%3A%2F%2Fexample.com%2Fa&collection=web&output=json");
    }

    @Test
    public void shouldReturnNullWithoutSnapshot() throws Exception {
        archive.respond("/__wb/sparkline", 200, "{\"last_ts\":null}");

        assertThat(strategy.attempt(PAGE_URL, "widgets")).isNull();
        assertThat(archive.totalHits()).isEqualTo(1);
    }

    @Test
    public void shouldReturnNullWhenLookupFails() throws Exception {
        archive.respond("/__wb/sparkline", 500, "error");

        assertThat(strategy.attempt(PAGE_URL, "widgets")).isNull();
    }

    @Test
    public void shouldReturnNullWhenSnapshotMissing() throws Exception {
        archive.respond("/__wb/sparkline", 200, "{\"last_ts\":\"20240101000000\"}");

        assertThat(strategy.attempt(PAGE_URL, "widgets")).isNull();
        assertThat(archive.hits("/web/20240101000000/" + PAGE_URL)).isEqualTo(1);
    }

}
