package fun.fengwk.mcc.cli.crawl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mcc.core.service.crawl.ContentCrawlService;
import fun.fengwk.mcc.core.service.crawl.model.CrawlRequest;
import fun.fengwk.mcc.core.service.crawl.model.CrawlResponse;
import fun.fengwk.mcc.core.service.crawl.model.CrawlState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
class CrawlCommandTest {

    @Mock
    private ContentCrawlService contentCrawlService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ByteArrayOutputStream output;
    private CrawlCommand command;

    @BeforeEach
    void setUp() {
        output = new ByteArrayOutputStream();
        command = new CrawlCommand(contentCrawlService, objectMapper,
            new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @Test
    void shouldCrawlAndPrintJson() throws Exception {
        when(contentCrawlService.crawl(any())).thenReturn(CrawlResponse.builder()
            .topic("widgets")
            .corpus("Widgets are great.")
            .wordCount(3)
            .state(CrawlState.COMPLETED)
            .pagesCrawled(1)
            .origins(List.of())
            .build());

        command.run(new DefaultApplicationArguments(
            "--topic=widgets", "--url=https://a.test/", "--url=https://b.test/", "--max-depth=1", "--max-pages=4"));

        ArgumentCaptor<CrawlRequest> captor = ArgumentCaptor.forClass(CrawlRequest.class);
        verify(contentCrawlService).crawl(captor.capture());
        CrawlRequest request = captor.getValue();
        assertThat(request.getTopic()).isEqualTo("widgets");
        assertThat(request.getSeedUrls()).containsExactly("https://a.test/", "https://b.test/");
        assertThat(request.getMaxDepth()).isEqualTo(1);
        assertThat(request.getMaxPages()).isEqualTo(4);
        assertThat(request.getPerOriginCap()).isNull();

        JsonNode json = objectMapper.readTree(output.toString(StandardCharsets.UTF_8));
        assertThat(json.get("corpus").asText()).isEqualTo("Widgets are great.");
        assertThat(json.get("wordCount").asInt()).isEqualTo(3);
        assertThat(json.get("state").asText()).isEqualTo("COMPLETED");
    }

    @Test
    void shouldSkipWithoutTopic() throws Exception {
        command.run(new DefaultApplicationArguments("--url=https://a.test/"));

        verify(contentCrawlService, never()).crawl(any());
        assertThat(output.size()).isZero();
    }

    @Test
    void shouldRejectNonNumericLimit() {
        assertThatThrownBy(() -> command.run(new DefaultApplicationArguments(
            "--topic=widgets", "--url=https://a.test/", "--max-pages=many")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("max-pages");
    }

}
