package fun.fengwk.mcc.cli.crawl;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mcc.core.service.crawl.ContentCrawlService;
import fun.fengwk.mcc.core.service.crawl.model.CrawlRequest;
import fun.fengwk.mcc.core.service.crawl.model.CrawlResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Crawl command runner, prints the crawl result as json.
 *
 * <pre>
 * --topic=widgets --url=https://example.com/ [--url=...] [--max-depth=2] [--max-pages=20] [--per-origin-cap=5]
 * </pre>
 *
 * @author fengwk
 */
@Slf4j
@Component
public class CrawlCommand implements ApplicationRunner {

    private final ContentCrawlService contentCrawlService;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    @Autowired
    public CrawlCommand(ContentCrawlService contentCrawlService, ObjectMapper objectMapper) {
        this(contentCrawlService, objectMapper, System.out);
    }

    CrawlCommand(ContentCrawlService contentCrawlService, ObjectMapper objectMapper, PrintStream out) {
        this.contentCrawlService = contentCrawlService;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (!args.containsOption("topic")) {
            log.info("no --topic given, nothing to crawl");
            return;
        }
        CrawlRequest request = CrawlRequest.builder()
            .topic(firstValue(args, "topic"))
            .seedUrls(args.containsOption("url") ? args.getOptionValues("url") : List.of())
            .maxDepth(intValue(args, "max-depth"))
            .maxPages(intValue(args, "max-pages"))
            .perOriginCap(intValue(args, "per-origin-cap"))
            .build();

        CrawlResponse response = contentCrawlService.crawl(request);
        out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
    }

    private String firstValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private Integer intValue(ApplicationArguments args, String name) {
        String value = firstValue(args, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--" + name + " is not a number: " + value, ex);
        }
    }

}
