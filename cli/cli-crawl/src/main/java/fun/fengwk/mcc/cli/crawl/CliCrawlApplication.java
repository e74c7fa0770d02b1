package fun.fengwk.mcc.cli.crawl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.mcc")
public class CliCrawlApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliCrawlApplication.class, args);
    }

}
