package guraa.uicompare;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for UI Compare.
 */
@Slf4j
@SpringBootApplication
public class UICompareApplication {

    public static void main(String[] args) {
        // Image processing only; no display is needed
        System.getProperties().putIfAbsent("java.awt.headless", "true");

        SpringApplication.run(UICompareApplication.class, args);
        log.info("UI Compare started");
    }
}
