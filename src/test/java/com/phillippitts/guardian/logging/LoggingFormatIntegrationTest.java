package com.phillippitts.guardian.logging;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.filter.AbstractFilter;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.apache.logging.log4j.util.ReadOnlyStringMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Checks that a status request is logged with the request id put into the ThreadContext by MdcFilter.
 */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "guardian.enabled=false",
        "guardian.kill-sequence.pid-file=target/test-backend.pid"
    }
)
class LoggingFormatIntegrationTest {

    private static final String CONTROLLER_LOGGER =
            "com.phillippitts.guardian.presentation.controller.GuardianStatusController";

    @Autowired
    private TestRestTemplate restTemplate;

    private InMemoryAppender appender;
    private Logger logger;
    private Level previousLevel;

    @BeforeEach
    void setUpAppender() {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        logger = ctx.getLogger(CONTROLLER_LOGGER);
        previousLevel = logger.getLevel();
        appender = new InMemoryAppender("test-appender");
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
    }

    @AfterEach
    void tearDownAppender() {
        logger.removeAppender(appender);
        appender.stop();
        logger.setLevel(previousLevel);
    }

    @Test
    void statusRequestCarriesRequestId() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Request-ID", "abc123");

        ResponseEntity<String> response = restTemplate.exchange(
                "/api/guardian/status", HttpMethod.GET, new HttpEntity<>(headers), String.class);
        assertThat(response.getStatusCode().is2xxSuccessful()).isTrue();

        await().atMost(3, SECONDS).until(() -> appender.statusEvent() != null);

        LogEvent event = appender.statusEvent();
        ReadOnlyStringMap contextData = event.getContextData();
        assertThat((String) contextData.getValue("requestId")).isEqualTo("abc123");
        assertThat((String) contextData.getValue("uri")).isEqualTo("/api/guardian/status");
        assertThat(event.getLoggerName()).isEqualTo(CONTROLLER_LOGGER);
    }

    private static class InMemoryAppender extends AbstractAppender {
        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        InMemoryAppender(String name) {
            super(name, new AbstractFilter() {}, PatternLayout.createDefaultLayout(), true, null);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }

        LogEvent statusEvent() {
            return events.stream()
                    .filter(e -> e.getMessage().getFormattedMessage().startsWith("Status requested"))
                    .findFirst()
                    .orElse(null);
        }
    }
}
