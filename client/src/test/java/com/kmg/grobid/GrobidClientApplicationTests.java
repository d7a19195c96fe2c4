package com.kmg.grobid;

import com.kmg.grobid.cli.GrobidClientRunner;
import com.kmg.grobid.config.GrobidProperties;
import com.kmg.grobid.service.BatchScheduler;
import com.kmg.grobid.service.GrobidClientService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "grobid.cli.enabled=false")
class GrobidClientApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private GrobidProperties properties;

    @Test
    void contextLoadsWithoutRunningTheClient() {
        assertNotNull(context.getBean(GrobidClientService.class));
        assertNotNull(context.getBean(BatchScheduler.class));
        assertTrue(context.getBeansOfType(GrobidClientRunner.class).isEmpty());
    }

    @Test
    void defaultsComeFromApplicationYml() {
        assertEquals(1000, properties.getBatchSize());
        assertEquals(10, properties.getNumberOfProcesses());
        assertEquals(Duration.ofSeconds(5), properties.getSleepTime());
        assertEquals(".tei.xml", properties.getOutput().getSuffix());
        assertEquals(0, properties.getRetry().getMaxAttempts());
    }
}
