package com.civilworks.carbon;

import com.civilworks.carbon.config.AppProperties;
import com.civilworks.carbon.service.ScreeningService;
import com.civilworks.carbon.service.ingest.RetryingFetcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {"app.runner.enabled=false", "app.data-dir=target/test-data"})
public class CarbonScreenApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private AppProperties appProperties;

    @Test
    public void contextWiresPipelineFromConfiguration() {
        assertNotNull(context.getBean(RetryingFetcher.class));
        assertNotNull(context.getBean(ScreeningService.class));
        assertTrue(context.getBeansOfType(PipelineRunner.class).isEmpty());
        assertEquals("target/test-data", appProperties.getDataDir());
        assertEquals(List.of("45", "71"), appProperties.getIngest().getAcceptedCpvPrefixes());
        assertEquals(5000.0, appProperties.getScreening().getMinSpend());
    }
}
